package com.questrail.mdl.core;

/**
 * FaceMaterials
 * -----------------------------------------------------------------------------
 * Bit-packing of a face's surface material and smoothing group into the
 * single legacy "material" integer.
 *
 * <pre>
 *   raw = (smoothGroup &lt;&lt; 5) | (material &amp; 0x1F)
 * </pre>
 */
public final class FaceMaterials
{
    public static final int MATERIAL_MASK = 0x1F;
    public static final int SMOOTH_GROUP_SHIFT = 5;

    private FaceMaterials() {}

    /** Separated material and smoothing group. */
    public record Split(int material, int smoothGroup) {
    }

    public static int pack(int material, int smoothGroup)
    {
        return (smoothGroup << SMOOTH_GROUP_SHIFT) | (material & MATERIAL_MASK);
    }

    public static Split unpack(int raw)
    {
        return new Split(raw & MATERIAL_MASK, raw >>> SMOOTH_GROUP_SHIFT);
    }

    /**
     * Undoes one level of accidental packing on read.
     *
     * <p>Some exporters wrote the packed value into the smoothing-group column.
     * That is detected when the group exceeds 31 and its low five bits repeat
     * the material; the group is then shifted down and the material masked.</p>
     */
    public static Split normalize(int material, int smoothGroup)
    {
        if (smoothGroup > 31 && (smoothGroup & MATERIAL_MASK) == (material & MATERIAL_MASK)) {
            return new Split(material & MATERIAL_MASK, smoothGroup >>> SMOOTH_GROUP_SHIFT);
        }
        return new Split(material, smoothGroup);
    }
}
