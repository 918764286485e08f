package com.questrail.mdl.model;

/**
 * Rotation quaternion in {@code (x, y, z, w)} order, {@code w} being the
 * scalar part.
 *
 * <p>The in-memory graph always stores rotations in this form. The textual
 * format carries angle-axis instead; conversion lives in
 * {@code com.questrail.mdl.core.MdlMath}.</p>
 */
public record Quaternion(float x, float y, float z, float w)
{
    public static final Quaternion IDENTITY = new Quaternion(0f, 0f, 0f, 1f);

    public static Quaternion of(double x, double y, double z, double w) {
        return new Quaternion((float) x, (float) y, (float) z, (float) w);
    }

    public float[] toArray() {
        return new float[] { x, y, z, w };
    }
}
