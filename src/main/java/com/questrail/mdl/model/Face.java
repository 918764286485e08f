package com.questrail.mdl.model;

/**
 * Face
 * -----------------------------------------------------------------------------
 * One triangle of a mesh.
 *
 * <p>The legacy format multiplexes the surface material and the smoothing
 * group into one integer. This record keeps them apart; {@link #packedMaterial()}
 * rebuilds the legacy field.</p>
 *
 * <p>A texture-vertex index of {@link #REUSE_VERTEX_INDEX} means "use the
 * corresponding geometry vertex index". The sentinel is kept as-is in the
 * graph; only consumers apply the substitution, via {@link #effectiveT1()}
 * and friends.</p>
 */
public record Face(
    int v1,
    int v2,
    int v3,
    int material,
    int smoothGroup,
    int t1,
    int t2,
    int t3
) {
    public static final int REUSE_VERTEX_INDEX = -1;

    public static Face of(int v1, int v2, int v3, int material, int smoothGroup) {
        return new Face(v1, v2, v3, material, smoothGroup,
            REUSE_VERTEX_INDEX, REUSE_VERTEX_INDEX, REUSE_VERTEX_INDEX);
    }

    public int packedMaterial() {
        return (smoothGroup << 5) | (material & 0x1F);
    }

    public int effectiveT1() {
        return t1 == REUSE_VERTEX_INDEX ? v1 : t1;
    }

    public int effectiveT2() {
        return t2 == REUSE_VERTEX_INDEX ? v2 : t2;
    }

    public int effectiveT3() {
        return t3 == REUSE_VERTEX_INDEX ? v3 : t3;
    }
}
