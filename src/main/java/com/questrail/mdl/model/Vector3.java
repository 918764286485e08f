package com.questrail.mdl.model;

/**
 * Three-component float vector used for positions, normals, colors and
 * bounding-box corners.
 */
public record Vector3(float x, float y, float z)
{
    public static final Vector3 ZERO = new Vector3(0f, 0f, 0f);

    public static Vector3 of(double x, double y, double z) {
        return new Vector3((float) x, (float) y, (float) z);
    }

    public float[] toArray() {
        return new float[] { x, y, z };
    }
}
