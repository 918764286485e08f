package com.questrail.mdl.core;

import com.questrail.mdl.model.Quaternion;
import com.questrail.mdl.model.Vector3;

/**
 * MdlMath
 * -----------------------------------------------------------------------------
 * Rotation conversions shared by the textual and binary codecs.
 *
 * <p>The textual format writes orientations as angle-axis
 * {@code (ax, ay, az, angle)} with the angle in radians; the in-memory graph
 * holds unit quaternions {@code (x, y, z, w)}.</p>
 */
public final class MdlMath
{
    static final double DEGENERATE_NORM = 1e-12;
    static final double DEGENERATE_SINE = 1e-6;

    private static final float[] NO_ROTATION = { 1f, 0f, 0f, 0f };

    private MdlMath() {}

    /**
     * {@code (x·s, y·s, z·s, cos(a/2))} with {@code s = sin(a/2)}. The axis is
     * used as given.
     */
    public static Quaternion angleAxisToQuaternion(double x, double y, double z, double angle)
    {
        final double half = angle / 2.0;
        final double s = Math.sin(half);
        return Quaternion.of(x * s, y * s, z * s, Math.cos(half));
    }

    /**
     * Inverse of {@link #angleAxisToQuaternion}. Returns {@code {ax, ay, az, angle}}.
     *
     * <p>A zero quaternion is treated as identity. Rotations too small to carry
     * a meaningful axis come back as {@code (1, 0, 0, 0)}.</p>
     */
    public static float[] quaternionToAngleAxis(Quaternion q)
    {
        double x = q.x();
        double y = q.y();
        double z = q.z();
        double w = q.w();

        final double norm = Math.sqrt(x * x + y * y + z * z + w * w);
        if (norm < DEGENERATE_NORM) {
            return NO_ROTATION.clone();
        }
        x /= norm;
        y /= norm;
        z /= norm;
        w /= norm;

        w = Math.max(-1.0, Math.min(1.0, w));
        final double angle = 2.0 * Math.acos(w);
        final double s = Math.sqrt(1.0 - w * w);
        if (s < DEGENERATE_SINE) {
            return NO_ROTATION.clone();
        }
        return new float[] { (float) (x / s), (float) (y / s), (float) (z / s), (float) angle };
    }

    /** Unit-length copy; the zero vector stays zero. */
    public static Vector3 normalize(Vector3 v)
    {
        final double len = Math.sqrt((double) v.x() * v.x() + (double) v.y() * v.y() + (double) v.z() * v.z());
        if (len == 0.0) {
            return Vector3.ZERO;
        }
        return Vector3.of(v.x() / len, v.y() / len, v.z() / len);
    }
}
