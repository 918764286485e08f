package com.questrail.mdl.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * One keyframe: a time and the data vector sampled at that time.
 *
 * <p>Orientation rows hold a quaternion {@code (x, y, z, w)}. Bezier rows
 * hold the value followed by its tangents, so they are three times as wide as
 * a linear row of the same controller.</p>
 */
public record ControllerRow(float time, float[] values)
{
    public ControllerRow {
        Objects.requireNonNull(values, "values");
        values = values.clone();
    }

    @Override
    public float[] values() {
        return values.clone();
    }

    public int width() {
        return values.length;
    }

    public float value(int index) {
        return values[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ControllerRow other)) {
            return false;
        }
        return Float.compare(time, other.time) == 0 && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Float.hashCode(time) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "ControllerRow[time=" + time + ", values=" + Arrays.toString(values) + "]";
    }
}
