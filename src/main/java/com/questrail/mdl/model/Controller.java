package com.questrail.mdl.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named, time-keyed animatable property curve attached to a node.
 */
public final class Controller
{
    private final ControllerType type;
    private final boolean bezier;
    private final List<ControllerRow> rows;

    public Controller(ControllerType type, boolean bezier, List<ControllerRow> rows) {
        this.type = Objects.requireNonNull(type, "type");
        this.bezier = bezier;
        this.rows = new ArrayList<>(Objects.requireNonNull(rows, "rows"));
    }

    /**
     * Single-row controller at time zero, the shape produced by a bare
     * {@code name v0 v1 ...} line.
     */
    public static Controller constant(ControllerType type, float... values) {
        return new Controller(type, false, List.of(new ControllerRow(0f, values)));
    }

    public ControllerType type() {
        return type;
    }

    public boolean isBezier() {
        return bezier;
    }

    public List<ControllerRow> rows() {
        return rows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Controller other)) {
            return false;
        }
        return type == other.type && bezier == other.bezier && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, bezier, rows);
    }

    @Override
    public String toString() {
        return "Controller[" + type + (bezier ? ", bezier" : "") + ", rows=" + rows.size() + "]";
    }
}
