package com.questrail.mdl.model;

import java.util.Objects;

/**
 * Walkmesh AABB tree record. Child links are not part of the textual form;
 * the binary writer recomputes them.
 *
 * @param faceIndex face referenced by a leaf, {@code -1} for inner records
 */
public record AabbRecord(Vector3 min, Vector3 max, int faceIndex)
{
    public AabbRecord {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
    }
}
