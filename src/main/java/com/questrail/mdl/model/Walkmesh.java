package com.questrail.mdl.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Walkmesh payload: the AABB tree records in declaration order.
 */
public final class Walkmesh
{
    private final List<AabbRecord> records = new ArrayList<>();

    public List<AabbRecord> records() {
        return records;
    }
}
