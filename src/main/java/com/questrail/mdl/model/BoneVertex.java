package com.questrail.mdl.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bone influences of one skinned vertex: always exactly {@value #SLOTS}
 * slots, unused ones being {@link BoneWeight#UNUSED}.
 */
public record BoneVertex(List<BoneWeight> slots)
{
    public static final int SLOTS = 4;

    public BoneVertex {
        Objects.requireNonNull(slots, "slots");
        if (slots.size() != SLOTS) {
            throw new IllegalArgumentException("bone vertex needs " + SLOTS + " slots, got " + slots.size());
        }
        slots = List.copyOf(slots);
    }

    /**
     * Pads (or truncates) the given influences to exactly four slots.
     */
    public static BoneVertex padded(List<BoneWeight> influences) {
        List<BoneWeight> slots = new ArrayList<>(SLOTS);
        for (int i = 0; i < SLOTS; i++) {
            slots.add(i < influences.size() ? influences.get(i) : BoneWeight.UNUSED);
        }
        return new BoneVertex(slots);
    }

    public List<BoneWeight> usedSlots() {
        List<BoneWeight> used = new ArrayList<>();
        for (BoneWeight w : slots) {
            if (!w.isUnused()) {
                used.add(w);
            }
        }
        return used;
    }
}
