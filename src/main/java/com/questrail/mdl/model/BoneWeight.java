package com.questrail.mdl.model;

/**
 * One bone influence on a skinned vertex.
 *
 * @param boneIndex bone slot, or {@code -1} when the slot is unused
 * @param boneName  bone name when the source text named the bone instead of
 *                  indexing it; {@code null} otherwise
 * @param weight    influence weight
 */
public record BoneWeight(int boneIndex, String boneName, float weight)
{
    public static final BoneWeight UNUSED = new BoneWeight(-1, null, 0f);

    public static BoneWeight indexed(int boneIndex, float weight) {
        return new BoneWeight(boneIndex, null, weight);
    }

    public static BoneWeight named(String boneName, float weight) {
        return new BoneWeight(-1, boneName, weight);
    }

    public boolean isUnused() {
        return boneIndex < 0 && boneName == null;
    }
}
