package com.questrail.mdl.model;

import java.util.Objects;

/**
 * Skin bone entry with its bind-pose transform.
 */
public record SkinBone(int boneIndex, Quaternion bindRotation, Vector3 bindTranslation)
{
    public SkinBone {
        Objects.requireNonNull(bindRotation, "bindRotation");
        Objects.requireNonNull(bindTranslation, "bindTranslation");
    }

    public static SkinBone withoutBindPose(int boneIndex) {
        return new SkinBone(boneIndex, Quaternion.IDENTITY, Vector3.ZERO);
    }
}
