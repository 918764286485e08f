package com.questrail.mdl.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Skin payload. Augments the owning node's {@link Mesh} with one
 * {@link BoneVertex} per mesh vertex.
 */
public final class Skin
{
    private final List<SkinBone> bones = new ArrayList<>();
    private final List<BoneVertex> boneVertices = new ArrayList<>();

    public List<SkinBone> bones() {
        return bones;
    }

    public List<BoneVertex> boneVertices() {
        return boneVertices;
    }
}
