package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.core.LegacyNumbers;
import com.questrail.mdl.model.BoneVertex;
import com.questrail.mdl.model.BoneWeight;
import com.questrail.mdl.model.Node;
import com.questrail.mdl.model.PayloadKind;
import com.questrail.mdl.model.Quaternion;
import com.questrail.mdl.model.Skin;
import com.questrail.mdl.model.SkinBone;
import com.questrail.mdl.model.Vector3;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Bone table and per-vertex weights of a skinned mesh.
 *
 * <pre>
 *   bones N      idx bone [qx qy qz qw tx ty tz]
 *   weights N    bone w [bone w ...]     (up to four pairs, bone by index or name;
 *                                         -1 0 for a vertex without influences)
 * </pre>
 */
final class SkinSection implements PayloadSection
{
    private static final int BIND_POSE_TOKENS = 9;

    /** Row for a vertex without influences; reads back as four unused slots. */
    private static final String[] NO_INFLUENCE = { "-1", "0" };

    @Override
    public PayloadKind kind() {
        return PayloadKind.SKIN;
    }

    @Override
    public boolean read(AsciiLine line, LineCursor cursor, Node node) {
        final Skin skin = node.skin().orElseThrow();
        switch (line.keyword()) {
            case "bones" -> readBones(line, cursor, skin);
            case "weights" -> readWeights(line, cursor, skin);
            default -> {
                return false;
            }
        }
        return true;
    }

    private static void readBones(AsciiLine header, LineCursor cursor, Skin skin) {
        final int count = PayloadSection.declaredRows(header, cursor);
        final SkinBone[] bones = new SkinBone[count];
        for (int row = 0; row < count; row++) {
            AsciiLine line = cursor.require(header, "bones");
            if (line.size() == 1) {
                bones[row] = SkinBone.withoutBindPose(line.intAt(0));
                continue;
            }
            int idx = line.intAt(0);
            if (idx < 0 || idx >= count) {
                throw line.error("bone row index " + idx + " outside 0.." + (count - 1));
            }
            int bone = line.intAt(1);
            if (line.size() >= BIND_POSE_TOKENS) {
                Quaternion q = new Quaternion(line.floatAt(2), line.floatAt(3), line.floatAt(4), line.floatAt(5));
                bones[idx] = new SkinBone(bone, q, line.vectorAt(6));
            } else {
                bones[idx] = SkinBone.withoutBindPose(bone);
            }
        }
        skin.bones().clear();
        for (int i = 0; i < count; i++) {
            skin.bones().add(bones[i] != null ? bones[i] : SkinBone.withoutBindPose(i));
        }
    }

    private static void readWeights(AsciiLine header, LineCursor cursor, Skin skin) {
        final int count = PayloadSection.declaredRows(header, cursor);
        skin.boneVertices().clear();
        for (int row = 0; row < count; row++) {
            AsciiLine line = cursor.require(header, "weights");
            if (line.size() % 2 != 0) {
                throw line.error("weights row needs bone/weight pairs, got " + line.size() + " tokens");
            }
            if (line.size() / 2 > BoneVertex.SLOTS) {
                throw line.error("at most " + BoneVertex.SLOTS + " bone influences per vertex");
            }
            List<BoneWeight> influences = new ArrayList<>(BoneVertex.SLOTS);
            for (int i = 0; i < line.size(); i += 2) {
                float weight = line.floatAt(i + 1);
                if (line.isIntegerAt(i)) {
                    influences.add(BoneWeight.indexed(line.intAt(i), weight));
                } else {
                    influences.add(BoneWeight.named(line.token(i), weight));
                }
            }
            skin.boneVertices().add(BoneVertex.padded(influences));
        }
    }

    @Override
    public void write(Node node, AsciiLineWriter out) throws IOException {
        final Skin skin = node.skin().orElseThrow();
        if (!skin.bones().isEmpty()) {
            out.integer("bones", skin.bones().size());
            out.indent();
            for (int i = 0; i < skin.bones().size(); i++) {
                SkinBone b = skin.bones().get(i);
                Quaternion q = b.bindRotation();
                Vector3 t = b.bindTranslation();
                out.floats(i + " " + b.boneIndex(), q.x(), q.y(), q.z(), q.w(), t.x(), t.y(), t.z());
            }
            out.outdent();
        }
        if (!skin.boneVertices().isEmpty()) {
            out.integer("weights", skin.boneVertices().size());
            out.indent();
            for (BoneVertex vertex : skin.boneVertices()) {
                List<BoneWeight> used = vertex.usedSlots();
                if (used.isEmpty()) {
                    out.line(NO_INFLUENCE);
                    continue;
                }
                List<String> parts = new ArrayList<>(BoneVertex.SLOTS * 2);
                for (BoneWeight w : used) {
                    parts.add(w.boneName() != null ? w.boneName() : Integer.toString(w.boneIndex()));
                    parts.add(LegacyNumbers.formatPlain(w.weight()));
                }
                out.line(parts.toArray(new String[0]));
            }
            out.outdent();
        }
    }
}
