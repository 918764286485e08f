package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.format.ascii.observability.IncompleteBlockEvent;
import com.questrail.mdl.format.ascii.observability.MdlObservabilitySink;
import com.questrail.mdl.model.ControllerType;
import com.questrail.mdl.model.Face;
import com.questrail.mdl.model.IndexTriple;
import com.questrail.mdl.model.Mesh;
import com.questrail.mdl.model.Node;
import com.questrail.mdl.model.PayloadKind;
import com.questrail.mdl.model.RoomLink;
import com.questrail.mdl.model.Vector2;
import com.questrail.mdl.model.Vector3;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * MeshSection
 * -----------------------------------------------------------------------------
 * Material properties and the counted geometry blocks of a mesh.
 *
 * <p>Every counted block fills an array of exactly the declared size. Rows in
 * the long form carry their own slot index; rows in the short form fill the
 * next slot in order. Faces are the exception: a face row may carry several
 * faces, and slots that no row filled are dropped and reported.</p>
 *
 * <pre>
 *   verts N     x y z  |  idx x y z [nx ny nz [u v [u2 v2]]]
 *   tverts N    u v  |  u v w  |  idx u v [w]
 *   colors N    r g b  |  idx r g b
 * </pre>
 *
 * <p>Bounding box, radius, average point and surface area are not part of the
 * textual format; they are neither read nor written here.</p>
 */
final class MeshSection implements PayloadSection
{
    private final MdlObservabilitySink sink;

    MeshSection(MdlObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public PayloadKind kind() {
        return PayloadKind.MESH;
    }

    @Override
    public boolean read(AsciiLine line, LineCursor cursor, Node node) {
        final Mesh mesh = node.mesh().orElseThrow();
        switch (line.keyword()) {
            case "ambient" -> mesh.setAmbient(line.vectorAt(1));
            case "diffuse" -> mesh.setDiffuse(line.vectorAt(1));
            case "transparencyhint" -> mesh.setTransparencyHint(line.intAt(1));
            case "bitmap", "texture", "texture0" -> mesh.setTexture1(line.tokenOr(1, ""));
            case "bitmap2", "texture1" -> mesh.setTexture2(line.tokenOr(1, ""));
            case "lightmap" -> {
                mesh.setTexture2(line.tokenOr(1, ""));
                mesh.setHasLightmap(true);
            }
            case "render" -> mesh.setRender(line.flagAt(1) != 0);
            case "shadow" -> mesh.setShadow(line.flagAt(1) != 0);
            case "beaming" -> mesh.setBeaming(line.flagAt(1) != 0);
            case "m_bisbackgroundgeometry" -> mesh.setBackgroundGeometry(line.flagAt(1) != 0);
            case "rotatetexture" -> mesh.setRotateTexture(line.flagAt(1) != 0);
            case "lightmapped" -> mesh.setHasLightmap(line.flagAt(1) != 0);
            case "tangentspace" -> mesh.setTangentSpace(line.flagAt(1) != 0);
            case "animateuv" -> mesh.setAnimateUv(line.flagAt(1) != 0);
            case "uvdirectionx" -> mesh.setUvDirectionX(line.floatAt(1));
            case "uvdirectiony" -> mesh.setUvDirectionY(line.floatAt(1));
            case "uvjitter" -> mesh.setUvJitter(line.floatAt(1));
            case "uvjitterspeed" -> mesh.setUvJitterSpeed(line.floatAt(1));
            case "dirt_enabled" -> mesh.setDirtEnabled(line.flagAt(1) != 0);
            case "dirt_texture" -> mesh.setDirtTexture(line.intAt(1));
            case "dirt_worldspace" -> mesh.setDirtWorldSpace(line.intAt(1));
            case "hologram_donotdraw" -> mesh.setHologramDoNotDraw(line.flagAt(1) != 0);
            case "verts" -> readVerts(line, cursor, mesh);
            case "faces" -> readFaces(line, cursor, node);
            case "tverts", "tverts0" -> readUvs(line, cursor, mesh.uv1());
            case "tverts1", "lightmaptverts" -> readUvs(line, cursor, mesh.uv2());
            case "colors" -> readColors(line, cursor, mesh);
            case "texindices1" -> readTexIndices(line, cursor, mesh);
            case "roomlinks" -> readRoomLinks(line, cursor, mesh);
            default -> {
                return false;
            }
        }
        return true;
    }

    private static void readVerts(AsciiLine header, LineCursor cursor, Mesh mesh) {
        final int count = PayloadSection.declaredRows(header, cursor);
        reset(mesh.positions(), count, Vector3.ZERO);
        mesh.normals().clear();

        for (int row = 0; row < count; row++) {
            AsciiLine line = cursor.require(header, "verts");
            if (line.size() == 3) {
                mesh.positions().set(row, line.vectorAt(0));
                continue;
            }
            final int idx = slot(line, count);
            mesh.positions().set(idx, line.vectorAt(1));
            if (line.size() >= 7) {
                if (mesh.normals().isEmpty()) {
                    reset(mesh.normals(), count, Vector3.ZERO);
                }
                mesh.normals().set(idx, line.vectorAt(4));
            }
            if (line.size() >= 9) {
                if (mesh.uv1().size() != count) {
                    reset(mesh.uv1(), count, Vector2.ZERO);
                }
                mesh.uv1().set(idx, new Vector2(line.floatAt(7), line.floatAt(8)));
            }
            if (line.size() >= 11) {
                if (mesh.uv2().size() != count) {
                    reset(mesh.uv2(), count, Vector2.ZERO);
                }
                mesh.uv2().set(idx, new Vector2(line.floatAt(9), line.floatAt(10)));
            }
        }
    }

    private void readFaces(AsciiLine header, LineCursor cursor, Node node) {
        final int count = PayloadSection.declaredCount(header);
        final SortedMap<Integer, Face> faces = new TreeMap<>();
        int next = 0;
        int rows = 0;
        while (rows < count) {
            AsciiLine line = cursor.require(header, "faces");
            for (FaceLineCodec.Entry entry : FaceLineCodec.read(line)) {
                int idx = entry.index() == FaceLineCodec.NO_INDEX ? next++ : entry.index();
                if (idx < 0 || idx >= count) {
                    throw line.error("face index " + idx + " outside 0.." + (count - 1));
                }
                faces.put(idx, entry.face());
                rows++;
            }
        }
        if (faces.size() < count) {
            sink.onIncompleteBlock(IncompleteBlockEvent.of(node.name(), "faces", header.number(), count, faces.size()));
        }
        final Mesh mesh = node.mesh().orElseThrow();
        mesh.faces().clear();
        mesh.faces().addAll(faces.values());
    }

    private static void readUvs(AsciiLine header, LineCursor cursor, List<Vector2> target) {
        final int count = PayloadSection.declaredRows(header, cursor);
        reset(target, count, Vector2.ZERO);
        for (int row = 0; row < count; row++) {
            AsciiLine line = cursor.require(header, header.keyword());
            if (line.size() <= 3) {
                // u v, or u v w with w ignored
                target.set(row, new Vector2(line.floatAt(0), line.floatAt(1)));
            } else {
                target.set(slot(line, count), new Vector2(line.floatAt(1), line.floatAt(2)));
            }
        }
    }

    private static void readColors(AsciiLine header, LineCursor cursor, Mesh mesh) {
        final int count = PayloadSection.declaredRows(header, cursor);
        reset(mesh.colors(), count, Vector3.ZERO);
        for (int row = 0; row < count; row++) {
            AsciiLine line = cursor.require(header, "colors");
            if (line.size() == 3) {
                mesh.colors().set(row, line.vectorAt(0));
            } else {
                mesh.colors().set(slot(line, count), line.vectorAt(1));
            }
        }
    }

    private static void readTexIndices(AsciiLine header, LineCursor cursor, Mesh mesh) {
        final int count = PayloadSection.declaredRows(header, cursor);
        reset(mesh.textureIndices1(), count, new IndexTriple(0, 0, 0));
        for (int row = 0; row < count; row++) {
            AsciiLine line = cursor.require(header, "texindices1");
            if (line.size() == 3) {
                mesh.textureIndices1().set(row, new IndexTriple(line.intAt(0), line.intAt(1), line.intAt(2)));
            } else {
                mesh.textureIndices1().set(slot(line, count),
                    new IndexTriple(line.intAt(1), line.intAt(2), line.intAt(3)));
            }
        }
    }

    private static void readRoomLinks(AsciiLine header, LineCursor cursor, Mesh mesh) {
        final int count = PayloadSection.declaredRows(header, cursor);
        mesh.roomLinks().clear();
        for (int row = 0; row < count; row++) {
            AsciiLine line = cursor.require(header, "roomlinks");
            mesh.roomLinks().add(new RoomLink(line.intAt(0), line.intAt(1)));
        }
    }

    private static int slot(AsciiLine line, int count) {
        int idx = line.intAt(0);
        if (idx < 0 || idx >= count) {
            throw line.error("row index " + idx + " outside 0.." + (count - 1));
        }
        return idx;
    }

    private static <T> void reset(List<T> list, int count, T fill) {
        list.clear();
        list.addAll(Collections.nCopies(count, fill));
    }

    // ---- writing ---------------------------------------------------------------

    @Override
    public void write(Node node, AsciiLineWriter out) throws IOException {
        final Mesh mesh = node.mesh().orElseThrow();

        out.vector("ambient", mesh.ambient());
        out.vector("diffuse", mesh.diffuse());
        if (!mesh.selfIllumColor().equals(Vector3.ZERO)) {
            out.vector(ControllerType.SELF_ILLUM_COLOR.asciiName(), mesh.selfIllumColor());
        }
        if (mesh.alpha() != 1f) {
            out.floats(ControllerType.ALPHA.asciiName(), mesh.alpha());
        }
        out.integer("transparencyhint", mesh.transparencyHint());
        if (!mesh.texture1().isEmpty()) {
            out.line("bitmap", mesh.texture1());
        }
        if (!mesh.texture2().isEmpty()) {
            out.line("bitmap2", mesh.texture2());
        }
        out.flag("render", mesh.render());
        out.flag("shadow", mesh.shadow());
        if (mesh.beaming()) {
            out.flag("beaming", true);
        }
        if (mesh.backgroundGeometry()) {
            out.flag("m_bIsBackgroundGeometry", true);
        }
        if (mesh.rotateTexture()) {
            out.flag("rotatetexture", true);
        }
        if (mesh.hasLightmap()) {
            out.flag("lightmapped", true);
        }
        if (mesh.tangentSpace()) {
            out.flag("tangentspace", true);
        }
        writeUvAnimation(mesh, out);
        if (mesh.dirtEnabled()) {
            out.flag("dirt_enabled", true);
        }
        if (mesh.dirtTexture() != 1) {
            out.integer("dirt_texture", mesh.dirtTexture());
        }
        if (mesh.dirtWorldSpace() != 1) {
            out.integer("dirt_worldspace", mesh.dirtWorldSpace());
        }
        if (mesh.hologramDoNotDraw()) {
            out.flag("hologram_donotdraw", true);
        }

        writeVerts(mesh, out);
        writeFaces(mesh, out);
        writeUvs("tverts", mesh.uv1(), out);
        writeUvs("tverts1", mesh.uv2(), out);
        if (!mesh.colors().isEmpty()) {
            out.integer("colors", mesh.colors().size());
            out.indent();
            for (Vector3 c : mesh.colors()) {
                out.row(c.x(), c.y(), c.z());
            }
            out.outdent();
        }
        if (!mesh.textureIndices1().isEmpty()) {
            out.integer("texindices1", mesh.textureIndices1().size());
            out.indent();
            for (IndexTriple t : mesh.textureIndices1()) {
                out.line(Integer.toString(t.a()), Integer.toString(t.b()), Integer.toString(t.c()));
            }
            out.outdent();
        }
        if (!mesh.roomLinks().isEmpty()) {
            out.integer("roomlinks", mesh.roomLinks().size());
            out.indent();
            for (RoomLink link : mesh.roomLinks()) {
                out.line(Integer.toString(link.index()), Integer.toString(link.room()));
            }
            out.outdent();
        }
    }

    private static void writeUvAnimation(Mesh mesh, AsciiLineWriter out) throws IOException {
        if (mesh.animateUv()) {
            out.flag("animateuv", true);
        }
        if (mesh.uvDirectionX() != 0f) {
            out.floats("uvdirectionx", mesh.uvDirectionX());
        }
        if (mesh.uvDirectionY() != 0f) {
            out.floats("uvdirectiony", mesh.uvDirectionY());
        }
        if (mesh.uvJitter() != 0f) {
            out.floats("uvjitter", mesh.uvJitter());
        }
        if (mesh.uvJitterSpeed() != 0f) {
            out.floats("uvjitterspeed", mesh.uvJitterSpeed());
        }
    }

    private static void writeVerts(Mesh mesh, AsciiLineWriter out) throws IOException {
        final List<Vector3> positions = mesh.positions();
        if (positions.isEmpty()) {
            return;
        }
        final boolean withNormals = mesh.normals().size() == positions.size();
        out.integer("verts", positions.size());
        out.indent();
        for (int i = 0; i < positions.size(); i++) {
            Vector3 p = positions.get(i);
            if (withNormals) {
                Vector3 n = mesh.normals().get(i);
                out.floats(Integer.toString(i), p.x(), p.y(), p.z(), n.x(), n.y(), n.z());
            } else {
                out.row(p.x(), p.y(), p.z());
            }
        }
        out.outdent();
    }

    private static void writeFaces(Mesh mesh, AsciiLineWriter out) throws IOException {
        if (mesh.faces().isEmpty()) {
            return;
        }
        out.integer("faces", mesh.faces().size());
        out.indent();
        for (Face f : mesh.faces()) {
            out.line(FaceLineCodec.write(f));
        }
        out.outdent();
    }

    private static void writeUvs(String keyword, List<Vector2> uvs, AsciiLineWriter out) throws IOException {
        if (uvs.isEmpty()) {
            return;
        }
        out.integer(keyword, uvs.size());
        out.indent();
        for (Vector2 uv : uvs) {
            out.row(uv.u(), uv.v());
        }
        out.outdent();
    }
}
