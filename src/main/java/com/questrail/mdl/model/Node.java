package com.questrail.mdl.model;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Node
 * -----------------------------------------------------------------------------
 * One entry of a model's geometry tree.
 *
 * <p>A node holds up to eight independent payload slots. They are not
 * subtypes: a skinned mesh is a node carrying both a {@link Mesh} and a
 * {@link Skin}. The textual type keyword is never stored; it is derived from
 * the attached payloads by {@code com.questrail.mdl.core.NodeTypeClassifier}.</p>
 *
 * <p>{@link #rawLines()} holds body lines the codec did not recognize,
 * verbatim, so that they survive a read/write cycle.</p>
 */
public final class Node
{
    public static final int NO_PARENT = -1;

    private String name;
    private int id;
    private int parentId = NO_PARENT;
    private Vector3 position = Vector3.ZERO;
    private Quaternion orientation = Quaternion.IDENTITY;
    private float scale = 1f;
    private Vector3 wireColor;

    private final List<Node> children = new ArrayList<>();
    private final List<Controller> controllers = new ArrayList<>();
    private final List<String> rawLines = new ArrayList<>();

    private Mesh mesh;
    private Skin skin;
    private Dangly dangly;
    private Light light;
    private Emitter emitter;
    private Reference reference;
    private Saber saber;
    private Walkmesh walkmesh;

    public Node(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() { return name; }
    public void setName(String name) { this.name = Objects.requireNonNull(name, "name"); }

    public int id() { return id; }
    public void setId(int id) { this.id = id; }

    public int parentId() { return parentId; }
    public void setParentId(int parentId) { this.parentId = parentId; }

    public Vector3 position() { return position; }
    public void setPosition(Vector3 position) { this.position = Objects.requireNonNull(position, "position"); }

    public Quaternion orientation() { return orientation; }
    public void setOrientation(Quaternion q) { this.orientation = Objects.requireNonNull(q, "orientation"); }

    public float scale() { return scale; }
    public void setScale(float scale) { this.scale = scale; }

    public Optional<Vector3> wireColor() { return Optional.ofNullable(wireColor); }
    public void setWireColor(Vector3 wireColor) { this.wireColor = wireColor; }

    public List<Node> children() { return children; }
    public List<Controller> controllers() { return controllers; }
    public List<String> rawLines() { return rawLines; }

    public void addChild(Node child) {
        Objects.requireNonNull(child, "child");
        child.setParentId(id);
        children.add(child);
    }

    public Optional<Controller> controller(ControllerType type) {
        for (Controller c : controllers) {
            if (c.type() == type) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    // ---- payload slots -------------------------------------------------------

    public Optional<Mesh> mesh() { return Optional.ofNullable(mesh); }
    public void setMesh(Mesh mesh) { this.mesh = mesh; }

    public Optional<Skin> skin() { return Optional.ofNullable(skin); }
    public void setSkin(Skin skin) { this.skin = skin; }

    public Optional<Dangly> dangly() { return Optional.ofNullable(dangly); }
    public void setDangly(Dangly dangly) { this.dangly = dangly; }

    public Optional<Light> light() { return Optional.ofNullable(light); }
    public void setLight(Light light) { this.light = light; }

    public Optional<Emitter> emitter() { return Optional.ofNullable(emitter); }
    public void setEmitter(Emitter emitter) { this.emitter = emitter; }

    public Optional<Reference> reference() { return Optional.ofNullable(reference); }
    public void setReference(Reference reference) { this.reference = reference; }

    public Optional<Saber> saber() { return Optional.ofNullable(saber); }
    public void setSaber(Saber saber) { this.saber = saber; }

    public Optional<Walkmesh> walkmesh() { return Optional.ofNullable(walkmesh); }
    public void setWalkmesh(Walkmesh walkmesh) { this.walkmesh = walkmesh; }

    /**
     * Attaches a fresh, empty payload of the given kind unless one is already
     * present.
     */
    public void attach(PayloadKind kind) {
        switch (kind) {
            case MESH -> { if (mesh == null) mesh = new Mesh(); }
            case SKIN -> { if (skin == null) skin = new Skin(); }
            case DANGLY -> { if (dangly == null) dangly = new Dangly(); }
            case LIGHT -> { if (light == null) light = new Light(); }
            case EMITTER -> { if (emitter == null) emitter = new Emitter(); }
            case REFERENCE -> { if (reference == null) reference = new Reference(); }
            case SABER -> { if (saber == null) saber = new Saber(); }
            case WALKMESH -> { if (walkmesh == null) walkmesh = new Walkmesh(); }
        }
    }

    public Set<PayloadKind> payloadKinds() {
        EnumSet<PayloadKind> kinds = EnumSet.noneOf(PayloadKind.class);
        if (mesh != null) kinds.add(PayloadKind.MESH);
        if (skin != null) kinds.add(PayloadKind.SKIN);
        if (dangly != null) kinds.add(PayloadKind.DANGLY);
        if (light != null) kinds.add(PayloadKind.LIGHT);
        if (emitter != null) kinds.add(PayloadKind.EMITTER);
        if (reference != null) kinds.add(PayloadKind.REFERENCE);
        if (saber != null) kinds.add(PayloadKind.SABER);
        if (walkmesh != null) kinds.add(PayloadKind.WALKMESH);
        return kinds;
    }

    // ---- traversal -----------------------------------------------------------

    /**
     * This node followed by all of its descendants, depth first, children in
     * list order.
     */
    public List<Node> flatten() {
        List<Node> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    private static void collect(Node node, List<Node> out) {
        out.add(node);
        for (Node child : node.children) {
            collect(child, out);
        }
    }

    public Optional<Node> find(String nodeName) {
        for (Node n : flatten()) {
            if (n.name.equalsIgnoreCase(nodeName)) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Node[" + name + "#" + id + ", payloads=" + payloadKinds() + "]";
    }
}
