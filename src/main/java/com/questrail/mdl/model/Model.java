package com.questrail.mdl.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Model
 * -----------------------------------------------------------------------------
 * Root of the in-memory graph: model header values, one geometry tree and the
 * animations. A model exclusively owns every node reachable from
 * {@link #root()}.
 *
 * <p>Defaults are the values the legacy toolchain assumes when a header
 * keyword is absent.</p>
 */
public final class Model
{
    public static final float DEFAULT_ANIMATION_SCALE = 0.971f;
    public static final Vector3 DEFAULT_BOUNDING_MIN = new Vector3(-5f, -5f, -1f);
    public static final Vector3 DEFAULT_BOUNDING_MAX = new Vector3(5f, 5f, 10f);
    public static final float DEFAULT_RADIUS = 7f;

    private String name;
    private String supermodel = "null";
    private Classification classification = Classification.OTHER;
    private int classificationUnk1;
    private boolean affectedByFog;
    private int compressQuaternions;
    private String headLink;
    private String fileDependency;
    private float animationScale = DEFAULT_ANIMATION_SCALE;
    private Vector3 boundingMin = DEFAULT_BOUNDING_MIN;
    private Vector3 boundingMax = DEFAULT_BOUNDING_MAX;
    private float radius = DEFAULT_RADIUS;
    private Vector3 layoutPosition;
    private Node root;
    private final List<Animation> animations = new ArrayList<>();

    public Model(String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.root = new Node(name);
    }

    public String name() { return name; }
    public void setName(String name) { this.name = Objects.requireNonNull(name, "name"); }

    public String supermodel() { return supermodel; }
    public void setSupermodel(String supermodel) { this.supermodel = Objects.requireNonNull(supermodel, "supermodel"); }

    public Classification classification() { return classification; }
    public void setClassification(Classification c) { this.classification = Objects.requireNonNull(c, "classification"); }

    public int classificationUnk1() { return classificationUnk1; }
    public void setClassificationUnk1(int v) { this.classificationUnk1 = v; }

    public boolean affectedByFog() { return affectedByFog; }
    public void setAffectedByFog(boolean fog) { this.affectedByFog = fog; }

    /** Stored losslessly; no further meaning is attached to it. */
    public int compressQuaternions() { return compressQuaternions; }
    public void setCompressQuaternions(int v) { this.compressQuaternions = v; }

    public Optional<String> headLink() { return Optional.ofNullable(headLink); }
    public void setHeadLink(String headLink) { this.headLink = headLink; }

    public Optional<String> fileDependency() { return Optional.ofNullable(fileDependency); }
    public void setFileDependency(String fileDependency) { this.fileDependency = fileDependency; }

    public float animationScale() { return animationScale; }
    public void setAnimationScale(float scale) { this.animationScale = scale; }

    public Vector3 boundingMin() { return boundingMin; }
    public void setBoundingMin(Vector3 v) { this.boundingMin = Objects.requireNonNull(v, "boundingMin"); }

    public Vector3 boundingMax() { return boundingMax; }
    public void setBoundingMax(Vector3 v) { this.boundingMax = Objects.requireNonNull(v, "boundingMax"); }

    public float radius() { return radius; }
    public void setRadius(float radius) { this.radius = radius; }

    public Optional<Vector3> layoutPosition() { return Optional.ofNullable(layoutPosition); }
    public void setLayoutPosition(Vector3 v) { this.layoutPosition = v; }

    public Node root() { return root; }
    public void setRoot(Node root) { this.root = Objects.requireNonNull(root, "root"); }

    public List<Animation> animations() { return animations; }

    /** Every geometry node, depth first from the root. */
    public List<Node> nodes() {
        return root.flatten();
    }

    public Optional<Node> node(String nodeName) {
        return root.find(nodeName);
    }

    public Optional<Animation> animation(String animationName) {
        return animations.stream().filter(a -> a.name().equalsIgnoreCase(animationName)).findFirst();
    }
}
