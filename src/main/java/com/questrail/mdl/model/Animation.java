package com.questrail.mdl.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Animation
 * -----------------------------------------------------------------------------
 * One named animation: timing, events and a node tree parallel to the model's
 * geometry tree.
 */
public final class Animation
{
    private String name;
    private String modelName;
    private String animRoot;
    private float length;
    private float transitionLength;
    private AnimationNode root;
    private final List<AnimationEvent> events = new ArrayList<>();

    public Animation(String name, String modelName) {
        this.name = Objects.requireNonNull(name, "name");
        this.modelName = Objects.requireNonNull(modelName, "modelName");
    }

    public String name() { return name; }
    public void setName(String name) { this.name = Objects.requireNonNull(name, "name"); }

    /** Model named on the {@code newanim} line. */
    public String modelName() { return modelName; }
    public void setModelName(String modelName) { this.modelName = Objects.requireNonNull(modelName, "modelName"); }

    /** Node the animation is rooted at, when declared with {@code animroot}. */
    public Optional<String> animRoot() { return Optional.ofNullable(animRoot); }
    public void setAnimRoot(String animRoot) { this.animRoot = animRoot; }

    public float length() { return length; }
    public void setLength(float length) { this.length = length; }

    public float transitionLength() { return transitionLength; }
    public void setTransitionLength(float transitionLength) { this.transitionLength = transitionLength; }

    public Optional<AnimationNode> root() { return Optional.ofNullable(root); }
    public void setRoot(AnimationNode root) { this.root = root; }

    public List<AnimationEvent> events() { return events; }

    public List<AnimationNode> nodes() {
        return root == null ? List.of() : root.flatten();
    }

    @Override
    public String toString() {
        return "Animation[" + name + ", length=" + length + ", nodes=" + nodes().size() + "]";
    }
}
