package com.questrail.mdl.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Node of an animation's tree. Carries controllers only; it is matched to the
 * geometry node of the same name.
 */
public final class AnimationNode
{
    private final String name;
    private int id;
    private final List<AnimationNode> children = new ArrayList<>();
    private final List<Controller> controllers = new ArrayList<>();
    private final List<String> rawLines = new ArrayList<>();

    public AnimationNode(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() { return name; }

    public int id() { return id; }
    public void setId(int id) { this.id = id; }

    public List<AnimationNode> children() { return children; }
    public List<Controller> controllers() { return controllers; }
    public List<String> rawLines() { return rawLines; }

    public List<AnimationNode> flatten() {
        List<AnimationNode> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    private static void collect(AnimationNode node, List<AnimationNode> out) {
        out.add(node);
        for (AnimationNode child : node.children) {
            collect(child, out);
        }
    }

    public Optional<AnimationNode> find(String nodeName) {
        return flatten().stream().filter(n -> n.name.equalsIgnoreCase(nodeName)).findFirst();
    }

    @Override
    public String toString() {
        return "AnimationNode[" + name + "#" + id + "]";
    }
}
