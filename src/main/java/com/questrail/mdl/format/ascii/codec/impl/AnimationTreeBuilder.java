package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.format.ascii.observability.AmbiguousReferenceEvent;
import com.questrail.mdl.format.ascii.observability.MdlObservabilitySink;
import com.questrail.mdl.format.ascii.observability.UnresolvedReferenceEvent;
import com.questrail.mdl.model.AnimationNode;
import com.questrail.mdl.model.Node;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * AnimationTreeBuilder
 * -----------------------------------------------------------------------------
 * Builds the node tree of one animation.
 *
 * <p>A numeric parent is first read as a position in the animation's own
 * declaration order. As a fallback it is read as the id of a geometry node,
 * mapped to the animation node of the same name. When both readings apply
 * and disagree, the local one wins and the clash is reported. Names resolve
 * among the animation's nodes only. {@code NULL} and anything unresolvable
 * mean top level.</p>
 *
 * <p>The root is the top-level node with the most children, the first one on
 * ties, so that a stray leaf declared first does not become the root. Other
 * top-level nodes are attached under it.</p>
 */
final class AnimationTreeBuilder
{
    private static final int TOP = -1;
    private static final int UNRESOLVED = -3;

    record Entry(AnimationNode node, String parentToken) {
        Entry {
            Objects.requireNonNull(node, "node");
        }
    }

    private final MdlObservabilitySink sink;

    AnimationTreeBuilder(MdlObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * @param scope    animation name, for reported events
     * @param geometry geometry nodes of the model, any order
     * @return the root, or {@code null} when the animation has no nodes
     */
    AnimationNode build(String scope, List<Entry> entries, List<Node> geometry) {
        final int n = entries.size();
        if (n == 0) {
            return null;
        }
        for (int i = 0; i < n; i++) {
            entries.get(i).node().setId(i);
        }

        final Map<String, Integer> byName = new HashMap<>();
        for (int i = 0; i < n; i++) {
            byName.put(lower(name(entries, i)), i);
        }
        final Map<Integer, String> geometryNames = new HashMap<>();
        for (Node g : geometry) {
            geometryNames.putIfAbsent(g.id(), g.name());
        }

        final int[] parent = new int[n];
        final Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < n; i++) {
            parent[i] = resolve(scope, entries, i, seen, byName, geometryNames);
            seen.put(lower(name(entries, i)), i);
        }
        for (int i = 0; i < n; i++) {
            if (parent[i] == i) {
                parent[i] = UNRESOLVED;
            }
        }
        GeometryTreeBuilder.breakCycles(parent);

        final int root = chooseRoot(parent);
        final AnimationNode rootNode = entries.get(root).node();
        if (parent[root] == UNRESOLVED) {
            sink.onUnresolvedReference(UnresolvedReferenceEvent.of(
                scope, rootNode.name(), entries.get(root).parentToken(), "NULL"));
        }
        for (int i = 0; i < n; i++) {
            if (i == root) {
                continue;
            }
            if (parent[i] == UNRESOLVED) {
                sink.onUnresolvedReference(UnresolvedReferenceEvent.of(
                    scope, name(entries, i), entries.get(i).parentToken(), rootNode.name()));
                parent[i] = root;
            } else if (parent[i] == TOP) {
                parent[i] = root;
            }
        }
        for (int i = 0; i < n; i++) {
            if (i != root) {
                entries.get(parent[i]).node().children().add(entries.get(i).node());
            }
        }
        return rootNode;
    }

    private int resolve(String scope, List<Entry> entries, int i, Map<String, Integer> seen,
                        Map<String, Integer> byName, Map<Integer, String> geometryNames) {
        final String token = entries.get(i).parentToken();
        if (GeometryTreeBuilder.isTopToken(token)) {
            return TOP;
        }
        final String key = lower(token);
        final Integer sameName = seen.containsKey(key) ? seen.get(key) : byName.get(key);
        final Integer numeric = GeometryTreeBuilder.integerValue(token);
        if (numeric == null) {
            return sameName != null ? sameName : UNRESOLVED;
        }

        final int n = entries.size();
        final int local = numeric >= 0 && numeric < n ? numeric : -1;
        if (sameName != null) {
            if (local >= 0 && local != sameName) {
                ambiguous(scope, entries, i, token, sameName, local);
            }
            return sameName;
        }

        int fallback = -1;
        String geometryName = geometryNames.get(numeric);
        if (geometryName != null) {
            Integer match = byName.get(lower(geometryName));
            fallback = match != null ? match : -1;
        }

        if (local >= 0 && fallback >= 0 && local != fallback) {
            ambiguous(scope, entries, i, token, local, fallback);
            return local;
        }
        if (local >= 0) {
            return local;
        }
        if (fallback >= 0) {
            return fallback;
        }
        return UNRESOLVED;
    }

    /** Top-level node with the most children; first seen on ties. */
    private static int chooseRoot(int[] parent) {
        final int n = parent.length;
        final int[] childCount = new int[n];
        for (int p : parent) {
            if (p >= 0) {
                childCount[p]++;
            }
        }
        int best = -1;
        for (int i = 0; i < n; i++) {
            if (parent[i] >= 0) {
                continue;
            }
            if (best < 0 || childCount[i] > childCount[best]) {
                best = i;
            }
        }
        return best >= 0 ? best : 0;
    }

    private void ambiguous(String scope, List<Entry> entries, int i, String token, int chosen, int rejected) {
        sink.onAmbiguousReference(AmbiguousReferenceEvent.of(
            scope, name(entries, i), token, name(entries, chosen), name(entries, rejected)));
    }

    private static String name(List<Entry> entries, int i) {
        return entries.get(i).node().name();
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
