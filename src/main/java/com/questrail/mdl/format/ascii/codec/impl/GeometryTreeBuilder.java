package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.format.ascii.observability.AmbiguousReferenceEvent;
import com.questrail.mdl.format.ascii.observability.MdlObservabilitySink;
import com.questrail.mdl.format.ascii.observability.UnresolvedReferenceEvent;
import com.questrail.mdl.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * GeometryTreeBuilder
 * -----------------------------------------------------------------------------
 * Turns the flat list of parsed geometry nodes into a tree.
 *
 * <p>Parent tokens:</p>
 * <ul>
 *   <li>{@code NULL} (any case) or {@code -1}: top level</li>
 *   <li>a node name, case-insensitive: the latest node of that name declared
 *       so far, or, if none yet, the latest one in the whole file</li>
 *   <li>an integer: index into the declaration order. When the integer is
 *       also a node's name the name wins and the clash is reported.</li>
 * </ul>
 *
 * <p>Self references and cycles count as unresolved. The root is the
 * top-level node named after the model, else the only top-level node named
 * {@code root}, else the first top-level node. Every other top-level or
 * unresolved node is attached under the root, so no node is lost. Children
 * keep declaration order and ids are declaration indices.</p>
 */
final class GeometryTreeBuilder
{
    private static final Logger log = LoggerFactory.getLogger(GeometryTreeBuilder.class);

    static final String SCOPE = "geometry";

    private static final int TOP = -1;
    private static final int PENDING = -2;
    private static final int UNRESOLVED = -3;

    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,9}");

    /** A parsed node and the raw token of its {@code parent} line, if any. */
    record Entry(Node node, String parentToken) {
        Entry {
            Objects.requireNonNull(node, "node");
        }
    }

    private final MdlObservabilitySink sink;

    GeometryTreeBuilder(MdlObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * @return the root; a fresh dummy named after the model when there are no
     *         entries
     */
    Node build(String modelName, List<Entry> entries) {
        final int n = entries.size();
        if (n == 0) {
            log.debug("model '{}' declares no nodes; using a synthetic root", modelName);
            Node root = new Node(modelName);
            root.setId(0);
            return root;
        }
        for (int i = 0; i < n; i++) {
            entries.get(i).node().setId(i);
        }

        final int[] parent = resolve(entries);
        final int root = chooseRoot(modelName, entries, parent);
        final Node rootNode = entries.get(root).node();

        if (parent[root] == UNRESOLVED) {
            report(entries.get(root), "NULL");
        }
        parent[root] = TOP;

        for (int i = 0; i < n; i++) {
            if (i == root) {
                continue;
            }
            if (parent[i] == UNRESOLVED) {
                report(entries.get(i), rootNode.name());
                parent[i] = root;
            } else if (parent[i] == TOP) {
                log.debug("top-level node '{}' attached under root '{}'", name(entries, i), rootNode.name());
                parent[i] = root;
            }
        }

        rootNode.setParentId(Node.NO_PARENT);
        for (int i = 0; i < n; i++) {
            if (i != root) {
                entries.get(parent[i]).node().addChild(entries.get(i).node());
            }
        }
        return rootNode;
    }

    private int[] resolve(List<Entry> entries) {
        final int n = entries.size();
        final int[] parent = new int[n];
        final Map<String, Integer> seen = new HashMap<>();

        for (int i = 0; i < n; i++) {
            String token = entries.get(i).parentToken();
            if (isTopToken(token)) {
                parent[i] = TOP;
            } else {
                Integer named = seen.get(lower(token));
                if (named != null) {
                    parent[i] = named;
                    checkAmbiguous(entries, i, token, named);
                } else {
                    parent[i] = PENDING;
                }
            }
            seen.put(lower(name(entries, i)), i);
        }

        for (int i = 0; i < n; i++) {
            if (parent[i] != PENDING) {
                continue;
            }
            String token = entries.get(i).parentToken();
            Integer named = seen.get(lower(token));
            if (named != null) {
                parent[i] = named;
                checkAmbiguous(entries, i, token, named);
            } else if (inRange(token, n)) {
                parent[i] = Integer.parseInt(token);
            } else {
                parent[i] = UNRESOLVED;
            }
        }

        for (int i = 0; i < n; i++) {
            if (parent[i] == i) {
                parent[i] = UNRESOLVED;
            }
        }
        breakCycles(parent);
        return parent;
    }

    /** Marks every node that is its own ancestor as unresolved. */
    static void breakCycles(int[] parent) {
        final int n = parent.length;
        final boolean[] inCycle = new boolean[n];
        for (int i = 0; i < n; i++) {
            int j = parent[i];
            for (int steps = 0; j >= 0 && steps < n; steps++) {
                if (j == i) {
                    inCycle[i] = true;
                    break;
                }
                j = parent[j];
            }
        }
        for (int i = 0; i < n; i++) {
            if (inCycle[i]) {
                parent[i] = UNRESOLVED;
            }
        }
    }

    private static int chooseRoot(String modelName, List<Entry> entries, int[] parent) {
        final List<Integer> top = new ArrayList<>();
        for (int i = 0; i < parent.length; i++) {
            if (parent[i] == TOP) {
                top.add(i);
            }
        }
        for (int i : top) {
            if (name(entries, i).equalsIgnoreCase(modelName)) {
                return i;
            }
        }
        int namedRoot = -1;
        int namedRootCount = 0;
        for (int i : top) {
            if (name(entries, i).equalsIgnoreCase("root")) {
                namedRoot = i;
                namedRootCount++;
            }
        }
        if (namedRootCount == 1) {
            return namedRoot;
        }
        if (!top.isEmpty()) {
            return top.get(0);
        }
        for (int i = 0; i < parent.length; i++) {
            if (parent[i] == UNRESOLVED) {
                return i;
            }
        }
        return 0;
    }

    private void checkAmbiguous(List<Entry> entries, int i, String token, int named) {
        if (!inRange(token, entries.size())) {
            return;
        }
        int index = Integer.parseInt(token);
        if (index != named) {
            sink.onAmbiguousReference(AmbiguousReferenceEvent.of(
                SCOPE, name(entries, i), token,
                name(entries, named),
                name(entries, index) + " (index " + index + ")"));
        }
    }

    private void report(Entry entry, String attachedTo) {
        sink.onUnresolvedReference(UnresolvedReferenceEvent.of(
            SCOPE, entry.node().name(), entry.parentToken(), attachedTo));
    }

    static boolean isTopToken(String token) {
        return token == null || token.equalsIgnoreCase("null") || token.equals("-1");
    }

    /** Value of a plain integer token of at most nine digits, or {@code null}. */
    static Integer integerValue(String token) {
        if (token == null || !INTEGER.matcher(token).matches()) {
            return null;
        }
        return Integer.valueOf(token);
    }

    static boolean inRange(String token, int size) {
        Integer v = integerValue(token);
        return v != null && v >= 0 && v < size;
    }

    private static String name(List<Entry> entries, int i) {
        return entries.get(i).node().name();
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
