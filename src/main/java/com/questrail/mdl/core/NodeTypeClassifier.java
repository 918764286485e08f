package com.questrail.mdl.core;

import com.questrail.mdl.model.NodeType;
import com.questrail.mdl.model.PayloadKind;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * NodeTypeClassifier
 * -----------------------------------------------------------------------------
 * Maps between a node's attached payloads and the legacy node type.
 *
 * <p>The combined flag value is the header bit plus one bit per payload. Only
 * the combinations enumerated by {@link NodeType} have a keyword; everything
 * else is written as {@code dummy}. That fallback is not an error here;
 * callers report it.</p>
 */
public final class NodeTypeClassifier
{
    /** Node-name prefix some exporters use to mark saber meshes. */
    public static final String SABER_NAME_PREFIX = "2081__";

    private NodeTypeClassifier() {}

    public static int combinedFlags(Set<PayloadKind> payloads)
    {
        int flags = PayloadKind.HEADER_FLAG;
        for (PayloadKind kind : payloads) {
            flags |= kind.flag();
        }
        return flags;
    }

    /**
     * The node type whose flags match exactly, if any.
     */
    public static Optional<NodeType> recognize(Set<PayloadKind> payloads)
    {
        return NodeType.fromFlags(combinedFlags(payloads));
    }

    /**
     * Type to write for the given payloads; unknown combinations become
     * {@link NodeType#DUMMY}. With {@code flattenSkins} a skinned mesh is
     * written as a plain trimesh.
     */
    public static NodeType classify(Set<PayloadKind> payloads, boolean flattenSkins)
    {
        final NodeType type = recognize(payloads).orElse(NodeType.DUMMY);
        if (flattenSkins && type == NodeType.SKIN) {
            return NodeType.TRIMESH;
        }
        return type;
    }

    /**
     * Payload slots to attach for a declared keyword. Unknown keywords, like
     * {@code dummy}, attach nothing.
     */
    public static Set<PayloadKind> payloadsForKeyword(String keyword)
    {
        return NodeType.fromKeyword(keyword)
            .map(NodeType::payloads)
            .orElseGet(() -> EnumSet.noneOf(PayloadKind.class));
    }

    public static boolean hasSaberPrefix(String nodeName)
    {
        return nodeName.toLowerCase(Locale.ROOT).startsWith(SABER_NAME_PREFIX);
    }

    public static String stripSaberPrefix(String nodeName)
    {
        return hasSaberPrefix(nodeName) ? nodeName.substring(SABER_NAME_PREFIX.length()) : nodeName;
    }
}
