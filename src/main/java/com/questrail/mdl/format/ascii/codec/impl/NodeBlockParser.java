package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.core.NodeTypeClassifier;
import com.questrail.mdl.format.ascii.config.MdlAsciiConfig;
import com.questrail.mdl.format.ascii.internal.decode.MdlFormatException;
import com.questrail.mdl.format.ascii.observability.MdlObservabilitySink;
import com.questrail.mdl.format.ascii.observability.NodeFormatErrorEvent;
import com.questrail.mdl.mapping.ControllerKeyword;
import com.questrail.mdl.mapping.ControllerNameIndex;
import com.questrail.mdl.model.AnimationNode;
import com.questrail.mdl.model.Controller;
import com.questrail.mdl.model.ControllerNamespace;
import com.questrail.mdl.model.Node;
import com.questrail.mdl.model.NodeType;
import com.questrail.mdl.model.PayloadKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * NodeBlockParser
 * -----------------------------------------------------------------------------
 * Parses the body of one {@code node <type> <name> ... endnode} block.
 *
 * <p>Each body line goes to the first of these that accepts it:</p>
 * <ol>
 *   <li>{@code parent} and {@code wirecolor}</li>
 *   <li>controller keywords of the node's namespaces, single shot or keyed;
 *       in geometry nodes a single-shot value with a matching field sets that
 *       field instead ({@link StaticPropertyBindings})</li>
 *   <li>the payload sections of the attached payloads</li>
 *   <li>otherwise the line is kept verbatim in the node's raw lines</li>
 * </ol>
 *
 * <p>A {@link MdlFormatException} inside the body ends that block: the lines
 * after it are skipped, the partly filled node is kept and the error is
 * reported. In strict mode the exception propagates instead.</p>
 */
final class NodeBlockParser
{
    private static final Logger log = LoggerFactory.getLogger(NodeBlockParser.class);

    private static final Set<String> BLOCK_TERMINATORS =
        Set.of("node", "endmodelgeom", "newanim", "doneanim", "donemodel");

    private final ControllerNameIndex names;
    private final List<PayloadSection> sections;
    private final MdlAsciiConfig config;
    private final MdlObservabilitySink sink;

    NodeBlockParser(ControllerNameIndex names, List<PayloadSection> sections,
                    MdlAsciiConfig config, MdlObservabilitySink sink) {
        this.names = Objects.requireNonNull(names, "names");
        this.sections = List.copyOf(sections);
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Collects the body lines following a node header, consuming the closing
     * {@code endnode} or {@code }}. A block left open ends before the next
     * structural keyword.
     */
    static List<AsciiLine> collectBody(AsciiLine header, LineCursor cursor) {
        final List<AsciiLine> body = new ArrayList<>();
        while (cursor.hasNext()) {
            final String keyword = cursor.peek().keyword();
            if (keyword.equals("endnode") || keyword.equals("}")) {
                cursor.next();
                return body;
            }
            if (BLOCK_TERMINATORS.contains(keyword)) {
                log.debug("node at line {} has no endnode; closed at line {}", header.number(), cursor.peek().number());
                return body;
            }
            if (keyword.equals("{")) {
                cursor.next();
                continue;
            }
            body.add(cursor.next());
        }
        return body;
    }

    /**
     * Parses a geometry node. The header is {@code node <type> <name>}.
     */
    GeometryTreeBuilder.Entry parseGeometry(AsciiLine header, List<AsciiLine> body) {
        final String keyword = header.token(1);
        String name = header.token(2);

        final Set<PayloadKind> payloads;
        if (NodeTypeClassifier.hasSaberPrefix(name)) {
            payloads = NodeType.SABER.payloads();
            name = NodeTypeClassifier.stripSaberPrefix(name);
        } else {
            payloads = NodeTypeClassifier.payloadsForKeyword(keyword);
        }

        final Node node = new Node(name);
        for (PayloadKind kind : payloads) {
            node.attach(kind);
        }
        final Set<ControllerNamespace> namespaces = ControllerNamespace.forPayloads(payloads);

        String parentToken = null;
        final LineCursor cursor = new LineCursor(body);
        try {
            while (cursor.hasNext()) {
                final AsciiLine line = cursor.next();
                switch (line.keyword()) {
                    case "parent" -> parentToken = line.tokenOr(1, "NULL");
                    case "wirecolor" -> node.setWireColor(line.vectorAt(1));
                    default -> {
                        if (!readController(line, cursor, node, namespaces) && !readSection(line, cursor, node)) {
                            node.rawLines().add(line.text());
                        }
                    }
                }
            }
        } catch (MdlFormatException ex) {
            recover(name, cursor, ex);
        }
        return new GeometryTreeBuilder.Entry(node, parentToken);
    }

    /**
     * Parses an animation node. Every controller line becomes a controller;
     * there are no payload fields to bind.
     */
    AnimationTreeBuilder.Entry parseAnimation(AsciiLine header, List<AsciiLine> body,
                                              Set<ControllerNamespace> namespaces) {
        final String name = NodeTypeClassifier.stripSaberPrefix(header.token(2));
        final AnimationNode node = new AnimationNode(name);

        String parentToken = null;
        final LineCursor cursor = new LineCursor(body);
        try {
            while (cursor.hasNext()) {
                final AsciiLine line = cursor.next();
                if (line.keyword().equals("parent")) {
                    parentToken = line.tokenOr(1, "NULL");
                    continue;
                }
                Optional<ControllerKeyword> keyword = names.resolve(line.token(0), namespaces);
                if (keyword.isEmpty()) {
                    node.rawLines().add(line.text());
                } else if (keyword.get().keyed()) {
                    node.controllers().add(ControllerLines.readKeyed(line, keyword.get(), cursor));
                } else {
                    float[] values = ControllerLines.singleShotValues(line, keyword.get().type());
                    node.controllers().add(Controller.constant(keyword.get().type(), values));
                }
            }
        } catch (MdlFormatException ex) {
            recover(name, cursor, ex);
        }
        return new AnimationTreeBuilder.Entry(node, parentToken);
    }

    private boolean readController(AsciiLine line, LineCursor cursor, Node node, Set<ControllerNamespace> namespaces) {
        Optional<ControllerKeyword> resolved = names.resolve(line.token(0), namespaces);
        if (resolved.isEmpty()) {
            return false;
        }
        final ControllerKeyword keyword = resolved.get();
        if (keyword.keyed()) {
            node.controllers().add(ControllerLines.readKeyed(line, keyword, cursor));
            return true;
        }
        float[] values = ControllerLines.singleShotValues(line, keyword.type());
        if (!StaticPropertyBindings.apply(node, keyword.type(), values, line)) {
            node.controllers().add(Controller.constant(keyword.type(), values));
        }
        return true;
    }

    private boolean readSection(AsciiLine line, LineCursor cursor, Node node) {
        final Set<PayloadKind> attached = node.payloadKinds();
        for (PayloadSection section : sections) {
            if (attached.contains(section.kind()) && section.read(line, cursor, node)) {
                return true;
            }
        }
        return false;
    }

    private void recover(String nodeName, LineCursor cursor, MdlFormatException ex) {
        if (config.strict()) {
            throw ex;
        }
        final int skipped = cursor.remaining();
        cursor.skipToEnd();
        log.debug("node '{}': {}", nodeName, ex.getMessage());
        sink.onNodeFormatError(NodeFormatErrorEvent.of(nodeName, skipped, ex));
    }
}
