package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.core.LegacyNumbers;
import com.questrail.mdl.core.NodeTypeClassifier;
import com.questrail.mdl.format.ascii.codec.MdlAsciiWriter;
import com.questrail.mdl.format.ascii.config.MdlAsciiConfig;
import com.questrail.mdl.format.ascii.observability.MdlObservabilitySink;
import com.questrail.mdl.format.ascii.observability.NullObservabilitySink;
import com.questrail.mdl.format.ascii.observability.UnknownPayloadCombinationEvent;
import com.questrail.mdl.mapping.ControllerNameIndex;
import com.questrail.mdl.mapping.LegacyControllerNameIndex;
import com.questrail.mdl.model.Animation;
import com.questrail.mdl.model.AnimationEvent;
import com.questrail.mdl.model.AnimationNode;
import com.questrail.mdl.model.Controller;
import com.questrail.mdl.model.ControllerNamespace;
import com.questrail.mdl.model.ControllerType;
import com.questrail.mdl.model.Model;
import com.questrail.mdl.model.Node;
import com.questrail.mdl.model.NodeType;
import com.questrail.mdl.model.PayloadKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * DefaultMdlAsciiWriter
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MdlAsciiWriter}.
 *
 * <p>Output layout:</p>
 * <ol>
 *   <li>Model header ({@code newmodel} through {@code setanimationscale})</li>
 *   <li>Geometry: bounds, then every node in id order with its parent named
 *       explicitly, so that reading the output back reproduces ids and
 *       child order</li>
 *   <li>Animations, nodes again in id order, written as {@code dummy}</li>
 *   <li>{@code donemodel}</li>
 * </ol>
 *
 * <p>Controllers are always written in keyed form. Fields bound to a static
 * line ({@code position}, light {@code color}, emitter parameters ...) are
 * written by the node header or the payload sections.</p>
 */
public final class DefaultMdlAsciiWriter implements MdlAsciiWriter
{
    private static final Logger log = LoggerFactory.getLogger(DefaultMdlAsciiWriter.class);

    static final String NO_PARENT = "NULL";

    private static final Comparator<Node> BY_NODE_ID = Comparator.comparingInt(Node::id);
    private static final Comparator<AnimationNode> BY_ANIMATION_NODE_ID = Comparator.comparingInt(AnimationNode::id);

    private final MdlAsciiConfig config;
    private final MdlObservabilitySink sink;
    private final ControllerNameIndex names;
    private final List<PayloadSection> sections;

    public DefaultMdlAsciiWriter() {
        this(MdlAsciiConfig.defaults(), NullObservabilitySink.INSTANCE, LegacyControllerNameIndex.standard());
    }

    public DefaultMdlAsciiWriter(MdlAsciiConfig config, MdlObservabilitySink sink, ControllerNameIndex names) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.names = Objects.requireNonNull(names, "names");
        this.sections = PayloadSection.standard(sink);
    }

    @Override
    public void write(Model model, Appendable out) throws IOException {
        Objects.requireNonNull(model, "model");
        final AsciiLineWriter w = new AsciiLineWriter(Objects.requireNonNull(out, "out"));

        writeHeader(model, w);

        final Map<Node, Set<PayloadKind>> written = new IdentityHashMap<>();
        w.line("beginmodelgeom", model.name());
        w.indent();
        w.vector("bmin", model.boundingMin());
        w.vector("bmax", model.boundingMax());
        w.floats("radius", model.radius());
        if (model.layoutPosition().isPresent()) {
            w.vector("layoutposition", model.layoutPosition().get());
        }
        w.outdent();

        final List<Node> nodes = new ArrayList<>(model.nodes());
        nodes.sort(BY_NODE_ID);
        final Map<Node, Node> parents = geometryParents(model.root());
        for (Node node : nodes) {
            writeNode(node, parents.get(node), written, w);
        }
        w.line("endmodelgeom", model.name());

        for (Animation animation : model.animations()) {
            writeAnimation(animation, model, written, w);
        }
        w.line("donemodel", model.name());
        log.debug("wrote model '{}': {} nodes, {} animations", model.name(), nodes.size(), model.animations().size());
    }

    private void writeHeader(Model model, AsciiLineWriter w) throws IOException {
        if (config.headerComment() != null) {
            w.line(String.valueOf(AsciiLine.COMMENT), config.headerComment());
        }
        final String dependency = model.fileDependency().orElse(config.fileDependency());
        if (dependency != null) {
            w.line("filedependancy", dependency);
        }
        w.line("newmodel", model.name());
        w.line("setsupermodel", model.name(), model.supermodel());
        w.line("classification", model.classification().keyword());
        w.integer("classification_unk1", model.classificationUnk1());
        w.flag("ignorefog", !model.affectedByFog());
        w.integer("compress_quaternions", model.compressQuaternions());
        if (model.headLink().isPresent()) {
            w.line("headlink", model.headLink().get());
        }
        w.floats("setanimationscale", model.animationScale());
    }

    // ---- geometry --------------------------------------------------------------

    private void writeNode(Node node, Node parent, Map<Node, Set<PayloadKind>> written,
                           AsciiLineWriter w) throws IOException {
        final NodeType type = nodeType(node);
        final Set<PayloadKind> payloads = type.payloads();
        written.put(node, payloads);

        w.line("node", type.keyword(), node.name());
        w.indent();
        w.line("parent", parent == null ? NO_PARENT : parent.name());
        w.line(join("position", ControllerLines.formatValues(ControllerType.POSITION, node.position().toArray())));
        w.line(join("orientation", ControllerLines.formatValues(ControllerType.ORIENTATION, node.orientation().toArray())));
        if (node.scale() != 1f) {
            w.floats("scale", node.scale());
        }
        if (node.wireColor().isPresent()) {
            w.vector("wirecolor", node.wireColor().get());
        }

        for (PayloadSection section : sections) {
            if (payloads.contains(section.kind())) {
                section.write(node, w);
            }
        }

        final Set<ControllerNamespace> namespaces = ControllerNamespace.forPayloads(payloads);
        for (Controller controller : node.controllers()) {
            ControllerLines.writeKeyed(controller, names.nameFor(controller.type(), namespaces), w);
        }
        for (String raw : node.rawLines()) {
            w.line(raw);
        }
        w.outdent();
        w.line("endnode");
    }

    /**
     * Keyword for the node's payloads. Payloads the chosen type does not
     * carry are not written.
     */
    private NodeType nodeType(Node node) {
        final Set<PayloadKind> kinds = node.payloadKinds();
        if (!kinds.isEmpty() && NodeTypeClassifier.recognize(kinds).isEmpty()) {
            sink.onUnknownPayloadCombination(UnknownPayloadCombinationEvent.of(
                node.name(), kinds, NodeTypeClassifier.combinedFlags(kinds)));
        }
        return NodeTypeClassifier.classify(kinds, config.flattenSkins());
    }

    private static Map<Node, Node> geometryParents(Node root) {
        final Map<Node, Node> parents = new IdentityHashMap<>();
        for (Node node : root.flatten()) {
            for (Node child : node.children()) {
                parents.put(child, node);
            }
        }
        return parents;
    }

    // ---- animations ------------------------------------------------------------

    private void writeAnimation(Animation animation, Model model, Map<Node, Set<PayloadKind>> written,
                                AsciiLineWriter w) throws IOException {
        w.line("newanim", animation.name(), animation.modelName());
        w.indent();
        w.floats("length", animation.length());
        w.floats("transtime", animation.transitionLength());
        if (animation.animRoot().isPresent()) {
            w.line("animroot", animation.animRoot().get());
        }
        for (AnimationEvent event : animation.events()) {
            w.line("event", LegacyNumbers.formatPlain(event.time()), event.name());
        }
        w.outdent();

        final List<AnimationNode> nodes = new ArrayList<>(animation.nodes());
        nodes.sort(BY_ANIMATION_NODE_ID);
        final Map<AnimationNode, AnimationNode> parents = new IdentityHashMap<>();
        for (AnimationNode node : nodes) {
            for (AnimationNode child : node.children()) {
                parents.put(child, node);
            }
        }

        for (AnimationNode node : nodes) {
            AnimationNode parent = parents.get(node);
            Set<PayloadKind> geometryPayloads = model.node(node.name()).map(written::get).orElse(null);

            w.line("node", NodeType.DUMMY.keyword(), node.name());
            w.indent();
            w.line("parent", parent == null ? NO_PARENT : parent.name());
            for (Controller controller : node.controllers()) {
                Set<ControllerNamespace> namespaces = geometryPayloads != null
                    ? ControllerNamespace.forPayloads(geometryPayloads)
                    : EnumSet.of(ControllerNamespace.HEADER, controller.type().namespace());
                ControllerLines.writeKeyed(controller, names.nameFor(controller.type(), namespaces), w);
            }
            for (String raw : node.rawLines()) {
                w.line(raw);
            }
            w.outdent();
            w.line("endnode");
        }
        w.line("doneanim", animation.name(), animation.modelName());
    }

    private static String[] join(String keyword, String[] values) {
        final String[] parts = new String[values.length + 1];
        parts[0] = keyword;
        System.arraycopy(values, 0, parts, 1, values.length);
        return parts;
    }
}
