package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.core.NodeTypeClassifier;
import com.questrail.mdl.format.ascii.codec.MdlAsciiReader;
import com.questrail.mdl.format.ascii.config.MdlAsciiConfig;
import com.questrail.mdl.format.ascii.internal.decode.MdlEmptyInputException;
import com.questrail.mdl.format.ascii.observability.MdlObservabilitySink;
import com.questrail.mdl.format.ascii.observability.NullObservabilitySink;
import com.questrail.mdl.mapping.ControllerNameIndex;
import com.questrail.mdl.mapping.LegacyControllerNameIndex;
import com.questrail.mdl.model.Animation;
import com.questrail.mdl.model.AnimationEvent;
import com.questrail.mdl.model.Classification;
import com.questrail.mdl.model.ControllerNamespace;
import com.questrail.mdl.model.Model;
import com.questrail.mdl.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * DefaultMdlAsciiReader
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MdlAsciiReader}.
 *
 * <p>This reader performs the following steps, in order:</p>
 * <ol>
 *   <li>Tokenizing the source into content lines</li>
 *   <li>Model header keywords, dispatched one line at a time</li>
 *   <li>Geometry node blocks, parsed as they are met</li>
 *   <li>Geometry tree construction, once every node is known</li>
 *   <li>Animation blocks, which were set aside until the geometry tree
 *       existed so that numeric parents can fall back to geometry ids</li>
 * </ol>
 *
 * <p>Header keywords the reader does not know are skipped. Instances hold no
 * per-parse state and may be shared between threads.</p>
 */
public final class DefaultMdlAsciiReader implements MdlAsciiReader
{
    private static final Logger log = LoggerFactory.getLogger(DefaultMdlAsciiReader.class);

    static final String UNNAMED_MODEL = "unnamed";

    private final MdlObservabilitySink sink;
    private final NodeBlockParser nodeParser;

    public DefaultMdlAsciiReader() {
        this(MdlAsciiConfig.defaults(), NullObservabilitySink.INSTANCE, LegacyControllerNameIndex.standard());
    }

    public DefaultMdlAsciiReader(MdlAsciiConfig config, MdlObservabilitySink sink, ControllerNameIndex names) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.nodeParser = new NodeBlockParser(names, PayloadSection.standard(sink), config, sink);
    }

    /** An animation block, set aside until the geometry tree is built. */
    private record PendingAnimation(AsciiLine header, List<AsciiLine> body) {}

    @Override
    public Model read(Reader source) throws IOException {
        Objects.requireNonNull(source, "source");
        final List<AsciiLine> lines = AsciiLine.readAll(source);
        if (lines.isEmpty()) {
            throw new MdlEmptyInputException("no content lines in ASCII MDL input");
        }

        final Model model = new Model(UNNAMED_MODEL);
        final List<GeometryTreeBuilder.Entry> geometry = new ArrayList<>();
        final List<PendingAnimation> animations = new ArrayList<>();
        final LineCursor cursor = new LineCursor(lines);

        while (cursor.hasNext()) {
            final AsciiLine line = cursor.next();
            final String keyword = line.keyword();
            if (keyword.equals("donemodel")) {
                break;
            }
            switch (keyword) {
                case "newmodel" -> model.setName(line.token(1));
                case "filedependancy", "filedependency" -> model.setFileDependency(line.token(1));
                case "setsupermodel" -> model.setSupermodel(line.tokenOr(2, "null"));
                case "classification" -> model.setClassification(classification(line));
                case "classification_unk1" -> model.setClassificationUnk1(line.intAt(1));
                case "ignorefog" -> model.setAffectedByFog(line.flagAt(1) == 0);
                case "compress_quaternions" -> model.setCompressQuaternions(line.intAt(1));
                case "headlink" -> model.setHeadLink(line.token(1));
                case "setanimationscale" -> model.setAnimationScale(line.floatAt(1));
                case "bmin" -> model.setBoundingMin(line.vectorAt(1));
                case "bmax" -> model.setBoundingMax(line.vectorAt(1));
                case "radius" -> model.setRadius(line.floatAt(1));
                case "layoutposition" -> model.setLayoutPosition(line.vectorAt(1));
                case "beginmodelgeom", "endmodelgeom" -> { }
                case "node" -> {
                    List<AsciiLine> body = NodeBlockParser.collectBody(line, cursor);
                    geometry.add(nodeParser.parseGeometry(line, body));
                }
                case "newanim" -> animations.add(new PendingAnimation(line, collectAnimation(cursor)));
                default -> log.debug("skipping unknown line {}: {}", line.number(), line.text());
            }
        }

        log.debug("model '{}': {} geometry nodes, {} animations", model.name(), geometry.size(), animations.size());
        model.setRoot(new GeometryTreeBuilder(sink).build(model.name(), geometry));

        final List<Node> geometryNodes = model.nodes();
        for (PendingAnimation pending : animations) {
            model.animations().add(readAnimation(pending, model, geometryNodes));
        }
        return model;
    }

    private static Classification classification(AsciiLine line) {
        final String token = line.token(1);
        return Classification.fromKeyword(token).orElseGet(() -> {
            log.debug("unknown classification '{}' at line {}; using other", token, line.number());
            return Classification.OTHER;
        });
    }

    /**
     * Lines up to the matching {@code doneanim}, which is consumed. A missing
     * {@code doneanim} ends the block at {@code donemodel}, the next
     * {@code newanim} or the end of input.
     */
    private static List<AsciiLine> collectAnimation(LineCursor cursor) {
        final List<AsciiLine> body = new ArrayList<>();
        while (cursor.hasNext()) {
            final String keyword = cursor.peek().keyword();
            if (keyword.equals("doneanim")) {
                cursor.next();
                return body;
            }
            if (keyword.equals("donemodel") || keyword.equals("newanim")) {
                return body;
            }
            body.add(cursor.next());
        }
        return body;
    }

    private Animation readAnimation(PendingAnimation pending, Model model, List<Node> geometryNodes) {
        final AsciiLine header = pending.header();
        final Animation animation = new Animation(header.token(1), header.tokenOr(2, model.name()));
        final List<AnimationTreeBuilder.Entry> entries = new ArrayList<>();
        final LineCursor cursor = new LineCursor(pending.body());

        while (cursor.hasNext()) {
            final AsciiLine line = cursor.next();
            switch (line.keyword()) {
                case "length" -> animation.setLength(line.floatAt(1));
                case "transtime" -> animation.setTransitionLength(line.floatAt(1));
                case "animroot" -> animation.setAnimRoot(line.token(1));
                case "event" -> animation.events().add(new AnimationEvent(line.floatAt(1), line.token(2)));
                case "node" -> {
                    List<AsciiLine> body = NodeBlockParser.collectBody(line, cursor);
                    Set<ControllerNamespace> namespaces = namespacesFor(model, NodeTypeClassifier.stripSaberPrefix(line.token(2)));
                    entries.add(nodeParser.parseAnimation(line, body, namespaces));
                }
                default -> log.debug("skipping unknown line {} in animation '{}': {}",
                    line.number(), animation.name(), line.text());
            }
        }

        animation.setRoot(new AnimationTreeBuilder(sink).build(animation.name(), entries, geometryNodes));
        log.debug("animation '{}': {} nodes", animation.name(), entries.size());
        return animation;
    }

    /**
     * An animation node uses the namespaces of the geometry node it animates;
     * without one every namespace is searched.
     */
    private static Set<ControllerNamespace> namespacesFor(Model model, String nodeName) {
        return model.node(nodeName)
            .map(n -> ControllerNamespace.forPayloads(n.payloadKinds()))
            .orElseGet(() -> EnumSet.allOf(ControllerNamespace.class));
    }
}
