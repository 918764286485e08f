package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.format.ascii.config.MdlAsciiConfig;
import com.questrail.mdl.format.ascii.observability.RecordingMdlObservabilitySink;
import com.questrail.mdl.format.ascii.observability.UnknownPayloadCombinationEvent;
import com.questrail.mdl.mapping.LegacyControllerNameIndex;
import com.questrail.mdl.model.Animation;
import com.questrail.mdl.model.AnimationEvent;
import com.questrail.mdl.model.AnimationNode;
import com.questrail.mdl.model.BoneVertex;
import com.questrail.mdl.model.BoneWeight;
import com.questrail.mdl.model.Controller;
import com.questrail.mdl.model.ControllerType;
import com.questrail.mdl.model.Model;
import com.questrail.mdl.model.Node;
import com.questrail.mdl.model.PayloadKind;
import com.questrail.mdl.model.Vector3;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultMdlAsciiWriterTest
 * -----------------------------------------------------------------------------
 * Layout of the written text. Reading it back is covered by
 * {@link RoundTripTest}.
 */
final class DefaultMdlAsciiWriterTest
{
    private final RecordingMdlObservabilitySink sink = new RecordingMdlObservabilitySink();

    private DefaultMdlAsciiWriter writer(MdlAsciiConfig config)
    {
        return new DefaultMdlAsciiWriter(config, sink, LegacyControllerNameIndex.standard());
    }

    private static Node child(Model model, String name, int id)
    {
        Node node = new Node(name);
        node.setId(id);
        model.root().addChild(node);
        return node;
    }

    @Test
    void emptyModelLayout()
    {
        MdlAsciiConfig config = MdlAsciiConfig.builder()
            .withHeaderComment("exported")
            .withFileDependency("box.max")
            .build();

        String text = writer(config).writeToString(new Model("box"));

        assertEquals(String.join("\n",
            "# exported",
            "filedependancy box.max",
            "newmodel box",
            "setsupermodel box null",
            "classification other",
            "classification_unk1 0",
            "ignorefog 1",
            "compress_quaternions 0",
            "setanimationscale 0.971",
            "beginmodelgeom box",
            "  bmin -5 -5 -1",
            "  bmax 5 5 10",
            "  radius 7",
            "node dummy box",
            "  parent NULL",
            "  position 0 0 0",
            "  orientation 1 0 0 0",
            "endnode",
            "endmodelgeom box",
            "donemodel box",
            ""), text);
    }

    @Test
    void modelFileDependencyWinsOverConfig()
    {
        Model model = new Model("box");
        model.setFileDependency("from_model.max");

        String text = writer(MdlAsciiConfig.builder().withFileDependency("from_config.max").build())
            .writeToString(model);

        assertTrue(text.contains("filedependancy from_model.max\n"));
        assertFalse(text.contains("from_config"));
    }

    @Test
    void nodesNameTheirParentAndKeepIdOrder()
    {
        Model model = new Model("box");
        Node b = child(model, "b", 2);
        Node a = child(model, "a", 1);
        Node leaf = new Node("leaf");
        leaf.setId(3);
        a.addChild(leaf);

        String text = writer(MdlAsciiConfig.defaults()).writeToString(model);

        int ia = text.indexOf("node dummy a\n");
        int ib = text.indexOf("node dummy b\n");
        int il = text.indexOf("node dummy leaf\n");
        assertTrue(ia > 0 && ia < ib && ib < il);
        assertTrue(text.contains("node dummy leaf\n  parent a\n"));
        assertTrue(text.contains("node dummy b\n  parent box\n"));
    }

    @Test
    void nonDefaultTransformIsWritten()
    {
        Model model = new Model("box");
        Node a = child(model, "a", 1);
        a.setPosition(new Vector3(1.5f, 0f, -2f));
        a.setScale(2f);
        a.setWireColor(new Vector3(1f, 0f, 0f));

        String text = writer(MdlAsciiConfig.defaults()).writeToString(model);

        assertTrue(text.contains("  position 1.5 0 -2\n"));
        assertTrue(text.contains("  scale 2\n"));
        assertTrue(text.contains("  wirecolor 1 0 0\n"));
    }

    @Test
    void controllersAreAlwaysKeyed()
    {
        Model model = new Model("box");
        Node a = child(model, "a", 1);
        a.controllers().add(Controller.constant(ControllerType.ALPHA, 0.5f));

        String text = writer(MdlAsciiConfig.defaults()).writeToString(model);

        assertTrue(text.contains("  alphakey\n    0 0.5\n  endlist\n"), text);
    }

    @Test
    void emitterAlphaUsesTheEmitterName()
    {
        Model model = new Model("box");
        Node smoke = child(model, "smoke", 1);
        smoke.attach(PayloadKind.EMITTER);
        smoke.controllers().add(Controller.constant(ControllerType.ALPHA, 1f));

        String text = writer(MdlAsciiConfig.defaults()).writeToString(model);

        assertTrue(text.contains("node emitter smoke\n"));
        assertTrue(text.contains("  p2p_bezier3key\n"), text);
    }

    @Test
    void skinIsWrittenAsSkinUnlessFlattened()
    {
        Model model = new Model("box");
        Node body = child(model, "body", 1);
        body.attach(PayloadKind.MESH);
        body.attach(PayloadKind.SKIN);
        body.skin().orElseThrow().boneVertices().add(BoneVertex.padded(List.of(BoneWeight.named("torso", 1f))));

        String skinned = writer(MdlAsciiConfig.defaults()).writeToString(model);
        assertTrue(skinned.contains("node skin body\n"));
        assertTrue(skinned.contains("  weights 1\n    torso 1\n"));

        String flat = writer(MdlAsciiConfig.builder().withFlattenSkins(true).build()).writeToString(model);
        assertTrue(flat.contains("node trimesh body\n"));
        assertFalse(flat.contains("weights"));
    }

    @Test
    void unknownPayloadCombinationIsReportedAndWrittenAsDummy()
    {
        Model model = new Model("box");
        Node odd = child(model, "odd", 1);
        odd.attach(PayloadKind.LIGHT);
        odd.attach(PayloadKind.REFERENCE);

        String text = writer(MdlAsciiConfig.defaults()).writeToString(model);

        assertTrue(text.contains("node dummy odd\n"));
        assertFalse(text.contains("lightpriority"));
        List<UnknownPayloadCombinationEvent> events = sink.eventsOfType(UnknownPayloadCombinationEvent.class);
        assertEquals(1, events.size());
        assertEquals(Set.of(PayloadKind.LIGHT, PayloadKind.REFERENCE), events.get(0).payloads());
        assertEquals(0x13, events.get(0).combinedFlags());
    }

    @Test
    void lightFlaresCarryADerivedCount()
    {
        Model model = new Model("box");
        Node lamp = child(model, "lamp", 1);
        lamp.attach(PayloadKind.LIGHT);
        lamp.light().orElseThrow().flareTextures().addAll(List.of("fa", "fb"));
        lamp.light().orElseThrow().flareSizes().addAll(List.of(1f, 2f));
        lamp.light().orElseThrow().flarePositions().addAll(List.of(0f, 1f));
        lamp.light().orElseThrow().flareColorShifts().addAll(List.of(Vector3.ZERO, Vector3.ZERO));

        String text = writer(MdlAsciiConfig.defaults()).writeToString(model);

        assertTrue(text.contains("  lensflares 2\n  texturenames 2\n    fa\n    fb\n"), text);
    }

    @Test
    void animationsFollowTheGeometry()
    {
        Model model = new Model("box");
        Node body = child(model, "body", 1);
        body.attach(PayloadKind.MESH);

        Animation wave = new Animation("wave", "box");
        wave.setLength(2f);
        wave.setTransitionLength(0.25f);
        wave.events().add(new AnimationEvent(0.5f, "hit"));
        AnimationNode root = new AnimationNode("box");
        AnimationNode animated = new AnimationNode("body");
        animated.setId(1);
        animated.controllers().add(Controller.constant(ControllerType.SELF_ILLUM_COLOR, 1f, 1f, 1f));
        root.children().add(animated);
        wave.setRoot(root);
        model.animations().add(wave);

        String text = writer(MdlAsciiConfig.defaults()).writeToString(model);

        int geometryEnd = text.indexOf("endmodelgeom box\n");
        int animStart = text.indexOf("newanim wave box\n");
        assertTrue(geometryEnd > 0 && animStart > geometryEnd);
        assertTrue(text.contains("  length 2\n  transtime 0.25\n  event 0.5 hit\n"), text);
        assertTrue(text.contains("node dummy body\n  parent box\n  selfillumcolorkey\n    0 1 1 1\n  endlist\nendnode\n"), text);
        assertTrue(text.endsWith("doneanim wave box\ndonemodel box\n"));
    }
}
