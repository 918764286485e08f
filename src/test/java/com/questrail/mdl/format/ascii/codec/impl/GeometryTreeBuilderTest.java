package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.format.ascii.observability.AmbiguousReferenceEvent;
import com.questrail.mdl.format.ascii.observability.RecordingMdlObservabilitySink;
import com.questrail.mdl.format.ascii.observability.UnresolvedReferenceEvent;
import com.questrail.mdl.model.Node;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GeometryTreeBuilderTest
 * -----------------------------------------------------------------------------
 * Parent resolution and root selection for geometry nodes.
 */
final class GeometryTreeBuilderTest
{
    private final RecordingMdlObservabilitySink sink = new RecordingMdlObservabilitySink();
    private final GeometryTreeBuilder builder = new GeometryTreeBuilder(sink);

    private static List<GeometryTreeBuilder.Entry> entries(String... nameParentPairs)
    {
        List<GeometryTreeBuilder.Entry> out = new ArrayList<>();
        for (int i = 0; i < nameParentPairs.length; i += 2) {
            out.add(new GeometryTreeBuilder.Entry(new Node(nameParentPairs[i]), nameParentPairs[i + 1]));
        }
        return out;
    }

    private static List<String> childNames(Node node)
    {
        List<String> names = new ArrayList<>();
        for (Node c : node.children()) {
            names.add(c.name());
        }
        return names;
    }

    @Test
    void namedParentsBuildTheTree()
    {
        Node root = builder.build("m", entries("m", "NULL", "a", "m", "b", "A"));

        assertEquals("m", root.name());
        assertEquals(Node.NO_PARENT, root.parentId());
        assertEquals(List.of("a"), childNames(root));
        Node a = root.children().get(0);
        assertEquals(List.of("b"), childNames(a));
        assertEquals(1, a.id());
        assertEquals(1, a.children().get(0).parentId());
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void parentDeclaredLaterIsResolvedAfterwards()
    {
        Node root = builder.build("m", entries("m", "NULL", "hand", "arm", "arm", "m"));

        assertEquals(List.of("arm"), childNames(root));
        assertEquals(List.of("hand"), childNames(root.children().get(0)));
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void numericParentIsADeclarationIndex()
    {
        Node root = builder.build("m", entries("m", "NULL", "a", "0", "b", "1"));

        assertEquals(List.of("a"), childNames(root));
        assertEquals(List.of("b"), childNames(root.children().get(0)));
    }

    @Test
    void numberThatIsAlsoANameResolvesByNameAndIsReported()
    {
        Node root = builder.build("m", entries("m", "NULL", "2", "m", "a", "m", "b", "2"));

        Node two = root.find("2").orElseThrow();
        assertEquals(List.of("b"), childNames(two));

        List<AmbiguousReferenceEvent> events = sink.eventsOfType(AmbiguousReferenceEvent.class);
        assertEquals(1, events.size());
        assertEquals("b", events.get(0).nodeName());
        assertEquals("2", events.get(0).chosen());
    }

    @Test
    void unresolvedParentIsReattachedUnderRoot()
    {
        Node root = builder.build("m", entries("m", "NULL", "x", "ghost"));

        assertEquals(List.of("x"), childNames(root));
        List<UnresolvedReferenceEvent> events = sink.eventsOfType(UnresolvedReferenceEvent.class);
        assertEquals(1, events.size());
        assertEquals(GeometryTreeBuilder.SCOPE, events.get(0).scope());
        assertEquals("x", events.get(0).nodeName());
        assertEquals("ghost", events.get(0).parentToken());
        assertEquals("m", events.get(0).attachedTo());
    }

    @Test
    void soleNodeNamedRootWinsWhenNothingMatchesTheModel()
    {
        Node root = builder.build("m", entries("stray", "NULL", "root", "NULL", "child", "root"));

        assertEquals("root", root.name());
        assertEquals(List.of("stray", "child"), childNames(root));
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void firstTopLevelNodeIsTheFallbackRoot()
    {
        Node root = builder.build("m", entries("a", "b", "b", "NULL", "c", "NULL"));

        assertEquals("b", root.name());
        assertEquals(List.of("a", "c"), childNames(root));
    }

    @Test
    void cyclesAreBrokenAndReported()
    {
        Node root = builder.build("m", entries("m", "NULL", "a", "b", "b", "a"));

        assertEquals(List.of("a", "b"), childNames(root));
        assertEquals(2, sink.eventsOfType(UnresolvedReferenceEvent.class).size());
    }

    @Test
    void selfReferenceIsUnresolved()
    {
        Node root = builder.build("m", entries("m", "NULL", "a", "a"));

        assertEquals(List.of("a"), childNames(root));
        assertEquals(1, sink.eventsOfType(UnresolvedReferenceEvent.class).size());
    }

    @Test
    void nameResolvesToLatestDeclarationSeenSoFar()
    {
        Node root = builder.build("m", entries(
            "m", "NULL", "arm", "m", "hand", "arm", "arm", "m", "finger", "arm"));

        Node firstArm = root.children().get(0);
        Node secondArm = root.children().get(1);
        assertEquals(List.of("hand"), childNames(firstArm));
        assertEquals(List.of("finger"), childNames(secondArm));
        assertEquals(3, secondArm.id());
    }

    @Test
    void noNodesGivesSyntheticRoot()
    {
        Node root = builder.build("empty", new ArrayList<>());

        assertEquals("empty", root.name());
        assertEquals(0, root.id());
        assertTrue(root.children().isEmpty());
    }

    @Test
    void unresolvedRootIsReportedAsAttachedNowhere()
    {
        Node root = builder.build("m", entries("a", "ghost"));

        assertEquals("a", root.name());
        UnresolvedReferenceEvent event = sink.eventsOfType(UnresolvedReferenceEvent.class).get(0);
        assertEquals("NULL", event.attachedTo());
    }

    @Test
    void missingParentLineMeansTopLevel()
    {
        Node root = builder.build("m", entries("m", null, "a", "-1"));

        assertEquals("m", root.name());
        assertEquals(List.of("a"), childNames(root));
        assertTrue(sink.getAllEvents().isEmpty());
    }
}
