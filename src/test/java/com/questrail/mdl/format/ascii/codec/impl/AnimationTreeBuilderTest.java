package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.format.ascii.observability.AmbiguousReferenceEvent;
import com.questrail.mdl.format.ascii.observability.RecordingMdlObservabilitySink;
import com.questrail.mdl.format.ascii.observability.UnresolvedReferenceEvent;
import com.questrail.mdl.model.AnimationNode;
import com.questrail.mdl.model.Node;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AnimationTreeBuilderTest
{
    private final RecordingMdlObservabilitySink sink = new RecordingMdlObservabilitySink();
    private final AnimationTreeBuilder builder = new AnimationTreeBuilder(sink);

    private static List<AnimationTreeBuilder.Entry> entries(String... nameParentPairs)
    {
        List<AnimationTreeBuilder.Entry> out = new ArrayList<>();
        for (int i = 0; i < nameParentPairs.length; i += 2) {
            out.add(new AnimationTreeBuilder.Entry(new AnimationNode(nameParentPairs[i]), nameParentPairs[i + 1]));
        }
        return out;
    }

    private static Node geometry(String name, int id)
    {
        Node node = new Node(name);
        node.setId(id);
        return node;
    }

    private static List<String> childNames(AnimationNode node)
    {
        List<String> names = new ArrayList<>();
        for (AnimationNode c : node.children()) {
            names.add(c.name());
        }
        return names;
    }

    @Test
    void rootIsTheTopLevelNodeWithMostChildren()
    {
        AnimationNode root = builder.build("walk", entries(
            "leaf", "NULL", "torso", "NULL", "arm", "torso", "leg", "torso"), List.of());

        assertEquals("torso", root.name());
        assertEquals(List.of("leaf", "arm", "leg"), childNames(root));
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void tiesGoToTheFirstSeen()
    {
        AnimationNode root = builder.build("walk", entries("a", "NULL", "b", "NULL"), List.of());

        assertEquals("a", root.name());
        assertEquals(List.of("b"), childNames(root));
    }

    @Test
    void numericParentIsLocalDeclarationIndex()
    {
        AnimationNode root = builder.build("walk", entries("torso", "NULL", "arm", "0", "hand", "1"), List.of());

        assertEquals(List.of("arm"), childNames(root));
        assertEquals(List.of("hand"), childNames(root.children().get(0)));
        assertEquals(2, root.children().get(0).children().get(0).id());
    }

    @Test
    void outOfRangeIndexFallsBackToGeometryId()
    {
        AnimationNode root = builder.build("walk", entries("torso", "NULL", "hand", "7"),
            List.of(geometry("torso", 7)));

        assertEquals("torso", root.name());
        assertEquals(List.of("hand"), childNames(root));
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void disagreeingReadingsPreferLocalAndAreReported()
    {
        AnimationNode root = builder.build("walk", entries("torso", "NULL", "arm", "torso", "hand", "1"),
            List.of(geometry("arm", 0), geometry("torso", 1)));

        AnimationNode arm = root.find("arm").orElseThrow();
        assertEquals(List.of("hand"), childNames(arm));

        List<AmbiguousReferenceEvent> events = sink.eventsOfType(AmbiguousReferenceEvent.class);
        assertEquals(1, events.size());
        assertEquals("walk", events.get(0).scope());
        assertEquals("arm", events.get(0).chosen());
        assertEquals("torso", events.get(0).rejected());
    }

    @Test
    void unresolvableNameIsReattachedAndReported()
    {
        AnimationNode root = builder.build("walk", entries("torso", "NULL", "arm", "torso", "tail", "ghost"), List.of());

        assertEquals(List.of("arm", "tail"), childNames(root));
        UnresolvedReferenceEvent event = sink.eventsOfType(UnresolvedReferenceEvent.class).get(0);
        assertEquals("tail", event.nodeName());
        assertEquals("torso", event.attachedTo());
    }

    @Test
    void emptyAnimationHasNoRoot()
    {
        assertNull(builder.build("walk", new ArrayList<>(), List.of()));
    }
}
