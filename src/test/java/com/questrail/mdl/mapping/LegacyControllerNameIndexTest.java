package com.questrail.mdl.mapping;

import com.questrail.mdl.model.ControllerNamespace;
import com.questrail.mdl.model.ControllerType;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LegacyControllerNameIndexTest
{
    private static final Set<ControllerNamespace> LIGHT_NODE =
        EnumSet.of(ControllerNamespace.HEADER, ControllerNamespace.LIGHT);
    private static final Set<ControllerNamespace> EMITTER_NODE =
        EnumSet.of(ControllerNamespace.HEADER, ControllerNamespace.EMITTER);
    private static final Set<ControllerNamespace> MESH_NODE =
        EnumSet.of(ControllerNamespace.HEADER, ControllerNamespace.MESH);

    private final ControllerNameIndex index = LegacyControllerNameIndex.standard();

    @Test
    void sharedIdResolvesByNamespace()
    {
        assertEquals(88, ControllerType.LIGHT_RADIUS.legacyId());
        assertEquals(88, ControllerType.BIRTHRATE.legacyId());

        assertEquals("radius", index.nameFor(ControllerType.LIGHT_RADIUS, LIGHT_NODE));
        assertEquals("birthrate", index.nameFor(ControllerType.BIRTHRATE, EMITTER_NODE));
        assertEquals(ControllerType.LIGHT_RADIUS, index.typeFor(ControllerNamespace.LIGHT, 88).orElseThrow());
        assertEquals(ControllerType.BIRTHRATE, index.typeFor(ControllerNamespace.EMITTER, 88).orElseThrow());
    }

    @Test
    void nameLookupIsCaseInsensitive()
    {
        ControllerKeyword kw = index.resolve("BirthRate", EMITTER_NODE).orElseThrow();
        assertEquals(ControllerType.BIRTHRATE, kw.type());
        assertFalse(kw.keyed());
    }

    @Test
    void keySuffixesSelectKeyedForms()
    {
        ControllerKeyword linear = index.resolve("positionkey", MESH_NODE).orElseThrow();
        assertEquals(ControllerType.POSITION, linear.type());
        assertTrue(linear.keyed());
        assertFalse(linear.bezier());

        ControllerKeyword bezier = index.resolve("orientationbezierkey", MESH_NODE).orElseThrow();
        assertEquals(ControllerType.ORIENTATION, bezier.type());
        assertTrue(bezier.keyed());
        assertTrue(bezier.bezier());
    }

    @Test
    void namesOutsideTheNodeNamespacesDoNotResolve()
    {
        assertTrue(index.resolve("birthrate", LIGHT_NODE).isEmpty());
        assertTrue(index.resolve("selfillumcolor", LIGHT_NODE).isEmpty());
        assertTrue(index.resolve("verts", MESH_NODE).isEmpty());
        assertFalse(index.isControllerKeyword("radius", MESH_NODE));
    }

    @Test
    void writeSideProbesByIdInPriorityOrder()
    {
        // alpha (header id 132) on an emitter is found under the emitter's id 132 first
        assertEquals("p2p_bezier3", index.nameFor(ControllerType.ALPHA, EMITTER_NODE));
        assertEquals("alpha", index.nameFor(ControllerType.ALPHA, MESH_NODE));
    }

    @Test
    void unknownIdFallsBackToTheTypeName()
    {
        assertEquals("colorStart", index.nameFor(ControllerType.COLOR_START, MESH_NODE));
    }

    @Test
    void emptyIndexIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new LegacyControllerNameIndex());
    }

    @Test
    void repeatingATypeIsNotADuplicate()
    {
        LegacyControllerNameIndex small = new LegacyControllerNameIndex(ControllerType.POSITION, ControllerType.POSITION);
        assertEquals("position", small.nameFor(ControllerType.POSITION, MESH_NODE));
        assertTrue(small.resolve("orientation", MESH_NODE).isEmpty());
    }
}
