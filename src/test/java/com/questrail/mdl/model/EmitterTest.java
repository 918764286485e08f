package com.questrail.mdl.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class EmitterTest
{
    @Test
    void unsetParameterReadsAsZeros()
    {
        Emitter emitter = new Emitter();

        assertArrayEquals(new float[] { 0f, 0f, 0f }, emitter.parameter(ControllerType.COLOR_START));
        assertTrue(emitter.parameterTypes().isEmpty());
    }

    @Test
    void parametersAreCopied()
    {
        Emitter emitter = new Emitter();
        float[] values = { 5f };
        emitter.setParameter(ControllerType.BIRTHRATE, values);
        values[0] = 9f;

        assertArrayEquals(new float[] { 5f }, emitter.parameter(ControllerType.BIRTHRATE));
        assertTrue(emitter.parameterTypes().contains(ControllerType.BIRTHRATE));
    }

    @Test
    void nonEmitterTypesAreRejected()
    {
        Emitter emitter = new Emitter();

        assertThrows(IllegalArgumentException.class, () -> emitter.setParameter(ControllerType.ALPHA, 1f));
        assertThrows(IllegalArgumentException.class, () -> emitter.parameter(ControllerType.LIGHT_RADIUS));
    }

    @Test
    void flagsAreIndependentBits()
    {
        Emitter emitter = new Emitter();
        emitter.setFlag(EmitterFlag.BOUNCE, true);
        emitter.setFlag(EmitterFlag.P2P, true);
        emitter.setFlag(EmitterFlag.P2P, false);

        assertTrue(emitter.hasFlag(EmitterFlag.BOUNCE));
        assertFalse(emitter.hasFlag(EmitterFlag.P2P));
        assertEquals(EmitterFlag.BOUNCE.bit(), emitter.flags());
    }
}
