package com.questrail.mdl.core;

import com.questrail.mdl.model.Quaternion;
import com.questrail.mdl.model.Vector3;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class MdlMathTest
{
    private static final float EPS = 1e-6f;

    @Test
    void quarterTurnAboutZ()
    {
        Quaternion q = MdlMath.angleAxisToQuaternion(0, 0, 1, Math.PI / 2);

        assertEquals(0f, q.x(), EPS);
        assertEquals(0f, q.y(), EPS);
        assertEquals((float) Math.sqrt(0.5), q.z(), EPS);
        assertEquals((float) Math.sqrt(0.5), q.w(), EPS);
    }

    @Test
    void angleAxisSurvivesConversionBothWays()
    {
        Quaternion q = MdlMath.angleAxisToQuaternion(0, 1, 0, 1.25);
        float[] aa = MdlMath.quaternionToAngleAxis(q);

        assertEquals(0f, aa[0], EPS);
        assertEquals(1f, aa[1], EPS);
        assertEquals(0f, aa[2], EPS);
        assertEquals(1.25f, aa[3], 1e-5f);
    }

    @Test
    void zeroAngleReadsAsIdentity()
    {
        Quaternion q = MdlMath.angleAxisToQuaternion(0, 0, 0, 0);
        assertEquals(Quaternion.IDENTITY, q);
    }

    @Test
    void identityWritesAsUnitXAxisWithNoAngle()
    {
        assertArrayEquals(new float[] { 1f, 0f, 0f, 0f }, MdlMath.quaternionToAngleAxis(Quaternion.IDENTITY));
    }

    @Test
    void zeroQuaternionIsTreatedAsIdentity()
    {
        assertArrayEquals(new float[] { 1f, 0f, 0f, 0f }, MdlMath.quaternionToAngleAxis(new Quaternion(0f, 0f, 0f, 0f)));
    }

    @Test
    void unnormalizedQuaternionIsNormalizedFirst()
    {
        Quaternion doubled = new Quaternion(0f, 0f, 2f * (float) Math.sqrt(0.5), 2f * (float) Math.sqrt(0.5));
        float[] aa = MdlMath.quaternionToAngleAxis(doubled);

        assertEquals(1f, aa[2], EPS);
        assertEquals((float) (Math.PI / 2), aa[3], 1e-5f);
    }

    @Test
    void normalizeKeepsZeroVector()
    {
        assertEquals(Vector3.ZERO, MdlMath.normalize(Vector3.ZERO));
        Vector3 n = MdlMath.normalize(new Vector3(3f, 0f, 4f));
        assertEquals(0.6f, n.x(), EPS);
        assertEquals(0.8f, n.z(), EPS);
    }
}
