package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.format.ascii.internal.decode.MdlFormatException;
import com.questrail.mdl.mapping.ControllerKeyword;
import com.questrail.mdl.model.Controller;
import com.questrail.mdl.model.ControllerRow;
import com.questrail.mdl.model.ControllerType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ControllerLinesTest
{
    private static LineCursor cursor(String... lines)
    {
        List<AsciiLine> out = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            out.add(AsciiLine.of(i + 2, lines[i]));
        }
        return new LineCursor(out);
    }

    private static ControllerKeyword keyed(ControllerType type)
    {
        return new ControllerKeyword(type, true, false);
    }

    @Test
    void countedRowsConsumeTrailingEndlist()
    {
        LineCursor rows = cursor("0 1 2 3", "1.5 1 2 4", "endlist");

        Controller c = ControllerLines.readKeyed(AsciiLine.of(1, "positionkey 2"), keyed(ControllerType.POSITION), rows);

        assertEquals(ControllerType.POSITION, c.type());
        assertEquals(2, c.rows().size());
        assertEquals(1.5f, c.rows().get(1).time());
        assertArrayEquals(new float[] { 1f, 2f, 4f }, c.rows().get(1).values());
        assertEquals(0, rows.remaining());
    }

    @Test
    void uncountedRowsRunToEndlist()
    {
        LineCursor rows = cursor("0 1", "1 0.5", "endlist", "radius 3");

        Controller c = ControllerLines.readKeyed(AsciiLine.of(1, "alphakey"), keyed(ControllerType.ALPHA), rows);

        assertEquals(2, c.rows().size());
        assertEquals("radius", rows.peek().keyword());
    }

    @Test
    void uncountedRowsStopAtTheFirstKeyword()
    {
        LineCursor rows = cursor("0 1", "radius 3");

        Controller c = ControllerLines.readKeyed(AsciiLine.of(1, "alphakey"), keyed(ControllerType.ALPHA), rows);

        assertEquals(1, c.rows().size());
        assertEquals("radius", rows.peek().keyword());
    }

    @Test
    void shortCountedBlockIsAFormatError()
    {
        LineCursor rows = cursor("0 1");

        MdlFormatException ex = assertThrows(MdlFormatException.class,
            () -> ControllerLines.readKeyed(AsciiLine.of(1, "alphakey 3"), keyed(ControllerType.ALPHA), rows));
        assertEquals(1, ex.lineNumber());
    }

    @Test
    void bezierFormIsRemembered()
    {
        Controller c = ControllerLines.readKeyed(AsciiLine.of(1, "alphabezierkey 1"),
            new ControllerKeyword(ControllerType.ALPHA, true, true), cursor("0 1 0 0"));

        assertTrue(c.isBezier());
    }

    @Test
    void zeroAngleOrientationRowIsIdentity()
    {
        ControllerRow row = ControllerLines.readRow(AsciiLine.of(4, "0.0 0 0 1 0"), ControllerType.ORIENTATION);

        assertArrayEquals(new float[] { 0f, 0f, 0f, 1f }, row.values(), 1e-6f);
    }

    @Test
    void halfTurnOrientationBecomesAQuaternion()
    {
        ControllerRow row = ControllerLines.readRow(AsciiLine.of(4, "0 0 0 1 3.14159265"), ControllerType.ORIENTATION);

        assertArrayEquals(new float[] { 0f, 0f, 1f, 0f }, row.values(), 1e-6f);
    }

    @Test
    void orientationRowMustHaveFourValues()
    {
        assertThrows(MdlFormatException.class,
            () -> ControllerLines.readRow(AsciiLine.of(4, "0 0 0 1"), ControllerType.ORIENTATION));
    }

    @Test
    void singleShotWithoutValuesIsAFormatError()
    {
        assertThrows(MdlFormatException.class,
            () -> ControllerLines.singleShotValues(AsciiLine.of(7, "alpha"), ControllerType.ALPHA));
    }

    @Test
    void identityOrientationIsWrittenAsUnitXAxis()
    {
        String[] parts = ControllerLines.formatValues(ControllerType.ORIENTATION, new float[] { 0f, 0f, 0f, 1f });

        assertArrayEquals(new String[] { "1", "0", "0", "0" }, parts);
    }

    @Test
    void positionUsesTrimmedSevenDigitForm()
    {
        String[] parts = ControllerLines.formatValues(ControllerType.POSITION, new float[] { 1.5f, 0f, -2f });

        assertArrayEquals(new String[] { "1.5", "0", "-2" }, parts);
    }

    @Test
    void negativeZeroPositionIsWrittenWithItsSign()
    {
        String[] parts = ControllerLines.formatValues(ControllerType.POSITION, new float[] { -0f, 0f, 3f });

        assertArrayEquals(new String[] { "-0", "0", "3" }, parts);
    }

    @Test
    void otherTypesUseThePlainForm()
    {
        String[] parts = ControllerLines.formatValues(ControllerType.ALPHA, new float[] { 0.25f });

        assertArrayEquals(new String[] { "0.25" }, parts);
    }

    @Test
    void keyedControllerIsWrittenWithEndlist() throws IOException
    {
        Controller c = new Controller(ControllerType.ALPHA, false, List.of(
            new ControllerRow(0f, new float[] { 1f }),
            new ControllerRow(1.5f, new float[] { 0.5f })));
        StringBuilder out = new StringBuilder();

        ControllerLines.writeKeyed(c, "alpha", new AsciiLineWriter(out));

        assertEquals("alphakey\n  0 1\n  1.5 0.5\nendlist\n", out.toString());
    }

    @Test
    void bezierControllerUsesBezierKeySuffix() throws IOException
    {
        Controller c = new Controller(ControllerType.ALPHA, true, List.of(new ControllerRow(0f, new float[] { 1f, 0f, 0f })));
        StringBuilder out = new StringBuilder();

        ControllerLines.writeKeyed(c, "alpha", new AsciiLineWriter(out));

        assertTrue(out.toString().startsWith("alphabezierkey\n"));
    }
}
