package com.questrail.mdl.core;

import com.questrail.mdl.format.ascii.internal.decode.MdlFormatException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class LegacyNumbersTest
{
    @Test
    void legacyNanSpellingsParseAsNan()
    {
        assertTrue(Float.isNaN(LegacyNumbers.parseFloatLenient("1.#QNAN")));
        assertTrue(Float.isNaN(LegacyNumbers.parseFloatLenient("-1.#IND")));
        assertTrue(Float.isNaN(LegacyNumbers.parseFloatLenient("1.#QNAN0")));
        assertTrue(Float.isNaN(LegacyNumbers.parseFloatLenient("nan")));
    }

    @Test
    void legacyInfinitySpellingsKeepTheirSign()
    {
        assertEquals(Float.POSITIVE_INFINITY, LegacyNumbers.parseFloatLenient("1.#INF"));
        assertEquals(Float.NEGATIVE_INFINITY, LegacyNumbers.parseFloatLenient("-1.#INF00"));
        assertEquals(Float.POSITIVE_INFINITY, LegacyNumbers.parseFloatLenient("inf"));
    }

    @Test
    void ordinaryDecimalsParse()
    {
        assertEquals(0.5f, LegacyNumbers.parseFloatLenient("0.5"));
        assertEquals(-12f, LegacyNumbers.parseFloatLenient("-12"));
        assertEquals(1e-5f, LegacyNumbers.parseFloatLenient("1e-05"));
    }

    @Test
    void garbageIsAFormatError()
    {
        assertThrows(MdlFormatException.class, () -> LegacyNumbers.parseFloatLenient("abc"));
        assertThrows(MdlFormatException.class, () -> LegacyNumbers.parseFloatLenient("0x10"));
        assertThrows(MdlFormatException.class, () -> LegacyNumbers.parseFloatLenient("1f"));
        assertFalse(LegacyNumbers.isNumeric("NULL"));
        assertTrue(LegacyNumbers.isNumeric("-3.5"));
    }

    @Test
    void integersAcceptIntegralFloats()
    {
        assertEquals(3, LegacyNumbers.parseIntLenient("3"));
        assertEquals(3, LegacyNumbers.parseIntLenient("3.0"));
        assertThrows(MdlFormatException.class, () -> LegacyNumbers.parseIntLenient("3.5"));
        assertThrows(MdlFormatException.class, () -> LegacyNumbers.parseIntLenient("99999999999"));
    }

    @Test
    void sevenDigitFormatMatchesC()
    {
        assertEquals(" 1", LegacyNumbers.formatG7(1.0));
        assertEquals("-0.5", LegacyNumbers.formatG7(-0.5));
        assertEquals(" 0", LegacyNumbers.formatG7(0.0));
        assertEquals(" 100", LegacyNumbers.formatG7(100.0));
        assertEquals(" 3.141593", LegacyNumbers.formatG7(Math.PI));
        assertEquals(" 1e-05", LegacyNumbers.formatG7(1e-5));
        assertEquals(" 1.234568e+07", LegacyNumbers.formatG7(12345678.0));
        assertEquals(" 0.0001", LegacyNumbers.formatG7(1e-4));
    }

    @Test
    void negativeZeroKeepsItsSign()
    {
        assertEquals("-0", LegacyNumbers.formatG7(-0.0));
        assertEquals("-0", LegacyNumbers.formatG7(-0.0f));
        assertEquals(" 0", LegacyNumbers.formatG7(0.0));
    }

    @Test
    void plainFormatIsShortestAndNeverExponential()
    {
        assertEquals("0", LegacyNumbers.formatPlain(0f));
        assertEquals("1", LegacyNumbers.formatPlain(1f));
        assertEquals("100", LegacyNumbers.formatPlain(100f));
        assertEquals("0.1", LegacyNumbers.formatPlain(0.1f));
        assertEquals("-2.5", LegacyNumbers.formatPlain(-2.5f));
        assertEquals("0.00001", LegacyNumbers.formatPlain(1e-5f));
    }

    @Test
    void specialValuesAreWrittenInLegacySpelling()
    {
        assertEquals("1.#QNAN", LegacyNumbers.formatPlain(Float.NaN));
        assertEquals("1.#INF", LegacyNumbers.formatPlain(Float.POSITIVE_INFINITY));
        assertEquals("-1.#INF", LegacyNumbers.formatPlain(Float.NEGATIVE_INFINITY));
        assertTrue(Float.isNaN(LegacyNumbers.parseFloatLenient(LegacyNumbers.formatPlain(Float.NaN))));
    }
}
