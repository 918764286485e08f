package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.core.LegacyNumbers;
import com.questrail.mdl.format.ascii.internal.decode.MdlFormatException;
import com.questrail.mdl.model.Vector3;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * AsciiLine
 * -----------------------------------------------------------------------------
 * One content line of ASCII MDL: its 1-based position in the source, the
 * trimmed text and the whitespace-separated tokens.
 *
 * <p>Token accessors raise {@link MdlFormatException} positioned at this
 * line, so section parsers never handle line numbers themselves.</p>
 */
record AsciiLine(int number, String text, List<String> tokens)
{
    static final char COMMENT = '#';

    AsciiLine {
        tokens = List.copyOf(tokens);
    }

    static AsciiLine of(int number, String raw) {
        String trimmed = raw.trim();
        List<String> tokens = trimmed.isEmpty()
            ? List.of()
            : Arrays.asList(trimmed.split("\\s+"));
        return new AsciiLine(number, trimmed, tokens);
    }

    /**
     * Reads all content lines. Blank lines and lines starting with
     * {@value #COMMENT} are dropped but still counted for line numbers.
     */
    static List<AsciiLine> readAll(Reader source) throws IOException {
        BufferedReader in = source instanceof BufferedReader b ? b : new BufferedReader(source);
        List<AsciiLine> lines = new ArrayList<>();
        int number = 0;
        String raw;
        while ((raw = in.readLine()) != null) {
            number++;
            AsciiLine line = of(number, raw);
            if (!line.tokens.isEmpty() && line.text.charAt(0) != COMMENT) {
                lines.add(line);
            }
        }
        return lines;
    }

    /** First token, lowercased. */
    String keyword() {
        return tokens.isEmpty() ? "" : tokens.get(0).toLowerCase(Locale.ROOT);
    }

    int size() {
        return tokens.size();
    }

    boolean has(int index) {
        return index < tokens.size();
    }

    String token(int index) {
        if (index >= tokens.size()) {
            throw error("expected at least " + (index + 1) + " tokens in '" + text + "'");
        }
        return tokens.get(index);
    }

    String tokenOr(int index, String fallback) {
        return has(index) ? tokens.get(index) : fallback;
    }

    float floatAt(int index) {
        String t = token(index);
        try {
            return LegacyNumbers.parseFloatLenient(t);
        } catch (MdlFormatException ex) {
            throw ex.atLine(number);
        }
    }

    int intAt(int index) {
        String t = token(index);
        try {
            return LegacyNumbers.parseIntLenient(t);
        } catch (MdlFormatException ex) {
            throw ex.atLine(number);
        }
    }

    /** Keyword followed by nothing counts as 1, the way flag lines are often written. */
    int flagAt(int index) {
        return has(index) ? intAt(index) : 1;
    }

    Vector3 vectorAt(int index) {
        return new Vector3(floatAt(index), floatAt(index + 1), floatAt(index + 2));
    }

    /** All tokens from {@code from} on, parsed as floats. */
    float[] floatsFrom(int from) {
        float[] out = new float[Math.max(0, tokens.size() - from)];
        for (int i = 0; i < out.length; i++) {
            out[i] = floatAt(from + i);
        }
        return out;
    }

    boolean isNumericAt(int index) {
        return has(index) && LegacyNumbers.isNumeric(tokens.get(index));
    }

    /** True if the token parses as an integer (integral floats included). */
    boolean isIntegerAt(int index) {
        if (!isNumericAt(index)) {
            return false;
        }
        float f = LegacyNumbers.parseFloatLenient(tokens.get(index));
        return Float.isFinite(f) && f == Math.rint(f);
    }

    MdlFormatException error(String detail) {
        return new MdlFormatException(detail, number);
    }
}
