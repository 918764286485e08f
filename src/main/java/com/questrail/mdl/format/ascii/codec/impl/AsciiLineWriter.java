package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.core.LegacyNumbers;
import com.questrail.mdl.model.Vector3;

import java.io.IOException;
import java.util.Objects;

/**
 * Line-oriented output with a fixed two-space indent per nesting level.
 * Lines end in {@code \n}.
 */
final class AsciiLineWriter
{
    private static final String INDENT = "  ";

    private final Appendable out;
    private int depth;

    AsciiLineWriter(Appendable out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    void indent() {
        depth++;
    }

    void outdent() {
        if (depth > 0) {
            depth--;
        }
    }

    /** Writes the parts separated by single spaces. */
    void line(String... parts) throws IOException {
        for (int i = 0; i < depth; i++) {
            out.append(INDENT);
        }
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                out.append(' ');
            }
            out.append(parts[i]);
        }
        out.append('\n');
    }

    void floats(String keyword, float... values) throws IOException {
        String[] parts = new String[values.length + 1];
        parts[0] = keyword;
        for (int i = 0; i < values.length; i++) {
            parts[i + 1] = LegacyNumbers.formatPlain(values[i]);
        }
        line(parts);
    }

    /** A data row: values only, no keyword. */
    void row(float... values) throws IOException {
        String[] parts = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            parts[i] = LegacyNumbers.formatPlain(values[i]);
        }
        line(parts);
    }

    void vector(String keyword, Vector3 v) throws IOException {
        floats(keyword, v.x(), v.y(), v.z());
    }

    void integer(String keyword, int value) throws IOException {
        line(keyword, Integer.toString(value));
    }

    void flag(String keyword, boolean value) throws IOException {
        line(keyword, value ? "1" : "0");
    }
}
