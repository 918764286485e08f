package com.questrail.mdl.format.ascii.codec.impl;

import java.util.List;
import java.util.Objects;

/**
 * Forward-only position over a list of content lines.
 */
final class LineCursor
{
    private final List<AsciiLine> lines;
    private int position;

    LineCursor(List<AsciiLine> lines) {
        this.lines = Objects.requireNonNull(lines, "lines");
    }

    boolean hasNext() {
        return position < lines.size();
    }

    AsciiLine peek() {
        return lines.get(position);
    }

    AsciiLine next() {
        return lines.get(position++);
    }

    /**
     * Consumes the next line, which must exist.
     *
     * @param after the line that announced the expected data, for the error
     */
    AsciiLine require(AsciiLine after, String what) {
        if (!hasNext()) {
            throw after.error("unexpected end of block while reading " + what);
        }
        return next();
    }

    /** True if another line follows and its first token is numeric. */
    boolean nextIsNumeric() {
        return hasNext() && peek().isNumericAt(0);
    }

    /** Consumes the next line if its keyword matches. */
    boolean skipIf(String keyword) {
        if (hasNext() && peek().keyword().equals(keyword)) {
            position++;
            return true;
        }
        return false;
    }

    int remaining() {
        return lines.size() - position;
    }

    void skipToEnd() {
        position = lines.size();
    }
}
