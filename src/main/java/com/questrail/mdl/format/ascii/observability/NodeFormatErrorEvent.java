package com.questrail.mdl.format.ascii.observability;

import com.questrail.mdl.format.ascii.internal.decode.MdlFormatException;

import java.time.Instant;

/**
 * A malformed line inside a node block. The rest of that block was skipped;
 * the node keeps whatever had been parsed before the bad line.
 */
public record NodeFormatErrorEvent(
    Instant timestamp,
    String nodeName,
    int lineNumber,
    int skippedLines,
    MdlFormatException cause
) {
    public static NodeFormatErrorEvent of(String nodeName, int skippedLines, MdlFormatException cause) {
        return new NodeFormatErrorEvent(Instant.now(), nodeName, cause.lineNumber(), skippedLines, cause);
    }
}
