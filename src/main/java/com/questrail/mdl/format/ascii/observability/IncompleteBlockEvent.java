package com.questrail.mdl.format.ascii.observability;

import java.time.Instant;

/**
 * A counted block whose rows filled fewer slots than its header declared,
 * for example face rows that repeat an index. Only the filled slots were
 * kept.
 */
public record IncompleteBlockEvent(
    Instant timestamp,
    String nodeName,
    String keyword,
    int lineNumber,
    int declared,
    int filled
) {
    public static IncompleteBlockEvent of(String nodeName, String keyword, int lineNumber, int declared, int filled) {
        return new IncompleteBlockEvent(Instant.now(), nodeName, keyword, lineNumber, declared, filled);
    }
}
