package com.questrail.mdl.format.ascii.observability;

import java.time.Instant;

/**
 * A parent reference that more than one reading could match, for example a
 * numeric token that is also the name of a node.
 */
public record AmbiguousReferenceEvent(
    Instant timestamp,
    String scope,
    String nodeName,
    String parentToken,
    String chosen,
    String rejected
) {
    public static AmbiguousReferenceEvent of(String scope, String nodeName, String parentToken,
                                             String chosen, String rejected) {
        return new AmbiguousReferenceEvent(Instant.now(), scope, nodeName, parentToken, chosen, rejected);
    }
}
