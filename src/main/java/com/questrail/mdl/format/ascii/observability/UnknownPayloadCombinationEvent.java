package com.questrail.mdl.format.ascii.observability;

import com.questrail.mdl.model.PayloadKind;

import java.time.Instant;
import java.util.Set;

/**
 * A node whose payloads match none of the legacy node types. It was written
 * as {@code dummy}.
 */
public record UnknownPayloadCombinationEvent(
    Instant timestamp,
    String nodeName,
    Set<PayloadKind> payloads,
    int combinedFlags
) {
    public UnknownPayloadCombinationEvent {
        payloads = Set.copyOf(payloads);
    }

    public static UnknownPayloadCombinationEvent of(String nodeName, Set<PayloadKind> payloads, int combinedFlags) {
        return new UnknownPayloadCombinationEvent(Instant.now(), nodeName, payloads, combinedFlags);
    }
}
