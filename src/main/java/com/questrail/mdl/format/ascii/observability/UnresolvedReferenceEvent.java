package com.questrail.mdl.format.ascii.observability;

import java.time.Instant;

/**
 * A parent reference that matched no node. The node was reattached under
 * {@code attachedTo} instead of being dropped.
 *
 * @param scope {@code "geometry"} or the name of the animation
 */
public record UnresolvedReferenceEvent(
    Instant timestamp,
    String scope,
    String nodeName,
    String parentToken,
    String attachedTo
) {
    public static UnresolvedReferenceEvent of(String scope, String nodeName, String parentToken, String attachedTo) {
        return new UnresolvedReferenceEvent(Instant.now(), scope, nodeName, parentToken, attachedTo);
    }
}
