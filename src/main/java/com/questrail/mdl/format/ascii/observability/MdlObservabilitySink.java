package com.questrail.mdl.format.ascii.observability;

/**
 * Receives the anomalies the ASCII codec recovers from instead of failing.
 * Implementations can provide logging, collection for reports, or metrics.
 */
public interface MdlObservabilitySink {
    /**
     * Called when a parent reference could not be resolved and the node was
     * reattached under the root.
     * @param event the reference details
     */
    void onUnresolvedReference(UnresolvedReferenceEvent event);

    /**
     * Called when a parent reference admitted more than one reading.
     * @param event the reference details, including the reading chosen
     */
    void onAmbiguousReference(AmbiguousReferenceEvent event);

    /**
     * Called when a malformed line truncated a node block.
     * @param event the error event
     */
    void onNodeFormatError(NodeFormatErrorEvent event);

    /**
     * Called when a counted block left some of its declared slots empty.
     * @param event the block and how many slots were filled
     */
    void onIncompleteBlock(IncompleteBlockEvent event);

    /**
     * Called when a node is written as {@code dummy} because its payloads
     * match no legacy node type.
     * @param event the node and its payloads
     */
    void onUnknownPayloadCombination(UnknownPayloadCombinationEvent event);
}
