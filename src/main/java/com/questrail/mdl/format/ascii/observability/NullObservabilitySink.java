package com.questrail.mdl.format.ascii.observability;

/**
 * No-op implementation of MdlObservabilitySink.
 */
public final class NullObservabilitySink implements MdlObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onUnresolvedReference(UnresolvedReferenceEvent event) {}

    @Override
    public void onAmbiguousReference(AmbiguousReferenceEvent event) {}

    @Override
    public void onNodeFormatError(NodeFormatErrorEvent event) {}

    @Override
    public void onIncompleteBlock(IncompleteBlockEvent event) {}

    @Override
    public void onUnknownPayloadCombination(UnknownPayloadCombinationEvent event) {}
}
