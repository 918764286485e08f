package com.questrail.mdl.format.ascii.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of MdlObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jMdlObservabilitySink implements MdlObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jMdlObservabilitySink.class);

    @Override
    public void onUnresolvedReference(UnresolvedReferenceEvent event) {
        log.warn("MDL [{}] node '{}': parent '{}' not found, attached under '{}'",
            event.scope(), event.nodeName(), event.parentToken(), event.attachedTo());
    }

    @Override
    public void onAmbiguousReference(AmbiguousReferenceEvent event) {
        log.warn("MDL [{}] node '{}': parent '{}' is ambiguous, using '{}' over '{}'",
            event.scope(), event.nodeName(), event.parentToken(), event.chosen(), event.rejected());
    }

    @Override
    public void onNodeFormatError(NodeFormatErrorEvent event) {
        log.warn("MDL node '{}' truncated at line {} ({} lines skipped): {}",
            event.nodeName(), event.lineNumber(), event.skippedLines(), event.cause().detail());
        log.debug("MDL format error detail", event.cause());
    }

    @Override
    public void onIncompleteBlock(IncompleteBlockEvent event) {
        log.warn("MDL node '{}': {} at line {} declared {} slots, {} filled",
            event.nodeName(), event.keyword(), event.lineNumber(), event.declared(), event.filled());
    }

    @Override
    public void onUnknownPayloadCombination(UnknownPayloadCombinationEvent event) {
        log.info("MDL node '{}' has payloads {} (flags 0x{}), written as dummy",
            event.nodeName(), event.payloads(), Integer.toHexString(event.combinedFlags()));
    }
}
