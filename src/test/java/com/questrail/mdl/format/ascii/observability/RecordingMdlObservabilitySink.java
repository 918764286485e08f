package com.questrail.mdl.format.ascii.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingMdlObservabilitySink implements MdlObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onUnresolvedReference(UnresolvedReferenceEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onAmbiguousReference(AmbiguousReferenceEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onNodeFormatError(NodeFormatErrorEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onIncompleteBlock(IncompleteBlockEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onUnknownPayloadCombination(UnknownPayloadCombinationEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
