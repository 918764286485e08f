package com.questrail.mdl.format.ascii.observability;

import com.questrail.mdl.format.ascii.internal.decode.MdlFormatException;
import com.questrail.mdl.model.PayloadKind;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Slf4jMdlObservabilitySinkTest
 * -----------------------------------------------------------------------------
 * The logging sink accepts every event kind without failing, including
 * events with missing optional detail.
 */
final class Slf4jMdlObservabilitySinkTest
{
    private final MdlObservabilitySink sink = new Slf4jMdlObservabilitySink();

    @Test
    void everyEventKindIsLogged()
    {
        assertDoesNotThrow(() -> {
            sink.onUnresolvedReference(UnresolvedReferenceEvent.of("geometry", "lid", "ghost", "crate"));
            sink.onAmbiguousReference(AmbiguousReferenceEvent.of("open", "lid", "1", "arm", "torso"));
            sink.onNodeFormatError(NodeFormatErrorEvent.of("lid", 3, new MdlFormatException("bad row", 17)));
            sink.onIncompleteBlock(IncompleteBlockEvent.of("lid", "faces", 12, 3, 2));
            sink.onUnknownPayloadCombination(UnknownPayloadCombinationEvent.of(
                "odd", EnumSet.of(PayloadKind.LIGHT, PayloadKind.EMITTER), 0x07));
        });
    }

    @Test
    void formatErrorWithoutLineNumberIsLogged()
    {
        NodeFormatErrorEvent event = NodeFormatErrorEvent.of("lid", 0, new MdlFormatException("bad row"));
        assertEquals(MdlFormatException.UNKNOWN_LINE, event.lineNumber());
        assertDoesNotThrow(() -> sink.onNodeFormatError(event));
    }
}
