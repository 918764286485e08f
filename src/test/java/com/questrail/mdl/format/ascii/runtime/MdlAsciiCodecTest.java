package com.questrail.mdl.format.ascii.runtime;

import com.questrail.mdl.format.ascii.config.MdlAsciiConfig;
import com.questrail.mdl.format.ascii.internal.decode.MdlFormatException;
import com.questrail.mdl.format.ascii.observability.RecordingMdlObservabilitySink;
import com.questrail.mdl.format.ascii.observability.Slf4jMdlObservabilitySink;
import com.questrail.mdl.format.ascii.observability.UnresolvedReferenceEvent;
import com.questrail.mdl.mapping.LegacyControllerNameIndex;
import com.questrail.mdl.model.ControllerType;
import com.questrail.mdl.model.Model;
import com.questrail.mdl.model.Node;
import com.questrail.mdl.model.PayloadKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class MdlAsciiCodecTest {

    private static final String TEXT = String.join("\n",
        "newmodel box",
        "node dummy box",
        "  parent NULL",
        "endnode",
        "node trimesh lid",
        "  parent nowhere",
        "  verts 1",
        "    0 0 1",
        "endnode",
        "donemodel box",
        "");

    @Test
    void defaultsReadAndWrite() throws IOException {
        MdlAsciiCodec codec = MdlAsciiCodec.builder().build();

        Model model = codec.read(new StringReader(TEXT));
        StringWriter out = new StringWriter();
        codec.write(model, out);

        assertEquals(MdlAsciiConfig.defaults(), codec.config());
        assertEquals("box", model.root().name());
        assertTrue(out.toString().startsWith("newmodel box\n"));
        assertEquals(out.toString(), codec.writeToString(model));
    }

    @Test
    void sinkSeesReaderAnomalies() {
        RecordingMdlObservabilitySink sink = new RecordingMdlObservabilitySink();
        MdlAsciiCodec codec = MdlAsciiCodec.builder()
            .withObservabilitySink(sink)
            .build();

        Model model = codec.read(TEXT);

        assertEquals(model.root().id(), model.node("lid").orElseThrow().parentId());
        UnresolvedReferenceEvent event = sink.eventsOfType(UnresolvedReferenceEvent.class).get(0);
        assertEquals("lid", event.nodeName());
        assertEquals("nowhere", event.parentToken());
    }

    @Test
    void configReachesReaderAndWriter() {
        MdlAsciiCodec codec = MdlAsciiCodec.builder()
            .withConfig(MdlAsciiConfig.builder().withStrict(true).withFlattenSkins(true).build())
            .withObservabilitySink(new Slf4jMdlObservabilitySink())
            .withControllerNameIndex(LegacyControllerNameIndex.standard())
            .build();

        assertThrows(MdlFormatException.class, () -> codec.read(TEXT.replace("    0 0 1\n", "")));

        Model model = new Model("box");
        Node body = new Node("body");
        body.setId(1);
        body.attach(PayloadKind.MESH);
        body.attach(PayloadKind.SKIN);
        model.root().addChild(body);
        assertTrue(codec.writeToString(model).contains("node trimesh body\n"));
    }

    @Test
    void customNameIndexIsUsed() {
        MdlAsciiCodec codec = MdlAsciiCodec.builder()
            .withControllerNameIndex(new LegacyControllerNameIndex(ControllerType.POSITION, ControllerType.ORIENTATION))
            .build();

        Model model = codec.read(String.join("\n",
            "newmodel box",
            "node dummy box",
            "  parent NULL",
            "  alpha 0.5",
            "endnode"));

        assertTrue(model.root().controllers().isEmpty());
        assertEquals(1, model.root().rawLines().size());
    }

    @Test
    void builderRejectsNulls() {
        MdlAsciiCodec.Builder builder = MdlAsciiCodec.builder();
        assertThrows(NullPointerException.class, () -> builder.withConfig(null));
        assertThrows(NullPointerException.class, () -> builder.withObservabilitySink(null));
        assertThrows(NullPointerException.class, () -> builder.withControllerNameIndex(null));
    }
}
