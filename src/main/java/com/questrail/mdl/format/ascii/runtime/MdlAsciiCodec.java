package com.questrail.mdl.format.ascii.runtime;

import com.questrail.mdl.format.ascii.codec.MdlAsciiReader;
import com.questrail.mdl.format.ascii.codec.MdlAsciiWriter;
import com.questrail.mdl.format.ascii.codec.impl.DefaultMdlAsciiReader;
import com.questrail.mdl.format.ascii.codec.impl.DefaultMdlAsciiWriter;
import com.questrail.mdl.format.ascii.config.MdlAsciiConfig;
import com.questrail.mdl.format.ascii.observability.MdlObservabilitySink;
import com.questrail.mdl.format.ascii.observability.NullObservabilitySink;
import com.questrail.mdl.mapping.ControllerNameIndex;
import com.questrail.mdl.mapping.LegacyControllerNameIndex;
import com.questrail.mdl.model.Model;

import java.io.IOException;
import java.io.Reader;
import java.util.Objects;

/**
 * MdlAsciiCodec
 * =============================================================================
 * Composition root for the ASCII MDL stack.
 *
 * <p>Wires one configuration, one observability sink and one controller name
 * index into a matching reader and writer pair. The codec is immutable and
 * safe to share.</p>
 *
 * <pre>
 *   MdlAsciiCodec codec = MdlAsciiCodec.builder()
 *       .withConfig(MdlAsciiConfig.builder().withStrict(true).build())
 *       .withObservabilitySink(new Slf4jMdlObservabilitySink())
 *       .build();
 *   Model model = codec.read(reader);
 * </pre>
 */
public final class MdlAsciiCodec
{
    private final MdlAsciiConfig config;
    private final MdlAsciiReader reader;
    private final MdlAsciiWriter writer;

    private MdlAsciiCodec(MdlAsciiConfig config, MdlAsciiReader reader, MdlAsciiWriter writer) {
        this.config = config;
        this.reader = reader;
        this.writer = writer;
    }

    public MdlAsciiConfig config() {
        return config;
    }

    public MdlAsciiReader reader() {
        return reader;
    }

    public MdlAsciiWriter writer() {
        return writer;
    }

    public Model read(Reader source) throws IOException {
        return reader.read(source);
    }

    public Model read(String text) {
        return reader.read(text);
    }

    public void write(Model model, Appendable out) throws IOException {
        writer.write(model, out);
    }

    public String writeToString(Model model) {
        return writer.writeToString(model);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MdlAsciiConfig config = MdlAsciiConfig.defaults();
        private MdlObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private ControllerNameIndex controllerNames = LegacyControllerNameIndex.standard();

        public Builder withConfig(MdlAsciiConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder withObservabilitySink(MdlObservabilitySink sink) {
            this.observabilitySink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder withControllerNameIndex(ControllerNameIndex names) {
            this.controllerNames = Objects.requireNonNull(names, "names");
            return this;
        }

        public MdlAsciiCodec build() {
            return new MdlAsciiCodec(
                config,
                new DefaultMdlAsciiReader(config, observabilitySink, controllerNames),
                new DefaultMdlAsciiWriter(config, observabilitySink, controllerNames));
        }
    }
}
