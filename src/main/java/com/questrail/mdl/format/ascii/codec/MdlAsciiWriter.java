package com.questrail.mdl.format.ascii.codec;

import com.questrail.mdl.model.Model;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * MdlAsciiWriter
 * -----------------------------------------------------------------------------
 * Text-level encoder for ASCII MDL.
 *
 * <p>The writer never mutates the model and does not validate it: whatever
 * the graph holds is written.</p>
 */
public interface MdlAsciiWriter
{
    /**
     * Writes the model to {@code out}. The target is neither flushed nor
     * closed.
     */
    void write(Model model, Appendable out) throws IOException;

    default String writeToString(Model model) {
        StringBuilder sb = new StringBuilder();
        try {
            write(model, sb);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return sb.toString();
    }
}
