package com.questrail.mdl.format.ascii.codec;

import com.questrail.mdl.model.Model;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;

/**
 * MdlAsciiReader
 * -----------------------------------------------------------------------------
 * Text-level decoder for ASCII MDL.
 *
 * <p>The reader is responsible for:</p>
 * <ul>
 *   <li>Tokenizing lines and dispatching keywords</li>
 *   <li>Attaching payloads according to the declared node keyword</li>
 *   <li>Resolving controller keywords against the node's namespaces</li>
 *   <li>Rebuilding the geometry and animation trees</li>
 * </ul>
 *
 * <p>The reader is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Locating files or guessing character encodings</li>
 *   <li>Validating geometry (index ranges, matching array lengths)</li>
 * </ul>
 *
 * <p>Recoverable anomalies (unresolved parents, malformed lines inside a node)
 * are reported to the configured observability sink. Unrecoverable ones throw
 * a subclass of {@code MdlDecodeException}.</p>
 */
public interface MdlAsciiReader
{
    /**
     * Parses one model from the given text. The reader is not closed.
     *
     * @throws IOException if reading the source fails
     * @throws com.questrail.mdl.format.ascii.internal.decode.MdlEmptyInputException
     *         if the source holds no content lines
     * @throws com.questrail.mdl.format.ascii.internal.decode.MdlFormatException
     *         for malformed lines outside node blocks
     */
    Model read(Reader source) throws IOException;

    /**
     * Parses one model from an in-memory string.
     */
    default Model read(String text) {
        try {
            return read(new StringReader(text));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
