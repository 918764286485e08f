package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.format.ascii.observability.MdlObservabilitySink;
import com.questrail.mdl.model.Node;
import com.questrail.mdl.model.PayloadKind;

import java.io.IOException;
import java.util.List;

/**
 * The keyword grammar of one payload kind.
 *
 * <p>A section only sees lines of nodes that carry its payload. Reading is
 * line driven: the node parser offers each body line to the sections in
 * turn and the first one that recognizes the keyword consumes it, together
 * with any data rows that follow.</p>
 */
interface PayloadSection
{
    PayloadKind kind();

    /**
     * Consumes {@code line} (and, for counted blocks, the rows after it) if
     * the keyword belongs to this payload.
     *
     * @return false if the keyword is not part of this payload's grammar
     */
    boolean read(AsciiLine line, LineCursor cursor, Node node);

    /**
     * Writes the payload's fields. Only called when the payload is attached.
     */
    void write(Node node, AsciiLineWriter out) throws IOException;

    /**
     * Sections in the order their lines are written.
     */
    static List<PayloadSection> standard(MdlObservabilitySink sink) {
        return List.of(
            new MeshSection(sink),
            new SkinSection(),
            new DanglySection(),
            new LightSection(),
            new EmitterSection(),
            new ReferenceSection(),
            new SaberSection(),
            new WalkmeshSection());
    }

    /** Declared row count of a counted block header such as {@code verts 12}. */
    static int declaredCount(AsciiLine header) {
        int count = header.intAt(1);
        if (count < 0) {
            throw header.error("negative count " + count);
        }
        return count;
    }

    /**
     * Declared count of a block with one row per line. A count larger than
     * the lines left in the node is rejected before anything is allocated.
     */
    static int declaredRows(AsciiLine header, LineCursor cursor) {
        int count = declaredCount(header);
        if (count > cursor.remaining()) {
            throw header.error(header.keyword() + " declares " + count + " rows but only "
                + cursor.remaining() + " lines follow");
        }
        return count;
    }
}
