package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.core.LegacyNumbers;
import com.questrail.mdl.model.AabbRecord;
import com.questrail.mdl.model.Node;
import com.questrail.mdl.model.PayloadKind;
import com.questrail.mdl.model.Walkmesh;

import java.io.IOException;
import java.util.List;

/**
 * AABB tree records of a walkmesh node.
 *
 * <p>Three header shapes occur in the wild:</p>
 * <pre>
 *   aabb N                              followed by N records
 *   aabb                                followed by records while the rows are numeric
 *   aabb minx miny minz maxx maxy maxz face   first record inline, more may follow
 * </pre>
 */
final class WalkmeshSection implements PayloadSection
{
    private static final int RECORD_TOKENS = 7;

    @Override
    public PayloadKind kind() {
        return PayloadKind.WALKMESH;
    }

    @Override
    public boolean read(AsciiLine line, LineCursor cursor, Node node) {
        if (!line.keyword().equals("aabb")) {
            return false;
        }
        final List<AabbRecord> records = node.walkmesh().orElseThrow().records();
        records.clear();

        if (line.size() == 2) {
            final int count = PayloadSection.declaredRows(line, cursor);
            for (int i = 0; i < count; i++) {
                records.add(record(cursor.require(line, "aabb records"), 0));
            }
            return true;
        }
        if (line.size() > RECORD_TOKENS) {
            records.add(record(line, 1));
        }
        while (cursor.nextIsNumeric()) {
            records.add(record(cursor.next(), 0));
        }
        return true;
    }

    private static AabbRecord record(AsciiLine line, int from) {
        if (line.size() - from < RECORD_TOKENS) {
            throw line.error("aabb record needs " + RECORD_TOKENS + " values");
        }
        return new AabbRecord(line.vectorAt(from), line.vectorAt(from + 3), line.intAt(from + 6));
    }

    @Override
    public void write(Node node, AsciiLineWriter out) throws IOException {
        final Walkmesh walkmesh = node.walkmesh().orElseThrow();
        out.integer("aabb", walkmesh.records().size());
        out.indent();
        for (AabbRecord r : walkmesh.records()) {
            out.line(
                LegacyNumbers.formatPlain(r.min().x()),
                LegacyNumbers.formatPlain(r.min().y()),
                LegacyNumbers.formatPlain(r.min().z()),
                LegacyNumbers.formatPlain(r.max().x()),
                LegacyNumbers.formatPlain(r.max().y()),
                LegacyNumbers.formatPlain(r.max().z()),
                Integer.toString(r.faceIndex()));
        }
        out.outdent();
    }
}
