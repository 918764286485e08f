package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.model.Dangly;
import com.questrail.mdl.model.Node;
import com.questrail.mdl.model.PayloadKind;

import java.io.IOException;
import java.util.Collections;

/**
 * Dangly-mesh motion parameters and per-vertex constraints
 * ({@code constraints N}, rows {@code w} or {@code idx w}).
 */
final class DanglySection implements PayloadSection
{
    @Override
    public PayloadKind kind() {
        return PayloadKind.DANGLY;
    }

    @Override
    public boolean read(AsciiLine line, LineCursor cursor, Node node) {
        final Dangly dangly = node.dangly().orElseThrow();
        switch (line.keyword()) {
            case "period" -> dangly.setPeriod(line.floatAt(1));
            case "tightness" -> dangly.setTightness(line.floatAt(1));
            case "displacement" -> dangly.setDisplacement(line.floatAt(1));
            case "constraints" -> readConstraints(line, cursor, dangly);
            default -> {
                return false;
            }
        }
        return true;
    }

    private static void readConstraints(AsciiLine header, LineCursor cursor, Dangly dangly) {
        final int count = PayloadSection.declaredRows(header, cursor);
        dangly.constraints().clear();
        dangly.constraints().addAll(Collections.nCopies(count, 0f));
        for (int row = 0; row < count; row++) {
            AsciiLine line = cursor.require(header, "constraints");
            if (line.size() == 1) {
                dangly.constraints().set(row, line.floatAt(0));
            } else {
                int idx = line.intAt(0);
                if (idx < 0 || idx >= count) {
                    throw line.error("constraint index " + idx + " outside 0.." + (count - 1));
                }
                dangly.constraints().set(idx, line.floatAt(1));
            }
        }
    }

    @Override
    public void write(Node node, AsciiLineWriter out) throws IOException {
        final Dangly dangly = node.dangly().orElseThrow();
        out.floats("period", dangly.period());
        out.floats("tightness", dangly.tightness());
        out.floats("displacement", dangly.displacement());
        if (!dangly.constraints().isEmpty()) {
            out.integer("constraints", dangly.constraints().size());
            out.indent();
            for (Float w : dangly.constraints()) {
                out.row(w);
            }
            out.outdent();
        }
    }
}
