package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.model.Node;
import com.questrail.mdl.model.PayloadKind;
import com.questrail.mdl.model.Reference;

import java.io.IOException;

/** {@code refmodel} (or {@code model}) and {@code reattachable}. */
final class ReferenceSection implements PayloadSection
{
    @Override
    public PayloadKind kind() {
        return PayloadKind.REFERENCE;
    }

    @Override
    public boolean read(AsciiLine line, LineCursor cursor, Node node) {
        final Reference reference = node.reference().orElseThrow();
        switch (line.keyword()) {
            case "refmodel", "model" -> reference.setModel(line.tokenOr(1, ""));
            case "reattachable" -> reference.setReattachable(line.flagAt(1) != 0);
            default -> {
                return false;
            }
        }
        return true;
    }

    @Override
    public void write(Node node, AsciiLineWriter out) throws IOException {
        final Reference reference = node.reference().orElseThrow();
        if (!reference.model().isEmpty()) {
            out.line("refmodel", reference.model());
        }
        out.flag("reattachable", reference.reattachable());
    }
}
