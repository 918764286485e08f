package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.model.Node;
import com.questrail.mdl.model.PayloadKind;
import com.questrail.mdl.model.Saber;

import java.io.IOException;

/** Blade type, colour and dimensions of a saber mesh. */
final class SaberSection implements PayloadSection
{
    @Override
    public PayloadKind kind() {
        return PayloadKind.SABER;
    }

    @Override
    public boolean read(AsciiLine line, LineCursor cursor, Node node) {
        final Saber saber = node.saber().orElseThrow();
        switch (line.keyword()) {
            case "sabertype" -> saber.setSaberType(line.intAt(1));
            case "sabercolor" -> saber.setSaberColor(line.intAt(1));
            case "length", "saberlength" -> saber.setLength(line.floatAt(1));
            case "width", "saberwidth" -> saber.setWidth(line.floatAt(1));
            case "saberflarecolor" -> saber.setFlareColor(line.intAt(1));
            case "saberflareradius" -> saber.setFlareRadius(line.floatAt(1));
            default -> {
                return false;
            }
        }
        return true;
    }

    @Override
    public void write(Node node, AsciiLineWriter out) throws IOException {
        final Saber saber = node.saber().orElseThrow();
        out.integer("sabertype", saber.saberType());
        out.integer("sabercolor", saber.saberColor());
        out.floats("saberlength", saber.length());
        out.floats("saberwidth", saber.width());
        out.integer("saberflarecolor", saber.flareColor());
        out.floats("saberflareradius", saber.flareRadius());
    }
}
