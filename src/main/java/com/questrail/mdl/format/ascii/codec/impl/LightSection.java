package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.model.ControllerNamespace;
import com.questrail.mdl.model.ControllerType;
import com.questrail.mdl.model.Light;
import com.questrail.mdl.model.Node;
import com.questrail.mdl.model.PayloadKind;
import com.questrail.mdl.model.Vector3;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * LightSection
 * -----------------------------------------------------------------------------
 * Light flags and the four lens-flare arrays.
 *
 * <p>The flare arrays may be written with a count ({@code flaresizes 2}
 * followed by two rows) or without one. Without a count, numeric arrays run
 * until a row whose first token is not a number, and {@code texturenames}
 * runs until a line that starts with a known light keyword.</p>
 *
 * <p>{@code color}, {@code radius} and {@code multiplier} are controller
 * keywords; their single-shot form is bound to the light's fields before this
 * section sees the line.</p>
 */
final class LightSection implements PayloadSection
{
    private static final Set<String> KEYWORDS = Set.of(
        "lightpriority", "priority", "ambientonly", "shadow", "flare", "fadinglight",
        "ndynamictype", "affectdynamic", "flareradius", "lensflares",
        "texturenames", "flaresizes", "flarepositions", "flarecolorshifts");

    private static final Set<String> NODE_KEYWORDS = Set.of(
        "parent", "wirecolor", "endnode", "endlist");

    private static final Set<String> STOP_WORDS = stopWords();

    @Override
    public PayloadKind kind() {
        return PayloadKind.LIGHT;
    }

    @Override
    public boolean read(AsciiLine line, LineCursor cursor, Node node) {
        final Light light = node.light().orElseThrow();
        switch (line.keyword()) {
            case "lightpriority", "priority" -> light.setLightPriority(line.intAt(1));
            case "ambientonly" -> light.setAmbientOnly(line.flagAt(1) != 0);
            case "shadow" -> light.setShadow(line.flagAt(1) != 0);
            case "flare" -> light.setFlare(line.flagAt(1) != 0);
            case "fadinglight" -> light.setFadingLight(line.flagAt(1) != 0);
            case "ndynamictype" -> light.setDynamicType(line.intAt(1));
            case "affectdynamic" -> light.setAffectDynamic(line.flagAt(1) != 0);
            case "flareradius" -> light.setFlareRadius(line.floatAt(1));
            case "lensflares" -> {
                // derived from the flare arrays; nothing to store
            }
            case "texturenames" -> readTextureNames(line, cursor, light.flareTextures());
            case "flaresizes" -> readArray(line, cursor, light.flareSizes(), row -> row.floatAt(0));
            case "flarepositions" -> readArray(line, cursor, light.flarePositions(), row -> row.floatAt(0));
            case "flarecolorshifts" -> readArray(line, cursor, light.flareColorShifts(), row -> row.vectorAt(0));
            default -> {
                return false;
            }
        }
        return true;
    }

    private static <T> void readArray(AsciiLine header, LineCursor cursor, List<T> target,
                                      Function<AsciiLine, T> rowReader) {
        target.clear();
        if (header.has(1)) {
            final int count = PayloadSection.declaredRows(header, cursor);
            for (int i = 0; i < count; i++) {
                target.add(rowReader.apply(cursor.require(header, header.keyword())));
            }
            return;
        }
        while (cursor.nextIsNumeric()) {
            target.add(rowReader.apply(cursor.next()));
        }
    }

    private static void readTextureNames(AsciiLine header, LineCursor cursor, List<String> target) {
        target.clear();
        if (header.has(1)) {
            final int count = PayloadSection.declaredRows(header, cursor);
            for (int i = 0; i < count; i++) {
                target.add(cursor.require(header, "texturenames").text());
            }
            return;
        }
        while (cursor.hasNext() && !isStopWord(cursor.peek().keyword())) {
            target.add(cursor.next().text());
        }
    }

    private static boolean isStopWord(String keyword) {
        if (STOP_WORDS.contains(keyword)) {
            return true;
        }
        if (keyword.endsWith(ControllerLines.BEZIER_KEY_SUFFIX)) {
            return STOP_WORDS.contains(keyword.substring(0, keyword.length() - ControllerLines.BEZIER_KEY_SUFFIX.length()));
        }
        if (keyword.endsWith(ControllerLines.KEY_SUFFIX)) {
            return STOP_WORDS.contains(keyword.substring(0, keyword.length() - ControllerLines.KEY_SUFFIX.length()));
        }
        return false;
    }

    private static Set<String> stopWords() {
        Set<String> words = new HashSet<>(KEYWORDS);
        words.addAll(NODE_KEYWORDS);
        for (ControllerType type : ControllerType.values()) {
            if (type.namespace() == ControllerNamespace.LIGHT || type.namespace() == ControllerNamespace.HEADER) {
                words.add(type.asciiName().toLowerCase(Locale.ROOT));
            }
        }
        return Set.copyOf(words);
    }

    // ---- writing ---------------------------------------------------------------

    @Override
    public void write(Node node, AsciiLineWriter out) throws IOException {
        final Light light = node.light().orElseThrow();
        out.integer("lightpriority", light.lightPriority());
        out.flag("ambientonly", light.ambientOnly());
        out.integer("ndynamictype", light.dynamicType());
        out.flag("affectdynamic", light.affectDynamic());
        out.flag("shadow", light.shadow());
        out.flag("flare", light.flare());
        out.flag("fadinglight", light.fadingLight());
        out.vector(ControllerType.LIGHT_COLOR.asciiName(), light.color());
        out.floats(ControllerType.LIGHT_RADIUS.asciiName(), light.radius());
        out.floats(ControllerType.LIGHT_MULTIPLIER.asciiName(), light.multiplier());
        out.floats("flareradius", light.flareRadius());

        if (!light.hasFlareData()) {
            return;
        }
        out.integer("lensflares", light.flareTextures().size());
        out.integer("texturenames", light.flareTextures().size());
        out.indent();
        for (String name : light.flareTextures()) {
            out.line(name);
        }
        out.outdent();
        writeFloats("flaresizes", light.flareSizes(), out);
        writeFloats("flarepositions", light.flarePositions(), out);
        out.integer("flarecolorshifts", light.flareColorShifts().size());
        out.indent();
        for (Vector3 shift : light.flareColorShifts()) {
            out.row(shift.x(), shift.y(), shift.z());
        }
        out.outdent();
    }

    private static void writeFloats(String keyword, List<Float> values, AsciiLineWriter out) throws IOException {
        out.integer(keyword, values.size());
        out.indent();
        for (Float v : values) {
            out.row(v);
        }
        out.outdent();
    }
}
