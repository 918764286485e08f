package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.core.LegacyNumbers;
import com.questrail.mdl.core.MdlMath;
import com.questrail.mdl.mapping.ControllerKeyword;
import com.questrail.mdl.model.Controller;
import com.questrail.mdl.model.ControllerRow;
import com.questrail.mdl.model.ControllerType;
import com.questrail.mdl.model.Quaternion;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * ControllerLines
 * -----------------------------------------------------------------------------
 * Reads and writes controller rows.
 *
 * <p>Two textual forms exist:</p>
 * <pre>
 *   alpha 0.5                       single shot: one row at time 0
 *
 *   positionkey [N]                 keyed: N rows, or rows up to endlist
 *     0.0  1 2 3
 *     1.5  1 2 4
 *   endlist
 * </pre>
 *
 * <p>Orientation rows are angle-axis on the wire and quaternions in memory.
 * Every orientation row is converted, in both directions, and must carry
 * exactly four values.</p>
 */
final class ControllerLines
{
    static final String END_LIST = "endlist";
    static final String KEY_SUFFIX = "key";
    static final String BEZIER_KEY_SUFFIX = "bezierkey";

    private ControllerLines() {}

    /**
     * Values of a single-shot line, converted to the in-memory form.
     */
    static float[] singleShotValues(AsciiLine line, ControllerType type) {
        float[] values = line.floatsFrom(1);
        if (values.length == 0) {
            throw line.error("no values for " + type.asciiName());
        }
        return toMemory(line, type, values);
    }

    /**
     * Reads the rows of a keyed controller whose header line has already
     * been consumed.
     */
    static Controller readKeyed(AsciiLine header, ControllerKeyword keyword, LineCursor cursor) {
        final ControllerType type = keyword.type();
        final List<ControllerRow> rows = new ArrayList<>();

        if (header.has(1)) {
            final int count = header.intAt(1);
            for (int i = 0; i < count; i++) {
                AsciiLine row = cursor.require(header, type.asciiName() + " rows");
                rows.add(readRow(row, type));
            }
            cursor.skipIf(END_LIST);
        } else {
            while (cursor.hasNext()) {
                if (cursor.skipIf(END_LIST)) {
                    break;
                }
                if (!cursor.peek().isNumericAt(0)) {
                    break;
                }
                rows.add(readRow(cursor.next(), type));
            }
        }
        return new Controller(type, keyword.bezier(), rows);
    }

    static ControllerRow readRow(AsciiLine line, ControllerType type) {
        final float time = line.floatAt(0);
        final float[] values = line.floatsFrom(1);
        return new ControllerRow(time, toMemory(line, type, values));
    }

    private static float[] toMemory(AsciiLine line, ControllerType type, float[] values) {
        if (type != ControllerType.ORIENTATION) {
            return values;
        }
        if (values.length != 4) {
            throw line.error("orientation needs 4 values (axis and angle), got " + values.length);
        }
        Quaternion q = MdlMath.angleAxisToQuaternion(values[0], values[1], values[2], values[3]);
        return q.toArray();
    }

    // ---- writing ---------------------------------------------------------------

    /** Writes {@code name[bezier]key}, the rows and {@code endlist}. */
    static void writeKeyed(Controller controller, String name, AsciiLineWriter out) throws IOException {
        out.line(name + (controller.isBezier() ? BEZIER_KEY_SUFFIX : KEY_SUFFIX));
        out.indent();
        for (ControllerRow row : controller.rows()) {
            String[] values = formatValues(controller.type(), row.values());
            String[] parts = new String[values.length + 1];
            parts[0] = LegacyNumbers.formatPlain(row.time());
            System.arraycopy(values, 0, parts, 1, values.length);
            out.line(parts);
        }
        out.outdent();
        out.line(END_LIST);
    }

    /**
     * Formats in-memory values for the wire. Position and orientation use
     * the seven-digit legacy form; everything else the shortest exact form.
     */
    static String[] formatValues(ControllerType type, float[] values) {
        if (type == ControllerType.ORIENTATION && values.length == 4) {
            float[] aa = MdlMath.quaternionToAngleAxis(new Quaternion(values[0], values[1], values[2], values[3]));
            return g7(aa);
        }
        if (type == ControllerType.POSITION) {
            return g7(values);
        }
        String[] out = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = LegacyNumbers.formatPlain(values[i]);
        }
        return out;
    }

    private static String[] g7(float[] values) {
        String[] out = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = LegacyNumbers.formatG7(values[i]).trim();
        }
        return out;
    }
}
