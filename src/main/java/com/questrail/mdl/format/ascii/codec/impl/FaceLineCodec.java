package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.core.FaceMaterials;
import com.questrail.mdl.model.Face;

import java.util.ArrayList;
import java.util.List;

/**
 * FaceLineCodec
 * -----------------------------------------------------------------------------
 * Face rows of a {@code faces} block.
 *
 * <p>Accepted shapes, by integer count:</p>
 * <ul>
 *   <li>4: {@code v1 v2 v3 material}</li>
 *   <li>5: {@code v1 v2 v3 material smoothgroup}</li>
 *   <li>multiple of 8: one or more {@code v1 v2 v3 smoothgroup t1 t2 t3 material} groups</li>
 *   <li>any other count of 6 or more: {@code idx v1 v2 v3 material smoothgroup [t1 t2 t3]}</li>
 * </ul>
 *
 * <p>Missing texture indices are {@link Face#REUSE_VERTEX_INDEX}; a literal
 * {@code -1} is kept as that same sentinel and never replaced here.</p>
 */
final class FaceLineCodec
{
    static final int NO_INDEX = -1;

    private FaceLineCodec() {}

    /** A decoded face and the slot it was declared for, or {@link #NO_INDEX}. */
    record Entry(int index, Face face) {
    }

    static List<Entry> read(AsciiLine line) {
        final int n = line.size();
        final int[] v = new int[n];
        for (int i = 0; i < n; i++) {
            v[i] = line.intAt(i);
        }

        List<Entry> out = new ArrayList<>(1);
        if (n == 4) {
            out.add(new Entry(NO_INDEX, face(v[0], v[1], v[2], v[3], 0, -1, -1, -1)));
        } else if (n == 5) {
            out.add(new Entry(NO_INDEX, face(v[0], v[1], v[2], v[3], v[4], -1, -1, -1)));
        } else if (n >= 8 && n % 8 == 0) {
            for (int g = 0; g < n; g += 8) {
                out.add(new Entry(NO_INDEX,
                    face(v[g], v[g + 1], v[g + 2], v[g + 7], v[g + 3], v[g + 4], v[g + 5], v[g + 6])));
            }
        } else if (n >= 6) {
            int t1 = n > 6 ? v[6] : -1;
            int t2 = n > 7 ? v[7] : -1;
            int t3 = n > 8 ? v[8] : -1;
            out.add(new Entry(v[0], face(v[1], v[2], v[3], v[4], v[5], t1, t2, t3)));
        } else {
            throw line.error("face row needs at least 4 integers, got " + n);
        }
        return out;
    }

    private static Face face(int v1, int v2, int v3, int material, int smoothGroup, int t1, int t2, int t3) {
        FaceMaterials.Split split = FaceMaterials.normalize(material, smoothGroup);
        return new Face(v1, v2, v3, split.material(), split.smoothGroup(), t1, t2, t3);
    }

    /** {@code v1 v2 v3 smoothgroup t1 t2 t3 material}. */
    static String[] write(Face f) {
        return new String[] {
            Integer.toString(f.v1()),
            Integer.toString(f.v2()),
            Integer.toString(f.v3()),
            Integer.toString(f.smoothGroup()),
            Integer.toString(f.t1()),
            Integer.toString(f.t2()),
            Integer.toString(f.t3()),
            Integer.toString(f.material())
        };
    }
}
