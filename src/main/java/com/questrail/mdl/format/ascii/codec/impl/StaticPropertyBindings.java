package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.model.ControllerNamespace;
import com.questrail.mdl.model.ControllerType;
import com.questrail.mdl.model.Node;
import com.questrail.mdl.model.Quaternion;
import com.questrail.mdl.model.Vector3;

/**
 * StaticPropertyBindings
 * -----------------------------------------------------------------------------
 * Controller types that double as plain fields of a geometry node.
 *
 * <p>A single-shot line such as {@code position 1 2 3} or {@code birthrate 10}
 * sets the matching field when the node (or one of its attached payloads)
 * has one. Anything else becomes a one-row controller. Keyed controllers
 * never bind.</p>
 *
 * <pre>
 *   node     position, orientation, scale
 *   light    color, radius, multiplier
 *   mesh     selfillumcolor, alpha
 *   emitter  every emitter controller type
 * </pre>
 */
final class StaticPropertyBindings
{
    private StaticPropertyBindings() {}

    /**
     * Returns true if {@code type} has a field on this node.
     */
    static boolean isBound(Node node, ControllerType type) {
        if (type.namespace() == ControllerNamespace.EMITTER) {
            return node.emitter().isPresent();
        }
        return switch (type) {
            case POSITION, ORIENTATION, SCALE -> true;
            case LIGHT_COLOR, LIGHT_RADIUS, LIGHT_MULTIPLIER -> node.light().isPresent();
            case SELF_ILLUM_COLOR, ALPHA -> node.mesh().isPresent();
            default -> false;
        };
    }

    /**
     * Stores in-memory values (quaternion for orientation) into the bound
     * field.
     *
     * @return false if the node has no field for {@code type}
     */
    static boolean apply(Node node, ControllerType type, float[] values, AsciiLine line) {
        if (!isBound(node, type)) {
            return false;
        }
        if (values.length < type.columns()) {
            throw line.error(type.asciiName() + " needs " + type.columns() + " values, got " + values.length);
        }
        if (type.namespace() == ControllerNamespace.EMITTER) {
            float[] v = new float[type.columns()];
            System.arraycopy(values, 0, v, 0, v.length);
            node.emitter().orElseThrow().setParameter(type, v);
            return true;
        }
        switch (type) {
            case POSITION -> node.setPosition(vector(values));
            case ORIENTATION -> node.setOrientation(new Quaternion(values[0], values[1], values[2], values[3]));
            case SCALE -> node.setScale(values[0]);
            case LIGHT_COLOR -> node.light().orElseThrow().setColor(vector(values));
            case LIGHT_RADIUS -> node.light().orElseThrow().setRadius(values[0]);
            case LIGHT_MULTIPLIER -> node.light().orElseThrow().setMultiplier(values[0]);
            case SELF_ILLUM_COLOR -> node.mesh().orElseThrow().setSelfIllumColor(vector(values));
            case ALPHA -> node.mesh().orElseThrow().setAlpha(values[0]);
            default -> {
                return false;
            }
        }
        return true;
    }

    private static Vector3 vector(float[] v) {
        return new Vector3(v[0], v[1], v[2]);
    }
}
