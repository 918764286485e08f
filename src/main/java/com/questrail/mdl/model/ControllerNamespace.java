package com.questrail.mdl.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Legacy controller id namespaces.
 *
 * <p>Numeric controller ids are unique only within one namespace; the same id
 * means different things under {@link #LIGHT} and {@link #EMITTER}.</p>
 */
public enum ControllerNamespace
{
    HEADER(PayloadKind.HEADER_FLAG),
    LIGHT(PayloadKind.LIGHT.flag()),
    EMITTER(PayloadKind.EMITTER.flag()),
    MESH(PayloadKind.MESH.flag());

    /** Probe order used when resolving a controller for a node. */
    public static final List<ControllerNamespace> PRIORITY = List.of(LIGHT, EMITTER, MESH, HEADER);

    private final int flag;

    ControllerNamespace(int flag) {
        this.flag = flag;
    }

    public int flag() {
        return flag;
    }

    /**
     * Namespaces available to a node with the given payloads. The header
     * namespace is always present.
     */
    public static Set<ControllerNamespace> forPayloads(Set<PayloadKind> payloads) {
        EnumSet<ControllerNamespace> result = EnumSet.of(HEADER);
        if (payloads.contains(PayloadKind.LIGHT)) {
            result.add(LIGHT);
        }
        if (payloads.contains(PayloadKind.EMITTER)) {
            result.add(EMITTER);
        }
        if (payloads.contains(PayloadKind.MESH)) {
            result.add(MESH);
        }
        return result;
    }
}
