package com.questrail.mdl.model;

/**
 * The payload slots a {@link Node} may carry, each with the legacy node flag
 * bit it contributes to the node's combined type value.
 */
public enum PayloadKind
{
    LIGHT(0x0002),
    EMITTER(0x0004),
    REFERENCE(0x0010),
    MESH(0x0020),
    SKIN(0x0040),
    DANGLY(0x0100),
    WALKMESH(0x0200),
    SABER(0x0800);

    /** Flag every node carries regardless of payloads. */
    public static final int HEADER_FLAG = 0x0001;

    private final int flag;

    PayloadKind(int flag) {
        this.flag = flag;
    }

    public int flag() {
        return flag;
    }
}
