package com.questrail.mdl.model;

/**
 * Bits of the emitter flag register, with the keyword each one is written
 * under ({@code p2p 1}, {@code bounce 0}, ...).
 */
public enum EmitterFlag
{
    P2P(0x0001, "p2p"),
    P2P_SEL(0x0002, "p2p_sel"),
    AFFECTED_BY_WIND(0x0004, "affectedByWind"),
    TINTED(0x0008, "m_isTinted"),
    BOUNCE(0x0010, "bounce"),
    RANDOM(0x0020, "random"),
    INHERIT(0x0040, "inherit"),
    INHERIT_VEL(0x0080, "inheritvel"),
    INHERIT_LOCAL(0x0100, "inherit_local"),
    SPLAT(0x0200, "splat"),
    INHERIT_PART(0x0400, "inherit_part"),
    DEPTH_TEXTURE(0x0800, "depth_texture"),
    FLAG_13(0x1000, "emitterflag13");

    private final int bit;
    private final String keyword;

    EmitterFlag(int bit, String keyword) {
        this.bit = bit;
        this.keyword = keyword;
    }

    public int bit() {
        return bit;
    }

    public String keyword() {
        return keyword;
    }
}
