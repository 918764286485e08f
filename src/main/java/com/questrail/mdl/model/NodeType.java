package com.questrail.mdl.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * NodeType
 * -----------------------------------------------------------------------------
 * The eight payload combinations the legacy toolchain recognizes, keyed by
 * their combined flag value and textual keyword.
 *
 * <p>Any other combination of payloads has no keyword of its own and is
 * written as {@link #DUMMY}.</p>
 */
public enum NodeType
{
    DUMMY(0x0001, "dummy"),
    LIGHT(0x0003, "light"),
    EMITTER(0x0005, "emitter"),
    REFERENCE(0x0011, "reference"),
    TRIMESH(0x0021, "trimesh"),
    SKIN(0x0061, "skin"),
    DANGLYMESH(0x0121, "danglymesh"),
    AABB(0x0221, "aabb"),
    SABER(0x0821, "saber");

    private final int flags;
    private final String keyword;

    NodeType(int flags, String keyword) {
        this.flags = flags;
        this.keyword = keyword;
    }

    public int flags() {
        return flags;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Payload slots implied by this type's flag value.
     */
    public Set<PayloadKind> payloads() {
        EnumSet<PayloadKind> kinds = EnumSet.noneOf(PayloadKind.class);
        for (PayloadKind kind : PayloadKind.values()) {
            if ((flags & kind.flag()) != 0) {
                kinds.add(kind);
            }
        }
        return kinds;
    }

    public static Optional<NodeType> fromFlags(int flags) {
        for (NodeType type : values()) {
            if (type.flags == flags) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a declared node keyword. {@code lightsaber} is accepted as an
     * alias of {@link #SABER}.
     */
    public static Optional<NodeType> fromKeyword(String keyword) {
        String k = keyword.toLowerCase(Locale.ROOT);
        if (k.equals("lightsaber")) {
            return Optional.of(SABER);
        }
        for (NodeType type : values()) {
            if (type.keyword.equals(k)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
