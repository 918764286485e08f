package com.questrail.mdl.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Model classification tag together with its legacy numeric value.
 */
public enum Classification
{
    INVALID(0),
    EFFECT(1),
    TILE(2),
    CHARACTER(4),
    DOOR(8),
    PLACEABLE(16),
    OTHER(32),
    GUI(64),
    ITEM(128),
    LIGHTSABER(256),
    WAYPOINT(512),
    WEAPON(1024),
    FURNITURE(2048);

    private final int value;

    Classification(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * Keyword used by the textual format ({@code classification character}).
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Classification> fromKeyword(String keyword) {
        for (Classification c : values()) {
            if (c.keyword().equalsIgnoreCase(keyword)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public static Optional<Classification> fromValue(int value) {
        for (Classification c : values()) {
            if (c.value == value) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
