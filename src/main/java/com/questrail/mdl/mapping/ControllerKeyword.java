package com.questrail.mdl.mapping;

import com.questrail.mdl.model.ControllerType;

import java.util.Objects;

/**
 * A resolved controller keyword: the controller type plus the form it was
 * written in ({@code alpha}, {@code alphakey} or {@code alphabezierkey}).
 */
public record ControllerKeyword(
    ControllerType type,
    boolean keyed,
    boolean bezier
) {
    public ControllerKeyword {
        Objects.requireNonNull(type, "type");
        if (bezier && !keyed) {
            throw new IllegalArgumentException("bezier form is always keyed");
        }
    }

    public static ControllerKeyword single(ControllerType type) {
        return new ControllerKeyword(type, false, false);
    }
}
