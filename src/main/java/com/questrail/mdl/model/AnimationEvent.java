package com.questrail.mdl.model;

import java.util.Objects;

/**
 * Named event fired at a point in an animation's timeline.
 */
public record AnimationEvent(float time, String name)
{
    public AnimationEvent {
        Objects.requireNonNull(name, "name");
    }
}
