package com.questrail.mdl.model;

/**
 * Texture coordinate pair.
 */
public record Vector2(float u, float v)
{
    public static final Vector2 ZERO = new Vector2(0f, 0f);
}
