package com.questrail.mdl.model;

/**
 * Three per-face indices, as used by the second texture channel's
 * {@code texindices1} block.
 */
public record IndexTriple(int a, int b, int c)
{
}
