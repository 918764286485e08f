package com.questrail.mdl.model;

/**
 * Walkmesh room adjacency: the edge/face index and the room it leads to.
 */
public record RoomLink(int index, int room)
{
}
