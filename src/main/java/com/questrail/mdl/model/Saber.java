package com.questrail.mdl.model;

/**
 * Lightsaber blade payload.
 */
public final class Saber
{
    private int saberType;
    private int saberColor;
    private float length;
    private float width;
    private int flareColor;
    private float flareRadius;

    public int saberType() { return saberType; }
    public void setSaberType(int v) { this.saberType = v; }

    public int saberColor() { return saberColor; }
    public void setSaberColor(int v) { this.saberColor = v; }

    public float length() { return length; }
    public void setLength(float v) { this.length = v; }

    public float width() { return width; }
    public void setWidth(float v) { this.width = v; }

    public int flareColor() { return flareColor; }
    public void setFlareColor(int v) { this.flareColor = v; }

    public float flareRadius() { return flareRadius; }
    public void setFlareRadius(float v) { this.flareRadius = v; }
}
