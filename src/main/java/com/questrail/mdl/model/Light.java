package com.questrail.mdl.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Light payload.
 *
 * <p>The four flare lists are parallel arrays describing one lens flare per
 * index. They are expected to agree in length; this class does not check it,
 * and writers emit whatever is present.</p>
 */
public final class Light
{
    private Vector3 color = Vector3.ZERO;
    private float radius;
    private float multiplier = 1f;
    private int lightPriority = 5;
    private boolean ambientOnly;
    private boolean shadow;
    private boolean flare;
    private boolean fadingLight;
    private int dynamicType;
    private boolean affectDynamic;
    private float flareRadius;

    private final List<String> flareTextures = new ArrayList<>();
    private final List<Float> flareSizes = new ArrayList<>();
    private final List<Float> flarePositions = new ArrayList<>();
    private final List<Vector3> flareColorShifts = new ArrayList<>();

    public Vector3 color() { return color; }
    public void setColor(Vector3 color) { this.color = Objects.requireNonNull(color, "color"); }

    public float radius() { return radius; }
    public void setRadius(float radius) { this.radius = radius; }

    public float multiplier() { return multiplier; }
    public void setMultiplier(float multiplier) { this.multiplier = multiplier; }

    public int lightPriority() { return lightPriority; }
    public void setLightPriority(int priority) { this.lightPriority = priority; }

    public boolean ambientOnly() { return ambientOnly; }
    public void setAmbientOnly(boolean ambientOnly) { this.ambientOnly = ambientOnly; }

    public boolean shadow() { return shadow; }
    public void setShadow(boolean shadow) { this.shadow = shadow; }

    public boolean flare() { return flare; }
    public void setFlare(boolean flare) { this.flare = flare; }

    public boolean fadingLight() { return fadingLight; }
    public void setFadingLight(boolean fadingLight) { this.fadingLight = fadingLight; }

    public int dynamicType() { return dynamicType; }
    public void setDynamicType(int dynamicType) { this.dynamicType = dynamicType; }

    public boolean affectDynamic() { return affectDynamic; }
    public void setAffectDynamic(boolean affectDynamic) { this.affectDynamic = affectDynamic; }

    public float flareRadius() { return flareRadius; }
    public void setFlareRadius(float flareRadius) { this.flareRadius = flareRadius; }

    public List<String> flareTextures() { return flareTextures; }
    public List<Float> flareSizes() { return flareSizes; }
    public List<Float> flarePositions() { return flarePositions; }
    public List<Vector3> flareColorShifts() { return flareColorShifts; }

    public boolean hasFlareData() {
        return !flareTextures.isEmpty() || !flareSizes.isEmpty()
            || !flarePositions.isEmpty() || !flareColorShifts.isEmpty();
    }
}
