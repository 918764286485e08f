package com.questrail.mdl.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Dangly-mesh payload: cloth-like secondary motion parameters plus one
 * constraint weight (0-255) per mesh vertex.
 */
public final class Dangly
{
    private float period;
    private float tightness;
    private float displacement;
    private final List<Float> constraints = new ArrayList<>();

    public float period() { return period; }
    public void setPeriod(float period) { this.period = period; }

    public float tightness() { return tightness; }
    public void setTightness(float tightness) { this.tightness = tightness; }

    public float displacement() { return displacement; }
    public void setDisplacement(float displacement) { this.displacement = displacement; }

    public List<Float> constraints() {
        return constraints;
    }
}
