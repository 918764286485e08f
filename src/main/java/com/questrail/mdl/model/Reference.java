package com.questrail.mdl.model;

import java.util.Objects;

/**
 * Reference payload: attaches another model at this node.
 */
public final class Reference
{
    private String model = "";
    private boolean reattachable;

    public String model() { return model; }
    public void setModel(String model) { this.model = Objects.requireNonNull(model, "model"); }

    public boolean reattachable() { return reattachable; }
    public void setReattachable(boolean reattachable) { this.reattachable = reattachable; }
}
