package com.questrail.mdl.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Emitter
 * -----------------------------------------------------------------------------
 * Particle-system payload.
 *
 * <p>Plain properties (spawn type, blend mode, texture, ...) are ordinary
 * fields. The values that double as animatable controllers (birthrate,
 * lifeExp, colorStart, ...) are kept in a table keyed by their
 * {@link ControllerType}; only types of the
 * {@link ControllerNamespace#EMITTER} namespace are accepted, and a type
 * never set reads as all zeros of its {@link ControllerType#columns()}
 * width.</p>
 */
public final class Emitter
{
    private float deadSpace;
    private float blastRadius;
    private float blastLength;
    private int branchCount;
    private float controlPointSmoothing;
    private int xGrid;
    private int yGrid;
    private int spawnType;
    private String update = "";
    private String render = "";
    private String blend = "";
    private String texture = "";
    private String chunkName = "";
    private int twoSidedTexture;
    private int loop;
    private int renderOrder;
    private int frameBlending;
    private String depthTextureName = "";
    private int flags;

    private final Map<ControllerType, float[]> parameters = new EnumMap<>(ControllerType.class);

    public float deadSpace() { return deadSpace; }
    public void setDeadSpace(float v) { this.deadSpace = v; }

    public float blastRadius() { return blastRadius; }
    public void setBlastRadius(float v) { this.blastRadius = v; }

    public float blastLength() { return blastLength; }
    public void setBlastLength(float v) { this.blastLength = v; }

    public int branchCount() { return branchCount; }
    public void setBranchCount(int v) { this.branchCount = v; }

    public float controlPointSmoothing() { return controlPointSmoothing; }
    public void setControlPointSmoothing(float v) { this.controlPointSmoothing = v; }

    public int xGrid() { return xGrid; }
    public void setXGrid(int v) { this.xGrid = v; }

    public int yGrid() { return yGrid; }
    public void setYGrid(int v) { this.yGrid = v; }

    public int spawnType() { return spawnType; }
    public void setSpawnType(int v) { this.spawnType = v; }

    public String update() { return update; }
    public void setUpdate(String v) { this.update = Objects.requireNonNull(v, "update"); }

    public String render() { return render; }
    public void setRender(String v) { this.render = Objects.requireNonNull(v, "render"); }

    public String blend() { return blend; }
    public void setBlend(String v) { this.blend = Objects.requireNonNull(v, "blend"); }

    public String texture() { return texture; }
    public void setTexture(String v) { this.texture = Objects.requireNonNull(v, "texture"); }

    public String chunkName() { return chunkName; }
    public void setChunkName(String v) { this.chunkName = Objects.requireNonNull(v, "chunkName"); }

    public int twoSidedTexture() { return twoSidedTexture; }
    public void setTwoSidedTexture(int v) { this.twoSidedTexture = v; }

    public int loop() { return loop; }
    public void setLoop(int v) { this.loop = v; }

    public int renderOrder() { return renderOrder; }
    public void setRenderOrder(int v) { this.renderOrder = v; }

    public int frameBlending() { return frameBlending; }
    public void setFrameBlending(int v) { this.frameBlending = v; }

    public String depthTextureName() { return depthTextureName; }
    public void setDepthTextureName(String v) { this.depthTextureName = Objects.requireNonNull(v, "depthTextureName"); }

    public int flags() { return flags; }
    public void setFlags(int flags) { this.flags = flags; }

    public boolean hasFlag(EmitterFlag flag) {
        return (flags & flag.bit()) != 0;
    }

    public void setFlag(EmitterFlag flag, boolean on) {
        flags = on ? (flags | flag.bit()) : (flags & ~flag.bit());
    }

    /**
     * Static value of an emitter controller type.
     */
    public float[] parameter(ControllerType type) {
        requireEmitterType(type);
        float[] v = parameters.get(type);
        return v != null ? v.clone() : new float[type.columns()];
    }

    public void setParameter(ControllerType type, float... values) {
        requireEmitterType(type);
        parameters.put(type, values.clone());
    }

    /** Types with an explicitly set value, in declaration order. */
    public Set<ControllerType> parameterTypes() {
        return Collections.unmodifiableSet(parameters.keySet());
    }

    private static void requireEmitterType(ControllerType type) {
        Objects.requireNonNull(type, "type");
        if (type.namespace() != ControllerNamespace.EMITTER) {
            throw new IllegalArgumentException(type + " is not an emitter controller");
        }
    }
}
