package com.questrail.mdl.model;

import static com.questrail.mdl.model.ControllerNamespace.EMITTER;
import static com.questrail.mdl.model.ControllerNamespace.HEADER;
import static com.questrail.mdl.model.ControllerNamespace.LIGHT;
import static com.questrail.mdl.model.ControllerNamespace.MESH;

/**
 * ControllerType
 * -----------------------------------------------------------------------------
 * Semantic controller tag. Each constant is globally distinct even where its
 * legacy numeric id collides with a constant of another namespace
 * ({@link #LIGHT_RADIUS} and {@link #BIRTHRATE} are both id 88).
 *
 * <p>{@link #asciiName()} is the keyword stem the textual format uses inside
 * the constant's own namespace; {@link #columns()} is the number of values a
 * single keyframe row carries (excluding time and Bezier tangents).</p>
 */
public enum ControllerType
{
    // ---- header --------------------------------------------------------------
    POSITION(HEADER, 8, "position", 3),
    ORIENTATION(HEADER, 20, "orientation", 4),
    SCALE(HEADER, 36, "scale", 1),
    ALPHA(HEADER, 132, "alpha", 1),

    // ---- light ---------------------------------------------------------------
    LIGHT_COLOR(LIGHT, 76, "color", 3),
    LIGHT_RADIUS(LIGHT, 88, "radius", 1),
    LIGHT_SHADOW_RADIUS(LIGHT, 96, "shadowradius", 1),
    LIGHT_VERTICAL_DISPLACEMENT(LIGHT, 100, "verticaldisplacement", 1),
    LIGHT_MULTIPLIER(LIGHT, 140, "multiplier", 1),

    // ---- emitter -------------------------------------------------------------
    ALPHA_END(EMITTER, 80, "alphaEnd", 1),
    ALPHA_START(EMITTER, 84, "alphaStart", 1),
    BIRTHRATE(EMITTER, 88, "birthrate", 1),
    BOUNCE_CO(EMITTER, 92, "bounce_co", 1),
    COMBINE_TIME(EMITTER, 96, "combinetime", 1),
    DRAG(EMITTER, 100, "drag", 1),
    FPS(EMITTER, 104, "fps", 1),
    FRAME_END(EMITTER, 108, "frameEnd", 1),
    FRAME_START(EMITTER, 112, "frameStart", 1),
    GRAV(EMITTER, 116, "grav", 1),
    LIFE_EXP(EMITTER, 120, "lifeExp", 1),
    MASS(EMITTER, 124, "mass", 1),
    P2P_BEZIER2(EMITTER, 128, "p2p_bezier2", 1),
    P2P_BEZIER3(EMITTER, 132, "p2p_bezier3", 1),
    PARTICLE_ROT(EMITTER, 136, "particleRot", 1),
    RAND_VEL(EMITTER, 140, "randvel", 1),
    SIZE_START(EMITTER, 144, "sizeStart", 1),
    SIZE_END(EMITTER, 148, "sizeEnd", 1),
    SIZE_START_Y(EMITTER, 152, "sizeStart_y", 1),
    SIZE_END_Y(EMITTER, 156, "sizeEnd_y", 1),
    SPREAD(EMITTER, 160, "spread", 1),
    THRESHOLD(EMITTER, 164, "threshold", 1),
    VELOCITY(EMITTER, 168, "velocity", 1),
    X_SIZE(EMITTER, 172, "xsize", 1),
    Y_SIZE(EMITTER, 176, "ysize", 1),
    BLUR_LENGTH(EMITTER, 180, "blurlength", 1),
    LIGHTNING_DELAY(EMITTER, 184, "lightningDelay", 1),
    LIGHTNING_RADIUS(EMITTER, 188, "lightningRadius", 1),
    LIGHTNING_SCALE(EMITTER, 192, "lightningScale", 1),
    LIGHTNING_SUB_DIV(EMITTER, 196, "lightningSubDiv", 1),
    LIGHTNING_ZIGZAG(EMITTER, 200, "lightningzigzag", 1),
    ALPHA_MID(EMITTER, 216, "alphaMid", 1),
    PERCENT_START(EMITTER, 220, "percentStart", 1),
    PERCENT_MID(EMITTER, 224, "percentMid", 1),
    PERCENT_END(EMITTER, 228, "percentEnd", 1),
    SIZE_MID(EMITTER, 232, "sizeMid", 1),
    SIZE_MID_Y(EMITTER, 236, "sizeMid_y", 1),
    RANDOM_BIRTH_RATE(EMITTER, 240, "m_fRandomBirthRate", 1),
    TARGET_SIZE(EMITTER, 252, "targetsize", 1),
    NUM_CONTROL_PTS(EMITTER, 256, "numcontrolpts", 1),
    CONTROL_PT_RADIUS(EMITTER, 260, "controlptradius", 1),
    CONTROL_PT_DELAY(EMITTER, 264, "controlptdelay", 1),
    TANGENT_SPREAD(EMITTER, 268, "tangentspread", 1),
    TANGENT_LENGTH(EMITTER, 272, "tangentlength", 1),
    COLOR_MID(EMITTER, 284, "colorMid", 3),
    COLOR_END(EMITTER, 380, "colorEnd", 3),
    COLOR_START(EMITTER, 392, "colorStart", 3),
    DETONATE(EMITTER, 502, "detonate", 1),

    // ---- mesh ----------------------------------------------------------------
    SELF_ILLUM_COLOR(MESH, 100, "selfillumcolor", 3);

    private final ControllerNamespace namespace;
    private final int legacyId;
    private final String asciiName;
    private final int columns;

    ControllerType(ControllerNamespace namespace, int legacyId, String asciiName, int columns) {
        this.namespace = namespace;
        this.legacyId = legacyId;
        this.asciiName = asciiName;
        this.columns = columns;
    }

    public ControllerNamespace namespace() {
        return namespace;
    }

    public int legacyId() {
        return legacyId;
    }

    public String asciiName() {
        return asciiName;
    }

    public int columns() {
        return columns;
    }
}
