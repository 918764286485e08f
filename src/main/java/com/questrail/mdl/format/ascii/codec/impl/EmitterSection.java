package com.questrail.mdl.format.ascii.codec.impl;

import com.questrail.mdl.model.ControllerType;
import com.questrail.mdl.model.Emitter;
import com.questrail.mdl.model.EmitterFlag;
import com.questrail.mdl.model.Node;
import com.questrail.mdl.model.PayloadKind;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * EmitterSection
 * -----------------------------------------------------------------------------
 * Plain emitter properties and the flag register.
 *
 * <p>Each flag is its own line, {@code bounce 1}; a bare keyword sets the
 * flag. Emitter controller values ({@code birthrate 10}) are bound through
 * {@link StaticPropertyBindings} before a line reaches this section, and are
 * written back here from the emitter's parameter table.</p>
 */
final class EmitterSection implements PayloadSection
{
    private static final Map<String, EmitterFlag> FLAGS = Stream.of(EmitterFlag.values())
        .collect(Collectors.toUnmodifiableMap(f -> f.keyword().toLowerCase(Locale.ROOT), Function.identity()));

    @Override
    public PayloadKind kind() {
        return PayloadKind.EMITTER;
    }

    @Override
    public boolean read(AsciiLine line, LineCursor cursor, Node node) {
        final Emitter emitter = node.emitter().orElseThrow();
        final String keyword = line.keyword();

        EmitterFlag flag = FLAGS.get(keyword);
        if (flag != null) {
            emitter.setFlag(flag, line.flagAt(1) != 0);
            return true;
        }

        switch (keyword) {
            case "deadspace" -> emitter.setDeadSpace(line.floatAt(1));
            case "blastradius" -> emitter.setBlastRadius(line.floatAt(1));
            case "blastlength" -> emitter.setBlastLength(line.floatAt(1));
            case "numbranches" -> emitter.setBranchCount(line.intAt(1));
            case "controlptsmoothing" -> emitter.setControlPointSmoothing(line.floatAt(1));
            case "xgrid" -> emitter.setXGrid(line.intAt(1));
            case "ygrid" -> emitter.setYGrid(line.intAt(1));
            case "spawntype" -> emitter.setSpawnType(line.intAt(1));
            case "update" -> emitter.setUpdate(line.tokenOr(1, ""));
            case "render" -> emitter.setRender(line.tokenOr(1, ""));
            case "blend" -> emitter.setBlend(line.tokenOr(1, ""));
            case "texture" -> emitter.setTexture(line.tokenOr(1, ""));
            case "chunkname" -> emitter.setChunkName(line.tokenOr(1, ""));
            case "twosidedtex" -> emitter.setTwoSidedTexture(line.intAt(1));
            case "loop" -> emitter.setLoop(line.intAt(1));
            case "renderorder" -> emitter.setRenderOrder(line.intAt(1));
            case "m_bframeblending" -> emitter.setFrameBlending(line.intAt(1));
            case "m_sdepthtexturename" -> emitter.setDepthTextureName(line.tokenOr(1, ""));
            default -> {
                return false;
            }
        }
        return true;
    }

    @Override
    public void write(Node node, AsciiLineWriter out) throws IOException {
        final Emitter e = node.emitter().orElseThrow();
        out.floats("deadspace", e.deadSpace());
        out.floats("blastRadius", e.blastRadius());
        out.floats("blastLength", e.blastLength());
        out.integer("numBranches", e.branchCount());
        out.floats("controlptsmoothing", e.controlPointSmoothing());
        out.integer("xgrid", e.xGrid());
        out.integer("ygrid", e.yGrid());
        out.integer("spawntype", e.spawnType());
        writeName("update", e.update(), out);
        writeName("render", e.render(), out);
        writeName("blend", e.blend(), out);
        writeName("texture", e.texture(), out);
        writeName("chunkName", e.chunkName(), out);
        out.integer("twosidedtex", e.twoSidedTexture());
        out.integer("loop", e.loop());
        out.integer("renderorder", e.renderOrder());
        out.integer("m_bFrameBlending", e.frameBlending());
        writeName("m_sDepthTextureName", e.depthTextureName(), out);

        for (EmitterFlag flag : EmitterFlag.values()) {
            out.flag(flag.keyword(), e.hasFlag(flag));
        }
        for (ControllerType type : e.parameterTypes()) {
            out.floats(type.asciiName(), e.parameter(type));
        }
    }

    private static void writeName(String keyword, String value, AsciiLineWriter out) throws IOException {
        if (!value.isEmpty()) {
            out.line(keyword, value);
        }
    }
}
