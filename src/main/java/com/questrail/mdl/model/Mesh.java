package com.questrail.mdl.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mesh
 * -----------------------------------------------------------------------------
 * Triangle mesh payload.
 *
 * <p>Optional per-vertex channels ({@link #normals()}, {@link #uv1()},
 * {@link #uv2()}, {@link #colors()}) are absent when empty; when present they
 * are expected to be as long as {@link #positions()}, although nothing here
 * enforces it.</p>
 *
 * <p>The bounding box, radius, average point and surface area are carried for
 * the binary side only. The textual form does not contain them.</p>
 */
public final class Mesh
{
    private Vector3 boundingMin = Vector3.ZERO;
    private Vector3 boundingMax = Vector3.ZERO;
    private Vector3 averagePoint = Vector3.ZERO;
    private float radius;
    private float surfaceArea;

    private Vector3 ambient = Vector3.ZERO;
    private Vector3 diffuse = Vector3.ZERO;
    private Vector3 selfIllumColor = Vector3.ZERO;
    private String texture1 = "";
    private String texture2 = "";
    private int transparencyHint;
    private float alpha = 1f;

    private boolean render = true;
    private boolean shadow = true;
    private boolean beaming;
    private boolean backgroundGeometry;
    private boolean rotateTexture;
    private boolean hasLightmap;
    private boolean tangentSpace;

    private boolean animateUv;
    private float uvDirectionX;
    private float uvDirectionY;
    private float uvJitter;
    private float uvJitterSpeed;

    private boolean dirtEnabled;
    private int dirtTexture = 1;
    private int dirtWorldSpace = 1;
    private boolean hologramDoNotDraw;

    private final List<Vector3> positions = new ArrayList<>();
    private final List<Vector3> normals = new ArrayList<>();
    private final List<Vector2> uv1 = new ArrayList<>();
    private final List<Vector2> uv2 = new ArrayList<>();
    private final List<Vector3> colors = new ArrayList<>();
    private final List<Face> faces = new ArrayList<>();
    private final List<IndexTriple> textureIndices1 = new ArrayList<>();
    private final List<RoomLink> roomLinks = new ArrayList<>();

    public Vector3 boundingMin() { return boundingMin; }
    public void setBoundingMin(Vector3 v) { this.boundingMin = Objects.requireNonNull(v, "boundingMin"); }

    public Vector3 boundingMax() { return boundingMax; }
    public void setBoundingMax(Vector3 v) { this.boundingMax = Objects.requireNonNull(v, "boundingMax"); }

    public Vector3 averagePoint() { return averagePoint; }
    public void setAveragePoint(Vector3 v) { this.averagePoint = Objects.requireNonNull(v, "averagePoint"); }

    public float radius() { return radius; }
    public void setRadius(float radius) { this.radius = radius; }

    public float surfaceArea() { return surfaceArea; }
    public void setSurfaceArea(float surfaceArea) { this.surfaceArea = surfaceArea; }

    public Vector3 ambient() { return ambient; }
    public void setAmbient(Vector3 v) { this.ambient = Objects.requireNonNull(v, "ambient"); }

    public Vector3 diffuse() { return diffuse; }
    public void setDiffuse(Vector3 v) { this.diffuse = Objects.requireNonNull(v, "diffuse"); }

    public Vector3 selfIllumColor() { return selfIllumColor; }
    public void setSelfIllumColor(Vector3 v) { this.selfIllumColor = Objects.requireNonNull(v, "selfIllumColor"); }

    public String texture1() { return texture1; }
    public void setTexture1(String name) { this.texture1 = Objects.requireNonNull(name, "texture1"); }

    public String texture2() { return texture2; }
    public void setTexture2(String name) { this.texture2 = Objects.requireNonNull(name, "texture2"); }

    public int transparencyHint() { return transparencyHint; }
    public void setTransparencyHint(int hint) { this.transparencyHint = hint; }

    public float alpha() { return alpha; }
    public void setAlpha(float alpha) { this.alpha = alpha; }

    public boolean render() { return render; }
    public void setRender(boolean render) { this.render = render; }

    public boolean shadow() { return shadow; }
    public void setShadow(boolean shadow) { this.shadow = shadow; }

    public boolean beaming() { return beaming; }
    public void setBeaming(boolean beaming) { this.beaming = beaming; }

    public boolean backgroundGeometry() { return backgroundGeometry; }
    public void setBackgroundGeometry(boolean background) { this.backgroundGeometry = background; }

    public boolean rotateTexture() { return rotateTexture; }
    public void setRotateTexture(boolean rotate) { this.rotateTexture = rotate; }

    public boolean hasLightmap() { return hasLightmap; }
    public void setHasLightmap(boolean hasLightmap) { this.hasLightmap = hasLightmap; }

    public boolean tangentSpace() { return tangentSpace; }
    public void setTangentSpace(boolean tangentSpace) { this.tangentSpace = tangentSpace; }

    public boolean animateUv() { return animateUv; }
    public void setAnimateUv(boolean animateUv) { this.animateUv = animateUv; }

    public float uvDirectionX() { return uvDirectionX; }
    public void setUvDirectionX(float v) { this.uvDirectionX = v; }

    public float uvDirectionY() { return uvDirectionY; }
    public void setUvDirectionY(float v) { this.uvDirectionY = v; }

    public float uvJitter() { return uvJitter; }
    public void setUvJitter(float v) { this.uvJitter = v; }

    public float uvJitterSpeed() { return uvJitterSpeed; }
    public void setUvJitterSpeed(float v) { this.uvJitterSpeed = v; }

    public boolean dirtEnabled() { return dirtEnabled; }
    public void setDirtEnabled(boolean enabled) { this.dirtEnabled = enabled; }

    public int dirtTexture() { return dirtTexture; }
    public void setDirtTexture(int texture) { this.dirtTexture = texture; }

    public int dirtWorldSpace() { return dirtWorldSpace; }
    public void setDirtWorldSpace(int worldSpace) { this.dirtWorldSpace = worldSpace; }

    public boolean hologramDoNotDraw() { return hologramDoNotDraw; }
    public void setHologramDoNotDraw(boolean v) { this.hologramDoNotDraw = v; }

    public List<Vector3> positions() { return positions; }
    public List<Vector3> normals() { return normals; }
    public List<Vector2> uv1() { return uv1; }
    public List<Vector2> uv2() { return uv2; }
    public List<Vector3> colors() { return colors; }
    public List<Face> faces() { return faces; }
    public List<IndexTriple> textureIndices1() { return textureIndices1; }
    public List<RoomLink> roomLinks() { return roomLinks; }
}
