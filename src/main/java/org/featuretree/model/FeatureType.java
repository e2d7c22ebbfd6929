package org.featuretree.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * CAD 特征（操作）类型，封闭枚举。
 * <p>
 * 每个常量带有：
 * <ul>
 *   <li>{@link #value()}：序列化/对外展示用的小写值（例如 {@code pattern_linear}）。</li>
 *   <li>{@link #role()}：角色分组，用于校验表与代码生成的分组判断。</li>
 * </ul>
 */
public enum FeatureType {

    WORKPLANE("workplane", FeatureRole.CONSTRUCTION),
    SKETCH("sketch", FeatureRole.CONSTRUCTION),

    EXTRUDE("extrude", FeatureRole.VOLUME),
    REVOLVE("revolve", FeatureRole.VOLUME),
    LOFT("loft", FeatureRole.VOLUME),
    SWEEP("sweep", FeatureRole.VOLUME),
    BOX("box", FeatureRole.VOLUME),
    CYLINDER("cylinder", FeatureRole.VOLUME),
    SPHERE("sphere", FeatureRole.VOLUME),
    CONE("cone", FeatureRole.VOLUME),
    TORUS("torus", FeatureRole.VOLUME),

    UNION("union", FeatureRole.BOOLEAN),
    DIFFERENCE("difference", FeatureRole.BOOLEAN),
    INTERSECTION("intersection", FeatureRole.BOOLEAN),

    FILLET("fillet", FeatureRole.SURFACE),
    CHAMFER("chamfer", FeatureRole.SURFACE),
    MIRROR("mirror", FeatureRole.SURFACE),
    PATTERN_LINEAR("pattern_linear", FeatureRole.SURFACE),
    PATTERN_CIRCULAR("pattern_circular", FeatureRole.SURFACE),

    ASSEMBLY_ROOT("assembly_root", FeatureRole.ASSEMBLY),
    COMPONENT("component", FeatureRole.ASSEMBLY),
    CONSTRAINT("constraint", FeatureRole.ASSEMBLY),

    DATUM_PLANE("datum_plane", FeatureRole.DATUM),
    DATUM_AXIS("datum_axis", FeatureRole.DATUM),
    DATUM_POINT("datum_point", FeatureRole.DATUM);

    private final String value;
    private final FeatureRole role;

    FeatureType(String value, FeatureRole role) {
        this.value = value;
        this.role = role;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public FeatureRole role() {
        return role;
    }

    /**
     * 接受小写值（{@code pattern_linear}）或常量名（{@code PATTERN_LINEAR}），大小写不敏感。
     */
    @JsonCreator
    public static FeatureType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("特征类型不能为空");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (FeatureType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的特征类型：" + raw);
    }

    public boolean isConstruction() {
        return role == FeatureRole.CONSTRUCTION;
    }

    public boolean isVolumeProducing() {
        return role == FeatureRole.VOLUME;
    }

    public boolean isBoolean() {
        return role == FeatureRole.BOOLEAN;
    }

    /** 圆角/倒角：只修饰边，不改变布尔运算应使用的“原始实体”。 */
    public boolean isEdgeFinish() {
        return this == FILLET || this == CHAMFER;
    }

    public boolean isPrimitive() {
        return this == BOX || this == CYLINDER || this == SPHERE || this == CONE || this == TORUS;
    }

    /**
     * 结果是否为实体（可以作为布尔运算的操作数、可以被圆角/倒角）。
     */
    public boolean producesSolid() {
        return role == FeatureRole.VOLUME || role == FeatureRole.BOOLEAN || role == FeatureRole.SURFACE;
    }

    @Override
    public String toString() {
        return value;
    }
}
