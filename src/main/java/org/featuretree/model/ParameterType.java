package org.featuretree.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * 参数值类型。
 */
public enum ParameterType {
    FLOAT("float"),
    INTEGER("integer"),
    STRING("string"),
    BOOLEAN("boolean"),
    VECTOR3D("vector3d"),
    POINT3D("point3d"),
    ANGLE("angle"),
    LENGTH("length"),
    LIST("list"),
    /** 无法静态求值的脚本表达式，值为源码文本（例如 {@code cq.Vector(0, 0, 1)}），生成代码时原样输出。 */
    EXPRESSION("expression");

    private final String value;

    ParameterType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ParameterType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("参数类型不能为空");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ParameterType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的参数类型：" + raw);
    }

    public boolean isNumeric() {
        return this == FLOAT || this == INTEGER || this == ANGLE || this == LENGTH;
    }

    /**
     * 按值的形状推断类型：bool / int / float / str / 2、3 元数值向量 / 其他列表。
     */
    public static ParameterType infer(Object value) {
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return INTEGER;
        }
        if (value instanceof Number) {
            return FLOAT;
        }
        if (value instanceof List<?> list) {
            boolean flatNumeric = list.stream().allMatch(v -> v instanceof Number);
            if (flatNumeric && list.size() == 3) {
                return VECTOR3D;
            }
            if (flatNumeric && list.size() == 2) {
                return POINT3D;
            }
            return LIST;
        }
        return STRING;
    }

    @Override
    public String toString() {
        return value;
    }
}
