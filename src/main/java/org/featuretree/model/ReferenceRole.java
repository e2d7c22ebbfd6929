package org.featuretree.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 引用的几何实体粒度：子节点消费了父节点产出的哪一类几何/标识。
 */
public enum ReferenceRole {
    FACE,
    EDGE,
    VERTEX,
    SOLID,
    FEATURE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReferenceRole fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return FEATURE;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
