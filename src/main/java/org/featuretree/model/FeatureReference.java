package org.featuretree.model;

import java.util.Objects;

/**
 * 对其他特征的引用：本节点消费了 {@code targetNodeId} 产出的几何/标识。
 */
public record FeatureReference(String targetNodeId, ReferenceRole role) {

    public FeatureReference {
        Objects.requireNonNull(targetNodeId, "targetNodeId");
        if (role == null) {
            role = ReferenceRole.FEATURE;
        }
    }

    public static FeatureReference feature(String targetNodeId) {
        return new FeatureReference(targetNodeId, ReferenceRole.FEATURE);
    }

    public static FeatureReference solid(String targetNodeId) {
        return new FeatureReference(targetNodeId, ReferenceRole.SOLID);
    }
}
