package org.featuretree.validate;

import org.featuretree.model.FeatureType;

/**
 * 可合法添加的特征类型及一句话理由。
 */
public record AdditionSuggestion(FeatureType type, String reason) {
}
