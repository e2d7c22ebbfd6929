package org.featuretree.service;

import org.featuretree.generate.GeneratedScript;
import org.featuretree.model.FeatureTree;

/**
 * 重新生成的结果：记录了新脚本的版本，以及生成详情（变量映射、告警）。
 */
public record Regeneration(FeatureTree tree, GeneratedScript script) {
}
