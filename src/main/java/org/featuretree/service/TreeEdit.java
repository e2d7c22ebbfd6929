package org.featuretree.service;

import org.featuretree.model.FeatureTree;

import java.util.List;

/**
 * 一次已提交编辑的结果。
 *
 * @param tree     新提交的版本
 * @param warnings 非致命提示（例如被绕过的圆角、级联删除的节点）
 */
public record TreeEdit(FeatureTree tree, List<String> warnings) {

    public TreeEdit {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
