package org.featuretree.dto;

import org.featuretree.model.FeatureTree;

import java.util.List;

/**
 * 返回一个特征树版本的工具结果（导入、查询与各类编辑共用）。
 *
 * @param projectId             项目 ID
 * @param version               版本号
 * @param nodeCount             节点数
 * @param dirty                 树与源脚本是否已不一致
 * @param needsFullRegeneration 是否需要完整重新生成（结构性修改后为 true）
 * @param tree                  完整的树
 * @param warnings              非致命提示
 */
public record FeatureTreeResult(
        String projectId,
        int version,
        int nodeCount,
        boolean dirty,
        boolean needsFullRegeneration,
        FeatureTree tree,
        List<String> warnings
) {

    public static FeatureTreeResult of(FeatureTree tree, List<String> warnings) {
        return new FeatureTreeResult(tree.getProjectId(), tree.getVersion(), tree.getNodes().size(),
                tree.isDirty(), tree.isNeedsFullRegeneration(), tree, warnings == null ? List.of() : warnings);
    }
}
