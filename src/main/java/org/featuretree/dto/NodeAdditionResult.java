package org.featuretree.dto;

import org.featuretree.model.FeatureTree;
import org.featuretree.validate.AdditionSuggestion;

import java.util.List;

/**
 * {@code ft_add_node} 的返回结果。被拒绝时不产生新版本，{@code alternatives} 给出可以合法添加的类型。
 *
 * @param accepted     是否已提交
 * @param projectId    项目 ID
 * @param version      提交后的版本号（被拒绝时为当前版本号）
 * @param nodeId       候选节点 ID
 * @param errors       拒绝原因
 * @param warnings     非致命提示
 * @param alternatives 替代建议
 * @param tree         提交后的树（被拒绝时为空）
 */
public record NodeAdditionResult(
        boolean accepted,
        String projectId,
        int version,
        String nodeId,
        List<String> errors,
        List<String> warnings,
        List<AdditionSuggestion> alternatives,
        FeatureTree tree
) {
}
