package org.featuretree.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 一次逻辑编辑的记录，保存在它所产生的版本上（{@link FeatureTree#getLastOperation()}），
 * 因此版本列表本身就是操作历史。
 *
 * @param type             编辑类型
 * @param nodeId           涉及的节点（可选）
 * @param parentId         新增节点时指定的父节点（可选）
 * @param parameterChanges 参数修改（可选）
 * @param newOrder         重排后的顺序（可选）
 * @param summary          简要说明
 * @param at               发生时间
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FeatureTreeOperation(
        OperationType type,
        String nodeId,
        String parentId,
        Map<String, Object> parameterChanges,
        List<String> newOrder,
        String summary,
        Instant at
) {

    public static FeatureTreeOperation of(OperationType type, String nodeId, String summary) {
        return new FeatureTreeOperation(type, nodeId, null, null, null, summary, Instant.now());
    }
}
