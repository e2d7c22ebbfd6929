package org.featuretree.dto;

import java.util.List;
import java.util.Map;

/**
 * {@code ft_generate_code} / {@code ft_regenerate} 的返回结果。
 *
 * @param projectId      项目 ID
 * @param version        生成所依据的版本（regenerate 时为新提交的版本）
 * @param code           CadQuery 脚本
 * @param resultVariable 结果变量名
 * @param variables      节点 ID 到脚本变量名的映射
 * @param warnings       生成时发现的问题（同时以注释写在脚本中）
 */
public record GeneratedCodeResult(
        String projectId,
        int version,
        String code,
        String resultVariable,
        Map<String, String> variables,
        List<String> warnings
) {
}
