package org.featuretree.dto;

import org.featuretree.model.Parameter;

import java.util.List;

/**
 * {@code ft_patch_parameter} 的返回结果。
 *
 * @param projectId  项目 ID（直接修改脚本文本时为空）
 * @param version    新版本号（直接修改脚本文本时为空）
 * @param sourceName 被修改的变量名
 * @param script     修改后的脚本
 * @param parameters 修改后重新提取的设计参数
 */
public record ParameterPatchResult(
        String projectId,
        Integer version,
        String sourceName,
        String script,
        List<Parameter> parameters
) {
}
