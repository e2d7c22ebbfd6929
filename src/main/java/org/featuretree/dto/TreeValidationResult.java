package org.featuretree.dto;

import java.util.List;

/**
 * {@code ft_validate_tree} 的返回结果。
 *
 * @param projectId 项目 ID
 * @param version   被校验的版本
 * @param valid     是否满足全部不变式
 * @param errors    违例说明
 */
public record TreeValidationResult(String projectId, int version, boolean valid, List<String> errors) {
}
