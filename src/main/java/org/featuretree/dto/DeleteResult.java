package org.featuretree.dto;

/**
 * {@code ft_delete_tree} 的返回结果。
 *
 * @param projectId 项目 ID
 * @param version   删除的版本（为空表示全部版本）
 * @param deleted   是否删除了任何内容
 */
public record DeleteResult(String projectId, Integer version, boolean deleted) {
}
