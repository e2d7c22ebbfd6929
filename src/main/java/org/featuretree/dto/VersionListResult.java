package org.featuretree.dto;

import org.featuretree.store.FeatureTreeVersion;

import java.util.List;

/**
 * {@code ft_list_versions} 的返回结果（按版本号升序）。
 */
public record VersionListResult(String projectId, List<FeatureTreeVersion> versions) {
}
