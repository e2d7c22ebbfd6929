package org.featuretree.dto;

import org.featuretree.validate.AdditionSuggestion;

import java.util.List;

/**
 * {@code ft_suggest_nodes} 的返回结果。
 */
public record SuggestionResult(String projectId, String parentId, List<AdditionSuggestion> suggestions) {
}
