package org.featuretree.dto;

import org.featuretree.model.Parameter;

import java.util.List;

/**
 * {@code ft_extract_parameters} 的返回结果：脚本顶部的设计参数，按出现顺序。
 */
public record ParameterListResult(List<Parameter> parameters) {
}
