package org.featuretree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * 特征参数（不可变）。
 *
 * @param name               参数名：位置参数为 {@code arg_0...}，关键字参数为关键字本身；设计参数为可读名称
 * @param value              参数值：{@link Long}/{@link Double}/{@link String}/{@link Boolean}/{@link List}
 * @param type               参数类型
 * @param description        说明（可选）
 * @param units              单位（可选，例如 mm/degrees）
 * @param minValue           建议最小值（可选）
 * @param maxValue           建议最大值（可选）
 * @param originalSourceName 该参数来源于脚本中的哪个标识符（用于原位修改；可选）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Parameter(
        String name,
        Object value,
        ParameterType type,
        String description,
        String units,
        Double minValue,
        Double maxValue,
        String originalSourceName
) {

    public Parameter {
        Objects.requireNonNull(name, "name");
        value = ParameterValues.normalize(value);
        if (type == null) {
            type = ParameterType.infer(value);
        }
    }

    public static Parameter of(String name, Object value) {
        return new Parameter(name, value, ParameterType.infer(value), null, null, null, null, null);
    }

    public static Parameter fromSource(String name, Object value, String originalSourceName) {
        return new Parameter(name, value, ParameterType.infer(value), null, null, null, null, originalSourceName);
    }

    /** 无法静态求值的实参，保留源码文本。 */
    public static Parameter expression(String name, String sourceText) {
        return new Parameter(name, sourceText, ParameterType.EXPRESSION, null, null, null, null, null);
    }

    public Parameter withValue(Object newValue) {
        if (type == ParameterType.EXPRESSION && newValue instanceof String) {
            return new Parameter(name, newValue, type, description, units, minValue, maxValue, originalSourceName);
        }
        ParameterType inferred = ParameterType.infer(ParameterValues.normalize(newValue));
        // ANGLE/LENGTH 是语义类型：新值仍为数值时保留，其余情况按新值重新推断
        boolean keepSemantic = inferred.isNumeric() && (type == ParameterType.ANGLE || type == ParameterType.LENGTH);
        ParameterType newType = keepSemantic ? type : inferred;
        return new Parameter(name, newValue, newType, description, units, minValue, maxValue, originalSourceName);
    }

    @JsonIgnore
    public boolean isNumeric() {
        return value instanceof Number;
    }

    public double numericValue() {
        if (!(value instanceof Number number)) {
            throw new IllegalStateException("参数 " + name + " 不是数值：" + value);
        }
        return number.doubleValue();
    }
}
