package org.featuretree.params;

import org.featuretree.model.FeatureNode;
import org.featuretree.model.Parameter;
import org.featuretree.model.ParameterType;
import org.featuretree.model.ParameterValues;
import org.featuretree.script.ScriptParser;
import org.featuretree.script.ScriptSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 节点参数修改的类型与取值检查。
 * <ul>
 *   <li>参数必须已存在于节点上；</li>
 *   <li>数值参数只接受数值，向量/点需保持元素个数；</li>
 *   <li>半径、直径（以及圆角/倒角的第一个位置参数）必须为正；</li>
 *   <li>count/number 类参数必须为正整数；</li>
 *   <li>表达式参数必须是可解析的表达式。</li>
 * </ul>
 */
public class ParameterChangeValidator {

    /**
     * @return 错误列表；为空表示可以应用
     */
    public List<String> validate(FeatureNode node, Map<String, Object> changes) {
        List<String> errors = new ArrayList<>();
        if (changes == null || changes.isEmpty()) {
            errors.add("No parameter changes given for node " + node.name());
            return errors;
        }
        Map<String, Parameter> existing = node.parameterMap();
        for (Map.Entry<String, Object> change : changes.entrySet()) {
            Parameter current = existing.get(change.getKey());
            if (current == null) {
                errors.add("Node " + node.name() + " has no parameter '" + change.getKey() + "'");
                continue;
            }
            check(node, current, ParameterValues.normalize(change.getValue()), errors);
        }
        return errors;
    }

    private void check(FeatureNode node, Parameter current, Object value, List<String> errors) {
        String name = current.name();
        if (value == null) {
            errors.add("Parameter '" + name + "' cannot be set to None");
            return;
        }
        switch (current.type()) {
            case FLOAT, INTEGER, ANGLE, LENGTH -> {
                if (!(value instanceof Number)) {
                    errors.add("Parameter '" + name + "' expects a number but got " + describe(value));
                    return;
                }
            }
            case VECTOR3D, POINT3D -> {
                int arity = current.type() == ParameterType.VECTOR3D ? 3 : 2;
                if (!(value instanceof List<?> list) || list.size() != arity
                        || !list.stream().allMatch(v -> v instanceof Number)) {
                    errors.add("Parameter '" + name + "' expects " + arity + " numbers but got " + describe(value));
                }
                return;
            }
            case BOOLEAN -> {
                if (!(value instanceof Boolean)) {
                    errors.add("Parameter '" + name + "' expects True or False but got " + describe(value));
                }
                return;
            }
            case EXPRESSION -> {
                if (value instanceof String text) {
                    try {
                        ScriptParser.parseExpression(text);
                    } catch (ScriptSyntaxException e) {
                        errors.add("Parameter '" + name + "' is not a valid expression: " + e.getReason());
                    }
                    return;
                }
            }
            case STRING, LIST -> {
                // 任意值
            }
        }

        String lower = name.toLowerCase(Locale.ROOT);
        boolean mustBePositive = lower.contains("radius") || lower.contains("diameter")
                || (node.featureType().isEdgeFinish() && name.equals("arg_0"));
        if (mustBePositive && (!(value instanceof Number number) || number.doubleValue() <= 0)) {
            errors.add("Parameter '" + name + "' must be a positive number but got " + describe(value));
        }
        boolean isCount = lower.contains("count") || lower.contains("number");
        if (isCount && !isPositiveInteger(value)) {
            errors.add("Parameter '" + name + "' must be a positive integer but got " + describe(value));
        }
    }

    private static boolean isPositiveInteger(Object value) {
        if (value instanceof Long l) {
            return l > 0;
        }
        if (value instanceof Double d) {
            return d > 0 && d == Math.rint(d);
        }
        return false;
    }

    private static String describe(Object value) {
        return value instanceof String s ? "'" + s + "'" : String.valueOf(value);
    }
}
