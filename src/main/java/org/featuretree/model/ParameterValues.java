package org.featuretree.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 参数值的规范化：整数统一为 {@link Long}，浮点统一为 {@link Double}，列表递归规范化并只读。
 * <p>
 * JSON 反序列化会得到 {@link Integer}/{@link BigDecimal} 等类型，这里统一口径，便于比较与生成代码。
 */
public final class ParameterValues {

    private ParameterValues() {
    }

    public static Object normalize(Object value) {
        if (value == null || value instanceof Long || value instanceof Double
                || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.longValue();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(normalize(item));
            }
            return Collections.unmodifiableList(out);
        }
        if (value instanceof Object[] array) {
            return normalize(Arrays.asList(array));
        }
        return value.toString();
    }

    /** 数值相等（int 5 与 float 5.0 视为相等），非数值按 equals 比较。 */
    public static boolean sameValue(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        return a == null ? b == null : a.equals(b);
    }
}
