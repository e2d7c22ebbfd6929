package org.featuretree.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 已解析的脚本变量表（不可变值对象）：变量名 -> 字面量值。
 * <p>
 * 由 {@link VariableResolver} 产生，并作为参数显式传递给解析过程，不存在共享/静态状态。
 */
public final class ResolvedVariables {

    private static final ResolvedVariables EMPTY = new ResolvedVariables(Map.of(), Set.of());

    private final Map<String, Object> values;
    private final Set<String> defaulted;

    private ResolvedVariables(Map<String, Object> values, Set<String> defaulted) {
        this.values = values;
        this.defaulted = defaulted;
    }

    public static ResolvedVariables empty() {
        return EMPTY;
    }

    public Optional<Object> lookup(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /** 该变量是否因无法求值而使用了默认值。 */
    public boolean isDefaulted(String name) {
        return defaulted.contains(name);
    }

    public ResolvedVariables with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        Set<String> defaults = new LinkedHashSet<>(defaulted);
        defaults.remove(name);
        return new ResolvedVariables(Collections.unmodifiableMap(copy), Collections.unmodifiableSet(defaults));
    }

    ResolvedVariables withDefault(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        Set<String> defaults = new LinkedHashSet<>(defaulted);
        defaults.add(name);
        return new ResolvedVariables(Collections.unmodifiableMap(copy), Collections.unmodifiableSet(defaults));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "ResolvedVariables" + values;
    }
}
