package org.featuretree.generate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 代码生成结果。
 *
 * @param code           完整脚本
 * @param resultVariable 最终赋给结果变量的标识符
 * @param variables      节点 id -> 脚本中的标识符
 * @param warnings       生成过程中遇到的问题（同时以 {@code # WARNING:} 注释写入脚本）
 */
public record GeneratedScript(String code, String resultVariable, Map<String, String> variables,
                              List<String> warnings) {

    public GeneratedScript {
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        warnings = List.copyOf(warnings);
    }
}
