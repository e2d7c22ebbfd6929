package org.featuretree.validate;

import java.util.List;

/**
 * 校验结果：errors 非空即为拒绝；warnings 只提示，不阻止修改。
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of(), List.of());
    }
}
