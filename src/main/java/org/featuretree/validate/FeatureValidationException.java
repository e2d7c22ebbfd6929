package org.featuretree.validate;

import org.featuretree.model.FeatureTreeException;

import java.util.List;

/**
 * 修改被校验器拒绝。携带可读的拒绝原因，以及（可用时）合法的替代方案。
 */
public class FeatureValidationException extends FeatureTreeException {

    private final List<String> reasons;
    private final List<AdditionSuggestion> alternatives;

    public FeatureValidationException(List<String> reasons, List<AdditionSuggestion> alternatives) {
        super("修改未通过校验：" + String.join("; ", reasons));
        this.reasons = List.copyOf(reasons);
        this.alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public List<String> getReasons() {
        return reasons;
    }

    public List<AdditionSuggestion> getAlternatives() {
        return alternatives;
    }
}
