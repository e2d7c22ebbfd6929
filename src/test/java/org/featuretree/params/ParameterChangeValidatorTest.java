package org.featuretree.params;

import org.featuretree.model.FeatureNode;
import org.featuretree.model.FeatureType;
import org.featuretree.model.Parameter;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ParameterChangeValidatorTest {

    private final ParameterChangeValidator validator = new ParameterChangeValidator();

    private final FeatureNode node = FeatureNode.create("n1", "hub", FeatureType.CYLINDER, List.of(
            Parameter.of("radius", 5L),
            Parameter.of("count", 4L),
            Parameter.of("center", List.of(0.0, 0.0, 0.0)),
            Parameter.of("centered", true),
            Parameter.expression("height", "w * 2")), List.of());

    @Test
    void validate_acceptsWellTypedChanges() {
        assertThat(validator.validate(node, Map.of(
                "radius", 7.5,
                "count", 3.0,
                "center", List.of(1, 2, 3),
                "centered", false,
                "height", "w * 3"))).isEmpty();
    }

    @Test
    void validate_reportsEveryProblem() {
        Map<String, Object> changes = new HashMap<>();
        changes.put("radius", -1L);
        changes.put("count", 2.5);
        changes.put("center", List.of(1, 2));
        changes.put("centered", "yes");
        changes.put("missing", 1L);

        assertThat(validator.validate(node, changes)).containsExactlyInAnyOrder(
                "Parameter 'radius' must be a positive number but got -1",
                "Parameter 'count' must be a positive integer but got 2.5",
                "Parameter 'center' expects 3 numbers but got [1, 2]",
                "Parameter 'centered' expects True or False but got 'yes'",
                "Node hub has no parameter 'missing'")
                .hasSize(5);
        assertThat(validator.validate(node, Map.of("height", "w *")))
                .singleElement().asString().startsWith("Parameter 'height' is not a valid expression: ");
    }

    @Test
    void validate_rejectsNonNumbersNullsAndEmptyChanges() {
        Map<String, Object> none = new HashMap<>();
        none.put("radius", null);

        assertThat(validator.validate(node, Map.of("radius", "big")))
                .containsExactly("Parameter 'radius' expects a number but got 'big'");
        assertThat(validator.validate(node, none)).containsExactly("Parameter 'radius' cannot be set to None");
        assertThat(validator.validate(node, Map.of())).containsExactly("No parameter changes given for node hub");
    }

    @Test
    void validate_edgeFinishSizeMustBePositive() {
        FeatureNode fillet = FeatureNode.create("f", "round", FeatureType.FILLET,
                List.of(Parameter.of("arg_0", 0.5)), List.of());

        assertThat(validator.validate(fillet, Map.of("arg_0", 0L)))
                .containsExactly("Parameter 'arg_0' must be a positive number but got 0");
    }
}
