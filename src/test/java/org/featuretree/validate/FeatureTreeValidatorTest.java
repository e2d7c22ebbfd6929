package org.featuretree.validate;

import org.featuretree.model.FeatureNode;
import org.featuretree.model.FeatureReference;
import org.featuretree.model.FeatureTree;
import org.featuretree.model.FeatureType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FeatureTreeValidatorTest {

    private final FeatureTreeValidator validator = new FeatureTreeValidator();

    private FeatureTree tree;

    @BeforeEach
    void setUp() {
        tree = new FeatureTree("p1", 1, "tester");
        tree.addNode(node("wp", FeatureType.WORKPLANE), null);
    }

    @Test
    void validateAddition_extrudeDirectlyOnWorkplaneIsRejected() {
        ValidationResult result = validator.validateAddition(tree, node("ex", FeatureType.EXTRUDE), "wp");

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).anyMatch(e -> e.startsWith(
                "Invalid parent type: extrude cannot be created from workplane"));
    }

    @Test
    void validateAddition_extrudeOnSketchIsAccepted() {
        tree.addNode(node("sk", FeatureType.SKETCH), "wp");

        ValidationResult result = validator.validateAddition(tree, node("ex", FeatureType.EXTRUDE), "sk");

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void validateAddition_booleanNeedsTwoSolidParents() {
        tree.addNode(node("b1", FeatureType.BOX), "wp");

        ValidationResult result = validator.validateAddition(tree,
                node("u", FeatureType.UNION, FeatureReference.solid("b1")), null);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).contains("Boolean operation union requires 2 solid parents, but only 1 found. "
                + "Add more solid parent references.");
    }

    @Test
    void validateAddition_booleanBypassingFilletWarns() {
        tree.addNode(node("b1", FeatureType.BOX), "wp");
        tree.addNode(node("f", FeatureType.FILLET), "b1");
        tree.addNode(node("b2", FeatureType.BOX), "wp");

        ValidationResult result = validator.validateAddition(tree,
                node("u", FeatureType.UNION, FeatureReference.solid("b1"), FeatureReference.solid("b2")), null);

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).singleElement().asString().contains("fillet f is bypassed");
    }

    @Test
    void validateAddition_filletOnAlreadyCombinedSolidWarns() {
        tree.addNode(node("b1", FeatureType.BOX), "wp");
        tree.addNode(node("b2", FeatureType.BOX), "wp");
        tree.addNode(node("u", FeatureType.UNION, FeatureReference.solid("b1"), FeatureReference.solid("b2")), null);

        ValidationResult result = validator.validateAddition(tree, node("f", FeatureType.FILLET), "b1");

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).singleElement().asString()
                .startsWith("Warning: Adding fillet to b1 may not appear in final result");
    }

    @Test
    void validateAddition_structuralErrorsShortCircuit() {
        assertThat(validator.validateAddition(tree, node("wp", FeatureType.WORKPLANE), null).errors())
                .containsExactly("Node with ID wp already exists in tree");
        assertThat(validator.validateAddition(tree, node("x", FeatureType.BOX), "missing").errors())
                .containsExactly("Parent node missing does not exist in tree");
        assertThat(validator.validateAddition(tree,
                node("x", FeatureType.BOX, FeatureReference.feature("ghost")), null).errors())
                .containsExactly("Referenced parent node ghost does not exist in tree");
    }

    @Test
    void validateAddition_booleanAndSketchParentsMustBeVolumes() {
        tree.addNode(node("b1", FeatureType.BOX), "wp");
        tree.addNode(node("b2", FeatureType.BOX), "wp");
        tree.addNode(node("f", FeatureType.FILLET), "b1");

        ValidationResult union = validator.validateAddition(tree,
                node("u", FeatureType.UNION, FeatureReference.solid("b2")), "f");
        assertThat(union.valid()).isFalse();
        assertThat(union.errors()).anyMatch(e -> e.startsWith("Invalid parent type: union cannot be created from fillet"));
        assertThat(validator.validateAddition(tree, node("s", FeatureType.SKETCH), "f").errors())
                .anyMatch(e -> e.startsWith("Invalid parent type: sketch cannot be created from fillet"));

        tree.addNode(node("u2", FeatureType.UNION, FeatureReference.solid("b1"), FeatureReference.solid("b2")), null);
        assertThat(validator.validateAddition(tree, node("r", FeatureType.FILLET), "u2").errors())
                .noneMatch(e -> e.startsWith("Invalid parent type"));
    }

    @Test
    void validateAddition_primitiveWithoutParentNeedsRootType() {
        ValidationResult result = validator.validateAddition(tree, node("b", FeatureType.BOX), null);

        assertThat(result.errors()).anyMatch(e -> e.startsWith("Invalid parent type: box requires a parent of type"));
    }

    @Test
    void validateAddition_detectsCycleThroughDanglingReference() {
        tree.addNode(node("b", FeatureType.BOX, FeatureReference.feature("wp"), FeatureReference.feature("x")), null);

        ValidationResult result = validator.validateAddition(tree, node("x", FeatureType.FILLET), "b");

        assertThat(result.errors()).contains("Adding node x would create a circular dependency");
    }

    @Test
    void validateAddition_solidThatFeedsOnlyASketchHasNoEffect() {
        tree.addNode(node("s2", FeatureType.SKETCH, FeatureReference.feature("y")), null);

        ValidationResult result = validator.validateAddition(tree, node("y", FeatureType.BOX), "wp");

        assertThat(result.errors()).anyMatch(e -> e.contains("will not affect the final model result"));
    }

    @Test
    void validateTree_acceptsConsistentTree() {
        tree.addNode(node("sk", FeatureType.SKETCH), "wp");
        tree.addNode(node("ex", FeatureType.EXTRUDE), "sk");

        assertThat(validator.validateTree(tree)).isEmpty();
    }

    @Test
    void validateTree_reportsOrderViolationsAndCycles() {
        tree.addNode(node("sk", FeatureType.SKETCH), "wp");
        tree.reorder(List.of("sk", "wp"));

        assertThat(validator.validateTree(tree)).containsExactly("Node sk is regenerated before its parent wp");

        FeatureTree cyclic = new FeatureTree("p2", 1, null);
        cyclic.addNode(node("a", FeatureType.BOX, FeatureReference.feature("b")), null);
        cyclic.addNode(node("b", FeatureType.FILLET, FeatureReference.feature("a")), null);

        assertThat(validator.validateTree(cyclic)).anyMatch(e -> e.startsWith(
                "Feature tree contains a circular dependency involving node"));
    }

    @Test
    void suggestAdditions_dependsOnParentType() {
        assertThat(validator.suggestAdditions(new FeatureTree("empty", 1, null), null))
                .extracting(AdditionSuggestion::type).containsExactly(FeatureType.WORKPLANE);
        assertThat(validator.suggestAdditions(tree, null)).extracting(AdditionSuggestion::type)
                .containsExactly(FeatureType.WORKPLANE, FeatureType.ASSEMBLY_ROOT, FeatureType.DATUM_PLANE,
                        FeatureType.DATUM_AXIS, FeatureType.DATUM_POINT);

        tree.addNode(node("sk", FeatureType.SKETCH), "wp");
        assertThat(validator.suggestAdditions(tree, "sk")).extracting(AdditionSuggestion::type)
                .containsExactly(FeatureType.EXTRUDE, FeatureType.REVOLVE, FeatureType.LOFT, FeatureType.SWEEP);
    }

    @Test
    void suggestAdditions_booleansOnlyWithAnotherSolid() {
        tree.addNode(node("b1", FeatureType.BOX), "wp");
        assertThat(validator.suggestAdditions(tree, "b1")).extracting(AdditionSuggestion::type)
                .contains(FeatureType.FILLET, FeatureType.CHAMFER)
                .doesNotContain(FeatureType.UNION);

        tree.addNode(node("b2", FeatureType.BOX), "wp");
        assertThat(validator.suggestAdditions(tree, "b1")).extracting(AdditionSuggestion::type)
                .contains(FeatureType.UNION, FeatureType.DIFFERENCE, FeatureType.INTERSECTION);
        assertThat(validator.suggestAdditions(tree, "nope")).isEmpty();
    }

    private static FeatureNode node(String id, FeatureType type, FeatureReference... refs) {
        return FeatureNode.create(id, id, type, List.of(), List.of(refs));
    }
}
