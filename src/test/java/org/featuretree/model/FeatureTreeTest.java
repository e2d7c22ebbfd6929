package org.featuretree.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureTreeTest {

    private FeatureTree tree;

    @BeforeEach
    void setUp() {
        tree = new FeatureTree("p1", 1, "tester");
        tree.addNode(node("wp", FeatureType.WORKPLANE), null);
        tree.addNode(node("sk", FeatureType.SKETCH, Parameter.of("radius", 5L)), "wp");
        tree.addNode(node("ex", FeatureType.EXTRUDE, Parameter.of("arg_0", 10L)), "sk");
        tree.addNode(node("b", FeatureType.BOX), "wp");
    }

    @Test
    void addNode_maintainsRootOrderAndChildren() {
        assertThat(tree.getRootNodeId()).isEqualTo("wp");
        assertThat(tree.getRegenerationOrder()).containsExactly("wp", "sk", "ex", "b");
        assertThat(tree.requireNode("wp").childIds()).containsExactly("sk", "b");
        assertThat(tree.requireNode("ex").parentReferences()).containsExactly(FeatureReference.feature("sk"));
        assertThat(tree.dependentsOf("wp")).containsExactly("sk", "b");
        assertThat(tree.dependenciesOf("ex")).containsExactlyInAnyOrder("sk", "wp");
    }

    @Test
    void addNode_parentBecomesFirstReference() {
        tree.addNode(FeatureNode.create("cut", "cut", FeatureType.DIFFERENCE, List.of(),
                List.of(FeatureReference.solid("ex"))), "b");
        tree.addNode(FeatureNode.create("join", "join", FeatureType.UNION, List.of(),
                List.of(FeatureReference.solid("ex"), FeatureReference.solid("b"))), "b");

        assertThat(tree.requireNode("cut").parentReferences())
                .containsExactly(FeatureReference.feature("b"), FeatureReference.solid("ex"));
        assertThat(tree.requireNode("join").parentReferences())
                .containsExactly(FeatureReference.solid("b"), FeatureReference.solid("ex"));
        assertThat(tree.requireNode("cut").primaryParentId()).contains("b");
    }

    @Test
    void removeNode_cascadesAndPromotesRoot() {
        assertThat(tree.removeNode("sk")).containsExactly("sk", "ex");
        assertThat(tree.getRegenerationOrder()).containsExactly("wp", "b");
        assertThat(tree.requireNode("wp").childIds()).containsExactly("b");

        assertThat(tree.removeNode("wp")).containsExactly("wp", "b");
        assertThat(tree.getRootNodeId()).isNull();
        assertThat(tree.removeNode("wp")).isEmpty();
    }

    @Test
    void replaceNodeParameters_onlyExistingParameters() {
        FeatureNode updated = tree.replaceNodeParameters("ex", Map.of("arg_0", 12.5));

        assertThat(updated.parameter("arg_0").orElseThrow().value()).isEqualTo(12.5);
        assertThat(updated.parameter("arg_0").orElseThrow().type()).isEqualTo(ParameterType.FLOAT);
        assertThatThrownBy(() -> tree.replaceNodeParameters("ex", Map.of("depth", 1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tree.replaceNodeParameters("nope", Map.of("arg_0", 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reorder_requiresSameNodeSet() {
        tree.reorder(List.of("wp", "b", "sk", "ex"));
        assertThat(tree.orderedNodes()).extracting(FeatureNode::id).containsExactly("wp", "b", "sk", "ex");

        assertThatThrownBy(() -> tree.reorder(List.of("wp", "b", "sk")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tree.reorder(List.of("wp", "b", "sk", "sk")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nextVersion_isIndependentCopy() {
        tree.markStructuralChange();

        FeatureTree next = tree.nextVersion("bob");
        next.removeNode("b");
        next.markRegenerated("result = 1\n");

        assertThat(next.getVersion()).isEqualTo(2);
        assertThat(next.getId()).isNotEqualTo(tree.getId());
        assertThat(next.getCreatedBy()).isEqualTo("bob");
        assertThat(next.isDirty()).isFalse();
        assertThat(tree.containsNode("b")).isTrue();
        assertThat(tree.isDirty()).isTrue();
        assertThat(tree.isNeedsFullRegeneration()).isTrue();
        assertThat(tree.nextVersion(null).getCreatedBy()).isEqualTo("tester");
    }

    @Test
    void featureType_fromValueIgnoresCase() {
        assertThat(FeatureType.fromValue(" Pattern_Linear ")).isEqualTo(FeatureType.PATTERN_LINEAR);
        assertThat(FeatureType.UNION.producesSolid()).isTrue();
        assertThat(FeatureType.SKETCH.producesSolid()).isFalse();
        assertThatThrownBy(() -> FeatureType.fromValue("spline")).isInstanceOf(IllegalArgumentException.class);
    }

    private static FeatureNode node(String id, FeatureType type, Parameter... parameters) {
        return FeatureNode.create(id, id, type, List.of(parameters), List.of());
    }
}
