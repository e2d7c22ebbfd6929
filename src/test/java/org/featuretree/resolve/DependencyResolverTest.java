package org.featuretree.resolve;

import org.featuretree.model.FeatureNode;
import org.featuretree.model.FeatureReference;
import org.featuretree.model.FeatureTree;
import org.featuretree.model.FeatureType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyResolverTest {

    private final DependencyResolver resolver = new DependencyResolver();

    @Test
    void resolve_parentsComeFirstAndIndependentNodesKeepInsertionOrder() {
        FeatureTree tree = new FeatureTree("p1", 1, null);
        tree.addNode(node("u", FeatureType.UNION, FeatureReference.feature("b1"), FeatureReference.solid("b2")), null);
        tree.addNode(node("wp", FeatureType.WORKPLANE), null);
        tree.addNode(node("b2", FeatureType.BOX, FeatureReference.feature("wp")), null);
        tree.addNode(node("b1", FeatureType.BOX, FeatureReference.feature("wp")), null);

        assertThat(resolver.resolve(tree)).containsExactly("wp", "b2", "b1", "u");
    }

    @Test
    void resolve_duplicateReferencesToSameParentCountOnce() {
        FeatureTree tree = new FeatureTree("p1", 1, null);
        tree.addNode(node("wp", FeatureType.WORKPLANE), null);
        tree.addNode(node("b", FeatureType.BOX, FeatureReference.feature("wp"), FeatureReference.solid("wp")), null);

        assertThat(resolver.resolve(tree)).containsExactly("wp", "b");
    }

    @Test
    void resolve_referencesToMissingNodesAreIgnored() {
        FeatureTree tree = new FeatureTree("p1", 1, null);
        tree.addNode(node("f", FeatureType.FILLET, FeatureReference.feature("gone")), null);

        assertThat(resolver.resolve(tree)).containsExactly("f");
    }

    @Test
    void resolve_cycleThrowsWithRemainingNodes() {
        FeatureTree tree = cyclicTree();

        assertThatThrownBy(() -> resolver.resolve(tree))
                .isInstanceOfSatisfying(DependencyCycleException.class,
                        e -> assertThat(e.getCycleNodeIds()).containsExactlyInAnyOrder("a", "b", "c"));
    }

    @Test
    void resolveOrFallback_returnsPreviousOrderOnCycle() {
        FeatureTree tree = cyclicTree();
        tree.setRegenerationOrder(List.of("b", "stale", "wp"));

        assertThat(resolver.resolveOrFallback(tree)).containsExactly("b", "wp", "a", "c");
    }

    private static FeatureTree cyclicTree() {
        FeatureTree tree = new FeatureTree("p1", 1, null);
        tree.addNode(node("wp", FeatureType.WORKPLANE), null);
        tree.addNode(node("a", FeatureType.BOX, FeatureReference.feature("wp"), FeatureReference.feature("b")), null);
        tree.addNode(node("b", FeatureType.FILLET, FeatureReference.feature("a")), null);
        tree.addNode(node("c", FeatureType.CHAMFER, FeatureReference.feature("b")), null);
        return tree;
    }

    private static FeatureNode node(String id, FeatureType type, FeatureReference... refs) {
        return FeatureNode.create(id, id, type, List.of(), List.of(refs));
    }
}
