package org.featuretree.store;

import org.featuretree.model.FeatureNode;
import org.featuretree.model.FeatureTree;
import org.featuretree.model.FeatureTreeOperation;
import org.featuretree.model.FeatureType;
import org.featuretree.model.OperationType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryFeatureTreeStoreTest {

    private final InMemoryFeatureTreeStore store = new InMemoryFeatureTreeStore();

    @Test
    void put_storesSnapshotIsolatedFromCaller() {
        FeatureTree tree = tree("p1", 1);
        store.put(tree);
        tree.addNode(FeatureNode.create("late", FeatureType.BOX), "wp");

        FeatureTree stored = store.get("p1", 1).orElseThrow();
        assertThat(stored.getNodes()).containsOnlyKeys("wp");

        stored.addNode(FeatureNode.create("other", FeatureType.BOX), "wp");
        assertThat(store.get("p1", 1).orElseThrow().getNodes()).hasSize(1);
    }

    @Test
    void get_withoutVersionReturnsLatest() {
        store.put(tree("p1", 1));
        store.put(tree("p1", 2));

        assertThat(store.get("p1", null)).map(FeatureTree::getVersion).contains(2);
        assertThat(store.get("p1", 3)).isEmpty();
        assertThat(store.get("nope", null)).isEmpty();
    }

    @Test
    void put_sameVersionTwiceConflicts() {
        store.put(tree("p1", 1));

        assertThatThrownBy(() -> store.put(tree("p1", 1)))
                .isInstanceOf(VersionConflictException.class)
                .hasMessage("项目 p1 的版本 1 已存在，请基于最新版本重新编辑");
    }

    @Test
    void listVersions_carriesOperationAndFingerprint() {
        store.put(tree("p1", 1));
        store.put(tree("p1", 2));

        List<FeatureTreeVersion> versions = store.listVersions("p1");

        assertThat(versions).extracting(FeatureTreeVersion::version).containsExactly(1, 2);
        assertThat(versions.get(0).operation()).isEqualTo(OperationType.IMPORT);
        assertThat(versions.get(0).summary()).isEqualTo("import v1");
        assertThat(versions.get(0).nodeCount()).isEqualTo(1);
        assertThat(versions.get(0).sha256()).hasSize(64);
        assertThat(store.listVersions("nope")).isEmpty();
    }

    @Test
    void delete_singleVersionThenProject() {
        store.put(tree("p1", 1));
        store.put(tree("p1", 2));

        assertThat(store.delete("p1", 2)).isTrue();
        assertThat(store.delete("p1", 2)).isFalse();
        assertThat(store.get("p1", null)).map(FeatureTree::getVersion).contains(1);
        assertThat(store.delete("p1", null)).isTrue();
        assertThat(store.get("p1", null)).isEmpty();
        assertThat(store.delete("p1", null)).isFalse();
    }

    static FeatureTree tree(String projectId, int version) {
        FeatureTree tree = new FeatureTree(projectId, version, "tester");
        tree.addNode(FeatureNode.create("wp", "base", FeatureType.WORKPLANE, List.of(), List.of()), null);
        tree.setLastOperation(FeatureTreeOperation.of(OperationType.IMPORT, null, "import v" + version));
        return tree;
    }
}
