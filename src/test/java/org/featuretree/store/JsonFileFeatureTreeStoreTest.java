package org.featuretree.store;

import org.featuretree.model.FeatureNode;
import org.featuretree.model.FeatureReference;
import org.featuretree.model.FeatureTree;
import org.featuretree.model.FeatureType;
import org.featuretree.model.Parameter;
import org.featuretree.model.ParameterType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileFeatureTreeStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void put_writesVersionFileThatReadsBack() throws Exception {
        JsonFileFeatureTreeStore store = new JsonFileFeatureTreeStore(tempDir);
        FeatureTree tree = InMemoryFeatureTreeStoreTest.tree("bracket", 1);
        tree.addNode(FeatureNode.create("b", "block", FeatureType.BOX,
                List.of(Parameter.of("length", 10L), Parameter.of("size", 2.5),
                        Parameter.expression("height", "h * 2")),
                List.of(FeatureReference.feature("wp"))), null);
        tree.setSourceScript("x = 1\n");

        store.put(tree);

        Path file = tempDir.resolve("bracket").resolve("v1.json");
        assertThat(file).exists();
        try (Stream<Path> files = Files.list(tempDir.resolve("bracket"))) {
            assertThat(files).containsExactly(file);
        }

        FeatureTree read = store.get("bracket", 1).orElseThrow();
        assertThat(read.getId()).isEqualTo(tree.getId());
        assertThat(read.getRegenerationOrder()).containsExactly("wp", "b");
        assertThat(read.getSourceScript()).isEqualTo("x = 1\n");
        FeatureNode block = read.requireNode("b");
        assertThat(block.parameter("length").orElseThrow().value()).isEqualTo(10L);
        assertThat(block.parameter("size").orElseThrow().value()).isEqualTo(2.5);
        assertThat(block.parameter("height").orElseThrow().type()).isEqualTo(ParameterType.EXPRESSION);
        assertThat(read.requireNode("wp").childIds()).containsExactly("b");
        assertThat(read.getLastOperation().summary()).isEqualTo("import v1");
    }

    @Test
    void put_existingVersionConflicts() {
        JsonFileFeatureTreeStore store = new JsonFileFeatureTreeStore(tempDir);
        store.put(InMemoryFeatureTreeStoreTest.tree("p1", 1));

        assertThatThrownBy(() -> store.put(InMemoryFeatureTreeStoreTest.tree("p1", 1)))
                .isInstanceOf(VersionConflictException.class);
    }

    @Test
    void projectIdMustBeSafeDirectoryName() {
        JsonFileFeatureTreeStore store = new JsonFileFeatureTreeStore(tempDir);

        assertThatThrownBy(() -> store.get("../escape", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.get("..", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.put(InMemoryFeatureTreeStoreTest.tree("a/b", 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listVersions_hashesStoredDocuments() throws Exception {
        JsonFileFeatureTreeStore store = new JsonFileFeatureTreeStore(tempDir);
        store.put(InMemoryFeatureTreeStoreTest.tree("p1", 2));
        store.put(InMemoryFeatureTreeStoreTest.tree("p1", 10));

        List<FeatureTreeVersion> versions = store.listVersions("p1");

        assertThat(versions).extracting(FeatureTreeVersion::version).containsExactly(2, 10);
        byte[] bytes = Files.readAllBytes(tempDir.resolve("p1").resolve("v10.json"));
        assertThat(versions.get(1).sha256()).isEqualTo(HashingUtils.sha256Hex(bytes));
        assertThat(store.get("p1", null)).map(FeatureTree::getVersion).contains(10);
    }

    @Test
    void delete_removesFilesAndEmptyProjectDirectory() {
        JsonFileFeatureTreeStore store = new JsonFileFeatureTreeStore(tempDir);
        store.put(InMemoryFeatureTreeStoreTest.tree("p1", 1));
        store.put(InMemoryFeatureTreeStoreTest.tree("p1", 2));

        assertThat(store.delete("p1", 1)).isTrue();
        assertThat(tempDir.resolve("p1").resolve("v1.json")).doesNotExist();
        assertThat(store.get("p1", 1)).isEmpty();
        assertThat(store.delete("p1", 2)).isTrue();
        assertThat(tempDir.resolve("p1")).doesNotExist();
        assertThat(store.delete("p1", null)).isFalse();
    }
}
