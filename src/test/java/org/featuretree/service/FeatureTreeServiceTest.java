package org.featuretree.service;

import org.featuretree.generate.CadQueryCodeGenerator;
import org.featuretree.model.FeatureNode;
import org.featuretree.model.FeatureTree;
import org.featuretree.model.FeatureType;
import org.featuretree.model.OperationType;
import org.featuretree.model.Parameter;
import org.featuretree.params.ParameterChangeValidator;
import org.featuretree.params.ParameterExtractor;
import org.featuretree.params.ParameterPatcher;
import org.featuretree.parse.FeatureTreeParser;
import org.featuretree.resolve.DependencyResolver;
import org.featuretree.store.FeatureTreeNotFoundException;
import org.featuretree.store.FeatureTreeVersion;
import org.featuretree.store.InMemoryFeatureTreeStore;
import org.featuretree.validate.AdditionSuggestion;
import org.featuretree.validate.FeatureTreeValidator;
import org.featuretree.validate.FeatureValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureTreeServiceTest {

    private static final String SCRIPT = """
            import cadquery as cq

            length = 10
            base = cq.Workplane("XY").box(length, 5, 2)
            """;

    private InMemoryFeatureTreeStore store;
    private FeatureTreeProperties properties;
    private FeatureTreeService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryFeatureTreeStore();
        properties = new FeatureTreeProperties();
        DependencyResolver resolver = new DependencyResolver();
        service = new FeatureTreeService(store, new FeatureTreeParser(), new FeatureTreeValidator(), resolver,
                new CadQueryCodeGenerator(resolver, "result"), new ParameterExtractor(), new ParameterPatcher(),
                new ParameterChangeValidator(), properties);
    }

    @Test
    void importScript_storesFirstVersionWithDesignParameters() {
        FeatureTree tree = service.importScript("p1", SCRIPT, "alice");

        assertThat(tree.getVersion()).isEqualTo(1);
        assertThat(tree.getCreatedBy()).isEqualTo("alice");
        assertThat(tree.getNodes()).hasSize(2);
        assertThat(tree.getGlobalParameters()).extracting(Parameter::originalSourceName).containsExactly("length");
        assertThat(tree.getLastOperation().type()).isEqualTo(OperationType.IMPORT);

        FeatureTree again = service.importScript("p1", SCRIPT, null);
        assertThat(again.getVersion()).isEqualTo(2);
        assertThat(again.getCreatedBy()).isEqualTo("mcp");
        assertThat(service.getTree("p1", 1).getId()).isEqualTo(tree.getId());
    }

    @Test
    void importScript_rejectsOversizedScript() {
        properties.setMaxScriptSize(DataSize.ofBytes(10));

        assertThatThrownBy(() -> service.importScript("p1", SCRIPT, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("脚本过大：");
        assertThat(store.get("p1", null)).isEmpty();
    }

    @Test
    void addNode_commitsNewVersionAndKeepsHistory() {
        String boxId = importAndBoxId();

        TreeEdit edit = service.addNode("p1", FeatureNode.create("f1", "round", FeatureType.FILLET,
                List.of(Parameter.of("radius", 1.0)), List.of()), boxId, "bob");

        FeatureTree next = edit.tree();
        assertThat(next.getVersion()).isEqualTo(2);
        assertThat(next.getNodes()).hasSize(3);
        assertThat(next.requireNode("f1").primaryParentId()).contains(boxId);
        assertThat(next.isDirty()).isTrue();
        assertThat(next.isNeedsFullRegeneration()).isTrue();
        assertThat(next.getLastOperation().parentId()).isEqualTo(boxId);
        assertThat(service.getTree("p1", 1).getNodes()).hasSize(2);
        assertThat(service.listVersions("p1")).extracting(FeatureTreeVersion::operation)
                .containsExactly(OperationType.IMPORT, OperationType.ADD);
    }

    @Test
    void addNode_rejectionLeavesStoreUntouchedAndOffersAlternatives() {
        importAndBoxId();
        String workplaneId = service.getTree("p1", null).orderedNodes().get(0).id();

        assertThatThrownBy(() -> service.addNode("p1", FeatureNode.create("ex", FeatureType.EXTRUDE), workplaneId, null))
                .isInstanceOfSatisfying(FeatureValidationException.class, e -> {
                    assertThat(e.getReasons()).anyMatch(r -> r.startsWith(
                            "Invalid parent type: extrude cannot be created from workplane"));
                    assertThat(e.getAlternatives()).extracting(AdditionSuggestion::type)
                            .containsExactly(FeatureType.WORKPLANE, FeatureType.SKETCH, FeatureType.BOX);
                });
        assertThat(service.getTree("p1", null).getVersion()).isEqualTo(1);
    }

    @Test
    void removeNode_cascadesToDependents() {
        String boxId = importAndBoxId();
        String workplaneId = service.getTree("p1", null).orderedNodes().get(0).id();

        TreeEdit edit = service.removeNode("p1", workplaneId, null);

        assertThat(edit.tree().getNodes()).isEmpty();
        assertThat(edit.tree().getRootNodeId()).isNull();
        assertThat(edit.warnings()).containsExactly("Also removed dependent nodes: [" + boxId + "]");
        assertThatThrownBy(() -> service.removeNode("p1", "ghost", null))
                .isInstanceOf(FeatureTreeNotFoundException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void updateNodeParameters_validatesBeforeCommit() {
        String boxId = importAndBoxId();

        TreeEdit edit = service.updateNodeParameters("p1", boxId, Map.of("arg_1", 12), null);

        assertThat(edit.tree().requireNode(boxId).parameter("arg_1").orElseThrow().value()).isEqualTo(12L);
        assertThat(edit.tree().isDirty()).isTrue();
        assertThat(edit.tree().isNeedsFullRegeneration()).isFalse();
        assertThat(edit.tree().getLastOperation().parameterChanges()).containsEntry("arg_1", 12);
        assertThat(edit.warnings()).isEmpty();

        assertThatThrownBy(() -> service.updateNodeParameters("p1", boxId, Map.of("arg_1", "abc"), null))
                .isInstanceOfSatisfying(FeatureValidationException.class, e -> assertThat(e.getReasons())
                        .containsExactly("Parameter 'arg_1' expects a number but got 'abc'"));
        assertThat(service.getTree("p1", null).getVersion()).isEqualTo(2);
    }

    @Test
    void updateNodeParameters_designParameterIsChangedInSourceScript() {
        String boxId = importAndBoxId();

        TreeEdit edit = service.updateNodeParameters("p1", boxId, Map.of("arg_0", 12), null);

        FeatureTree tree = edit.tree();
        assertThat(tree.getVersion()).isEqualTo(2);
        assertThat(tree.isDirty()).isFalse();
        assertThat(tree.getSourceScript()).contains("length = 12\n").doesNotContain("length = 10");
        assertThat(tree.getGlobalParameters().get(0).value()).isEqualTo(12L);
        assertThat(tree.orderedNodes().get(1).parameter("arg_0").orElseThrow().value()).isEqualTo(12L);
        assertThat(tree.getLastOperation().type()).isEqualTo(OperationType.MODIFY);
        assertThat(edit.warnings()).containsExactly(
                "Updated design parameters [length] in the source script; every feature using them follows the new value");

        String reparsedBoxId = tree.orderedNodes().get(1).id();
        TreeEdit mixed = service.updateNodeParameters("p1", reparsedBoxId, Map.of("arg_0", 15, "arg_1", 7), null);

        FeatureNode box = mixed.tree().orderedNodes().get(1);
        assertThat(mixed.tree().getSourceScript()).contains("length = 15\n");
        assertThat(box.parameter("arg_0").orElseThrow().value()).isEqualTo(15L);
        assertThat(box.parameter("arg_1").orElseThrow().value()).isEqualTo(7L);
        assertThat(mixed.tree().isDirty()).isTrue();
    }

    @Test
    void reorderNodes_mustRespectDependencies() {
        String boxId = importAndBoxId();
        String workplaneId = service.getTree("p1", null).orderedNodes().get(0).id();

        assertThatThrownBy(() -> service.reorderNodes("p1", List.of(boxId, workplaneId), null))
                .isInstanceOfSatisfying(FeatureValidationException.class, e -> assertThat(e.getReasons())
                        .anyMatch(r -> r.contains("is regenerated before its parent")));
        assertThatThrownBy(() -> service.reorderNodes("p1", List.of(boxId), null))
                .isInstanceOfSatisfying(FeatureValidationException.class, e -> assertThat(e.getReasons().get(0))
                        .startsWith("Reorder must list every node exactly once"));

        TreeEdit edit = service.reorderNodes("p1", List.of(workplaneId, boxId), null);
        assertThat(edit.tree().getLastOperation().newOrder()).containsExactly(workplaneId, boxId);
    }

    @Test
    void regenerate_writesScriptAndClearsDirtyFlag() {
        String boxId = importAndBoxId();
        service.updateNodeParameters("p1", boxId, Map.of("arg_1", 6), null);

        Regeneration regeneration = service.regenerate("p1", null);

        FeatureTree tree = regeneration.tree();
        assertThat(tree.getVersion()).isEqualTo(3);
        assertThat(tree.isDirty()).isFalse();
        assertThat(tree.getSourceScript()).isEqualTo(regeneration.script().code());
        assertThat(regeneration.script().code())
                .contains("length = 10")
                .contains("box_1 = workplane_1.box(length, 6, 2)")
                .endsWith("result = box_1\n");
        assertThat(service.validate("p1", null)).isEmpty();
    }

    @Test
    void patchParameter_rewritesSourceAndReparses() {
        String boxId = importAndBoxId();

        FeatureTree patched = service.patchParameter("p1", "length", 20, "carol");

        assertThat(patched.getVersion()).isEqualTo(2);
        assertThat(patched.getSourceScript()).contains("length = 20\n").doesNotContain("length = 10");
        assertThat(patched.getGlobalParameters().get(0).value()).isEqualTo(20L);
        FeatureNode box = patched.orderedNodes().get(1);
        assertThat(box.id()).isNotEqualTo(boxId);
        assertThat(box.parameter("arg_0").orElseThrow().value()).isEqualTo(20L);
        assertThat(patched.getLastOperation().type()).isEqualTo(OperationType.PATCH);
    }

    @Test
    void patchParameter_refusesToDropUnregeneratedEdits() {
        String boxId = importAndBoxId();
        service.addNode("p1", FeatureNode.create("f1", "round", FeatureType.FILLET,
                List.of(Parameter.of("radius", 1.0)), List.of()), boxId, null);

        assertThatThrownBy(() -> service.patchParameter("p1", "length", 20, null))
                .isInstanceOfSatisfying(FeatureValidationException.class, e -> assertThat(e.getReasons())
                        .containsExactly("Version 2 has edits that are not in its script yet. "
                                + "Regenerate the script before changing design parameter length."));
        FeatureTree latest = service.getTree("p1", null);
        assertThat(latest.getVersion()).isEqualTo(2);
        assertThat(latest.containsNode("f1")).isTrue();

        service.regenerate("p1", null);
        FeatureTree patched = service.patchParameter("p1", "length", 20, null);

        assertThat(patched.getVersion()).isEqualTo(4);
        assertThat(patched.orderedNodes()).extracting(FeatureNode::featureType)
                .containsExactly(FeatureType.WORKPLANE, FeatureType.BOX, FeatureType.FILLET);
        assertThat(patched.orderedNodes().get(1).parameter("arg_0").orElseThrow().value()).isEqualTo(20L);
    }

    @Test
    void queriesOnUnknownProjectOrParentFail() {
        assertThatThrownBy(() -> service.getTree("nope", null))
                .isInstanceOf(FeatureTreeNotFoundException.class)
                .hasMessage("项目 nope 不存在");
        assertThatThrownBy(() -> service.listVersions("nope")).isInstanceOf(FeatureTreeNotFoundException.class);

        importAndBoxId();
        assertThatThrownBy(() -> service.suggest("p1", "ghost")).isInstanceOf(FeatureTreeNotFoundException.class);
        assertThat(service.suggest("p1", null)).isNotEmpty();
        assertThat(service.deleteTree("p1", null)).isTrue();
        assertThat(store.get("p1", null)).isEmpty();
    }

    private String importAndBoxId() {
        FeatureTree tree = service.importScript("p1", SCRIPT, null);
        return tree.orderedNodes().get(1).id();
    }
}
