package org.featuretree.mcp;

import org.featuretree.dto.FeatureTreeResult;
import org.featuretree.dto.GeneratedCodeResult;
import org.featuretree.dto.NodeAdditionResult;
import org.featuretree.dto.ParameterPatchResult;
import org.featuretree.generate.CadQueryCodeGenerator;
import org.featuretree.model.FeatureNode;
import org.featuretree.model.FeatureReference;
import org.featuretree.model.FeatureType;
import org.featuretree.model.Parameter;
import org.featuretree.model.ParameterType;
import org.featuretree.model.ReferenceRole;
import org.featuretree.params.ParameterChangeValidator;
import org.featuretree.params.ParameterExtractor;
import org.featuretree.params.ParameterPatcher;
import org.featuretree.parse.FeatureTreeParser;
import org.featuretree.resolve.DependencyResolver;
import org.featuretree.service.FeatureTreeProperties;
import org.featuretree.service.FeatureTreeService;
import org.featuretree.store.FeatureTreeNotFoundException;
import org.featuretree.store.InMemoryFeatureTreeStore;
import org.featuretree.validate.AdditionSuggestion;
import org.featuretree.validate.FeatureTreeValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureTreeMcpToolsTest {

    private static final String TWO_BOXES = """
            import cadquery as cq
            size = 2
            a = cq.Workplane("XY").box(1, 1, 1)
            b = cq.Workplane("XY").box(size, size, size)
            """;

    private FeatureTreeMcpTools tools;

    @BeforeEach
    void setUp() {
        DependencyResolver resolver = new DependencyResolver();
        FeatureTreeService service = new FeatureTreeService(new InMemoryFeatureTreeStore(), new FeatureTreeParser(),
                new FeatureTreeValidator(), resolver, new CadQueryCodeGenerator(resolver, "result"),
                new ParameterExtractor(), new ParameterPatcher(), new ParameterChangeValidator(),
                new FeatureTreeProperties());
        tools = new FeatureTreeMcpTools(service);
    }

    @Test
    void parseParameters_jsonObjectKeepsOrderAndTypes() {
        List<Parameter> parameters = FeatureTreeMcpTools.parseParameters("{\"radius\": 5, \"center\": [0, 0, 1.5]}");

        assertThat(parameters).extracting(Parameter::name).containsExactly("radius", "center");
        assertThat(parameters.get(0).value()).isEqualTo(5L);
        assertThat(parameters.get(1).type()).isEqualTo(ParameterType.VECTOR3D);
        assertThat(FeatureTreeMcpTools.parseParameters(" ")).isEmpty();
    }

    @Test
    void parseReferences_acceptsIdsAndObjects() {
        List<FeatureReference> refs = FeatureTreeMcpTools.parseReferences(
                "[\"a\", {\"targetNodeId\": \"b\", \"role\": \"solid\"}, {\"targetNodeId\": \"c\"}]");

        assertThat(refs).containsExactly(
                FeatureReference.feature("a"),
                new FeatureReference("b", ReferenceRole.SOLID),
                FeatureReference.feature("c"));
        assertThatThrownBy(() -> FeatureTreeMcpTools.parseReferences("{}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("必须是 JSON 数组");
        assertThatThrownBy(() -> FeatureTreeMcpTools.parseReferences("[1]"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parseObjectAndValue_reportInvalidJson() {
        assertThatThrownBy(() -> FeatureTreeMcpTools.parseObject("{radius: 1", "changes"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("changes 不是合法的 JSON 对象");
        assertThatThrownBy(() -> FeatureTreeMcpTools.parseObject("null", "changes"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("changes 格式错误：必须是 JSON 对象");
        assertThat(FeatureTreeMcpTools.parseValue("12.5")).isEqualTo(12.5);
        assertThat(FeatureTreeMcpTools.parseValue("\"XY\"")).isEqualTo("XY");
        assertThatThrownBy(() -> FeatureTreeMcpTools.parseValue("XY")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FeatureTreeMcpTools.parseStringList("[\"a\", 1]", "order"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void addNode_rejectionIsReturnedAsResult() {
        FeatureTreeResult imported = tools.importScript("p1", TWO_BOXES, null);
        String workplaneId = imported.tree().orderedNodes().get(0).id();

        NodeAdditionResult result = tools.addNode("p1", "extrude", null, workplaneId, "{\"arg_0\": 10}",
                null, null, null);

        assertThat(result.accepted()).isFalse();
        assertThat(result.version()).isEqualTo(1);
        assertThat(result.tree()).isNull();
        assertThat(result.errors()).isNotEmpty();
        assertThat(result.alternatives()).extracting(AdditionSuggestion::type)
                .containsExactly(FeatureType.WORKPLANE, FeatureType.SKETCH, FeatureType.BOX);
        assertThat(tools.getTree("p1", null).version()).isEqualTo(1);
    }

    @Test
    void addNode_unionOfTwoBoxesThenGenerate() {
        FeatureTreeResult imported = tools.importScript("p1", TWO_BOXES, null);
        List<FeatureNode> nodes = imported.tree().orderedNodes();
        String first = nodes.get(1).id();
        String second = nodes.get(3).id();

        NodeAdditionResult result = tools.addNode("p1", "UNION", "joined", first,
                null, "[{\"targetNodeId\": \"" + second + "\", \"role\": \"solid\"}]", "u1", "dana");

        assertThat(result.accepted()).isTrue();
        assertThat(result.version()).isEqualTo(2);
        assertThat(result.nodeId()).isEqualTo("u1");
        assertThat(result.tree().requireNode("u1").parentReferences()).extracting(FeatureReference::targetNodeId)
                .containsExactly(first, second);

        GeneratedCodeResult code = tools.generateCode("p1", null);
        assertThat(code.version()).isEqualTo(2);
        assertThat(code.code()).contains("size = 2").contains("union_1 = box_1.union(box_2)");
        assertThat(code.resultVariable()).isEqualTo("union_1");
        assertThat(tools.validateTree("p1", null).valid()).isTrue();
    }

    @Test
    void updateReorderAndRegenerate() {
        FeatureTreeResult imported = tools.importScript("p1", TWO_BOXES, null);
        List<FeatureNode> nodes = imported.tree().orderedNodes();

        FeatureTreeResult updated = tools.updateNode("p1", nodes.get(1).id(), "{\"arg_0\": 4}", null);
        assertThat(updated.version()).isEqualTo(2);
        assertThat(updated.dirty()).isTrue();

        String order = "[\"" + nodes.get(2).id() + "\", \"" + nodes.get(3).id() + "\", \""
                + nodes.get(0).id() + "\", \"" + nodes.get(1).id() + "\"]";
        FeatureTreeResult reordered = tools.reorderNodes("p1", order, null);
        assertThat(reordered.tree().getRegenerationOrder()).startsWith(nodes.get(2).id());
        assertThat(reordered.needsFullRegeneration()).isTrue();

        GeneratedCodeResult regenerated = tools.regenerate("p1", null);
        assertThat(regenerated.version()).isEqualTo(4);
        assertThat(regenerated.code()).contains("box_1 = workplane_1.box(4, 1, 1)");
        assertThat(tools.getTree("p1", null).dirty()).isFalse();
        assertThat(tools.listVersions("p1").versions()).hasSize(4);
    }

    @Test
    void parameterToolsWorkOnScriptsAndProjects() {
        ParameterPatchResult patchedScript = tools.patchParameter("size", "3", TWO_BOXES, null, null);
        assertThat(patchedScript.version()).isNull();
        assertThat(patchedScript.script()).contains("size = 3\n");
        assertThat(patchedScript.parameters()).extracting(Parameter::value).containsExactly(3L);

        tools.importScript("p1", TWO_BOXES, null);
        assertThat(tools.extractParameters(null, "p1").parameters()).extracting(Parameter::originalSourceName)
                .containsExactly("size");

        ParameterPatchResult patchedProject = tools.patchParameter("size", "2.5", null, "p1", "erin");
        assertThat(patchedProject.version()).isEqualTo(2);
        assertThat(patchedProject.script()).contains("size = 2.5\n");
        assertThat(tools.getTree("p1", null).tree().orderedNodes().get(3).parameter("arg_0"))
                .map(Parameter::value).contains(2.5);
    }

    @Test
    void blankArgumentsAreRejected() {
        assertThatThrownBy(() -> tools.getTree(" ", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("参数错误：projectId 不能为空");
        assertThatThrownBy(() -> tools.addNode("p1", "bogus", null, null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("未知的特征类型：bogus");
        assertThatThrownBy(() -> tools.updateNode("p1", "n", " ", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleteTreeRemovesAllVersions() {
        tools.importScript("p1", TWO_BOXES, null);

        assertThat(tools.deleteTree("p1", null).deleted()).isTrue();
        assertThat(tools.deleteTree("p1", null).deleted()).isFalse();
        assertThatThrownBy(() -> tools.suggestNodes("p1", null))
                .isInstanceOf(FeatureTreeNotFoundException.class);
    }
}
