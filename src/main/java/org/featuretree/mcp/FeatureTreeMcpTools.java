package org.featuretree.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.featuretree.dto.DeleteResult;
import org.featuretree.dto.FeatureTreeResult;
import org.featuretree.dto.GeneratedCodeResult;
import org.featuretree.dto.NodeAdditionResult;
import org.featuretree.dto.ParameterListResult;
import org.featuretree.dto.ParameterPatchResult;
import org.featuretree.dto.SuggestionResult;
import org.featuretree.dto.TreeValidationResult;
import org.featuretree.dto.VersionListResult;
import org.featuretree.generate.GeneratedScript;
import org.featuretree.model.FeatureNode;
import org.featuretree.model.FeatureReference;
import org.featuretree.model.FeatureTree;
import org.featuretree.model.FeatureType;
import org.featuretree.model.Parameter;
import org.featuretree.model.ReferenceRole;
import org.featuretree.service.FeatureTreeService;
import org.featuretree.service.Regeneration;
import org.featuretree.service.TreeEdit;
import org.featuretree.validate.FeatureValidationException;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 特征树 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>导入 CadQuery 脚本为特征树（{@code ft_import_script}），查询版本与历史（{@code ft_get_tree}/{@code ft_list_versions}）。</li>
 *   <li>结构编辑（{@code ft_add_node}/{@code ft_remove_node}/{@code ft_reorder_nodes}）与参数编辑（{@code ft_update_node}）。</li>
 *   <li>校验与建议（{@code ft_validate_tree}/{@code ft_suggest_nodes}）。</li>
 *   <li>从树生成脚本（{@code ft_generate_code}/{@code ft_regenerate}）。</li>
 *   <li>设计参数的提取与原位修改（{@code ft_extract_parameters}/{@code ft_patch_parameter}）。</li>
 * </ul>
 * <p>
 * 每次编辑都会产生一个新版本；被校验拒绝的编辑不会改变任何已存版本。
 */
@Component
public class FeatureTreeMcpTools {

    /**
     * 解析 JSON 形式的工具入参（参数表、引用列表、顺序、参数值）。
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final FeatureTreeService service;

    public FeatureTreeMcpTools(FeatureTreeService service) {
        this.service = service;
    }

    @Tool(
            name = "ft_import_script",
            description = "解析 CadQuery 脚本，构建特征树并保存为项目的新版本（首次导入为版本 1）；脚本顶部的设计参数一并提取。"
    )
    /**
     * 导入脚本。语法错误时报告行号、列号与出错的行。
     */
    public FeatureTreeResult importScript(
            @ToolParam(description = "项目 ID（字母、数字与 . _ -）") String projectId,
            @ToolParam(description = "CadQuery Python 脚本全文") String script,
            @ToolParam(required = false, description = "作者（为空默认 app.feature-tree.default-created-by）") String author
    ) {
        requireText(projectId, "projectId");
        FeatureTree tree = service.importScript(projectId, script, author);
        return FeatureTreeResult.of(tree, List.of());
    }

    @Tool(
            name = "ft_get_tree",
            description = "读取项目的特征树（默认最新版本），包括节点、父引用、重建顺序与设计参数。"
    )
    public FeatureTreeResult getTree(
            @ToolParam(description = "项目 ID") String projectId,
            @ToolParam(required = false, description = "版本号（为空返回最新版本）") Integer version
    ) {
        requireText(projectId, "projectId");
        return FeatureTreeResult.of(service.getTree(projectId, version), List.of());
    }

    @Tool(
            name = "ft_list_versions",
            description = "列出项目的全部版本（版本号、节点数、作者、产生该版本的操作与内容 sha256）。"
    )
    public VersionListResult listVersions(
            @ToolParam(description = "项目 ID") String projectId
    ) {
        requireText(projectId, "projectId");
        return new VersionListResult(projectId, service.listVersions(projectId));
    }

    @Tool(
            name = "ft_add_node",
            description = "向最新版本添加一个特征节点。先做结构与语义校验：不合法时不保存，并返回拒绝原因和可以合法添加的替代类型。"
    )
    /**
     * 添加节点。
     * <p>
     * 典型用法：
     * <ul>
     *   <li>在草图上拉伸：type=extrude，parentId=草图节点，parameters={"arg_0": 10}。</li>
     *   <li>布尔并集：type=union，parentId=第一个实体，references=["第二个实体"]。</li>
     * </ul>
     */
    public NodeAdditionResult addNode(
            @ToolParam(description = "项目 ID") String projectId,
            @ToolParam(description = "特征类型，例如 workplane/sketch/extrude/fillet/union/pattern_linear") String type,
            @ToolParam(required = false, description = "节点名称（为空使用类型名）") String name,
            @ToolParam(required = false, description = "父节点 ID（作为第一条父引用，即布尔运算的基体）") String parentId,
            @ToolParam(required = false, description = "参数（JSON 对象，例如 {\"radius\": 5} 或 {\"arg_0\": 10}）") String parameters,
            @ToolParam(required = false, description = "额外父引用（JSON 数组，元素为节点 ID 或 {\"targetNodeId\":...,\"role\":\"solid\"}）") String references,
            @ToolParam(required = false, description = "节点 ID（为空自动生成）") String nodeId,
            @ToolParam(required = false, description = "作者") String author
    ) {
        requireText(projectId, "projectId");
        requireText(type, "type");
        FeatureType featureType = FeatureType.fromValue(type);
        FeatureNode candidate = FeatureNode.create(nodeId, name, featureType,
                parseParameters(parameters), parseReferences(references));
        try {
            TreeEdit edit = service.addNode(projectId, candidate, blankToNull(parentId), author);
            FeatureTree tree = edit.tree();
            return new NodeAdditionResult(true, projectId, tree.getVersion(), candidate.id(),
                    List.of(), edit.warnings(), List.of(), tree);
        } catch (FeatureValidationException e) {
            int current = service.getTree(projectId, null).getVersion();
            return new NodeAdditionResult(false, projectId, current, candidate.id(),
                    e.getReasons(), List.of(), e.getAlternatives(), null);
        }
    }

    @Tool(
            name = "ft_remove_node",
            description = "删除一个节点；依赖它的后代节点会一并删除（结果中列出）。"
    )
    public FeatureTreeResult removeNode(
            @ToolParam(description = "项目 ID") String projectId,
            @ToolParam(description = "节点 ID") String nodeId,
            @ToolParam(required = false, description = "作者") String author
    ) {
        requireText(projectId, "projectId");
        requireText(nodeId, "nodeId");
        TreeEdit edit = service.removeNode(projectId, nodeId, author);
        return FeatureTreeResult.of(edit.tree(), edit.warnings());
    }

    @Tool(
            name = "ft_update_node",
            description = "修改节点已有参数的取值（类型需一致；半径/直径必须为正，count 必须为正整数）。"
    )
    public FeatureTreeResult updateNode(
            @ToolParam(description = "项目 ID") String projectId,
            @ToolParam(description = "节点 ID") String nodeId,
            @ToolParam(description = "参数修改（JSON 对象，键为参数名，例如 {\"radius\": 2.5}）") String changes,
            @ToolParam(required = false, description = "作者") String author
    ) {
        requireText(projectId, "projectId");
        requireText(nodeId, "nodeId");
        Map<String, Object> parsed = parseObject(changes, "changes");
        TreeEdit edit = service.updateNodeParameters(projectId, nodeId, parsed, author);
        return FeatureTreeResult.of(edit.tree(), edit.warnings());
    }

    @Tool(
            name = "ft_reorder_nodes",
            description = "替换重建顺序：必须列出全部节点且每个节点排在它的父节点之后。"
    )
    public FeatureTreeResult reorderNodes(
            @ToolParam(description = "项目 ID") String projectId,
            @ToolParam(description = "新的重建顺序（JSON 字符串数组，元素为节点 ID）") String order,
            @ToolParam(required = false, description = "作者") String author
    ) {
        requireText(projectId, "projectId");
        List<String> newOrder = parseStringList(order, "order");
        TreeEdit edit = service.reorderNodes(projectId, newOrder, author);
        return FeatureTreeResult.of(edit.tree(), edit.warnings());
    }

    @Tool(
            name = "ft_validate_tree",
            description = "检查特征树的不变式：引用存在、无环、重建顺序为拓扑序且覆盖全部节点、根节点有效。"
    )
    public TreeValidationResult validateTree(
            @ToolParam(description = "项目 ID") String projectId,
            @ToolParam(required = false, description = "版本号（为空校验最新版本）") Integer version
    ) {
        requireText(projectId, "projectId");
        FeatureTree tree = service.getTree(projectId, version);
        List<String> errors = service.validate(projectId, tree.getVersion());
        return new TreeValidationResult(projectId, tree.getVersion(), errors.isEmpty(), errors);
    }

    @Tool(
            name = "ft_suggest_nodes",
            description = "建议在某个节点之后可以合法添加的特征类型（附说明）；不指定父节点时返回可以作为起点的类型。"
    )
    public SuggestionResult suggestNodes(
            @ToolParam(description = "项目 ID") String projectId,
            @ToolParam(required = false, description = "父节点 ID") String parentId
    ) {
        requireText(projectId, "projectId");
        String parent = blankToNull(parentId);
        return new SuggestionResult(projectId, parent, service.suggest(projectId, parent));
    }

    @Tool(
            name = "ft_generate_code",
            description = "按依赖顺序从特征树生成 CadQuery 脚本（只读，不产生新版本）。"
    )
    public GeneratedCodeResult generateCode(
            @ToolParam(description = "项目 ID") String projectId,
            @ToolParam(required = false, description = "版本号（为空使用最新版本）") Integer version
    ) {
        requireText(projectId, "projectId");
        FeatureTree tree = service.getTree(projectId, version);
        return toResult(projectId, tree.getVersion(), service.generateCode(projectId, tree.getVersion()));
    }

    @Tool(
            name = "ft_regenerate",
            description = "重新计算重建顺序并生成脚本，作为新版本保存（清除 dirty 标记）。依赖存在环时报错。"
    )
    public GeneratedCodeResult regenerate(
            @ToolParam(description = "项目 ID") String projectId,
            @ToolParam(required = false, description = "作者") String author
    ) {
        requireText(projectId, "projectId");
        Regeneration regeneration = service.regenerate(projectId, author);
        return toResult(projectId, regeneration.tree().getVersion(), regeneration.script());
    }

    @Tool(
            name = "ft_extract_parameters",
            description = "提取脚本顶部的设计参数（第一个 CadQuery 调用之前的字面量赋值），含推断的单位与建议范围。"
    )
    public ParameterListResult extractParameters(
            @ToolParam(required = false, description = "脚本全文（与 projectId 二选一）") String script,
            @ToolParam(required = false, description = "项目 ID（使用最新版本的源脚本）") String projectId
    ) {
        if (script != null && !script.isBlank()) {
            return new ParameterListResult(service.extractParameters(script));
        }
        requireText(projectId, "projectId");
        String source = service.getTree(projectId, null).getSourceScript();
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("项目没有源脚本：" + projectId);
        }
        return new ParameterListResult(service.extractParameters(source));
    }

    @Tool(
            name = "ft_patch_parameter",
            description = "在脚本中原位修改一个顶层设计参数（只改这一处赋值，其余文本不变）。指定 projectId 时修改项目源脚本并保存为新版本。"
    )
    /**
     * 修改设计参数。value 按 JSON 解析：{@code 12.5}、{@code true}、{@code [0, 0, 1]}、{@code "XY"}。
     */
    public ParameterPatchResult patchParameter(
            @ToolParam(description = "变量名（即参数的 originalSourceName）") String name,
            @ToolParam(description = "新值（JSON 字面量）") String value,
            @ToolParam(required = false, description = "脚本全文（与 projectId 二选一）") String script,
            @ToolParam(required = false, description = "项目 ID") String projectId,
            @ToolParam(required = false, description = "作者") String author
    ) {
        requireText(name, "name");
        Object newValue = parseValue(value);
        if (script != null && !script.isBlank()) {
            String patched = service.patchScript(script, name, newValue);
            return new ParameterPatchResult(null, null, name, patched, service.extractParameters(patched));
        }
        requireText(projectId, "projectId");
        FeatureTree tree = service.patchParameter(projectId, name, newValue, author);
        return new ParameterPatchResult(projectId, tree.getVersion(), name, tree.getSourceScript(),
                tree.getGlobalParameters());
    }

    @Tool(
            name = "ft_delete_tree",
            description = "删除项目的一个版本，或（不指定版本时）删除项目的全部版本。"
    )
    public DeleteResult deleteTree(
            @ToolParam(description = "项目 ID") String projectId,
            @ToolParam(required = false, description = "版本号（为空删除全部版本）") Integer version
    ) {
        requireText(projectId, "projectId");
        return new DeleteResult(projectId, version, service.deleteTree(projectId, version));
    }

    // ---------------------------------------------------------------------
    // 入参解析
    // ---------------------------------------------------------------------

    private static GeneratedCodeResult toResult(String projectId, int version, GeneratedScript script) {
        return new GeneratedCodeResult(projectId, version, script.code(), script.resultVariable(),
                script.variables(), script.warnings());
    }

    static List<Parameter> parseParameters(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        List<Parameter> parameters = new ArrayList<>();
        for (Map.Entry<String, Object> entry : parseObject(json, "parameters").entrySet()) {
            parameters.add(Parameter.of(entry.getKey(), entry.getValue()));
        }
        return parameters;
    }

    static List<FeatureReference> parseReferences(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JsonNode root = readTree(json, "references");
        if (!root.isArray()) {
            throw new IllegalArgumentException("references 格式错误：必须是 JSON 数组");
        }
        List<FeatureReference> references = new ArrayList<>();
        for (JsonNode item : root) {
            if (item.isTextual()) {
                references.add(FeatureReference.feature(item.asText()));
            } else if (item.isObject() && item.hasNonNull("targetNodeId")) {
                ReferenceRole role = ReferenceRole.fromValue(item.path("role").asText(null));
                references.add(new FeatureReference(item.get("targetNodeId").asText(), role));
            } else {
                throw new IllegalArgumentException("references 元素格式错误（需要节点 ID 或含 targetNodeId 的对象）：" + item);
            }
        }
        return references;
    }

    static Map<String, Object> parseObject(String json, String field) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("参数错误：" + field + " 不能为空");
        }
        Map<String, Object> parsed;
        try {
            parsed = OBJECT_MAPPER.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {
            });
        } catch (Exception e) {
            throw new IllegalArgumentException(field + " 不是合法的 JSON 对象：" + e.getMessage(), e);
        }
        if (parsed == null) {
            throw new IllegalArgumentException(field + " 格式错误：必须是 JSON 对象");
        }
        return parsed;
    }

    static List<String> parseStringList(String json, String field) {
        JsonNode root = readTree(json, field);
        if (!root.isArray()) {
            throw new IllegalArgumentException(field + " 格式错误：必须是 JSON 字符串数组");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : root) {
            if (!item.isTextual()) {
                throw new IllegalArgumentException(field + " 元素必须是字符串：" + item);
            }
            out.add(item.asText());
        }
        return out;
    }

    static Object parseValue(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("参数错误：value 不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(json, Object.class);
        } catch (Exception e) {
            throw new IllegalArgumentException("value 不是合法的 JSON 字面量（字符串需要加双引号）：" + json, e);
        }
    }

    private static JsonNode readTree(String json, String field) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("参数错误：" + field + " 不能为空");
        }
        try {
            return OBJECT_MAPPER.readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException(field + " 不是合法的 JSON：" + e.getMessage(), e);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("参数错误：" + field + " 不能为空");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
