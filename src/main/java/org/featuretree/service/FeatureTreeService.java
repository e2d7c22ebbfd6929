package org.featuretree.service;

import org.featuretree.generate.CadQueryCodeGenerator;
import org.featuretree.generate.GeneratedScript;
import org.featuretree.model.FeatureNode;
import org.featuretree.model.FeatureTree;
import org.featuretree.model.FeatureTreeOperation;
import org.featuretree.model.OperationType;
import org.featuretree.model.Parameter;
import org.featuretree.model.ParameterValues;
import org.featuretree.params.ParameterChangeValidator;
import org.featuretree.params.ParameterExtractor;
import org.featuretree.params.ParameterPatcher;
import org.featuretree.parse.FeatureTreeParser;
import org.featuretree.resolve.DependencyResolver;
import org.featuretree.store.FeatureTreeNotFoundException;
import org.featuretree.store.FeatureTreeStore;
import org.featuretree.store.FeatureTreeVersion;
import org.featuretree.validate.AdditionSuggestion;
import org.featuretree.validate.FeatureTreeValidator;
import org.featuretree.validate.FeatureValidationException;
import org.featuretree.validate.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 特征树的应用服务：把解析、校验、排序、生成与版本存储串成完整的编辑流程。
 * <p>
 * 每次逻辑编辑都遵循同一模式：
 * <ol>
 *   <li>读取最新版本；</li>
 *   <li>在 {@link FeatureTree#nextVersion(String)} 得到的副本上修改；</li>
 *   <li>校验通过才提交为新版本（版本号 +1），否则抛出 {@link FeatureValidationException}，已存版本不受影响；</li>
 *   <li>并发编辑同一版本时，后提交者收到 {@code VersionConflictException}。</li>
 * </ol>
 */
public class FeatureTreeService {

    private static final Logger log = LoggerFactory.getLogger(FeatureTreeService.class);

    private final FeatureTreeStore store;
    private final FeatureTreeParser parser;
    private final FeatureTreeValidator validator;
    private final DependencyResolver resolver;
    private final CadQueryCodeGenerator generator;
    private final ParameterExtractor extractor;
    private final ParameterPatcher patcher;
    private final ParameterChangeValidator changeValidator;
    private final FeatureTreeProperties properties;

    public FeatureTreeService(FeatureTreeStore store, FeatureTreeParser parser, FeatureTreeValidator validator,
                              DependencyResolver resolver, CadQueryCodeGenerator generator,
                              ParameterExtractor extractor, ParameterPatcher patcher,
                              ParameterChangeValidator changeValidator, FeatureTreeProperties properties) {
        this.store = store;
        this.parser = parser;
        this.validator = validator;
        this.resolver = resolver;
        this.generator = generator;
        this.extractor = extractor;
        this.patcher = patcher;
        this.changeValidator = changeValidator;
        this.properties = properties;
    }

    // ---------------------------------------------------------------------
    // 导入与查询
    // ---------------------------------------------------------------------

    /**
     * 解析脚本并保存为项目的新版本（项目不存在时为版本 1）。顶层设计参数写入 {@code globalParameters}。
     */
    public FeatureTree importScript(String projectId, String script, String author) {
        requireScriptSize(script);
        String by = author(author);
        FeatureTree tree = parser.parse(script, projectId, by);
        tree.setGlobalParameters(extractor.extract(script));
        int version = store.get(projectId, null).map(t -> t.getVersion() + 1).orElse(1);
        tree.setVersion(version);
        tree.setLastOperation(FeatureTreeOperation.of(OperationType.IMPORT, null,
                "Imported script with " + tree.getNodes().size() + " nodes"));

        List<String> errors = validator.validateTree(tree);
        if (!errors.isEmpty()) {
            throw new FeatureValidationException(errors, List.of());
        }
        store.put(tree);
        log.info("导入脚本：project={}, version={}, nodes={}, parameters={}",
                projectId, version, tree.getNodes().size(), tree.getGlobalParameters().size());
        return tree;
    }

    /**
     * @param version 为 null 时返回最新版本
     * @throws FeatureTreeNotFoundException 项目或版本不存在
     */
    public FeatureTree getTree(String projectId, Integer version) {
        return store.get(projectId, version)
                .orElseThrow(() -> new FeatureTreeNotFoundException(projectId, version));
    }

    public List<FeatureTreeVersion> listVersions(String projectId) {
        List<FeatureTreeVersion> versions = store.listVersions(projectId);
        if (versions.isEmpty()) {
            throw new FeatureTreeNotFoundException(projectId, null);
        }
        return versions;
    }

    public boolean deleteTree(String projectId, Integer version) {
        boolean removed = store.delete(projectId, version);
        log.info("删除特征树：project={}, version={}, removed={}", projectId, version == null ? "all" : version, removed);
        return removed;
    }

    // ---------------------------------------------------------------------
    // 结构编辑
    // ---------------------------------------------------------------------

    /**
     * 新增节点。校验失败时携带拒绝原因与（最多 {@code suggestion-limit} 条）替代方案。
     */
    public TreeEdit addNode(String projectId, FeatureNode candidate, String parentId, String author) {
        FeatureTree current = getTree(projectId, null);
        ValidationResult result = validator.validateAddition(current, candidate, parentId);
        if (!result.valid()) {
            throw new FeatureValidationException(result.errors(), alternatives(current, parentId));
        }

        FeatureTree next = current.nextVersion(author(author));
        next.addNode(candidate, parentId);
        next.markStructuralChange();
        next.setLastOperation(new FeatureTreeOperation(OperationType.ADD, candidate.id(), parentId, null, null,
                "Added " + candidate.featureType().value() + " node " + candidate.name(), Instant.now()));
        commit(next);
        log.info("新增节点：project={}, version={}, node={}({}), nodes={}", projectId, next.getVersion(),
                candidate.name(), candidate.featureType().value(), next.getNodes().size());
        return new TreeEdit(next, result.warnings());
    }

    /**
     * 删除节点，依赖它的后代一并删除（它们无法再重建）。
     */
    public TreeEdit removeNode(String projectId, String nodeId, String author) {
        FeatureTree current = getTree(projectId, null);
        FeatureNode node = current.node(nodeId)
                .orElseThrow(() -> new FeatureTreeNotFoundException(projectId, current.getVersion(), nodeId));

        FeatureTree next = current.nextVersion(author(author));
        List<String> removed = next.removeNode(nodeId);
        next.markStructuralChange();
        next.setLastOperation(FeatureTreeOperation.of(OperationType.REMOVE, nodeId,
                "Removed " + node.featureType().value() + " node " + node.name()
                        + (removed.size() > 1 ? " and " + (removed.size() - 1) + " dependents" : "")));
        commit(next);

        List<String> dependents = new ArrayList<>(removed);
        dependents.remove(nodeId);
        List<String> warnings = new ArrayList<>();
        if (!dependents.isEmpty()) {
            warnings.add("Also removed dependent nodes: " + dependents);
        }
        log.info("删除节点：project={}, version={}, removed={}", projectId, next.getVersion(), removed);
        return new TreeEdit(next, warnings);
    }

    /**
     * 修改节点已有参数的取值（参数化修改：不改变结构，重建顺序不变）。
     * <p>
     * 树与源脚本一致时，取自顶层设计参数且取值未变的参数改为修改源脚本中的赋值，再重新解析，
     * 使用同一设计参数的其他特征随之更新（重新解析后节点 id 会变化）；其余参数直接写入节点。
     */
    public TreeEdit updateNodeParameters(String projectId, String nodeId, Map<String, Object> changes, String author) {
        FeatureTree current = getTree(projectId, null);
        FeatureNode node = current.node(nodeId)
                .orElseThrow(() -> new FeatureTreeNotFoundException(projectId, current.getVersion(), nodeId));
        List<String> errors = changeValidator.validate(node, changes);
        if (!errors.isEmpty()) {
            throw new FeatureValidationException(errors, List.of());
        }

        Map<String, String> linked = sourceLinkedParameters(current, node, changes);
        FeatureTree next;
        List<String> warnings = new ArrayList<>();
        if (linked.isEmpty()) {
            next = current.nextVersion(author(author));
            next.replaceNodeParameters(nodeId, changes);
            next.markParametricChange();
        } else {
            String patched = current.getSourceScript();
            Map<String, Object> remaining = new LinkedHashMap<>(changes);
            for (Map.Entry<String, String> entry : linked.entrySet()) {
                patched = patcher.patch(patched, entry.getValue(), remaining.remove(entry.getKey()));
            }
            next = reparse(current, patched, author);
            if (!remaining.isEmpty()) {
                // 重新解析后节点 id 会变，按节点名对应
                FeatureNode reparsed = nodeNamed(next, node.name());
                if (reparsed == null) {
                    throw new FeatureValidationException(List.of("Node " + node.name()
                            + " no longer exists after updating the source script"), List.of());
                }
                next.replaceNodeParameters(reparsed.id(), remaining);
                next.markParametricChange();
            }
            warnings.add("Updated design parameters " + new ArrayList<>(new LinkedHashSet<>(linked.values()))
                    + " in the source script; every feature using them follows the new value");
        }
        next.setLastOperation(new FeatureTreeOperation(OperationType.MODIFY, nodeId, null,
                new LinkedHashMap<>(changes), null,
                "Changed " + String.join(", ", changes.keySet()) + " of " + node.name(), Instant.now()));
        commit(next);
        log.info("修改参数：project={}, version={}, node={}, changed={}, viaSource={}", projectId, next.getVersion(),
                node.name(), changes.keySet(), linked.values());
        return new TreeEdit(next, warnings);
    }

    /**
     * 替换重建顺序。新顺序必须覆盖全部节点，且每个节点排在它的所有父节点之后。
     */
    public TreeEdit reorderNodes(String projectId, List<String> newOrder, String author) {
        FeatureTree current = getTree(projectId, null);
        FeatureTree next = current.nextVersion(author(author));
        try {
            next.reorder(newOrder);
        } catch (IllegalArgumentException e) {
            throw new FeatureValidationException(List.of("Reorder must list every node exactly once: " + newOrder),
                    List.of());
        }
        next.markStructuralChange();
        next.setLastOperation(new FeatureTreeOperation(OperationType.REORDER, null, null, null,
                List.copyOf(newOrder), "Reordered " + newOrder.size() + " nodes", Instant.now()));
        commit(next);
        log.info("重排节点：project={}, version={}", projectId, next.getVersion());
        return new TreeEdit(next, List.of());
    }

    // ---------------------------------------------------------------------
    // 校验与建议
    // ---------------------------------------------------------------------

    /**
     * @return 树的不变式违例；为空表示合法
     */
    public List<String> validate(String projectId, Integer version) {
        return validator.validateTree(getTree(projectId, version));
    }

    public List<AdditionSuggestion> suggest(String projectId, String parentId) {
        FeatureTree tree = getTree(projectId, null);
        if (parentId != null && !tree.containsNode(parentId)) {
            throw new FeatureTreeNotFoundException(projectId, tree.getVersion(), parentId);
        }
        return validator.suggestAdditions(tree, parentId);
    }

    // ---------------------------------------------------------------------
    // 代码生成
    // ---------------------------------------------------------------------

    /** 按指定版本生成脚本，不产生新版本。 */
    public GeneratedScript generateCode(String projectId, Integer version) {
        return generator.generateScript(getTree(projectId, version));
    }

    /**
     * 重新计算重建顺序并生成脚本，保存为新版本（清除 dirty 标记）。
     *
     * @throws org.featuretree.resolve.DependencyCycleException 依赖图存在环
     */
    public Regeneration regenerate(String projectId, String author) {
        FeatureTree current = getTree(projectId, null);
        FeatureTree next = current.nextVersion(author(author));
        next.setRegenerationOrder(resolver.resolve(next));
        GeneratedScript script = generator.generateScript(next);
        next.markRegenerated(script.code());
        next.setLastOperation(FeatureTreeOperation.of(OperationType.REGENERATE, null,
                "Regenerated script from " + next.getNodes().size() + " nodes"));
        commit(next);
        log.info("重新生成脚本：project={}, version={}, warnings={}", projectId, next.getVersion(),
                script.warnings().size());
        return new Regeneration(next, script);
    }

    // ---------------------------------------------------------------------
    // 设计参数
    // ---------------------------------------------------------------------

    public List<Parameter> extractParameters(String script) {
        requireScriptSize(script);
        return extractor.extract(script);
    }

    /** 在脚本文本中原位修改一个顶层设计参数，返回修改后的脚本。 */
    public String patchScript(String script, String sourceName, Object newValue) {
        requireScriptSize(script);
        return patcher.patch(script, sourceName, newValue);
    }

    /**
     * 修改项目源脚本中的设计参数，并以修改后的脚本重新解析出新版本。
     * 树上有尚未 regenerate 的编辑时拒绝修改，已存版本不变。
     */
    public FeatureTree patchParameter(String projectId, String sourceName, Object newValue, String author) {
        FeatureTree current = getTree(projectId, null);
        String source = current.getSourceScript();
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("项目 " + projectId + " 没有源脚本，无法修改设计参数");
        }
        requireScriptInSync(current, sourceName);
        String patched = patcher.patch(source, sourceName, newValue);
        FeatureTree next = reparse(current, patched, author);
        next.setLastOperation(new FeatureTreeOperation(OperationType.PATCH, null, null,
                Collections.singletonMap(sourceName, newValue), null, "Set " + sourceName + " in source script", Instant.now()));
        commit(next);
        log.info("修改设计参数：project={}, version={}, parameter={}", projectId, next.getVersion(), sourceName);
        return next;
    }

    private static FeatureNode nodeNamed(FeatureTree tree, String name) {
        for (FeatureNode candidate : tree.orderedNodes()) {
            if (candidate.name().equals(name)) {
                return candidate;
            }
        }
        return null;
    }

    /** 以修改后的脚本重新解析出 current 的下一个版本。 */
    private FeatureTree reparse(FeatureTree current, String script, String author) {
        FeatureTree next = parser.parse(script, current.getProjectId(), author(author));
        next.setGlobalParameters(extractor.extract(script));
        next.setName(current.getName());
        next.setDescription(current.getDescription());
        next.setVersion(current.getVersion() + 1);
        return next;
    }

    /**
     * 树上有尚未写回脚本的编辑时，按源脚本重新解析会丢掉这些编辑，必须先 regenerate。
     */
    private void requireScriptInSync(FeatureTree current, String sourceName) {
        if (current.isDirty()) {
            throw new FeatureValidationException(List.of("Version " + current.getVersion()
                    + " has edits that are not in its script yet. Regenerate the script before changing design parameter "
                    + sourceName + "."), List.of());
        }
    }

    /**
     * 找出取自顶层设计参数、且当前取值仍等于该设计参数的被修改参数。
     *
     * @return 参数名 -> 设计参数的源变量名；树与脚本不一致或没有此类参数时为空
     */
    private Map<String, String> sourceLinkedParameters(FeatureTree current, FeatureNode node, Map<String, Object> changes) {
        Map<String, String> linked = new LinkedHashMap<>();
        if (current.isDirty() || current.getSourceScript() == null || current.getSourceScript().isBlank()) {
            return linked;
        }
        Map<String, Object> designValues = new LinkedHashMap<>();
        for (Parameter global : current.getGlobalParameters()) {
            if (global.originalSourceName() != null) {
                designValues.putIfAbsent(global.originalSourceName(), global.value());
            }
        }
        Map<String, Object> valueBySource = new LinkedHashMap<>();
        for (Map.Entry<String, Object> change : changes.entrySet()) {
            Parameter parameter = node.parameter(change.getKey()).orElse(null);
            String source = parameter == null ? null : parameter.originalSourceName();
            if (source == null || !designValues.containsKey(source)
                    || !ParameterValues.sameValue(designValues.get(source), parameter.value())) {
                continue;
            }
            if (valueBySource.containsKey(source)
                    && !ParameterValues.sameValue(valueBySource.get(source), change.getValue())) {
                throw new FeatureValidationException(List.of("Parameters of " + node.name()
                        + " that come from design parameter " + source + " were given different values"), List.of());
            }
            valueBySource.put(source, change.getValue());
            linked.put(change.getKey(), source);
        }
        return linked;
    }

    // ---------------------------------------------------------------------

    private void commit(FeatureTree next) {
        List<String> errors = validator.validateTree(next);
        if (!errors.isEmpty()) {
            throw new FeatureValidationException(errors, List.of());
        }
        store.put(next);
    }

    private List<AdditionSuggestion> alternatives(FeatureTree tree, String parentId) {
        if (parentId != null && !tree.containsNode(parentId)) {
            return List.of();
        }
        List<AdditionSuggestion> all = validator.suggestAdditions(tree, parentId);
        return all.size() <= properties.getSuggestionLimit() ? all : all.subList(0, properties.getSuggestionLimit());
    }

    private void requireScriptSize(String script) {
        if (script == null) {
            throw new IllegalArgumentException("script 不能为空");
        }
        long bytes = script.getBytes(StandardCharsets.UTF_8).length;
        long max = properties.getMaxScriptSize().toBytes();
        if (bytes > max) {
            throw new IllegalArgumentException("脚本过大：" + bytes + " 字节，上限 " + max + " 字节");
        }
    }

    private String author(String author) {
        return author == null || author.isBlank() ? properties.getDefaultCreatedBy() : author;
    }
}
