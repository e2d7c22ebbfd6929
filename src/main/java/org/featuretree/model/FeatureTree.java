package org.featuretree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * 一个设计版本的完整特征树（依赖图）。
 * <p>
 * 不变式（由校验器 {@code FeatureTreeValidator#validateTree} 检查）：
 * <ol>
 *   <li>{@code regenerationOrder} 与 {@code nodes.keySet()} 集合相等。</li>
 *   <li>{@code regenerationOrder} 是关于 {@code parentReferences} 的合法拓扑序。</li>
 *   <li>父引用图无环。</li>
 *   <li>从 {@code rootNodeId} 可达的节点都存在于 {@code nodes} 中。</li>
 * </ol>
 * <p>
 * 本类的变更方法只维护结构关系（childIds/root/顺序），<b>不做</b>合法性校验；
 * 调用方必须先校验再提交（validate-then-commit）。已持久化的版本视为不可变历史，编辑前先 {@link #copy()}。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeatureTree {

    private String id = UUID.randomUUID().toString();
    private String projectId;
    private int version = 1;
    private String name = "Feature Tree";
    private String description;
    private String rootNodeId;
    private Map<String, FeatureNode> nodes = new LinkedHashMap<>();
    private List<String> regenerationOrder = new ArrayList<>();
    private List<Parameter> globalParameters = new ArrayList<>();
    private String sourceScript;
    private boolean dirty;
    private boolean needsFullRegeneration;
    private Instant createdAt = Instant.now();
    private Instant updatedAt = createdAt;
    private String createdBy;
    private FeatureTreeOperation lastOperation;

    public FeatureTree() {
    }

    public FeatureTree(String projectId, int version, String createdBy) {
        this.projectId = projectId;
        this.version = version;
        this.createdBy = createdBy;
    }

    // ---------------------------------------------------------------------
    // 变更
    // ---------------------------------------------------------------------

    /**
     * 加入节点。若指定了 parentId，它成为节点的第一个父引用（基体），尚未引用时补一条 FEATURE 引用。
     */
    public void addNode(FeatureNode node, String parentId) {
        FeatureNode toAdd = node;
        if (parentId != null && nodes.containsKey(parentId)) {
            toAdd = toAdd.withPrimaryParent(FeatureReference.feature(parentId));
        }
        nodes.put(toAdd.id(), toAdd.withChildIds(List.of()));
        regenerationOrder.remove(toAdd.id());
        regenerationOrder.add(toAdd.id());
        if (rootNodeId == null) {
            rootNodeId = toAdd.id();
        }
        rebuildChildIds();
        touch();
    }

    /**
     * 删除节点及其所有后代（依赖它的节点无法再重建）。
     *
     * @return 实际删除的节点 id（按删除前的节点顺序）
     */
    public List<String> removeNode(String nodeId) {
        if (!nodes.containsKey(nodeId)) {
            return List.of();
        }
        Set<String> doomed = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(nodeId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (doomed.add(current)) {
                queue.addAll(dependentsOf(current));
            }
        }
        List<String> removed = new ArrayList<>();
        for (String id : new ArrayList<>(nodes.keySet())) {
            if (doomed.contains(id)) {
                nodes.remove(id);
                removed.add(id);
            }
        }
        regenerationOrder.removeIf(doomed::contains);
        if (rootNodeId != null && doomed.contains(rootNodeId)) {
            rootNodeId = regenerationOrder.isEmpty() ? null : regenerationOrder.get(0);
        }
        rebuildChildIds();
        touch();
        return removed;
    }

    /**
     * 修改节点参数（只改已有参数）。
     *
     * @throws IllegalArgumentException 节点或参数不存在
     */
    public FeatureNode replaceNodeParameters(String nodeId, Map<String, Object> changes) {
        FeatureNode node = requireNode(nodeId);
        Map<String, Parameter> byName = node.parameterMap();
        for (String key : changes.keySet()) {
            if (!byName.containsKey(key)) {
                throw new IllegalArgumentException("节点 " + node.name() + " 不存在参数：" + key);
            }
        }
        List<Parameter> updated = new ArrayList<>(node.parameters().size());
        for (Parameter p : node.parameters()) {
            updated.add(changes.containsKey(p.name()) ? p.withValue(changes.get(p.name())) : p);
        }
        FeatureNode replaced = node.withParameters(updated);
        nodes.put(nodeId, replaced);
        touch();
        return replaced;
    }

    /**
     * 替换重建顺序。
     *
     * @throws IllegalArgumentException 新顺序与现有节点集合不一致
     */
    public void reorder(List<String> newOrder) {
        if (newOrder.size() != nodes.size() || !new LinkedHashSet<>(newOrder).equals(nodes.keySet())) {
            throw new IllegalArgumentException("新顺序必须与树中的节点完全一致（不多不少、不重复）");
        }
        regenerationOrder = new ArrayList<>(newOrder);
        touch();
    }

    /** 结构性修改：新增/删除/重排节点，需要完整重新生成脚本。 */
    public void markStructuralChange() {
        dirty = true;
        needsFullRegeneration = true;
    }

    /** 参数修改：只需重新执行，不需要重排/重建结构。 */
    public void markParametricChange() {
        dirty = true;
    }

    /** 脚本已根据当前树重新生成。 */
    public void markRegenerated(String script) {
        sourceScript = script;
        dirty = false;
        needsFullRegeneration = false;
        touch();
    }

    // ---------------------------------------------------------------------
    // 查询
    // ---------------------------------------------------------------------

    public Optional<FeatureNode> node(String nodeId) {
        return Optional.ofNullable(nodeId == null ? null : nodes.get(nodeId));
    }

    public FeatureNode requireNode(String nodeId) {
        FeatureNode node = nodeId == null ? null : nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("节点不存在：" + nodeId);
        }
        return node;
    }

    public boolean containsNode(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    /** 直接依赖 nodeId 的节点（前向边），按节点插入顺序。 */
    public List<String> dependentsOf(String nodeId) {
        List<String> result = new ArrayList<>();
        for (FeatureNode candidate : nodes.values()) {
            if (candidate.references(nodeId)) {
                result.add(candidate.id());
            }
        }
        return result;
    }

    /** nodeId 直接或间接依赖的所有节点（不含自身，除非存在环）。 */
    public Set<String> dependenciesOf(String nodeId) {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        FeatureNode start = nodes.get(nodeId);
        if (start == null) {
            return result;
        }
        for (FeatureReference ref : start.parentReferences()) {
            stack.push(ref.targetNodeId());
        }
        while (!stack.isEmpty()) {
            String current = stack.pop();
            FeatureNode node = nodes.get(current);
            if (node == null || !result.add(current)) {
                continue;
            }
            for (FeatureReference ref : node.parentReferences()) {
                stack.push(ref.targetNodeId());
            }
        }
        return result;
    }

    @JsonIgnore
    public List<FeatureNode> orderedNodes() {
        List<FeatureNode> ordered = new ArrayList<>(nodes.size());
        for (String nodeId : regenerationOrder) {
            FeatureNode node = nodes.get(nodeId);
            if (node != null) {
                ordered.add(node);
            }
        }
        return ordered;
    }

    // ---------------------------------------------------------------------
    // 复制（clone-on-write）
    // ---------------------------------------------------------------------

    /** 深拷贝：节点与参数本身不可变，复制容器即可。 */
    public FeatureTree copy() {
        FeatureTree copy = new FeatureTree();
        copy.id = id;
        copy.projectId = projectId;
        copy.version = version;
        copy.name = name;
        copy.description = description;
        copy.rootNodeId = rootNodeId;
        copy.nodes = new LinkedHashMap<>(nodes);
        copy.regenerationOrder = new ArrayList<>(regenerationOrder);
        copy.globalParameters = new ArrayList<>(globalParameters);
        copy.sourceScript = sourceScript;
        copy.dirty = dirty;
        copy.needsFullRegeneration = needsFullRegeneration;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.createdBy = createdBy;
        copy.lastOperation = lastOperation;
        return copy;
    }

    /** 基于当前树创建下一个版本（新 id、版本号 +1）。 */
    public FeatureTree nextVersion(String author) {
        FeatureTree next = copy();
        next.id = UUID.randomUUID().toString();
        next.version = version + 1;
        next.createdAt = Instant.now();
        next.updatedAt = next.createdAt;
        next.createdBy = author == null ? createdBy : author;
        next.lastOperation = null;
        return next;
    }

    private void rebuildChildIds() {
        Map<String, List<String>> children = new LinkedHashMap<>();
        for (String nodeId : nodes.keySet()) {
            children.put(nodeId, new ArrayList<>());
        }
        for (FeatureNode node : nodes.values()) {
            for (FeatureReference ref : node.parentReferences()) {
                List<String> list = children.get(ref.targetNodeId());
                if (list != null && !list.contains(node.id())) {
                    list.add(node.id());
                }
            }
        }
        for (Map.Entry<String, List<String>> entry : children.entrySet()) {
            FeatureNode node = nodes.get(entry.getKey());
            if (!node.childIds().equals(entry.getValue())) {
                nodes.put(entry.getKey(), node.withChildIds(entry.getValue()));
            }
        }
    }

    private void touch() {
        updatedAt = Instant.now();
    }

    // ---------------------------------------------------------------------
    // getter / setter（Jackson 序列化使用）
    // ---------------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getRootNodeId() {
        return rootNodeId;
    }

    public void setRootNodeId(String rootNodeId) {
        this.rootNodeId = rootNodeId;
    }

    public Map<String, FeatureNode> getNodes() {
        return nodes;
    }

    public void setNodes(Map<String, FeatureNode> nodes) {
        this.nodes = nodes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(nodes);
    }

    public List<String> getRegenerationOrder() {
        return regenerationOrder;
    }

    public void setRegenerationOrder(List<String> regenerationOrder) {
        this.regenerationOrder = regenerationOrder == null ? new ArrayList<>() : new ArrayList<>(regenerationOrder);
    }

    public List<Parameter> getGlobalParameters() {
        return globalParameters;
    }

    public void setGlobalParameters(List<Parameter> globalParameters) {
        this.globalParameters = globalParameters == null ? new ArrayList<>() : new ArrayList<>(globalParameters);
    }

    public String getSourceScript() {
        return sourceScript;
    }

    public void setSourceScript(String sourceScript) {
        this.sourceScript = sourceScript;
    }

    public boolean isDirty() {
        return dirty;
    }

    public void setDirty(boolean dirty) {
        this.dirty = dirty;
    }

    public boolean isNeedsFullRegeneration() {
        return needsFullRegeneration;
    }

    public void setNeedsFullRegeneration(boolean needsFullRegeneration) {
        this.needsFullRegeneration = needsFullRegeneration;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public FeatureTreeOperation getLastOperation() {
        return lastOperation;
    }

    public void setLastOperation(FeatureTreeOperation lastOperation) {
        this.lastOperation = lastOperation;
    }
}
