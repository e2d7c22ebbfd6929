package org.featuretree.validate;

import org.featuretree.model.FeatureNode;
import org.featuretree.model.FeatureReference;
import org.featuretree.model.FeatureTree;
import org.featuretree.model.FeatureType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 特征树校验：候选节点的结构/语义合法性、整棵树的不变式、以及“可以加什么”的建议。
 * <p>
 * 新增节点的检查顺序：
 * <ol>
 *   <li>id 冲突（致命）</li>
 *   <li>引用存在性（致命）</li>
 *   <li>父子类型兼容（查 {@link FeatureTypeRules#validParents}）</li>
 *   <li>布尔运算必须恰好有 2 个实体父节点</li>
 *   <li>环检测（在模拟插入后的图上做 DFS）</li>
 *   <li>影响可达性：非构造类节点必须能前向到达某个“无后继的实体”</li>
 *   <li>被绕过的圆角/倒角：只给警告，不阻止</li>
 * </ol>
 * 只有致命的结构错误会短路，其余错误全部收集后一次返回。
 */
public class FeatureTreeValidator {

    private static final Logger log = LoggerFactory.getLogger(FeatureTreeValidator.class);

    /**
     * 校验一次节点添加。
     *
     * @param tree      当前树（不会被修改）
     * @param candidate 候选节点
     * @param parentId  可选的父节点；作为第一条父引用（基体），节点尚未引用它时补一条 FEATURE 引用
     */
    public ValidationResult validateAddition(FeatureTree tree, FeatureNode candidate, String parentId) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (tree.containsNode(candidate.id())) {
            errors.add("Node with ID " + candidate.id() + " already exists in tree");
            return ValidationResult.of(errors, warnings);
        }
        if (parentId != null && !tree.containsNode(parentId)) {
            errors.add("Parent node " + parentId + " does not exist in tree");
            return ValidationResult.of(errors, warnings);
        }
        FeatureNode node = parentId == null ? candidate : candidate.withPrimaryParent(FeatureReference.feature(parentId));
        for (FeatureReference ref : node.parentReferences()) {
            if (!ref.targetNodeId().equals(node.id()) && !tree.containsNode(ref.targetNodeId())) {
                errors.add("Referenced parent node " + ref.targetNodeId() + " does not exist in tree");
            }
        }
        if (!errors.isEmpty()) {
            return ValidationResult.of(errors, warnings);
        }

        checkTypeCompatibility(tree, node, errors);
        checkBooleanArity(tree, node, errors);
        Map<String, FeatureNode> simulated = simulate(tree, node);
        if (hasCycleFrom(simulated, node.id())) {
            errors.add("Adding node " + node.id() + " would create a circular dependency");
        } else if (!FeatureTypeRules.isInertAllowed(node.featureType()) && !affectsResult(simulated, node.id())) {
            errors.add("Node " + node.name() + " (" + node.featureType().value() + ") will not affect the final "
                    + "model result. Ensure it's properly connected to the dependency chain.");
        }
        checkBypassedSurfaceOperations(tree, node, warnings);
        remind(node);

        if (!warnings.isEmpty()) {
            warnings.forEach(log::warn);
        }
        return ValidationResult.of(errors, warnings);
    }

    /**
     * 校验整棵树的不变式：引用存在、无环、重建顺序与节点集合一致且为拓扑序、根节点有效、childIds 与父引用互逆。
     *
     * @return 错误列表；为空表示树合法
     */
    public List<String> validateTree(FeatureTree tree) {
        List<String> errors = new ArrayList<>();
        Map<String, FeatureNode> nodes = tree.getNodes();

        for (FeatureNode node : nodes.values()) {
            for (FeatureReference ref : node.parentReferences()) {
                if (!nodes.containsKey(ref.targetNodeId())) {
                    errors.add("Node " + node.id() + " references missing node " + ref.targetNodeId());
                }
            }
        }

        Set<String> reported = new HashSet<>();
        for (String nodeId : nodes.keySet()) {
            String onCycle = findCycle(nodes, nodeId);
            if (onCycle != null && reported.add(onCycle)) {
                errors.add("Feature tree contains a circular dependency involving node " + onCycle);
                break;
            }
        }

        checkRegenerationOrder(tree, errors);
        checkRoot(tree, errors);
        checkChildIds(tree, errors);
        return errors;
    }

    /**
     * 建议可以合法添加的特征类型。
     *
     * @param parentId 目标父节点；为空时返回可作为起点的类型
     */
    public List<AdditionSuggestion> suggestAdditions(FeatureTree tree, String parentId) {
        List<AdditionSuggestion> suggestions = new ArrayList<>();
        if (tree.getNodes().isEmpty()) {
            suggestions.add(new AdditionSuggestion(FeatureType.WORKPLANE,
                    "Start with a workplane to establish the coordinate system"));
            return suggestions;
        }
        if (parentId == null) {
            for (FeatureType type : FeatureType.values()) {
                if (FeatureTypeRules.allowsRoot(type)) {
                    suggestions.add(new AdditionSuggestion(type, FeatureTypeRules.rationale(type)));
                }
            }
            return suggestions;
        }
        FeatureNode parent = tree.node(parentId).orElse(null);
        if (parent == null) {
            return suggestions;
        }
        boolean otherSolidExists = tree.getNodes().values().stream()
                .anyMatch(n -> !n.id().equals(parentId) && n.featureType().isVolumeProducing());
        for (FeatureType type : FeatureType.values()) {
            if (!FeatureTypeRules.isValidParent(type, parent.featureType())) {
                continue;
            }
            if (type.isBoolean() && !otherSolidExists) {
                continue;
            }
            suggestions.add(new AdditionSuggestion(type, FeatureTypeRules.rationale(type)));
        }
        return suggestions;
    }

    // ---------------------------------------------------------------------
    // 新增节点的各项检查
    // ---------------------------------------------------------------------

    private void checkTypeCompatibility(FeatureTree tree, FeatureNode node, List<String> errors) {
        FeatureType type = node.featureType();
        Set<FeatureType> valid = FeatureTypeRules.validParents(type);
        if (node.parentReferences().isEmpty()) {
            if (!FeatureTypeRules.allowsRoot(type)) {
                errors.add("Invalid parent type: " + type.value() + " requires a parent of type "
                        + describe(valid));
            }
            return;
        }
        for (FeatureReference ref : node.parentReferences()) {
            FeatureNode parent = tree.getNodes().get(ref.targetNodeId());
            if (parent != null && !valid.contains(parent.featureType())) {
                errors.add("Invalid parent type: " + type.value() + " cannot be created from "
                        + parent.featureType().value() + ". Valid parent types: " + describe(valid));
            }
        }
    }

    private void checkBooleanArity(FeatureTree tree, FeatureNode node, List<String> errors) {
        if (!node.featureType().isBoolean()) {
            return;
        }
        int solids = 0;
        for (FeatureReference ref : node.parentReferences()) {
            FeatureNode parent = tree.getNodes().get(ref.targetNodeId());
            if (parent != null && parent.featureType().isVolumeProducing()) {
                solids++;
            }
        }
        if (solids < 2) {
            errors.add("Boolean operation " + node.featureType().value() + " requires 2 solid parents, but only "
                    + solids + " found. Add more solid parent references.");
        } else if (solids > 2) {
            errors.add("Boolean operation " + node.featureType().value() + " requires 2 solid parents, but "
                    + solids + " found.");
        }
    }

    /**
     * 圆角/倒角被布尔运算绕过：
     * <ul>
     *   <li>新增圆角/倒角，而已有布尔运算直接引用了它的父节点；</li>
     *   <li>新增布尔运算，直接引用了一个已经有圆角/倒角子节点的实体。</li>
     * </ul>
     */
    private void checkBypassedSurfaceOperations(FeatureTree tree, FeatureNode node, List<String> warnings) {
        if (node.featureType().isEdgeFinish()) {
            node.primaryParentId().flatMap(tree::node).ifPresent(parent -> {
                List<String> booleans = new ArrayList<>();
                for (String dependentId : tree.dependentsOf(parent.id())) {
                    FeatureNode dependent = tree.getNodes().get(dependentId);
                    if (dependent.featureType().isBoolean()) {
                        booleans.add(dependent.name());
                    }
                }
                if (!booleans.isEmpty()) {
                    warnings.add("Warning: Adding " + node.featureType().value() + " to " + parent.name()
                            + " may not appear in final result because boolean operations reference the "
                            + "original geometry: " + booleans);
                }
            });
        }
        if (node.featureType().isBoolean()) {
            for (FeatureReference ref : node.parentReferences()) {
                for (String childId : tree.dependentsOf(ref.targetNodeId())) {
                    FeatureNode child = tree.getNodes().get(childId);
                    if (child.featureType().isEdgeFinish()) {
                        warnings.add("Warning: " + child.featureType().value() + " " + child.name()
                                + " is bypassed because " + node.name() + " combines the original geometry");
                    }
                }
            }
        }
    }

    private void remind(FeatureNode node) {
        if (node.featureType() == FeatureType.SKETCH) {
            log.warn("Reminder: Sketch '{}' will only affect the model if it's used by an extrude, revolve, "
                    + "or similar operation", node.name());
        } else if (node.featureType() == FeatureType.WORKPLANE) {
            log.warn("Reminder: Workplane '{}' will only affect the model if it's used for sketching or "
                    + "primitive creation", node.name());
        }
    }

    private static Map<String, FeatureNode> simulate(FeatureTree tree, FeatureNode node) {
        Map<String, FeatureNode> simulated = new LinkedHashMap<>(tree.getNodes());
        simulated.put(node.id(), node);
        return simulated;
    }

    private static boolean hasCycleFrom(Map<String, FeatureNode> nodes, String start) {
        return dfs(nodes, start, new HashSet<>(), new HashSet<>()) != null;
    }

    private static String findCycle(Map<String, FeatureNode> nodes, String start) {
        return dfs(nodes, start, new HashSet<>(), new HashSet<>());
    }

    /** 沿父引用做 DFS；发现回边时返回回边指向的节点，否则返回 null。 */
    private static String dfs(Map<String, FeatureNode> nodes, String nodeId, Set<String> visited, Set<String> stack) {
        if (stack.contains(nodeId)) {
            return nodeId;
        }
        if (!visited.add(nodeId)) {
            return null;
        }
        stack.add(nodeId);
        FeatureNode node = nodes.get(nodeId);
        if (node != null) {
            for (FeatureReference ref : node.parentReferences()) {
                String found = dfs(nodes, ref.targetNodeId(), visited, stack);
                if (found != null) {
                    return found;
                }
            }
        }
        stack.remove(nodeId);
        return null;
    }

    /** 从节点前向追踪，是否存在一条路径终止于“没有后继的实体节点”。 */
    private static boolean affectsResult(Map<String, FeatureNode> nodes, String start) {
        Map<String, List<String>> dependents = new HashMap<>();
        for (FeatureNode node : nodes.values()) {
            for (FeatureReference ref : node.parentReferences()) {
                dependents.computeIfAbsent(ref.targetNodeId(), k -> new ArrayList<>()).add(node.id());
            }
        }
        Set<String> visited = new HashSet<>();
        List<String> stack = new ArrayList<>();
        stack.add(start);
        while (!stack.isEmpty()) {
            String current = stack.remove(stack.size() - 1);
            if (!visited.add(current)) {
                continue;
            }
            FeatureNode node = nodes.get(current);
            if (node == null) {
                continue;
            }
            List<String> next = dependents.getOrDefault(current, List.of());
            if (next.isEmpty() && node.featureType().producesSolid()) {
                return true;
            }
            stack.addAll(next);
        }
        return false;
    }

    // ---------------------------------------------------------------------
    // 整树不变式
    // ---------------------------------------------------------------------

    private static void checkRegenerationOrder(FeatureTree tree, List<String> errors) {
        Map<String, FeatureNode> nodes = tree.getNodes();
        Map<String, Integer> position = new HashMap<>();
        List<String> order = tree.getRegenerationOrder();
        for (int i = 0; i < order.size(); i++) {
            String id = order.get(i);
            if (position.containsKey(id)) {
                errors.add("Regeneration order contains duplicate node " + id);
            } else {
                position.put(id, i);
            }
            if (!nodes.containsKey(id)) {
                errors.add("Regeneration order references unknown node " + id);
            }
        }
        for (String id : nodes.keySet()) {
            if (!position.containsKey(id)) {
                errors.add("Node " + id + " is missing from regeneration order");
            }
        }
        for (FeatureNode node : nodes.values()) {
            Integer own = position.get(node.id());
            if (own == null) {
                continue;
            }
            for (FeatureReference ref : node.parentReferences()) {
                Integer parent = position.get(ref.targetNodeId());
                if (parent != null && parent >= own) {
                    errors.add("Node " + node.id() + " is regenerated before its parent " + ref.targetNodeId());
                }
            }
        }
    }

    private static void checkRoot(FeatureTree tree, List<String> errors) {
        Map<String, FeatureNode> nodes = tree.getNodes();
        String rootId = tree.getRootNodeId();
        if (rootId == null) {
            if (!nodes.isEmpty()) {
                errors.add("Tree has nodes but no root node");
            }
            return;
        }
        if (!nodes.containsKey(rootId)) {
            errors.add("Root node " + rootId + " does not exist");
            return;
        }
        Set<String> visited = new LinkedHashSet<>();
        List<String> stack = new ArrayList<>();
        stack.add(rootId);
        while (!stack.isEmpty()) {
            String current = stack.remove(stack.size() - 1);
            if (!visited.add(current)) {
                continue;
            }
            FeatureNode node = nodes.get(current);
            for (String childId : node.childIds()) {
                if (!nodes.containsKey(childId)) {
                    errors.add("Node " + current + " lists unknown child " + childId);
                } else {
                    stack.add(childId);
                }
            }
        }
    }

    private static void checkChildIds(FeatureTree tree, List<String> errors) {
        Map<String, FeatureNode> nodes = tree.getNodes();
        Map<String, Set<String>> expected = new HashMap<>();
        for (FeatureNode node : nodes.values()) {
            for (FeatureReference ref : node.parentReferences()) {
                expected.computeIfAbsent(ref.targetNodeId(), k -> new HashSet<>()).add(node.id());
            }
        }
        for (FeatureNode node : nodes.values()) {
            Set<String> actual = new HashSet<>(node.childIds());
            if (!actual.equals(expected.getOrDefault(node.id(), Set.of()))) {
                errors.add("Node " + node.id() + " childIds are inconsistent with parent references");
            }
        }
    }

    private static String describe(Set<FeatureType> types) {
        List<String> values = new ArrayList<>();
        for (FeatureType type : types) {
            values.add(type.value());
        }
        return values.toString();
    }
}
