package org.featuretree.resolve;

import org.featuretree.model.FeatureNode;
import org.featuretree.model.FeatureReference;
import org.featuretree.model.FeatureTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 按父引用做拓扑排序（Kahn 算法）。
 * <p>
 * 队列为 FIFO，初始按节点插入顺序入队，所以无依赖关系的节点保持原有的相对顺序；
 * 指向树中不存在节点的引用不计入入度。
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * @return 全部节点 id 的一个合法拓扑序
     * @throws DependencyCycleException 依赖图存在环
     */
    public List<String> resolve(FeatureTree tree) {
        Map<String, FeatureNode> nodes = tree.getNodes();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (FeatureNode node : nodes.values()) {
            inDegree.put(node.id(), 0);
        }
        for (FeatureNode node : nodes.values()) {
            // 同一父节点的多条引用（例如 FEATURE + SOLID）只算一条边
            Set<String> parents = new LinkedHashSet<>();
            for (FeatureReference ref : node.parentReferences()) {
                if (nodes.containsKey(ref.targetNodeId())) {
                    parents.add(ref.targetNodeId());
                }
            }
            for (String parentId : parents) {
                dependents.computeIfAbsent(parentId, k -> new ArrayList<>()).add(node.id());
                inDegree.merge(node.id(), 1, Integer::sum);
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                queue.addLast(id);
            }
        });
        List<String> order = new ArrayList<>(nodes.size());
        while (!queue.isEmpty()) {
            String current = queue.removeFirst();
            order.add(current);
            for (String child : dependents.getOrDefault(current, List.of())) {
                if (inDegree.merge(child, -1, Integer::sum) == 0) {
                    queue.addLast(child);
                }
            }
        }

        if (order.size() < nodes.size()) {
            List<String> remaining = new ArrayList<>();
            inDegree.forEach((id, degree) -> {
                if (degree > 0) {
                    remaining.add(id);
                }
            });
            throw new DependencyCycleException(remaining);
        }
        return order;
    }

    /**
     * 与 {@link #resolve} 相同，但遇到环时记录警告并返回树上一次的重建顺序。
     */
    public List<String> resolveOrFallback(FeatureTree tree) {
        try {
            return resolve(tree);
        } catch (DependencyCycleException e) {
            log.warn("项目 {} 版本 {} 的依赖存在循环 {}，沿用上一次的重建顺序",
                    tree.getProjectId(), tree.getVersion(), e.getCycleNodeIds());
            List<String> fallback = new ArrayList<>();
            for (String id : tree.getRegenerationOrder()) {
                if (tree.containsNode(id)) {
                    fallback.add(id);
                }
            }
            // 上次顺序里没有的节点追加在末尾
            for (String id : tree.getNodes().keySet()) {
                if (!fallback.contains(id)) {
                    fallback.add(id);
                }
            }
            return fallback;
        }
    }
}
