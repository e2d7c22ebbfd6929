package org.featuretree.resolve;

import org.featuretree.model.FeatureTreeException;

import java.util.List;

/**
 * 依赖图存在环：拓扑排序结束后仍有节点入度不为 0。
 */
public class DependencyCycleException extends FeatureTreeException {

    private final List<String> cycleNodeIds;

    public DependencyCycleException(List<String> cycleNodeIds) {
        super("特征依赖存在循环，涉及节点：" + cycleNodeIds);
        this.cycleNodeIds = List.copyOf(cycleNodeIds);
    }

    /** 排序结束时仍未输出的节点（环上的节点及其下游）。 */
    public List<String> getCycleNodeIds() {
        return cycleNodeIds;
    }
}
