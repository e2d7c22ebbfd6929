package org.featuretree.store;

import org.featuretree.model.FeatureTreeException;

/**
 * 项目、版本或节点不存在。
 */
public class FeatureTreeNotFoundException extends FeatureTreeException {

    private final String projectId;
    private final Integer version;
    private final String nodeId;

    public FeatureTreeNotFoundException(String projectId, Integer version) {
        this(projectId, version, null);
    }

    public FeatureTreeNotFoundException(String projectId, Integer version, String nodeId) {
        super(message(projectId, version, nodeId));
        this.projectId = projectId;
        this.version = version;
        this.nodeId = nodeId;
    }

    private static String message(String projectId, Integer version, String nodeId) {
        String where = version == null ? "项目 " + projectId : "项目 " + projectId + " 的版本 " + version;
        return nodeId == null ? where + " 不存在" : where + " 中不存在节点 " + nodeId;
    }

    public String getProjectId() {
        return projectId;
    }

    public Integer getVersion() {
        return version;
    }

    public String getNodeId() {
        return nodeId;
    }
}
