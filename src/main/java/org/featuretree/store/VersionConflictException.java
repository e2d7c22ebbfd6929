package org.featuretree.store;

import org.featuretree.model.FeatureTreeException;

/**
 * 写入的版本号已存在（另一个编辑先提交了同一版本）。
 */
public class VersionConflictException extends FeatureTreeException {

    private final String projectId;
    private final int version;

    public VersionConflictException(String projectId, int version) {
        super("项目 " + projectId + " 的版本 " + version + " 已存在，请基于最新版本重新编辑");
        this.projectId = projectId;
        this.version = version;
    }

    public String getProjectId() {
        return projectId;
    }

    public int getVersion() {
        return version;
    }
}
