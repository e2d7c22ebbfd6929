package org.featuretree.store;

import org.featuretree.model.FeatureTree;

import java.util.List;
import java.util.Optional;

/**
 * 特征树版本存储，按 {@code (projectId, version)} 存取。
 * <p>
 * 版本只追加不修改：{@link #put} 遇到已存在的版本号时抛出 {@link VersionConflictException}，
 * 同一项目的并发编辑由此串行化。
 */
public interface FeatureTreeStore {

    /**
     * @param version 为 null 时返回最新版本
     */
    Optional<FeatureTree> get(String projectId, Integer version);

    /**
     * @throws VersionConflictException 该项目已存在相同版本号
     */
    void put(FeatureTree tree);

    /** 按版本号升序。项目不存在时返回空列表。 */
    List<FeatureTreeVersion> listVersions(String projectId);

    /**
     * @param version 为 null 时删除该项目的所有版本
     * @return 是否删除了任何内容
     */
    boolean delete(String projectId, Integer version);
}
