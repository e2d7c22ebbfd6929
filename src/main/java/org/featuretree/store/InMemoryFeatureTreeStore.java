package org.featuretree.store;

import org.featuretree.model.FeatureTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 进程内的版本存储（默认实现，进程退出即丢失）。
 * <p>
 * 存入与取出的都是副本，调用方对返回对象的修改不会影响已提交的历史。
 */
public class InMemoryFeatureTreeStore implements FeatureTreeStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFeatureTreeStore.class);

    private final Map<String, NavigableMap<Integer, Stored>> projects = new ConcurrentHashMap<>();
    private final FeatureTreeJson json;

    public InMemoryFeatureTreeStore() {
        this(new FeatureTreeJson());
    }

    public InMemoryFeatureTreeStore(FeatureTreeJson json) {
        this.json = json;
    }

    @Override
    public Optional<FeatureTree> get(String projectId, Integer version) {
        NavigableMap<Integer, Stored> versions = projects.get(projectId);
        if (versions == null || versions.isEmpty()) {
            return Optional.empty();
        }
        Stored stored = version == null ? lastValue(versions) : versions.get(version);
        return stored == null ? Optional.empty() : Optional.of(stored.tree().copy());
    }

    @Override
    public void put(FeatureTree tree) {
        NavigableMap<Integer, Stored> versions =
                projects.computeIfAbsent(tree.getProjectId(), k -> new ConcurrentSkipListMap<>());
        FeatureTree snapshot = tree.copy();
        String sha256 = HashingUtils.sha256Hex(json.write(snapshot));
        Stored previous = versions.putIfAbsent(tree.getVersion(), new Stored(snapshot, sha256));
        if (previous != null) {
            throw new VersionConflictException(tree.getProjectId(), tree.getVersion());
        }
        log.debug("已保存特征树：project={}, version={}", tree.getProjectId(), tree.getVersion());
    }

    @Override
    public List<FeatureTreeVersion> listVersions(String projectId) {
        NavigableMap<Integer, Stored> versions = projects.get(projectId);
        List<FeatureTreeVersion> out = new ArrayList<>();
        if (versions == null) {
            return out;
        }
        for (Stored stored : versions.values()) {
            out.add(FeatureTreeVersion.of(stored.tree(), stored.sha256()));
        }
        return out;
    }

    @Override
    public boolean delete(String projectId, Integer version) {
        if (version == null) {
            return projects.remove(projectId) != null;
        }
        NavigableMap<Integer, Stored> versions = projects.get(projectId);
        boolean removed = versions != null && versions.remove(version) != null;
        if (versions != null && versions.isEmpty()) {
            projects.remove(projectId, versions);
        }
        return removed;
    }

    private static Stored lastValue(NavigableMap<Integer, Stored> versions) {
        Map.Entry<Integer, Stored> last = versions.lastEntry();
        return last == null ? null : last.getValue();
    }

    private record Stored(FeatureTree tree, String sha256) {
    }
}
