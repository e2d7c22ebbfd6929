package org.featuretree.store;

import org.featuretree.model.FeatureTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 以 JSON 文件保存版本：{@code <storageDir>/<projectId>/v<version>.json}。
 * <p>
 * 写入先落到同目录临时文件，再原子移动到目标位置（不覆盖），目标已存在即视为版本冲突。
 * projectId 只允许字母、数字与 {@code . _ -}，避免路径穿越。
 */
public class JsonFileFeatureTreeStore implements FeatureTreeStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileFeatureTreeStore.class);

    private static final Pattern PROJECT_ID = Pattern.compile("[A-Za-z0-9._-]+");
    private static final Pattern VERSION_FILE = Pattern.compile("v(\\d+)\\.json");

    private final Path storageDir;
    private final FeatureTreeJson json;

    public JsonFileFeatureTreeStore(Path storageDir) {
        this(storageDir, new FeatureTreeJson());
    }

    public JsonFileFeatureTreeStore(Path storageDir, FeatureTreeJson json) {
        this.storageDir = storageDir.toAbsolutePath().normalize();
        this.json = json;
    }

    @Override
    public Optional<FeatureTree> get(String projectId, Integer version) {
        Path projectDir = projectDir(projectId);
        Integer target = version;
        if (target == null) {
            TreeMap<Integer, Path> files = versionFiles(projectDir);
            if (files.isEmpty()) {
                return Optional.empty();
            }
            target = files.lastKey();
        }
        Path file = versionFile(projectDir, target);
        try {
            return Optional.of(json.read(Files.readAllBytes(file)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new IllegalStateException("读取特征树版本失败：" + file, e);
        }
    }

    /**
     * 同一进程内的写入串行执行；存在性检查与移动之间的窗口只对其他进程开放。
     */
    @Override
    public synchronized void put(FeatureTree tree) {
        Path projectDir = projectDir(tree.getProjectId());
        Path target = versionFile(projectDir, tree.getVersion());
        byte[] bytes = json.write(tree);
        Path tmp = null;
        try {
            Files.createDirectories(projectDir);
            if (Files.exists(target)) {
                throw new VersionConflictException(tree.getProjectId(), tree.getVersion());
            }
            tmp = Files.createTempFile(projectDir, ".ft-", ".tmp");
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("文件系统不支持原子移动，退化为普通移动：{}", target);
                Files.move(tmp, target);
            }
            log.debug("已写入特征树版本文件：{}", target);
        } catch (FileAlreadyExistsException e) {
            throw new VersionConflictException(tree.getProjectId(), tree.getVersion());
        } catch (IOException e) {
            throw new IllegalStateException("写入特征树版本失败：" + target, e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    @Override
    public List<FeatureTreeVersion> listVersions(String projectId) {
        List<FeatureTreeVersion> out = new ArrayList<>();
        for (Path file : versionFiles(projectDir(projectId)).values()) {
            try {
                byte[] bytes = Files.readAllBytes(file);
                out.add(FeatureTreeVersion.of(json.read(bytes), HashingUtils.sha256Hex(bytes)));
            } catch (IOException e) {
                throw new IllegalStateException("读取特征树版本失败：" + file, e);
            }
        }
        return out;
    }

    @Override
    public boolean delete(String projectId, Integer version) {
        Path projectDir = projectDir(projectId);
        try {
            if (version != null) {
                boolean removed = Files.deleteIfExists(versionFile(projectDir, version));
                if (removed && versionFiles(projectDir).isEmpty()) {
                    Files.deleteIfExists(projectDir);
                }
                return removed;
            }
            TreeMap<Integer, Path> files = versionFiles(projectDir);
            for (Path file : files.values()) {
                Files.deleteIfExists(file);
            }
            boolean removedDir = Files.deleteIfExists(projectDir);
            return removedDir || !files.isEmpty();
        } catch (IOException e) {
            throw new IllegalStateException("删除特征树版本失败：" + projectDir, e);
        }
    }

    public Path getStorageDir() {
        return storageDir;
    }

    private Path projectDir(String projectId) {
        if (projectId == null || !PROJECT_ID.matcher(projectId).matches()
                || projectId.equals(".") || projectId.equals("..")) {
            throw new IllegalArgumentException("非法的项目 ID（仅允许字母、数字与 . _ -）：" + projectId);
        }
        return storageDir.resolve(projectId);
    }

    private static Path versionFile(Path projectDir, int version) {
        return projectDir.resolve("v" + version + ".json");
    }

    private static TreeMap<Integer, Path> versionFiles(Path projectDir) {
        TreeMap<Integer, Path> files = new TreeMap<>();
        if (!Files.isDirectory(projectDir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(projectDir, "v*.json")) {
            for (Path file : stream) {
                Matcher m = VERSION_FILE.matcher(file.getFileName().toString());
                if (m.matches()) {
                    files.put(Integer.parseInt(m.group(1)), file);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("列出特征树版本失败：" + projectDir, e);
        }
        return files;
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("清理临时文件失败：{}", tmp, e);
        }
    }
}
