package org.csits.reportd.manager.filesystem;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 本地文件系统实现。
 */
@Slf4j
@Component
public class LocalFileSystemManager implements FileSystemManager {

    private static final String TMP_SUFFIX = ".tmp";

    @Override
    public Path ensureDirectory(Path dir) throws IOException {
        if (Files.notExists(dir)) {
            Files.createDirectories(dir);
        }
        return dir;
    }

    @Override
    public void writeAtomically(Path target, byte[] content) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            ensureDirectory(parent);
        }
        Path tmp = target.resolveSibling(target.getFileName().toString() + TMP_SUFFIX);
        if (Files.exists(tmp)) {
            log.warn("临时文件已存在，删除: {}", tmp);
            Files.delete(tmp);
        }
        Files.write(tmp, content);
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("文件系统不支持原子移动，改为普通替换: {}", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void deleteRecursively(Path root) throws IOException {
        if (Files.notExists(root)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> stream = Files.walk(root)) {
            paths = stream.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }

    @Override
    public List<Path> scanFiles(Path root, String pattern) throws IOException {
        if (Files.notExists(root)) {
            return new ArrayList<>();
        }
        String glob = pattern == null || pattern.isEmpty() ? "*" : pattern;
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        try (Stream<Path> stream = Files.list(root)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(p -> matcher.matches(p.getFileName()))
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .collect(Collectors.toList());
        }
    }
}
