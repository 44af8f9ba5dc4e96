package org.csits.reportd.manager.filesystem;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 文件系统操作抽象。
 */
public interface FileSystemManager {

    Path ensureDirectory(Path dir) throws IOException;

    /**
     * 先写入同目录下的 .tmp 文件，再原子重命名为目标文件。
     */
    void writeAtomically(Path target, byte[] content) throws IOException;

    void deleteRecursively(Path root) throws IOException;

    /**
     * 列出目录下（不递归）文件名匹配 glob 的普通文件，按文件名排序。
     */
    List<Path> scanFiles(Path root, String pattern) throws IOException;
}
