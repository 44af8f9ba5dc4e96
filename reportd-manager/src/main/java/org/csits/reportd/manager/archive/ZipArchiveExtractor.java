package org.csits.reportd.manager.archive;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.csits.reportd.manager.filesystem.FileSystemManager;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 基于 commons-compress 的 zip 导出包解包实现。
 * 归档先落盘到私有临时目录再展开，目录结构被压平为文件名，临时目录在任何出口都会被删除。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ZipArchiveExtractor implements ArchiveExtractor {

    private static final String ARCHIVE_NAME = "export.zip";
    private static final String[] DATA_EXTENSIONS = {"csv", "json"};

    private final FileSystemManager fileSystemManager;

    @Value("${reportd.work.temp-dir:}")
    private String tempRoot;

    @Override
    public ExtractedPayload extract(byte[] archiveBytes, String expectedFormat) throws ArchiveExtractionException {
        String expected = expectedFormat == null ? "" : expectedFormat.toLowerCase(Locale.ROOT);
        Path workDir = null;
        try {
            workDir = createWorkDir();
            Path archive = workDir.resolve(ARCHIVE_NAME);
            Files.write(archive, archiveBytes);
            Path extractDir = fileSystemManager.ensureDirectory(workDir.resolve("extracted"));

            Map<String, Path> entries = unpack(archive, extractDir);
            log.debug("导出包解包完成: entries={}", entries.keySet());

            Path selected = findByExtension(entries, expected);
            boolean fallback = false;
            if (selected == null) {
                for (String ext : DATA_EXTENSIONS) {
                    selected = findByExtension(entries, ext);
                    if (selected != null) {
                        break;
                    }
                }
                if (selected == null) {
                    throw new ArchiveExtractionException(
                        "No " + expected.toUpperCase(Locale.ROOT) + " file found in export archive");
                }
                fallback = true;
                log.warn("导出包中未找到 {} 文件，改用: {}", expected, selected.getFileName());
            }
            return new ExtractedPayload(selected.getFileName().toString(), Files.readAllBytes(selected), fallback);
        } catch (ArchiveExtractionException e) {
            throw e;
        } catch (IOException e) {
            throw new ArchiveExtractionException("导出包无法读取: " + e.getMessage(), e);
        } finally {
            if (workDir != null) {
                try {
                    fileSystemManager.deleteRecursively(workDir);
                } catch (IOException e) {
                    log.warn("清理临时目录失败: {}", workDir, e);
                }
            }
        }
    }

    private Path createWorkDir() throws IOException {
        if (tempRoot == null || tempRoot.trim().isEmpty()) {
            return Files.createTempDirectory("reportd-export-");
        }
        Path root = fileSystemManager.ensureDirectory(Paths.get(tempRoot));
        return Files.createTempDirectory(root, "reportd-export-");
    }

    /**
     * 按归档顺序展开，只保留条目的文件名部分；同名条目保留第一个。
     */
    private Map<String, Path> unpack(Path archive, Path targetDir) throws IOException {
        Map<String, Path> result = new LinkedHashMap<>();
        try (InputStream fis = Files.newInputStream(archive);
             BufferedInputStream bis = new BufferedInputStream(fis);
             ZipArchiveInputStream zis = new ZipArchiveInputStream(bis)) {
            ZipArchiveEntry entry;
            while ((entry = zis.getNextZipEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                Path namePart = Paths.get(entry.getName().replace('\\', '/')).getFileName();
                if (namePart == null) {
                    continue;
                }
                String fileName = namePart.toString();
                if (fileName.isEmpty() || result.containsKey(fileName)) {
                    log.debug("跳过条目: {}", entry.getName());
                    continue;
                }
                Path dest = targetDir.resolve(fileName);
                Files.copy(zis, dest, StandardCopyOption.REPLACE_EXISTING);
                result.put(fileName, dest);
            }
        }
        return result;
    }

    private Path findByExtension(Map<String, Path> entries, String extension) {
        if (extension.isEmpty()) {
            return null;
        }
        String suffix = "." + extension;
        for (Map.Entry<String, Path> e : entries.entrySet()) {
            if (e.getKey().toLowerCase(Locale.ROOT).endsWith(suffix)) {
                return e.getValue();
            }
        }
        return null;
    }
}
