package org.csits.reportd.dao;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.manager.filesystem.FileSystemManager;
import org.csits.reportd.dao.serializer.ReportJson;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * 基于目录的报表仓储：每个报表一个 JSON 文件，写入先落 .tmp 再原子替换。
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "reportd.persistence.type", havingValue = "file", matchIfMissing = true)
public class FileScheduledReportRepository extends AbstractScheduledReportRepository {

    private final FileSystemManager fileSystemManager;
    private final Path directory;

    @Autowired
    public FileScheduledReportRepository(FileSystemManager fileSystemManager,
                                         @Value("${reportd.store.directory:./data/scheduled-reports}") String directory,
                                         @Value("${reportd.scheduler.time-zone:}") String timeZone) {
        this(fileSystemManager, ReportJson.newMapper(ReportJson.zoneOf(timeZone)), Paths.get(directory));
    }

    public FileScheduledReportRepository(FileSystemManager fileSystemManager, ObjectMapper objectMapper,
                                         Path directory) {
        super(objectMapper);
        this.fileSystemManager = fileSystemManager;
        this.directory = directory;
        log.info("报表存储目录: {}", directory.toAbsolutePath());
    }

    @Override
    protected Map<String, byte[]> readAllDefinitions() throws IOException {
        fileSystemManager.ensureDirectory(directory);
        if (!Files.isDirectory(directory) || !Files.isReadable(directory)) {
            throw new IOException("报表存储目录不可读: " + directory);
        }
        Map<String, byte[]> result = new LinkedHashMap<>();
        for (Path file : fileSystemManager.scanFiles(directory, "*" + ScheduledReportEntity.FILE_SUFFIX)) {
            String name = file.getFileName().toString();
            if (ScheduledReportIndex.FILE_NAME.equals(name)) {
                continue;
            }
            try {
                result.put(name, Files.readAllBytes(file));
            } catch (IOException e) {
                log.warn("报表文件读取失败，跳过: file={}", name, e);
            }
        }
        return result;
    }

    @Override
    protected Optional<byte[]> read(String fileName) throws IOException {
        Path file = directory.resolve(fileName);
        if (Files.notExists(file)) {
            return Optional.empty();
        }
        return Optional.of(Files.readAllBytes(file));
    }

    @Override
    protected void write(String fileName, byte[] content) throws IOException {
        fileSystemManager.writeAtomically(directory.resolve(fileName), content);
    }

    @Override
    protected boolean remove(String fileName) throws IOException {
        return Files.deleteIfExists(directory.resolve(fileName));
    }
}
