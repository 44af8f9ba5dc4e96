package org.csits.reportd.dao;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * 报表仓储的公共部分：文件名校验、解析与序列化。子类只负责按文件名读写字节。
 * 报表文件的写操作共用一把锁。
 */
@Slf4j
public abstract class AbstractScheduledReportRepository implements ScheduledReportRepository {

    protected final ObjectMapper objectMapper;

    private final ReentrantLock writeLock = new ReentrantLock();

    protected AbstractScheduledReportRepository(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 按文件名排序的全部报表文件内容，不含索引文件。
     */
    protected abstract Map<String, byte[]> readAllDefinitions() throws IOException;

    protected abstract Optional<byte[]> read(String fileName) throws IOException;

    protected abstract void write(String fileName, byte[] content) throws IOException;

    protected abstract boolean remove(String fileName) throws IOException;

    @Override
    public List<ScheduledReportEntity> findAll() throws IOException {
        List<ScheduledReportEntity> result = new ArrayList<>();
        for (Map.Entry<String, byte[]> e : readAllDefinitions().entrySet()) {
            try {
                ScheduledReportEntity report = parseReport(e.getValue());
                report.setSourceFileName(e.getKey());
                result.add(report);
            } catch (IllegalArgumentException ex) {
                log.warn("跳过无法解析的报表文件: file={}, reason={}", e.getKey(), ex.getMessage());
            }
        }
        return result;
    }

    @Override
    public Optional<ScheduledReportEntity> findById(String id) throws IOException {
        if (id == null) {
            return Optional.empty();
        }
        for (ScheduledReportEntity report : findAll()) {
            if (id.equals(report.getId())) {
                return Optional.of(report);
            }
        }
        return Optional.empty();
    }

    @Override
    public void save(ScheduledReportEntity report) throws IOException {
        if (report.getId() == null || report.getId().trim().isEmpty()) {
            throw new IllegalArgumentException("报表缺少 id");
        }
        String fileName = report.fileName();
        validateFileName(fileName);
        writeLock.lock();
        try {
            write(fileName, objectMapper.writeValueAsBytes(report));
        } finally {
            writeLock.unlock();
        }
        report.setSourceFileName(fileName);
    }

    @Override
    public Optional<ScheduledReportEntity> update(String id, Consumer<ScheduledReportEntity> change)
        throws IOException {
        writeLock.lock();
        try {
            Optional<ScheduledReportEntity> stored = findById(id);
            if (!stored.isPresent()) {
                log.warn("报表不存在，跳过更新: reportId={}", id);
                return Optional.empty();
            }
            ScheduledReportEntity report = stored.get();
            change.accept(report);
            save(report);
            return Optional.of(report);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public ScheduledReportEntity saveConfiguration(String fileName, byte[] content) throws IOException {
        validateFileName(fileName);
        ScheduledReportEntity report = parseReport(content);
        writeLock.lock();
        try {
            write(fileName, content);
        } finally {
            writeLock.unlock();
        }
        report.setSourceFileName(fileName);
        log.info("报表配置已保存: file={}, reportId={}", fileName, report.getId());
        return report;
    }

    @Override
    public boolean delete(String fileName) throws IOException {
        validateFileName(fileName);
        boolean removed;
        writeLock.lock();
        try {
            removed = remove(fileName);
        } finally {
            writeLock.unlock();
        }
        log.info("删除报表配置: file={}, removed={}", fileName, removed);
        return removed;
    }

    @Override
    public Optional<ScheduledReportIndex> readIndex() throws IOException {
        Optional<byte[]> content = read(ScheduledReportIndex.FILE_NAME);
        if (!content.isPresent()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parseIndex(content.get()));
        } catch (IllegalArgumentException e) {
            log.warn("索引文件无法解析，视为不存在: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void writeIndex(ScheduledReportIndex index) throws IOException {
        write(ScheduledReportIndex.FILE_NAME, objectMapper.writeValueAsBytes(index));
    }

    @Override
    public ScheduledReportIndex saveIndex(byte[] content) throws IOException {
        ScheduledReportIndex index = parseIndex(content);
        write(ScheduledReportIndex.FILE_NAME, content);
        return index;
    }

    protected ScheduledReportEntity parseReport(byte[] content) {
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("报表内容为空");
        }
        ScheduledReportEntity report;
        try {
            report = objectMapper.readValue(content, ScheduledReportEntity.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("报表内容无法解析: " + e.getMessage(), e);
        }
        if (report == null || report.getId() == null || report.getId().trim().isEmpty()) {
            throw new IllegalArgumentException("报表缺少 id");
        }
        if (report.getSchedule() == null) {
            report.setSchedule(new ArrayList<>());
        }
        if (report.getFilters() == null) {
            report.setFilters(new LinkedHashMap<>());
        }
        if (report.getDelivery() == null) {
            report.setDelivery(new DeliveryConfig());
        }
        if (report.getNotifications() == null) {
            report.setNotifications(new NotificationConfig());
        }
        return report;
    }

    protected ScheduledReportIndex parseIndex(byte[] content) {
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("索引内容为空");
        }
        try {
            ScheduledReportIndex index = objectMapper.readValue(content, ScheduledReportIndex.class);
            if (index == null) {
                throw new IllegalArgumentException("索引内容为空");
            }
            if (index.getReports() == null) {
                index.setReports(new ArrayList<>());
            }
            return index;
        } catch (IOException e) {
            throw new IllegalArgumentException("索引内容无法解析: " + e.getMessage(), e);
        }
    }

    /**
     * 文件名须为 xxx.json，不能是索引文件，不能包含路径。
     */
    public static void validateFileName(String fileName) {
        if (fileName == null || fileName.trim().isEmpty()) {
            throw new IllegalArgumentException("文件名不能为空");
        }
        if (fileName.contains("/") || fileName.contains("\\") || fileName.contains("..")) {
            throw new IllegalArgumentException("文件名不能包含路径: " + fileName);
        }
        if (!fileName.endsWith(ScheduledReportEntity.FILE_SUFFIX)
            || fileName.length() == ScheduledReportEntity.FILE_SUFFIX.length()) {
            throw new IllegalArgumentException("文件名必须以 .json 结尾: " + fileName);
        }
        if (ScheduledReportIndex.FILE_NAME.equals(fileName)) {
            throw new IllegalArgumentException("不能以索引文件名保存报表");
        }
    }
}
