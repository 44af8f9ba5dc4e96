package org.csits.reportd.dao;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.csits.reportd.dao.serializer.ReportJson;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * 基于内存的报表仓储，保存序列化后的字节，行为与文件实现一致。
 */
@Repository
@ConditionalOnProperty(name = "reportd.persistence.type", havingValue = "memory")
public class InMemoryScheduledReportRepository extends AbstractScheduledReportRepository {

    private final Map<String, byte[]> store = new ConcurrentHashMap<>();

    @Autowired
    public InMemoryScheduledReportRepository(@Value("${reportd.scheduler.time-zone:}") String timeZone) {
        this(ReportJson.newMapper(ReportJson.zoneOf(timeZone)));
    }

    public InMemoryScheduledReportRepository(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    protected Map<String, byte[]> readAllDefinitions() {
        Map<String, byte[]> result = new LinkedHashMap<>(new TreeMap<>(store));
        result.remove(ScheduledReportIndex.FILE_NAME);
        return result;
    }

    @Override
    protected Optional<byte[]> read(String fileName) {
        return Optional.ofNullable(store.get(fileName));
    }

    @Override
    protected void write(String fileName, byte[] content) {
        store.put(fileName, content.clone());
    }

    @Override
    protected boolean remove(String fileName) {
        return store.remove(fileName) != null;
    }
}
