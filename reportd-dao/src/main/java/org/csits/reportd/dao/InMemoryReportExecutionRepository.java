package org.csits.reportd.dao;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * 有界的内存执行历史，超过容量时丢弃最旧的记录。
 */
@Repository
public class InMemoryReportExecutionRepository implements ReportExecutionRepository {

    private final Deque<ReportExecutionRecord> records = new ArrayDeque<>();
    private final int capacity;

    public InMemoryReportExecutionRepository(@Value("${reportd.history.capacity:200}") int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("history capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void save(ReportExecutionRecord record) {
        records.addFirst(record);
        while (records.size() > capacity) {
            records.removeLast();
        }
    }

    @Override
    public synchronized List<ReportExecutionRecord> findRecent(int limit) {
        return records.stream().limit(Math.max(limit, 0)).collect(Collectors.toList());
    }

    @Override
    public synchronized List<ReportExecutionRecord> findByReportId(String reportId) {
        List<ReportExecutionRecord> result = new ArrayList<>();
        for (ReportExecutionRecord r : records) {
            if (r.getReportId() != null && r.getReportId().equals(reportId)) {
                result.add(r);
            }
        }
        return result;
    }

    @Override
    public synchronized long count() {
        return records.size();
    }
}
