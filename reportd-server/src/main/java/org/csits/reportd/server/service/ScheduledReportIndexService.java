package org.csits.reportd.server.service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.dao.ScheduledReportEntity;
import org.csits.reportd.dao.ScheduledReportIndex;
import org.csits.reportd.dao.ScheduledReportIndexEntry;
import org.csits.reportd.dao.ScheduledReportRepository;
import org.csits.reportd.server.schedule.ScheduleClock;
import org.springframework.stereotype.Service;

/**
 * 维护报表索引 index.json。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduledReportIndexService {

    private final ScheduledReportRepository scheduledReportRepository;
    private final ScheduleClock scheduleClock;

    /**
     * 由报表定义文件重建索引。
     *
     * @return 索引中的报表数
     */
    public int rebuild() throws IOException {
        List<ScheduledReportEntity> reports = new ArrayList<>(scheduledReportRepository.findAll());
        reports.sort(Comparator.comparing(ScheduledReportEntity::getName,
            Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)));
        ScheduledReportIndex index = new ScheduledReportIndex();
        for (ScheduledReportEntity report : reports) {
            index.getReports().add(ScheduledReportIndexEntry.of(report));
        }
        index.setLastUpdated(scheduleClock.now());
        scheduledReportRepository.writeIndex(index);
        log.info("报表索引已重建: reports={}", index.getReports().size());
        return index.getReports().size();
    }

    /**
     * 删除报表定义后移除对应条目，索引不存在时不做任何事。
     */
    public void removeEntry(String reportId) throws IOException {
        Optional<ScheduledReportIndex> existing = scheduledReportRepository.readIndex();
        if (!existing.isPresent() || reportId == null) {
            return;
        }
        ScheduledReportIndex index = existing.get();
        boolean removed = false;
        for (Iterator<ScheduledReportIndexEntry> it = index.getReports().iterator(); it.hasNext(); ) {
            if (reportId.equals(it.next().getId())) {
                it.remove();
                removed = true;
            }
        }
        if (removed) {
            index.setLastUpdated(scheduleClock.now());
            scheduledReportRepository.writeIndex(index);
            log.info("索引条目已移除: reportId={}", reportId);
        }
    }

    /**
     * 执行后同步索引中的 nextRun / lastRun / isEnabled，索引不存在时不创建。
     */
    public void sync() throws IOException {
        Optional<ScheduledReportIndex> existing = scheduledReportRepository.readIndex();
        if (!existing.isPresent()) {
            return;
        }
        ScheduledReportIndex index = existing.get();
        for (ScheduledReportEntity report : scheduledReportRepository.findAll()) {
            for (ScheduledReportIndexEntry entry : index.getReports()) {
                if (report.getId().equals(entry.getId())) {
                    entry.setEnabled(report.isEnabled());
                    entry.setNextRun(report.getNextRun());
                    entry.setLastRun(report.getLastRun());
                }
            }
        }
        index.setLastUpdated(scheduleClock.now());
        scheduledReportRepository.writeIndex(index);
    }
}
