package org.csits.reportd.server.service;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.dao.ReportExecutionRecord;
import org.csits.reportd.dao.ReportExecutionRepository;
import org.csits.reportd.dao.ScheduledReportEntity;
import org.csits.reportd.dao.ScheduledReportRepository;
import org.csits.reportd.server.config.ServiceConfig;
import org.csits.reportd.server.dto.SchedulerStatus;
import org.csits.reportd.server.dto.SweepSummary;
import org.csits.reportd.server.schedule.DueSetResolver;
import org.csits.reportd.server.schedule.ScheduleClock;
import org.springframework.stereotype.Service;

/**
 * 汇总调度器状态。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulerStatusService {

    private static final int AVERAGE_WINDOW = 50;

    private final ScheduledReportRepository scheduledReportRepository;
    private final ReportExecutionRepository reportExecutionRepository;
    private final ServiceConfigService serviceConfigService;
    private final ExecutionCoordinator executionCoordinator;
    private final DueSetResolver dueSetResolver;
    private final ScheduleClock scheduleClock;

    public SchedulerStatus getStatus() {
        ServiceConfig.SchedulerConfig scheduler = serviceConfigService.getServiceConfig().getScheduler();
        LocalDateTime now = scheduleClock.now();

        SchedulerStatus status = new SchedulerStatus();
        status.setSchedulerEnabled(!Boolean.FALSE.equals(scheduler.getEnabled()));
        status.setSchedulerIntervalSeconds(scheduler.getIntervalSeconds() != null ? scheduler.getIntervalSeconds() : 0);

        Optional<SweepSummary> last = executionCoordinator.getLastSummary();
        if (last.isPresent()) {
            status.setLastSchedulerRun(last.get().getTimestamp());
            status.setLastExecutionSummary(last.get());
        }

        List<ScheduledReportEntity> reports;
        try {
            reports = scheduledReportRepository.findAll();
        } catch (IOException e) {
            log.warn("读取定时报表失败，状态中报表数为 0: {}", e.getMessage());
            reports = Collections.emptyList();
        }
        status.setTotalReports(reports.size());
        int enabled = 0;
        int overdue = 0;
        for (ScheduledReportEntity report : reports) {
            if (!report.isEnabled()) {
                continue;
            }
            enabled++;
            if (dueSetResolver.isDue(report, now)) {
                overdue++;
            }
        }
        status.setEnabledReports(enabled);
        status.setOverdueReports(overdue);
        dueSetResolver.nextDue(reports, now).ifPresent(status::setNextReportDue);

        List<ReportExecutionRecord> recent = reportExecutionRepository.findRecent(AVERAGE_WINDOW);
        if (!recent.isEmpty()) {
            long total = 0L;
            for (ReportExecutionRecord r : recent) {
                total += r.getDurationMs();
            }
            status.setAverageExecutionTime(total / 1000.0 / recent.size());
        }
        return status;
    }
}
