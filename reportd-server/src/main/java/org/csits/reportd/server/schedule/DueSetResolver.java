package org.csits.reportd.server.schedule;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.dao.ScheduledReportEntity;
import org.springframework.stereotype.Component;

/**
 * 判定哪些报表到期。只读，不修改报表。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DueSetResolver {

    private final ScheduleClock scheduleClock;

    /**
     * 报表的有效下次运行时间。已存 nextRun 时直接使用；
     * 否则以 lastRun、created、当天零点的顺序取锚点计算。
     */
    public Optional<LocalDateTime> effectiveNextRun(ScheduledReportEntity report, LocalDateTime now) {
        if (report.getSchedule() == null || report.getSchedule().isEmpty()) {
            return Optional.empty();
        }
        if (report.getNextRun() != null) {
            return Optional.of(report.getNextRun());
        }
        LocalDateTime anchor;
        if (report.getLastRun() != null) {
            anchor = report.getLastRun();
        } else if (report.getCreated() != null) {
            anchor = report.getCreated();
        } else {
            // 严格晚于锚点，零点的触发也要算进当天
            anchor = now.toLocalDate().atStartOfDay().minusMinutes(1);
        }
        return scheduleClock.nextRun(report.getSchedule(), anchor);
    }

    public boolean isDue(ScheduledReportEntity report, LocalDateTime now) {
        if (!report.isEnabled()) {
            return false;
        }
        try {
            Optional<LocalDateTime> next = effectiveNextRun(report, now);
            return next.isPresent() && !next.get().isAfter(now);
        } catch (IllegalArgumentException e) {
            log.warn("报表调度配置非法，跳过: reportId={}, name={}, reason={}",
                report.getId(), report.getName(), e.getMessage());
            return false;
        }
    }

    /**
     * 保持输入顺序。
     */
    public List<ScheduledReportEntity> resolve(List<ScheduledReportEntity> reports, LocalDateTime now) {
        List<ScheduledReportEntity> due = new ArrayList<>();
        for (ScheduledReportEntity report : reports) {
            if (isDue(report, now)) {
                due.add(report);
            }
        }
        log.debug("到期报表: {}/{}", due.size(), reports.size());
        return due;
    }

    /**
     * 启用报表中最早的下次运行时间。
     */
    public Optional<LocalDateTime> nextDue(List<ScheduledReportEntity> reports, LocalDateTime now) {
        LocalDateTime earliest = null;
        for (ScheduledReportEntity report : reports) {
            if (!report.isEnabled()) {
                continue;
            }
            try {
                Optional<LocalDateTime> next = effectiveNextRun(report, now);
                if (next.isPresent() && (earliest == null || next.get().isBefore(earliest))) {
                    earliest = next.get();
                }
            } catch (IllegalArgumentException e) {
                log.debug("忽略非法调度: reportId={}", report.getId());
            }
        }
        return Optional.ofNullable(earliest);
    }
}
