package org.csits.reportd.job;

import com.xxl.job.core.context.XxlJobHelper;
import com.xxl.job.core.handler.annotation.XxlJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.server.dto.SweepSummary;
import org.csits.reportd.server.service.ScheduledReportService;
import org.springframework.stereotype.Component;

/**
 * 提供给 xxl-job 的定时报表处理器，每次触发执行一次到期检查。
 *
 * 调度中心配置示例：
 * - JobHandler：reportSweepJobHandler
 * - Cron：0 0/5 * * * ?（与 scheduler.interval_seconds 保持一致）
 * - 执行参数：无
 * 单个报表失败不会使任务失败，只有报表目录不可读时任务才标记失败。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportSweepXxlJobHandler {

    private final ScheduledReportService scheduledReportService;

    @XxlJob("reportSweepJobHandler")
    public void execute() throws Exception {
        XxlJobHelper.log("reportSweepJobHandler start");
        try {
            SweepSummary summary = scheduledReportService.executeScheduledReports().get();
            if (summary.getError() != null) {
                XxlJobHelper.log(summary.getError());
                XxlJobHelper.handleFail("reportSweepJobHandler 执行失败：" + summary.getError());
                return;
            }
            XxlJobHelper.log("reportSweepJobHandler success, checked={}, executed={}, success={}, failed={}",
                summary.getTotalReportsChecked(), summary.getReportsExecuted(),
                summary.getSuccessfulExecutions(), summary.getFailedExecutions());
        } catch (Exception e) {
            log.error("reportSweepJobHandler failed", e);
            XxlJobHelper.log(e);
            XxlJobHelper.handleFail("reportSweepJobHandler 执行失败：" + e.getMessage());
            throw e;
        }
    }
}
