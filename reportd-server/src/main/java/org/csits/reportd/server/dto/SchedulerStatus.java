package org.csits.reportd.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 调度器状态快照。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SchedulerStatus {

    private boolean schedulerEnabled;

    private long schedulerIntervalSeconds;

    private LocalDateTime lastSchedulerRun;

    private int totalReports;

    private int enabledReports;

    private LocalDateTime nextReportDue;

    private int overdueReports;

    /**
     * 最近执行记录的平均耗时（秒）。
     */
    private Double averageExecutionTime;

    private SweepSummary lastExecutionSummary;
}
