package org.csits.reportd.dao;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * 单次报表执行记录，用于调度状态统计。
 */
@Data
public class ReportExecutionRecord {

    private String reportId;

    private String reportName;

    private boolean success;

    private long durationMs;

    private LocalDateTime startedAt;

    private String failureStage;

    private String error;
}
