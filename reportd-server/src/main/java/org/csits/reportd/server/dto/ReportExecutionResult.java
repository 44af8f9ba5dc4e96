package org.csits.reportd.server.dto;

import java.time.LocalDateTime;
import lombok.Data;
import org.csits.reportd.server.constants.FailureStage;

/**
 * 单个报表一次执行的完整结果。
 */
@Data
public class ReportExecutionResult {

    private String reportId;

    private String reportName;

    private boolean success;

    private String jobId;

    private FailureStage failureStage;

    private String error;

    private String fileName;

    private Long fileSize;

    private Integer recordCount;

    private String format;

    private String downloadLink;

    private Integer linkExpirationDays;

    private boolean fallbackUsed;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private long durationMs;
}
