package org.csits.reportd.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * 一次定时执行的汇总。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SweepSummary {

    private LocalDateTime timestamp;

    private int totalReportsChecked;

    private int reportsExecuted;

    private int successfulExecutions;

    private int failedExecutions;

    private List<ReportRunSummary> results = new ArrayList<>();

    /**
     * 仅在存储目录不可读时出现。
     */
    private String error;

    public static SweepSummary failed(LocalDateTime timestamp, String error) {
        SweepSummary summary = new SweepSummary();
        summary.setTimestamp(timestamp);
        summary.setError(error);
        return summary;
    }
}
