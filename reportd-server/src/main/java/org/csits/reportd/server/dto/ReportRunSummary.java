package org.csits.reportd.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReportRunSummary {

    private String reportId;

    private String reportName;

    private String reportType;

    private boolean success;

    /**
     * 执行耗时（秒）。
     */
    private double executionTime;

    private LocalDateTime timestamp;

    private String error;
}
