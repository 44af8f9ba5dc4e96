package org.csits.reportd.dao;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 最近一次执行结果。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunResult {

    private boolean success;

    private String format;

    private String error;

    /**
     * 失败阶段：JOB / DOWNLOAD / EXTRACTION / UPLOAD / INTERNAL。
     */
    private String failureStage;

    private String fileName;

    private Long fileSize;

    private Integer recordCount;

    @JsonAlias("azureLink")
    private String downloadLink;

    private Integer linkExpirationDays;

    /**
     * 执行耗时（秒）。
     */
    private double runDuration;

    private LocalDateTime completedAt;
}
