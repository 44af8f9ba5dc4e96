package org.csits.reportd.dao;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 定时报表定义，每个实例一个 JSON 文件（{id}.json）。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduledReportEntity {

    public static final String FILE_SUFFIX = ".json";

    private String id;

    private String name;

    private String description;

    private String reportType;

    private String reportDisplayName;

    private String format = "csv";

    private Map<String, String> filters = new LinkedHashMap<>();

    /**
     * 为空表示使用报表类型的默认列。
     */
    private List<String> selectedColumns;

    private List<ScheduleTrigger> schedule = new ArrayList<>();

    @JsonProperty("isEnabled")
    private boolean enabled = true;

    private DeliveryConfig delivery = new DeliveryConfig();

    private NotificationConfig notifications = new NotificationConfig();

    private LocalDateTime created;

    private LocalDateTime modified;

    private LocalDateTime lastRun;

    private RunResult lastRunResult;

    private LocalDateTime nextRun;

    /**
     * 读取时的来源文件名，保存时写回同一文件。
     */
    @JsonIgnore
    @EqualsAndHashCode.Exclude
    private String sourceFileName;

    public String fileName() {
        if (sourceFileName != null) {
            return sourceFileName;
        }
        return id + FILE_SUFFIX;
    }
}
