package org.csits.reportd.dao;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduledReportIndexEntry {

    private String id;

    private String name;

    private String reportType;

    @JsonProperty("isEnabled")
    private boolean enabled;

    private LocalDateTime nextRun;

    private LocalDateTime lastRun;

    public static ScheduledReportIndexEntry of(ScheduledReportEntity report) {
        ScheduledReportIndexEntry entry = new ScheduledReportIndexEntry();
        entry.setId(report.getId());
        entry.setName(report.getName());
        entry.setReportType(report.getReportType());
        entry.setEnabled(report.isEnabled());
        entry.setNextRun(report.getNextRun());
        entry.setLastRun(report.getLastRun());
        return entry;
    }
}
