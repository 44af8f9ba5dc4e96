package org.csits.reportd.dao;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * 报表索引（index.json），供前端快速列表展示。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduledReportIndex {

    public static final String FILE_NAME = "index.json";

    private List<ScheduledReportIndexEntry> reports = new ArrayList<>();

    private LocalDateTime lastUpdated;
}
