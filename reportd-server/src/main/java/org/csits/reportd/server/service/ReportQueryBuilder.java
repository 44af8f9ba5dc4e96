package org.csits.reportd.server.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.csits.reportd.dao.ScheduledReportEntity;
import org.springframework.stereotype.Component;

/**
 * 由报表定义生成导出作业的过滤表达式和列。
 */
@Component
@RequiredArgsConstructor
public class ReportQueryBuilder {

    private static final String ALL = "All";

    private final ServiceConfigService serviceConfigService;

    /**
     * 空值和 All 被跳过；值含空格用 contains(key,'v')，否则 key eq 'v'；单引号加倍转义；以 and 连接。
     *
     * @return 无有效条件时为 null
     */
    public String buildFilter(Map<String, String> filters) {
        if (filters == null || filters.isEmpty()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, String> e : filters.entrySet()) {
            String value = e.getValue();
            if (value == null || value.isEmpty() || ALL.equals(value)) {
                continue;
            }
            String escaped = value.replace("'", "''");
            if (value.contains(" ")) {
                parts.add("contains(" + e.getKey() + ",'" + escaped + "')");
            } else {
                parts.add(e.getKey() + " eq '" + escaped + "'");
            }
        }
        return parts.isEmpty() ? null : String.join(" and ", parts);
    }

    /**
     * 报表选定列，未选定时取报表目录的默认列；返回空列表表示全部列。
     */
    public List<String> resolveColumns(ScheduledReportEntity report) {
        if (report.getSelectedColumns() != null && !report.getSelectedColumns().isEmpty()) {
            return new ArrayList<>(report.getSelectedColumns());
        }
        return new ArrayList<>(serviceConfigService.defaultColumns(report.getReportType()));
    }
}
