package org.csits.reportd.dao;

import java.util.List;

/**
 * 报表执行历史仓储。
 */
public interface ReportExecutionRepository {

    void save(ReportExecutionRecord record);

    /**
     * 最新的在前。
     */
    List<ReportExecutionRecord> findRecent(int limit);

    List<ReportExecutionRecord> findByReportId(String reportId);

    long count();
}
