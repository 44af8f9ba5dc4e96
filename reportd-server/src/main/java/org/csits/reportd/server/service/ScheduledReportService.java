package org.csits.reportd.server.service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.csits.reportd.server.dto.SchedulerStatus;
import org.csits.reportd.server.dto.SweepSummary;

/**
 * 定时报表服务入口，与传输方式无关。
 */
public interface ScheduledReportService {

    /**
     * 提交一次执行，排队在执行线程上运行，调用方不阻塞。
     */
    CompletableFuture<SweepSummary> executeScheduledReports();

    SchedulerStatus getSchedulerStatus();

    /**
     * @param fileName 形如 xxx.json，不能是 index.json，不能包含路径
     */
    boolean saveScheduledReportConfiguration(byte[] content, String fileName);

    /**
     * 同时移除索引中的对应条目。
     */
    boolean deleteScheduledReportConfiguration(String fileName);

    boolean updateScheduledReportsIndex(byte[] content);

    /**
     * @return 重建后索引中的报表数，失败时为 -1
     */
    int rebuildScheduledReportsIndex();

    /**
     * 按名称停用报表，存储配置被删除时使用。
     */
    boolean disableReportsByName(List<String> reportNames);

    boolean beginOperation(String identifier, long timeoutSeconds);

    boolean endOperation(String identifier);

    /**
     * 轮询已有导出作业并下载归档内容。
     */
    CompletableFuture<byte[]> pollAndDownloadExportJob(String jobId, long maxWaitSeconds, long pollIntervalSeconds);

    boolean ping();
}
