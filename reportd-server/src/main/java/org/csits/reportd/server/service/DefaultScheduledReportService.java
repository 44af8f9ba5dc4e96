package org.csits.reportd.server.service;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.dao.ScheduledReportEntity;
import org.csits.reportd.dao.ScheduledReportRepository;
import org.csits.reportd.manager.lock.NamedOperationLock;
import org.csits.reportd.manager.remote.RemoteJobClient;
import org.csits.reportd.manager.remote.RemoteJobException;
import org.csits.reportd.server.dto.JobOutcome;
import org.csits.reportd.server.dto.SchedulerStatus;
import org.csits.reportd.server.dto.SweepSummary;
import org.csits.reportd.server.schedule.ScheduleClock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * 定时报表服务实现。执行和作业轮询都提交到单线程执行器；
 * 停用等配置写入在调用线程上经仓储的 update 完成，与执行后的状态写入互不覆盖。
 */
@Slf4j
@Service
public class DefaultScheduledReportService implements ScheduledReportService {

    private final ExecutionCoordinator executionCoordinator;
    private final SchedulerStatusService schedulerStatusService;
    private final ScheduledReportIndexService scheduledReportIndexService;
    private final ScheduledReportRepository scheduledReportRepository;
    private final NamedOperationLock namedOperationLock;
    private final JobPoller jobPoller;
    private final RemoteJobClient remoteJobClient;
    private final ScheduleClock scheduleClock;
    private final ExecutorService sweepExecutor;

    public DefaultScheduledReportService(ExecutionCoordinator executionCoordinator,
                                         SchedulerStatusService schedulerStatusService,
                                         ScheduledReportIndexService scheduledReportIndexService,
                                         ScheduledReportRepository scheduledReportRepository,
                                         NamedOperationLock namedOperationLock,
                                         JobPoller jobPoller,
                                         RemoteJobClient remoteJobClient,
                                         ScheduleClock scheduleClock,
                                         @Qualifier("sweepExecutor") ExecutorService sweepExecutor) {
        this.executionCoordinator = executionCoordinator;
        this.schedulerStatusService = schedulerStatusService;
        this.scheduledReportIndexService = scheduledReportIndexService;
        this.scheduledReportRepository = scheduledReportRepository;
        this.namedOperationLock = namedOperationLock;
        this.jobPoller = jobPoller;
        this.remoteJobClient = remoteJobClient;
        this.scheduleClock = scheduleClock;
        this.sweepExecutor = sweepExecutor;
    }

    @Override
    public CompletableFuture<SweepSummary> executeScheduledReports() {
        log.info("收到定时报表执行请求");
        return CompletableFuture.supplyAsync(() -> {
            SweepSummary summary = executionCoordinator.executeScheduledReports();
            if (summary.getReportsExecuted() > 0) {
                try {
                    scheduledReportIndexService.sync();
                } catch (IOException | RuntimeException e) {
                    log.warn("执行后同步报表索引失败", e);
                }
            }
            return summary;
        }, sweepExecutor);
    }

    @Override
    public SchedulerStatus getSchedulerStatus() {
        return schedulerStatusService.getStatus();
    }

    @Override
    public boolean saveScheduledReportConfiguration(byte[] content, String fileName) {
        try {
            ScheduledReportEntity saved = scheduledReportRepository.saveConfiguration(fileName, content);
            log.info("报表配置已保存: file={}, name={}", fileName, saved.getName());
            return true;
        } catch (IllegalArgumentException e) {
            log.warn("报表配置无效: file={}, reason={}", fileName, e.getMessage());
            return false;
        } catch (IOException e) {
            log.error("报表配置保存失败: file={}", fileName, e);
            return false;
        }
    }

    @Override
    public boolean deleteScheduledReportConfiguration(String fileName) {
        try {
            String reportId = null;
            for (ScheduledReportEntity report : scheduledReportRepository.findAll()) {
                if (report.fileName().equals(fileName)) {
                    reportId = report.getId();
                    break;
                }
            }
            boolean removed = scheduledReportRepository.delete(fileName);
            if (!removed) {
                log.warn("报表配置不存在: file={}", fileName);
                return false;
            }
            String indexId = reportId != null ? reportId : stripSuffix(fileName);
            scheduledReportIndexService.removeEntry(indexId);
            return true;
        } catch (IllegalArgumentException e) {
            log.warn("报表文件名无效: file={}, reason={}", fileName, e.getMessage());
            return false;
        } catch (IOException e) {
            log.error("报表配置删除失败: file={}", fileName, e);
            return false;
        }
    }

    @Override
    public boolean updateScheduledReportsIndex(byte[] content) {
        try {
            scheduledReportRepository.saveIndex(content);
            log.info("报表索引已更新");
            return true;
        } catch (IllegalArgumentException e) {
            log.warn("报表索引内容无效: {}", e.getMessage());
            return false;
        } catch (IOException e) {
            log.error("报表索引保存失败", e);
            return false;
        }
    }

    @Override
    public int rebuildScheduledReportsIndex() {
        try {
            return scheduledReportIndexService.rebuild();
        } catch (IOException e) {
            log.error("报表索引重建失败", e);
            return -1;
        }
    }

    @Override
    public boolean disableReportsByName(List<String> reportNames) {
        if (reportNames == null || reportNames.isEmpty()) {
            return true;
        }
        log.info("停用定时报表: count={}", reportNames.size());
        List<ScheduledReportEntity> reports;
        try {
            reports = scheduledReportRepository.findAll();
        } catch (IOException e) {
            log.error("读取定时报表失败，无法停用", e);
            return false;
        }
        int successCount = 0;
        for (String name : reportNames) {
            Optional<ScheduledReportEntity> match = reports.stream()
                .filter(r -> name != null && name.equals(r.getName()))
                .findFirst();
            if (!match.isPresent()) {
                log.warn("未找到要停用的报表: name={}", name);
                continue;
            }
            ScheduledReportEntity report = match.get();
            if (!report.isEnabled()) {
                successCount++;
                continue;
            }
            try {
                Optional<ScheduledReportEntity> disabled = scheduledReportRepository.update(report.getId(), current -> {
                    current.setEnabled(false);
                    current.setModified(scheduleClock.now());
                });
                if (disabled.isPresent()) {
                    successCount++;
                    log.info("[reportId={}] 报表已停用: name={}", report.getId(), name);
                }
            } catch (IOException e) {
                log.error("[reportId={}] 报表停用失败: name={}", report.getId(), name, e);
            }
        }
        boolean all = successCount == reportNames.size();
        if (!all) {
            log.error("仅停用了 {}/{} 个报表", successCount, reportNames.size());
        }
        return all;
    }

    @Override
    public boolean beginOperation(String identifier, long timeoutSeconds) {
        return namedOperationLock.begin(identifier, timeoutSeconds);
    }

    @Override
    public boolean endOperation(String identifier) {
        return namedOperationLock.end(identifier);
    }

    @Override
    public CompletableFuture<byte[]> pollAndDownloadExportJob(String jobId, long maxWaitSeconds,
                                                              long pollIntervalSeconds) {
        if (jobId == null || jobId.trim().isEmpty()) {
            throw new IllegalArgumentException("jobId 不能为空");
        }
        return CompletableFuture.supplyAsync(() -> {
            JobOutcome outcome = jobPoller.poll(jobId, Duration.ofSeconds(maxWaitSeconds),
                Duration.ofSeconds(pollIntervalSeconds));
            if (!outcome.isCompleted()) {
                throw new CompletionException(new RemoteJobException(outcome.getError()));
            }
            try {
                return remoteJobClient.downloadExportJobData(outcome.getDownloadHandle());
            } catch (RemoteJobException e) {
                throw new CompletionException(e);
            }
        }, sweepExecutor);
    }

    @Override
    public boolean ping() {
        return true;
    }

    private static String stripSuffix(String fileName) {
        return fileName.endsWith(ScheduledReportEntity.FILE_SUFFIX)
            ? fileName.substring(0, fileName.length() - ScheduledReportEntity.FILE_SUFFIX.length())
            : fileName;
    }
}
