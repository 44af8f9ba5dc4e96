package org.csits.reportd.server.service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.dao.ReportExecutionRecord;
import org.csits.reportd.dao.ReportExecutionRepository;
import org.csits.reportd.dao.RunResult;
import org.csits.reportd.dao.ScheduledReportEntity;
import org.csits.reportd.dao.ScheduledReportRepository;
import org.csits.reportd.manager.archive.ArchiveExtractionException;
import org.csits.reportd.manager.archive.ArchiveExtractor;
import org.csits.reportd.manager.archive.ExtractedPayload;
import org.csits.reportd.manager.remote.ExportJobRequest;
import org.csits.reportd.manager.remote.RemoteJobClient;
import org.csits.reportd.manager.remote.RemoteJobException;
import org.csits.reportd.manager.storage.StorageException;
import org.csits.reportd.manager.storage.UnknownStorageConfigurationException;
import org.csits.reportd.server.config.ServiceConfig;
import org.csits.reportd.server.constants.FailureStage;
import org.csits.reportd.server.dto.JobOutcome;
import org.csits.reportd.server.dto.NotificationContext;
import org.csits.reportd.server.dto.ReportExecutionResult;
import org.csits.reportd.server.dto.ReportRunSummary;
import org.csits.reportd.server.dto.SweepSummary;
import org.csits.reportd.server.dto.UploadResult;
import org.csits.reportd.server.schedule.DueSetResolver;
import org.csits.reportd.server.schedule.ScheduleClock;
import org.springframework.stereotype.Service;

/**
 * 定时报表执行主流程：
 * - 读取全部报表，按名称排序，筛选到期报表
 * - 逐个执行 创建作业 -> 轮询 -> 下载 -> 解包 -> 上传 -> 通知
 * - 无论成败都更新 lastRun / lastRunResult / nextRun 并落盘
 * 单个报表的失败不会中断本次执行。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionCoordinator {

    private final ScheduledReportRepository scheduledReportRepository;
    private final ReportExecutionRepository reportExecutionRepository;
    private final ServiceConfigService serviceConfigService;
    private final ScheduleClock scheduleClock;
    private final DueSetResolver dueSetResolver;
    private final ReportQueryBuilder reportQueryBuilder;
    private final JobPoller jobPoller;
    private final RemoteJobClient remoteJobClient;
    private final ArchiveExtractor archiveExtractor;
    private final RecordCounter recordCounter;
    private final StorageUploader storageUploader;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    private final AtomicReference<SweepSummary> lastSummary = new AtomicReference<>();

    public SweepSummary executeScheduledReports() {
        LocalDateTime sweepTime = scheduleClock.now();
        log.info("开始检查定时报表: time={}", sweepTime);

        List<ScheduledReportEntity> reports;
        try {
            reports = new ArrayList<>(scheduledReportRepository.findAll());
        } catch (IOException e) {
            log.error("读取定时报表失败，本次执行终止", e);
            SweepSummary failed = SweepSummary.failed(sweepTime, "Failed to load scheduled reports: " + e.getMessage());
            lastSummary.set(failed);
            return failed;
        }
        reports.sort(Comparator.comparing(ScheduledReportEntity::getName,
            Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)));

        SweepSummary summary = new SweepSummary();
        summary.setTimestamp(sweepTime);
        summary.setTotalReportsChecked(reports.size());

        List<ScheduledReportEntity> due = dueSetResolver.resolve(reports, sweepTime);
        log.info("到期报表数: {}/{}", due.size(), reports.size());

        for (ScheduledReportEntity report : due) {
            ReportExecutionResult result;
            try {
                result = executeReport(report);
            } catch (RuntimeException e) {
                log.error("[reportId={}] 报表执行异常中断", report.getId(), e);
                result = new ReportExecutionResult();
                result.setReportId(report.getId());
                result.setReportName(report.getName());
                result.setFormat(report.getFormat());
                result.setCompletedAt(scheduleClock.now());
                result.setSuccess(false);
                result.setFailureStage(FailureStage.INTERNAL);
                result.setError("Unexpected error: " + e.getMessage());
            }
            updateAfterExecution(report, result);
            try {
                recordHistory(result);
            } catch (RuntimeException e) {
                log.warn("[reportId={}] 执行历史记录失败", report.getId(), e);
            }

            summary.setReportsExecuted(summary.getReportsExecuted() + 1);
            if (result.isSuccess()) {
                summary.setSuccessfulExecutions(summary.getSuccessfulExecutions() + 1);
            } else {
                summary.setFailedExecutions(summary.getFailedExecutions() + 1);
            }
            summary.getResults().add(new ReportRunSummary(report.getId(), report.getName(), report.getReportType(),
                result.isSuccess(), result.getDurationMs() / 1000.0, result.getCompletedAt(), result.getError()));
        }

        log.info("定时报表执行完成: checked={}, executed={}, success={}, failed={}",
            summary.getTotalReportsChecked(), summary.getReportsExecuted(),
            summary.getSuccessfulExecutions(), summary.getFailedExecutions());
        lastSummary.set(summary);
        return summary;
    }

    /**
     * 执行单个报表，不落盘。
     */
    public ReportExecutionResult executeReport(ScheduledReportEntity report) {
        ReportExecutionResult result = new ReportExecutionResult();
        result.setReportId(report.getId());
        result.setReportName(report.getName());
        result.setFormat(report.getFormat());
        result.setStartedAt(scheduleClock.now());
        long startMillis = clock.millis();
        log.info("[reportId={}] 开始执行报表: name={}, type={}", report.getId(), report.getName(), report.getReportType());

        try {
            runPipeline(report, result);
            result.setSuccess(true);
            log.info("[reportId={}] 报表执行成功: file={}, records={}", report.getId(), result.getFileName(),
                result.getRecordCount());
        } catch (StageFailedException e) {
            fail(report, result, e.stage, e.getMessage(), e.getCause());
        } catch (RuntimeException e) {
            fail(report, result, FailureStage.INTERNAL, "Unexpected error: " + e.getMessage(), e);
        }
        result.setDurationMs(Math.max(0L, clock.millis() - startMillis));
        result.setCompletedAt(scheduleClock.now());

        try {
            notificationDispatcher.dispatch(report, NotificationContext.builder()
                .success(result.isSuccess())
                .error(result.getError())
                .jobId(result.getJobId())
                .recordCount(result.getRecordCount())
                .fileSize(result.getFileSize())
                .format(result.getFormat())
                .downloadLink(result.getDownloadLink())
                .linkExpirationDays(result.getLinkExpirationDays())
                .timestamp(result.getCompletedAt())
                .build());
        } catch (RuntimeException e) {
            log.error("[reportId={}] 通知异常，忽略", report.getId(), e);
        }
        return result;
    }

    private void runPipeline(ScheduledReportEntity report, ReportExecutionResult result) throws StageFailedException {
        ServiceConfig.SchedulerConfig scheduler = serviceConfigService.getServiceConfig().getScheduler();
        ExportJobRequest request = ExportJobRequest.builder()
            .reportType(report.getReportType())
            .filter(reportQueryBuilder.buildFilter(report.getFilters()))
            .columns(reportQueryBuilder.resolveColumns(report))
            .format(report.getFormat())
            .build();

        JobOutcome outcome = jobPoller.run(request, Duration.ofSeconds(scheduler.getJobTimeoutSeconds()),
            Duration.ofSeconds(scheduler.getPollIntervalSeconds()));
        result.setJobId(outcome.getJobId());
        if (!outcome.isCompleted()) {
            throw new StageFailedException(FailureStage.JOB, outcome.getError(), null);
        }

        byte[] archive;
        try {
            archive = remoteJobClient.downloadExportJobData(outcome.getDownloadHandle());
        } catch (RemoteJobException e) {
            throw new StageFailedException(FailureStage.DOWNLOAD, "Failed to download export data: " + e.getMessage(), e);
        }

        ExtractedPayload payload;
        try {
            payload = archiveExtractor.extract(archive, report.getFormat());
        } catch (ArchiveExtractionException e) {
            throw new StageFailedException(FailureStage.EXTRACTION, "Failed to extract export data: " + e.getMessage(), e);
        }
        result.setFallbackUsed(payload.isFallbackUsed());
        result.setRecordCount(recordCounter.count(payload.getContent(), report.getFormat()));

        UploadResult upload;
        try {
            upload = storageUploader.upload(report, payload, outcome.getJobId());
        } catch (UnknownStorageConfigurationException e) {
            throw new StageFailedException(FailureStage.UPLOAD, "Storage configuration not found: "
                + e.getConfigurationName(), e);
        } catch (StorageException e) {
            throw new StageFailedException(FailureStage.UPLOAD, "Storage upload failed: " + e.getMessage(), e);
        }
        result.setFileName(upload.getFileName());
        result.setFileSize(upload.getFileSize());
        result.setDownloadLink(upload.getDownloadLink());
        result.setLinkExpirationDays(upload.getLinkExpirationDays());
    }

    private void fail(ScheduledReportEntity report, ReportExecutionResult result, FailureStage stage, String message,
                      Throwable cause) {
        result.setSuccess(false);
        result.setFailureStage(stage);
        result.setError(message);
        if (cause != null) {
            log.error("[reportId={}] 报表执行失败: stage={}, error={}", report.getId(), stage, message, cause);
        } else {
            log.error("[reportId={}] 报表执行失败: stage={}, error={}", report.getId(), stage, message);
        }
    }

    /**
     * 更新执行结果并推进 nextRun：nextRun = 下一个严格晚于 max(当前时间, 原 nextRun) 的时刻。
     * 落盘时重新读取已存报表，只写入运行状态字段，执行期间的停用或配置修改得以保留。
     */
    void updateAfterExecution(ScheduledReportEntity report, ReportExecutionResult result) {
        LocalDateTime now = scheduleClock.now();

        RunResult runResult = new RunResult();
        runResult.setSuccess(result.isSuccess());
        runResult.setFormat(report.getFormat());
        runResult.setError(result.getError());
        runResult.setFailureStage(result.getFailureStage() != null ? result.getFailureStage().name() : null);
        runResult.setFileName(result.getFileName());
        runResult.setFileSize(result.getFileSize());
        runResult.setRecordCount(result.getRecordCount());
        runResult.setDownloadLink(result.getDownloadLink());
        runResult.setLinkExpirationDays(result.getLinkExpirationDays());
        runResult.setRunDuration(result.getDurationMs() / 1000.0);
        runResult.setCompletedAt(result.getCompletedAt());

        LocalDateTime base = now;
        try {
            Optional<LocalDateTime> previous = dueSetResolver.effectiveNextRun(report, now);
            if (previous.isPresent() && previous.get().isAfter(now)) {
                base = previous.get();
            }
            report.setNextRun(scheduleClock.nextRun(report.getSchedule(), base).orElse(null));
        } catch (IllegalArgumentException e) {
            log.warn("[reportId={}] 调度配置非法，清空 nextRun: {}", report.getId(), e.getMessage());
            report.setNextRun(null);
        }
        report.setLastRun(now);
        report.setLastRunResult(runResult);
        report.setModified(now);

        try {
            Optional<ScheduledReportEntity> stored = scheduledReportRepository.update(report.getId(), current -> {
                current.setLastRun(report.getLastRun());
                current.setLastRunResult(report.getLastRunResult());
                current.setNextRun(report.getNextRun());
                current.setModified(report.getModified());
            });
            if (stored.isPresent()) {
                log.info("[reportId={}] 报表状态已更新: nextRun={}", report.getId(), report.getNextRun());
            } else {
                log.warn("[reportId={}] 报表已在执行期间删除，不再保存运行状态", report.getId());
            }
        } catch (IOException | RuntimeException e) {
            log.error("[reportId={}] 报表状态保存失败", report.getId(), e);
        }
    }

    private void recordHistory(ReportExecutionResult result) {
        ReportExecutionRecord record = new ReportExecutionRecord();
        record.setReportId(result.getReportId());
        record.setReportName(result.getReportName());
        record.setSuccess(result.isSuccess());
        record.setDurationMs(result.getDurationMs());
        record.setStartedAt(result.getStartedAt());
        record.setFailureStage(result.getFailureStage() != null ? result.getFailureStage().name() : null);
        record.setError(result.getError());
        reportExecutionRepository.save(record);
    }

    public Optional<SweepSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary.get());
    }

    /**
     * 带失败阶段的流程中断。
     */
    private static final class StageFailedException extends Exception {

        private final FailureStage stage;

        StageFailedException(FailureStage stage, String message, Throwable cause) {
            super(message, cause);
            this.stage = stage;
        }
    }
}
