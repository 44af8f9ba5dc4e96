package org.csits.reportd.server.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.manager.remote.ExportJobRequest;
import org.csits.reportd.manager.remote.ExportJobState;
import org.csits.reportd.manager.remote.ExportJobStatus;
import org.csits.reportd.manager.remote.RemoteJobClient;
import org.csits.reportd.manager.remote.RemoteJobException;
import org.csits.reportd.server.constants.JobState;
import org.csits.reportd.server.dto.JobOutcome;
import org.springframework.stereotype.Service;

/**
 * 导出作业状态机：CREATED -> POLLING -> COMPLETED / FAILED / TIMED_OUT。
 * 状态查询异常立即失败，不在这里重试。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobPoller {

    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(300);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(10);

    private final RemoteJobClient remoteJobClient;
    private final Clock clock;
    private final Sleeper sleeper;

    /**
     * 状态转换定义
     */
    private enum StateTransition {
        CREATED_TO_POLLING(JobState.CREATED, JobState.POLLING),
        CREATED_TO_FAILED(JobState.CREATED, JobState.FAILED),
        POLLING_TO_COMPLETED(JobState.POLLING, JobState.COMPLETED),
        POLLING_TO_FAILED(JobState.POLLING, JobState.FAILED),
        POLLING_TO_TIMED_OUT(JobState.POLLING, JobState.TIMED_OUT);

        private final JobState from;
        private final JobState to;

        StateTransition(JobState from, JobState to) {
            this.from = from;
            this.to = to;
        }

        static boolean allowed(JobState from, JobState to) {
            for (StateTransition t : values()) {
                if (t.from == from && t.to == to) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * 创建导出作业并轮询至终态。
     */
    public JobOutcome run(ExportJobRequest request, Duration maxWait, Duration pollInterval) {
        Instant start = clock.instant();
        JobState state = JobState.CREATED;
        String jobId;
        try {
            jobId = remoteJobClient.createExportJob(request);
        } catch (RemoteJobException | RuntimeException e) {
            log.error("创建导出作业失败: reportType={}", request.getReportType(), e);
            transition(state, JobState.FAILED, null);
            return new JobOutcome(JobState.FAILED, null, null,
                "Failed to create export job: " + e.getMessage(), elapsedSince(start));
        }
        if (jobId == null || jobId.trim().isEmpty()) {
            transition(state, JobState.FAILED, null);
            return new JobOutcome(JobState.FAILED, null, null,
                "Failed to create export job: empty job id", elapsedSince(start));
        }
        log.info("导出作业已创建: jobId={}, reportType={}", jobId, request.getReportType());
        return pollFrom(start, jobId, maxWait, pollInterval);
    }

    /**
     * 轮询已存在的作业。
     */
    public JobOutcome poll(String jobId, Duration maxWait, Duration pollInterval) {
        if (jobId == null || jobId.trim().isEmpty()) {
            throw new IllegalArgumentException("jobId 不能为空");
        }
        return pollFrom(clock.instant(), jobId, maxWait, pollInterval);
    }

    private JobOutcome pollFrom(Instant start, String jobId, Duration maxWait, Duration pollInterval) {
        if (maxWait == null || maxWait.isNegative() || pollInterval == null || pollInterval.isNegative()) {
            throw new IllegalArgumentException("maxWait / pollInterval 不能为负");
        }
        JobState state = transition(JobState.CREATED, JobState.POLLING, jobId);
        while (elapsedSince(start).compareTo(maxWait) < 0) {
            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                transition(state, JobState.FAILED, jobId);
                log.warn("[jobId={}] 轮询被中断", jobId);
                return new JobOutcome(JobState.FAILED, jobId, null, "interrupted", elapsedSince(start));
            }

            ExportJobStatus status;
            try {
                status = remoteJobClient.getExportJobStatus(jobId);
            } catch (RemoteJobException | RuntimeException e) {
                log.error("[jobId={}] 查询作业状态失败", jobId, e);
                transition(state, JobState.FAILED, jobId);
                return new JobOutcome(JobState.FAILED, jobId, null,
                    "Status check failed: " + e.getMessage(), elapsedSince(start));
            }
            if (status == null) {
                log.error("[jobId={}] 作业状态为空", jobId);
                transition(state, JobState.FAILED, jobId);
                return new JobOutcome(JobState.FAILED, jobId, null,
                    "Status check failed: empty status response", elapsedSince(start));
            }

            log.info("[jobId={}] status={}", jobId, status.getRawStatus());
            ExportJobState remoteState = status.getState() != null ? status.getState() : ExportJobState.UNKNOWN;
            switch (remoteState) {
                case COMPLETED:
                    if (status.getDownloadHandle() == null || status.getDownloadHandle().trim().isEmpty()) {
                        transition(state, JobState.FAILED, jobId);
                        return new JobOutcome(JobState.FAILED, jobId, null,
                            "Export job completed without a download URL", elapsedSince(start));
                    }
                    transition(state, JobState.COMPLETED, jobId);
                    return new JobOutcome(JobState.COMPLETED, jobId, status.getDownloadHandle(), null,
                        elapsedSince(start));
                case FAILED:
                    transition(state, JobState.FAILED, jobId);
                    String message = status.getErrorMessage() != null ? status.getErrorMessage() : "Unknown error";
                    return new JobOutcome(JobState.FAILED, jobId, null, "Export job failed: " + message,
                        elapsedSince(start));
                case UNKNOWN:
                    log.warn("[jobId={}] 未知作业状态，继续轮询: {}", jobId, status.getRawStatus());
                    break;
                default:
                    break;
            }
        }
        transition(state, JobState.TIMED_OUT, jobId);
        Duration elapsed = elapsedSince(start);
        log.warn("[jobId={}] 作业等待超时: elapsed={}s", jobId, elapsed.getSeconds());
        return new JobOutcome(JobState.TIMED_OUT, jobId, null,
            "Export job timed out after " + maxWait.getSeconds() + " seconds", elapsed);
    }

    private JobState transition(JobState from, JobState to, String jobId) {
        if (!StateTransition.allowed(from, to)) {
            throw new IllegalStateException("非法的状态转换: " + from + " -> " + to);
        }
        log.debug("[jobId={}] {} -> {}", jobId, from, to);
        return to;
    }

    private Duration elapsedSince(Instant start) {
        return Duration.between(start, clock.instant());
    }
}
