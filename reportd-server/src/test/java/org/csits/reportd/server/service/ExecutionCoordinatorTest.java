package org.csits.reportd.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.csits.reportd.dao.InMemoryReportExecutionRepository;
import org.csits.reportd.dao.InMemoryScheduledReportRepository;
import org.csits.reportd.dao.RunResult;
import org.csits.reportd.dao.ScheduleTrigger;
import org.csits.reportd.dao.ScheduledReportEntity;
import org.csits.reportd.dao.ScheduledReportRepository;
import org.csits.reportd.manager.archive.ArchiveExtractor;
import org.csits.reportd.manager.archive.ExtractedPayload;
import org.csits.reportd.manager.lock.NamedOperationLock;
import org.csits.reportd.manager.notification.WebhookSender;
import org.csits.reportd.manager.remote.ExportJobState;
import org.csits.reportd.manager.remote.ExportJobStatus;
import org.csits.reportd.manager.remote.RemoteJobClient;
import org.csits.reportd.manager.remote.RemoteJobException;
import org.csits.reportd.manager.storage.UnknownStorageConfigurationException;
import org.csits.reportd.server.MutableClock;
import org.csits.reportd.server.config.ServiceConfig;
import org.csits.reportd.server.constants.FailureStage;
import org.csits.reportd.server.dto.ReportExecutionResult;
import org.csits.reportd.server.dto.SweepSummary;
import org.csits.reportd.server.dto.UploadResult;
import org.csits.reportd.server.schedule.DueSetResolver;
import org.csits.reportd.server.schedule.ScheduleClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExecutionCoordinatorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 9, 5);

    private MutableClock clock;
    private InMemoryScheduledReportRepository repository;
    private InMemoryReportExecutionRepository history;
    private ServiceConfigService serviceConfigService;
    private ScheduleClock scheduleClock;
    private DueSetResolver dueSetResolver;
    private RemoteJobClient remoteJobClient;
    private ArchiveExtractor archiveExtractor;
    private StorageUploader storageUploader;
    private NotificationDispatcher notificationDispatcher;
    private ExecutionCoordinator coordinator;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.utc(NOW);
        repository = new InMemoryScheduledReportRepository("UTC");
        history = new InMemoryReportExecutionRepository(50);
        serviceConfigService = new ServiceConfigService(new ServiceConfig());
        scheduleClock = new ScheduleClock(clock);
        dueSetResolver = new DueSetResolver(scheduleClock);
        remoteJobClient = mock(RemoteJobClient.class);
        archiveExtractor = mock(ArchiveExtractor.class);
        storageUploader = mock(StorageUploader.class);
        notificationDispatcher = mock(NotificationDispatcher.class);
        coordinator = coordinatorWith(repository);

        when(remoteJobClient.createExportJob(any())).thenReturn("job-1");
    }

    private ExecutionCoordinator coordinatorWith(ScheduledReportRepository repo) {
        return coordinatorWith(repo, notificationDispatcher);
    }

    private ExecutionCoordinator coordinatorWith(ScheduledReportRepository repo, NotificationDispatcher dispatcher) {
        JobPoller poller = new JobPoller(remoteJobClient, clock, d -> clock.advance(d));
        return new ExecutionCoordinator(repo, history, serviceConfigService, scheduleClock, dueSetResolver,
            new ReportQueryBuilder(serviceConfigService), poller, remoteJobClient, archiveExtractor,
            new RecordCounter(), storageUploader, dispatcher, clock);
    }

    private ScheduledReportEntity dailyAtNine(String id, String name) throws IOException {
        ScheduledReportEntity report = new ScheduledReportEntity();
        report.setId(id);
        report.setName(name);
        report.setReportType("Devices");
        report.setSchedule(Collections.singletonList(ScheduleTrigger.daily(9, 0)));
        report.setCreated(LocalDateTime.of(2023, 12, 1, 12, 0));
        report.setNextRun(LocalDateTime.of(2024, 1, 1, 9, 0));
        report.getDelivery().setStorageConfigName("primary");
        repository.save(report);
        return report;
    }

    private void completedJob() throws Exception {
        when(remoteJobClient.getExportJobStatus("job-1")).thenReturn(
            new ExportJobStatus("job-1", ExportJobState.COMPLETED, "completed", "https://dl/export.zip", null));
        when(remoteJobClient.downloadExportJobData("https://dl/export.zip")).thenReturn(new byte[] {1, 2, 3});
        when(archiveExtractor.extract(any(), eq("csv"))).thenReturn(
            new ExtractedPayload("Devices.csv", "id\n1\n2\n".getBytes(StandardCharsets.UTF_8), false));
    }

    @Test
    void executeScheduledReports_successAdvancesNextRun() throws Exception {
        dailyAtNine("r1", "Daily Devices");
        completedJob();
        when(storageUploader.upload(any(), any(), eq("job-1"))).thenReturn(UploadResult.builder()
            .storageConfigName("primary").objectName("reports/devices/x.csv").fileName("x.csv").fileSize(9L)
            .downloadLink("https://link").linkExpirationDays(7).build());

        SweepSummary summary = coordinator.executeScheduledReports();

        assertThat(summary.getTotalReportsChecked()).isEqualTo(1);
        assertThat(summary.getReportsExecuted()).isEqualTo(1);
        assertThat(summary.getSuccessfulExecutions()).isEqualTo(1);
        assertThat(summary.getError()).isNull();

        ScheduledReportEntity stored = repository.findById("r1").get();
        assertThat(stored.getNextRun()).isEqualTo(LocalDateTime.of(2024, 1, 2, 9, 0));
        assertThat(stored.getLastRun()).isAfterOrEqualTo(NOW);
        RunResult run = stored.getLastRunResult();
        assertThat(run.isSuccess()).isTrue();
        assertThat(run.getRecordCount()).isEqualTo(2);
        assertThat(run.getFileName()).isEqualTo("x.csv");
        assertThat(run.getDownloadLink()).isEqualTo("https://link");
        assertThat(history.count()).isEqualTo(1);
        verify(notificationDispatcher).dispatch(any(), argThat(ctx -> ctx.isSuccess()
            && "https://link".equals(ctx.getDownloadLink()) && Integer.valueOf(2).equals(ctx.getRecordCount())));
        assertThat(coordinator.getLastSummary()).contains(summary);
    }

    @Test
    void executeScheduledReports_notDueIsUntouched() throws Exception {
        ScheduledReportEntity report = dailyAtNine("r1", "Daily Devices");
        report.setNextRun(LocalDateTime.of(2024, 1, 1, 10, 0));
        repository.save(report);

        SweepSummary summary = coordinator.executeScheduledReports();

        assertThat(summary.getTotalReportsChecked()).isEqualTo(1);
        assertThat(summary.getReportsExecuted()).isZero();
        assertThat(repository.findById("r1").get().getLastRun()).isNull();
        verify(remoteJobClient, never()).createExportJob(any());
    }

    @Test
    void executeScheduledReports_jobFailureSkipsDownstreamAndStillAdvances() throws Exception {
        dailyAtNine("r1", "Daily Devices");
        when(remoteJobClient.getExportJobStatus("job-1")).thenReturn(
            new ExportJobStatus("job-1", ExportJobState.FAILED, "failed", null, "boom"));

        SweepSummary summary = coordinator.executeScheduledReports();

        assertThat(summary.getFailedExecutions()).isEqualTo(1);
        assertThat(summary.getResults().get(0).getError()).isEqualTo("Export job failed: boom");
        verify(remoteJobClient, never()).downloadExportJobData(anyString());
        verify(archiveExtractor, never()).extract(any(), anyString());
        verify(storageUploader, never()).upload(any(), any(), anyString());
        verify(notificationDispatcher).dispatch(any(), argThat(ctx -> !ctx.isSuccess()
            && "Export job failed: boom".equals(ctx.getError())));

        ScheduledReportEntity stored = repository.findById("r1").get();
        assertThat(stored.getNextRun()).isEqualTo(LocalDateTime.of(2024, 1, 2, 9, 0));
        assertThat(stored.getLastRunResult().isSuccess()).isFalse();
        assertThat(stored.getLastRunResult().getFailureStage()).isEqualTo("JOB");
    }

    @Test
    void executeScheduledReports_runsInNameOrderAndIsolatesFailures() throws Exception {
        dailyAtNine("r2", "beta");
        dailyAtNine("r1", "Alpha");
        completedJob();
        when(storageUploader.upload(any(), any(), anyString()))
            .thenThrow(new UnknownStorageConfigurationException("primary"))
            .thenReturn(UploadResult.builder().fileName("b.csv").fileSize(9L).build());

        SweepSummary summary = coordinator.executeScheduledReports();

        assertThat(summary.getResults()).extracting("reportName").containsExactly("Alpha", "beta");
        assertThat(summary.getResults().get(0).getError()).isEqualTo("Storage configuration not found: primary");
        assertThat(summary.getResults().get(1).isSuccess()).isTrue();
        assertThat(summary.getSuccessfulExecutions()).isEqualTo(1);
        assertThat(summary.getFailedExecutions()).isEqualTo(1);
    }

    @Test
    void executeScheduledReports_unreadableStore() throws Exception {
        ScheduledReportRepository broken = mock(ScheduledReportRepository.class);
        when(broken.findAll()).thenThrow(new IOException("permission denied"));

        SweepSummary summary = coordinatorWith(broken).executeScheduledReports();

        assertThat(summary.getTotalReportsChecked()).isZero();
        assertThat(summary.getReportsExecuted()).isZero();
        assertThat(summary.getError()).isEqualTo("Failed to load scheduled reports: permission denied");
    }

    @Test
    void executeScheduledReports_persistFailureOnlyLogged() throws Exception {
        ScheduledReportEntity report = dailyAtNine("r1", "Daily Devices");
        ScheduledReportRepository readOnly = mock(ScheduledReportRepository.class);
        when(readOnly.findAll()).thenReturn(Collections.singletonList(report));
        when(readOnly.update(eq("r1"), any())).thenThrow(new IOException("disk full"));
        completedJob();
        when(storageUploader.upload(any(), any(), anyString()))
            .thenReturn(UploadResult.builder().fileName("x.csv").fileSize(9L).build());

        SweepSummary summary = coordinatorWith(readOnly).executeScheduledReports();

        assertThat(summary.getSuccessfulExecutions()).isEqualTo(1);
        verify(readOnly).update(eq("r1"), any());
    }

    @Test
    void executeScheduledReports_brokenNotificationConfigStillAdvancesAll() throws Exception {
        ScheduledReportEntity alpha = dailyAtNine("r1", "Alpha");
        ScheduledReportEntity beta = dailyAtNine("r2", "Beta");
        for (ScheduledReportEntity report : Arrays.asList(alpha, beta)) {
            report.getNotifications().setEnabled(true);
            report.getNotifications().setUseGlobalWebhook(true);
            repository.save(report);
        }
        when(remoteJobClient.getExportJobStatus("job-1")).thenReturn(
            new ExportJobStatus("job-1", ExportJobState.FAILED, "failed", null, "boom"));
        ServiceConfigService brokenConfig = mock(ServiceConfigService.class);
        when(brokenConfig.globalWebhookUrl()).thenThrow(new NullPointerException("notification section missing"));
        WebhookSender webhookSender = mock(WebhookSender.class);
        NotificationDispatcher dispatcher = new NotificationDispatcher(brokenConfig, webhookSender, clock);

        SweepSummary summary = coordinatorWith(repository, dispatcher).executeScheduledReports();

        assertThat(summary.getReportsExecuted()).isEqualTo(2);
        assertThat(summary.getFailedExecutions()).isEqualTo(2);
        assertThat(repository.findById("r1").get().getNextRun()).isEqualTo(LocalDateTime.of(2024, 1, 2, 9, 0));
        assertThat(repository.findById("r2").get().getNextRun()).isEqualTo(LocalDateTime.of(2024, 1, 2, 9, 0));
        assertThat(history.count()).isEqualTo(2);
        verify(webhookSender, never()).post(anyString(), any());
    }

    @Test
    void executeScheduledReports_throwingDispatcherDoesNotAbortSweep() throws Exception {
        dailyAtNine("r1", "Alpha");
        dailyAtNine("r2", "Beta");
        when(remoteJobClient.getExportJobStatus("job-1")).thenReturn(
            new ExportJobStatus("job-1", ExportJobState.FAILED, "failed", null, "boom"));
        when(notificationDispatcher.dispatch(any(), any())).thenThrow(new IllegalStateException("bug"));

        SweepSummary summary = coordinator.executeScheduledReports();

        assertThat(summary.getReportsExecuted()).isEqualTo(2);
        assertThat(summary.getResults()).extracting("error")
            .containsExactly("Export job failed: boom", "Export job failed: boom");
        assertThat(repository.findById("r2").get().getNextRun()).isEqualTo(LocalDateTime.of(2024, 1, 2, 9, 0));
    }

    @Test
    void executeScheduledReports_disableDuringRunIsKept() throws Exception {
        dailyAtNine("r1", "Daily");
        DefaultScheduledReportService facade = new DefaultScheduledReportService(mock(ExecutionCoordinator.class),
            mock(SchedulerStatusService.class), new ScheduledReportIndexService(repository, scheduleClock),
            repository, mock(NamedOperationLock.class), mock(JobPoller.class), remoteJobClient, scheduleClock,
            mock(ExecutorService.class));
        when(remoteJobClient.createExportJob(any())).thenAnswer(invocation -> {
            // 作业执行期间由另一线程停用
            boolean disabled = CompletableFuture
                .supplyAsync(() -> facade.disableReportsByName(Collections.singletonList("Daily")))
                .get(5, TimeUnit.SECONDS);
            assertThat(disabled).isTrue();
            return "job-1";
        });
        when(remoteJobClient.getExportJobStatus("job-1")).thenReturn(
            new ExportJobStatus("job-1", ExportJobState.FAILED, "failed", null, "boom"));

        coordinator.executeScheduledReports();

        ScheduledReportEntity stored = repository.findById("r1").get();
        assertThat(stored.isEnabled()).isFalse();
        assertThat(stored.getNextRun()).isEqualTo(LocalDateTime.of(2024, 1, 2, 9, 0));
        assertThat(stored.getLastRunResult().isSuccess()).isFalse();
    }

    @Test
    void updateAfterExecution_reportDeletedDuringRunIsNotRecreated() throws Exception {
        ScheduledReportEntity report = dailyAtNine("r1", "Daily");
        repository.delete("r1.json");
        ReportExecutionResult result = new ReportExecutionResult();
        result.setSuccess(true);

        coordinator.updateAfterExecution(report, result);

        assertThat(repository.findById("r1")).isEmpty();
    }

    @Test
    void executeReport_downloadFailure() throws Exception {
        ScheduledReportEntity report = dailyAtNine("r1", "Daily Devices");
        when(remoteJobClient.getExportJobStatus("job-1")).thenReturn(
            new ExportJobStatus("job-1", ExportJobState.COMPLETED, "completed", "h", null));
        when(remoteJobClient.downloadExportJobData("h")).thenThrow(new RemoteJobException("HTTP 404"));

        ReportExecutionResult result = coordinator.executeReport(report);

        assertThat(result.getFailureStage()).isEqualTo(FailureStage.DOWNLOAD);
        assertThat(result.getError()).isEqualTo("Failed to download export data: HTTP 404");
    }

    @Test
    void executeReport_unexpectedError() throws Exception {
        ScheduledReportEntity report = dailyAtNine("r1", "Daily Devices");
        completedJob();
        when(archiveExtractor.extract(any(), anyString())).thenThrow(new IllegalStateException("bug"));

        ReportExecutionResult result = coordinator.executeReport(report);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureStage()).isEqualTo(FailureStage.INTERNAL);
        assertThat(result.getError()).isEqualTo("Unexpected error: bug");
        verify(notificationDispatcher).dispatch(eq(report), any());
    }

    @Test
    void updateAfterExecution_overdueByDaysSkipsMissedRuns() throws Exception {
        ScheduledReportEntity report = dailyAtNine("r1", "Daily Devices");
        report.setNextRun(LocalDateTime.of(2023, 12, 25, 9, 0));
        ReportExecutionResult result = new ReportExecutionResult();
        result.setSuccess(true);

        coordinator.updateAfterExecution(report, result);

        assertThat(report.getNextRun()).isEqualTo(LocalDateTime.of(2024, 1, 2, 9, 0));
    }

    @Test
    void executeReport_jobTimeoutFromConfig() throws Exception {
        serviceConfigService.getServiceConfig().getScheduler().setJobTimeoutSeconds(20);
        ScheduledReportEntity report = dailyAtNine("r1", "Daily Devices");
        when(remoteJobClient.getExportJobStatus("job-1")).thenReturn(
            new ExportJobStatus("job-1", ExportJobState.IN_PROGRESS, "inProgress", null, null));

        ReportExecutionResult result = coordinator.executeReport(report);

        assertThat(result.getFailureStage()).isEqualTo(FailureStage.JOB);
        assertThat(result.getError()).isEqualTo("Export job timed out after 20 seconds");
        assertThat(clock.instant()).isEqualTo(NOW.plus(Duration.ofSeconds(20)).atZone(clock.getZone()).toInstant());
    }
}
