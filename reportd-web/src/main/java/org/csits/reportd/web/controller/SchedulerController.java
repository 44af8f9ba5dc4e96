package org.csits.reportd.web.controller;

import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.server.dto.SchedulerStatus;
import org.csits.reportd.server.dto.SweepSummary;
import org.csits.reportd.server.service.ScheduledReportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 定时执行 API
 */
@Slf4j
@RestController
@RequestMapping("/api/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final ScheduledReportService scheduledReportService;

    /**
     * 触发一次执行，异步返回汇总
     */
    @PostMapping("/execute")
    public CompletableFuture<ResponseEntity<SweepSummary>> execute() {
        log.info("收到 HTTP 执行请求");
        return scheduledReportService.executeScheduledReports().thenApply(ResponseEntity::ok);
    }

    @GetMapping("/status")
    public ResponseEntity<SchedulerStatus> status() {
        return ResponseEntity.ok(scheduledReportService.getSchedulerStatus());
    }
}
