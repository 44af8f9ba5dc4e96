package org.csits.reportd.web.controller;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.server.service.ScheduledReportService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 临时导出作业：轮询已有作业并返回归档内容。
 */
@Slf4j
@RestController
@RequestMapping("/api/export-jobs")
@RequiredArgsConstructor
public class ExportJobController {

    private final ScheduledReportService scheduledReportService;

    @PostMapping("/{jobId}/download")
    public CompletableFuture<ResponseEntity<?>> download(
        @PathVariable String jobId,
        @RequestParam(defaultValue = "300") long maxWaitSeconds,
        @RequestParam(defaultValue = "10") long pollIntervalSeconds) {
        if (maxWaitSeconds < 0 || pollIntervalSeconds < 0) {
            return CompletableFuture.<ResponseEntity<?>>completedFuture(
                ScheduledReportConfigController.error("maxWaitSeconds / pollIntervalSeconds 不能为负"));
        }
        return scheduledReportService.pollAndDownloadExportJob(jobId, maxWaitSeconds, pollIntervalSeconds)
            .<ResponseEntity<?>>handle((content, ex) -> {
                if (ex == null) {
                    return ResponseEntity.ok()
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .body(content);
                }
                Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                log.error("[jobId={}] 导出作业下载失败: {}", jobId, cause.getMessage());
                Map<String, Object> body = new HashMap<>();
                body.put("error", cause.getMessage());
                return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
            });
    }
}
