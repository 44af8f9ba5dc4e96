package org.csits.reportd.web.controller;

import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.manager.lock.NamedOperationLock;
import org.csits.reportd.server.service.ScheduledReportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 命名操作互斥 API
 */
@Slf4j
@RestController
@RequestMapping("/api/operations")
@RequiredArgsConstructor
public class OperationController {

    private final ScheduledReportService scheduledReportService;

    /**
     * 已有同名操作在进行时 started=false
     */
    @PostMapping("/{identifier}/begin")
    public ResponseEntity<Map<String, Object>> begin(
        @PathVariable String identifier,
        @RequestParam(defaultValue = "" + NamedOperationLock.DEFAULT_TIMEOUT_SECONDS) long timeoutSeconds) {
        boolean started;
        try {
            started = scheduledReportService.beginOperation(identifier, timeoutSeconds);
        } catch (IllegalArgumentException e) {
            return ScheduledReportConfigController.error(e.getMessage());
        }
        Map<String, Object> body = new HashMap<>();
        body.put("identifier", identifier);
        body.put("started", started);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{identifier}/end")
    public ResponseEntity<Map<String, Object>> end(@PathVariable String identifier) {
        Map<String, Object> body = new HashMap<>();
        body.put("identifier", identifier);
        body.put("ended", scheduledReportService.endOperation(identifier));
        return ResponseEntity.ok(body);
    }
}
