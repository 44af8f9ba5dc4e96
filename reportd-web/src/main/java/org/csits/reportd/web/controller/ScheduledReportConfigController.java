package org.csits.reportd.web.controller;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.server.service.ScheduledReportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 报表定义与索引管理 API。请求体为原始 JSON 文件内容，按原样写入存储目录。
 */
@Slf4j
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ScheduledReportConfigController {

    private final ScheduledReportService scheduledReportService;

    @PutMapping("/index")
    public ResponseEntity<Map<String, Object>> updateIndex(@RequestBody byte[] content) {
        if (!scheduledReportService.updateScheduledReportsIndex(content)) {
            return error("索引内容无效或保存失败");
        }
        return success();
    }

    @PostMapping("/index/rebuild")
    public ResponseEntity<Map<String, Object>> rebuildIndex() {
        int count = scheduledReportService.rebuildScheduledReportsIndex();
        if (count < 0) {
            return error("索引重建失败");
        }
        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("reports", count);
        return ResponseEntity.ok(body);
    }

    /**
     * 按名称停用，请求体为报表名数组
     */
    @PostMapping("/disable")
    public ResponseEntity<Map<String, Object>> disable(@RequestBody List<String> reportNames) {
        boolean all = scheduledReportService.disableReportsByName(reportNames);
        Map<String, Object> body = new HashMap<>();
        body.put("success", all);
        return ResponseEntity.ok(body);
    }

    @PutMapping("/{fileName}")
    public ResponseEntity<Map<String, Object>> save(@PathVariable String fileName, @RequestBody byte[] content) {
        if (!scheduledReportService.saveScheduledReportConfiguration(content, fileName)) {
            return error("报表配置无效或保存失败: " + fileName);
        }
        return success();
    }

    @DeleteMapping("/{fileName}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String fileName) {
        if (!scheduledReportService.deleteScheduledReportConfiguration(fileName)) {
            return error("报表配置不存在或删除失败: " + fileName);
        }
        return success();
    }

    private static ResponseEntity<Map<String, Object>> success() {
        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        return ResponseEntity.ok(body);
    }

    static ResponseEntity<Map<String, Object>> error(String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", message);
        return ResponseEntity.badRequest().body(body);
    }
}
