package org.csits.reportd.server.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.server.constants.ExportFormat;
import org.springframework.stereotype.Component;

/**
 * 统计导出数据的记录数。
 */
@Slf4j
@Component
public class RecordCounter {

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * CSV：非空行数减表头。JSON：value 数组或顶层数组的长度，无法解析时按对象起始符估算。
     */
    public int count(byte[] content, String format) {
        if (content == null || content.length == 0) {
            return 0;
        }
        String text = new String(content, StandardCharsets.UTF_8);
        if (ExportFormat.fromValue(format) == ExportFormat.JSON) {
            return countJson(text);
        }
        int nonEmpty = 0;
        for (String line : text.split("\\r?\\n|\\r")) {
            if (!line.trim().isEmpty()) {
                nonEmpty++;
            }
        }
        return Math.max(0, nonEmpty - 1);
    }

    private int countJson(String text) {
        try {
            JsonNode root = objectMapper.readTree(text);
            if (root != null && root.isObject() && root.path("value").isArray()) {
                return root.path("value").size();
            }
            if (root != null && root.isArray()) {
                return root.size();
            }
        } catch (IOException e) {
            log.debug("JSON 解析失败，按对象起始符估算: {}", e.getMessage());
        }
        int braces = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '{') {
                braces++;
            }
        }
        return Math.max(0, braces - 1);
    }
}
