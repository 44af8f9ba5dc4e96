package org.csits.reportd.server.service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.dao.DeliveryConfig;
import org.springframework.stereotype.Service;

/**
 * 上传对象命名：目录模板 + 文件名模板。
 * 占位符 {reportName} {reportType} {date} {time} {jobId} {extension}。
 */
@Slf4j
@Service
public class FileNamingService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH-mm-ss");

    /**
     * 生成文件名
     *
     * @param template 文件名模板，为空时使用默认模板
     * @param reportName 报表名，空白被去除
     * @param reportType 报表类型
     * @param jobId 远端作业 ID
     * @param format 导出格式，扩展名取小写
     * @param now 服务时区当前时间
     */
    public String resolveFileName(String template, String reportName, String reportType, String jobId,
                                  String format, LocalDateTime now) {
        String effective = isBlank(template) ? DeliveryConfig.DEFAULT_FILE_NAME_TEMPLATE : template;
        String fileName = effective
            .replace("{reportName}", safeSegment(reportName == null ? "" : reportName.replaceAll("\\s+", "")))
            .replace("{reportType}", safeSegment(nullToEmpty(reportType)))
            .replace("{date}", now.format(DATE_FORMATTER))
            .replace("{time}", now.format(TIME_FORMATTER))
            .replace("{jobId}", safeSegment(nullToEmpty(jobId)))
            .replace("{extension}", nullToEmpty(format).toLowerCase(Locale.ROOT));
        fileName = safeSegment(fileName);
        log.debug("生成文件名: template={}, fileName={}", effective, fileName);
        return fileName;
    }

    /**
     * 生成目录，非空时以 / 结尾、不以 / 开头。{reportType} 取小写。
     */
    public String resolveFolderPath(String template, String reportType, LocalDateTime now) {
        if (template == null) {
            template = DeliveryConfig.DEFAULT_FOLDER_PATH;
        }
        String folder = template
            .replace("{reportType}", nullToEmpty(reportType).toLowerCase(Locale.ROOT))
            .replace("{date}", now.format(DATE_FORMATTER))
            .replace("{time}", now.format(TIME_FORMATTER))
            .replace('\\', '/');
        while (folder.startsWith("/")) {
            folder = folder.substring(1);
        }
        if (!folder.isEmpty() && !folder.endsWith("/")) {
            folder = folder + "/";
        }
        return folder;
    }

    private static String safeSegment(String value) {
        return value.replace('/', '_').replace('\\', '_');
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
