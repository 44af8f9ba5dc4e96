package org.csits.reportd.server.service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.dao.NotificationConfig;
import org.csits.reportd.dao.ScheduledReportEntity;
import org.csits.reportd.manager.notification.WebhookSender;
import org.csits.reportd.server.config.ServiceConfig;
import org.csits.reportd.server.dto.NotificationContext;
import org.springframework.stereotype.Service;

/**
 * 报表执行通知。尽力投递：失败只记日志，不影响执行结果。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatcher {

    public static final String DEFAULT_MESSAGE_TEMPLATE = "📊 **Scheduled Report Complete: {status}**\n\n"
        + "**{reportName}** generated\n"
        + "- **Records:** {recordCount}\n"
        + "- **File Size:** {fileSize}\n"
        + "- **Format:** {format}\n\n"
        + "🔗 **Download:** [{reportName} Report]({azureLink})\n\n"
        + "⏰ **Link expires:** {expirationDate}";

    public static final String DEFAULT_FAILURE_TEMPLATE = "📊 **Scheduled Report: {status}**\n\n"
        + "**{reportName}** ({reportType}) failed at {timestamp}\n"
        + "- **Job ID:** {jobId}\n"
        + "- **Error:** {error}";

    private static final String STATUS_SUCCESS = "✅ SUCCESS";
    private static final String STATUS_FAILED = "❌ FAILED";
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final ServiceConfigService serviceConfigService;
    private final WebhookSender webhookSender;
    private final Clock clock;

    /**
     * 地址解析、模板渲染和投递中的任何异常都只记日志。
     *
     * @return 是否已投递；未启用通知、没有 webhook 或投递失败时为 false
     */
    public boolean dispatch(ScheduledReportEntity report, NotificationContext context) {
        NotificationConfig config = report.getNotifications();
        if (config == null || !config.isEnabled()) {
            log.debug("[reportId={}] 通知未启用，跳过", report.getId());
            return false;
        }
        try {
            String webhookUrl = config.isUseGlobalWebhook()
                ? serviceConfigService.globalWebhookUrl()
                : config.getCustomWebhookUrl();
            if (webhookUrl == null || webhookUrl.trim().isEmpty()) {
                log.error("[reportId={}] 未配置通知 webhook 地址", report.getId());
                return false;
            }

            Map<String, Object> payload;
            if (context.isSuccess() && context.getDownloadLink() != null) {
                payload = buildCard(report, context);
            } else {
                payload = Collections.<String, Object>singletonMap("text", renderMessage(report, context));
            }
            webhookSender.post(webhookUrl, payload);
            log.info("[reportId={}] 通知已发送: success={}", report.getId(), context.isSuccess());
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("[reportId={}] 通知发送失败: name={}", report.getId(), report.getName(), e);
            return false;
        }
    }

    /**
     * 按报表模板（或默认模板）渲染消息。
     */
    public String renderMessage(ScheduledReportEntity report, NotificationContext context) {
        LocalDateTime now = context.getTimestamp() != null ? context.getTimestamp() : LocalDateTime.now(clock);
        String template = resolveTemplate(report, context.isSuccess());
        String format = context.getFormat() != null ? context.getFormat() : report.getFormat();
        String link = context.getDownloadLink();

        String expiration;
        if (link == null) {
            expiration = "N/A";
        } else if (context.getLinkExpirationDays() != null) {
            expiration = now.plusDays(context.getLinkExpirationDays()).format(DATE_FORMATTER);
        } else {
            expiration = "Never";
        }

        return template
            .replace("{reportName}", nullToEmpty(report.getName()))
            .replace("{reportType}", nullToEmpty(report.getReportType()))
            .replace("{status}", context.isSuccess() ? STATUS_SUCCESS : STATUS_FAILED)
            .replace("{timestamp}", now.format(TIMESTAMP_FORMATTER))
            .replace("{error}", nullToEmpty(context.getError()))
            .replace("{jobId}", context.getJobId() != null ? context.getJobId() : "N/A")
            .replace("{recordCount}", context.getRecordCount() != null ? String.valueOf(context.getRecordCount()) : "Unknown")
            .replace("{fileSize}", context.getFileSize() != null ? formatFileSize(context.getFileSize()) : "Unknown")
            .replace("{format}", nullToEmpty(format).toUpperCase(Locale.ROOT))
            .replace("{azureLink}", link != null ? link : "Not available")
            .replace("{downloadLink}", link != null ? link : "Not available")
            .replace("{expirationDate}", expiration);
    }

    private String resolveTemplate(ScheduledReportEntity report, boolean success) {
        String custom = report.getNotifications() != null ? report.getNotifications().getMessageTemplate() : null;
        if (custom != null && !custom.trim().isEmpty()) {
            return custom;
        }
        if (!success) {
            return DEFAULT_FAILURE_TEMPLATE;
        }
        ServiceConfig.NotificationSettings settings = serviceConfigService.getServiceConfig().getNotification();
        String configured = settings != null ? settings.getDefaultMessageTemplate() : null;
        return configured != null && !configured.trim().isEmpty() ? configured : DEFAULT_MESSAGE_TEMPLATE;
    }

    /**
     * 带下载按钮的自适应卡片。
     */
    private Map<String, Object> buildCard(ScheduledReportEntity report, NotificationContext context) {
        LocalDateTime now = context.getTimestamp() != null ? context.getTimestamp() : LocalDateTime.now(clock);
        String expiration = context.getLinkExpirationDays() != null
            ? now.plusDays(context.getLinkExpirationDays()).format(DATE_FORMATTER) : "Never";
        String format = context.getFormat() != null ? context.getFormat() : report.getFormat();

        List<Map<String, Object>> body = new ArrayList<>();
        body.add(textBlock("📊 **Scheduled Report Complete**", "Bolder", "Large"));
        body.add(textBlock("**" + report.getName() + "** generated successfully", null, null));
        Map<String, Object> facts = new LinkedHashMap<>();
        facts.put("type", "FactSet");
        List<Map<String, Object>> factList = new ArrayList<>();
        factList.add(fact("Records", context.getRecordCount() != null ? String.valueOf(context.getRecordCount()) : "Unknown"));
        factList.add(fact("File Size", context.getFileSize() != null ? formatFileSize(context.getFileSize()) : "Unknown"));
        factList.add(fact("Format", nullToEmpty(format).toUpperCase(Locale.ROOT)));
        factList.add(fact("Link Expires", expiration));
        facts.put("facts", factList);
        facts.put("spacing", "Medium");
        body.add(facts);

        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "Action.OpenUrl");
        action.put("title", "📥 Download Report");
        action.put("url", context.getDownloadLink());

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("type", "AdaptiveCard");
        content.put("version", "1.4");
        content.put("msteams", Collections.singletonMap("width", "full"));
        content.put("body", body);
        content.put("actions", Collections.singletonList(action));

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("contentType", "application/vnd.microsoft.card.adaptive");
        attachment.put("content", content);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "message");
        payload.put("attachments", Collections.singletonList(attachment));
        return payload;
    }

    private static Map<String, Object> textBlock(String text, String weight, String size) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "TextBlock");
        block.put("text", text);
        if (weight != null) {
            block.put("weight", weight);
        }
        if (size != null) {
            block.put("size", size);
        }
        block.put("wrap", Boolean.TRUE);
        return block;
    }

    private static Map<String, Object> fact(String title, String value) {
        Map<String, Object> fact = new LinkedHashMap<>();
        fact.put("title", title);
        fact.put("value", value);
        return fact;
    }

    /**
     * 十进制单位，如 2.0 KB。
     */
    static String formatFileSize(long bytes) {
        if (bytes < 1000) {
            return bytes + " bytes";
        }
        String[] units = {"KB", "MB", "GB", "TB"};
        double value = bytes;
        int unit = -1;
        while (value >= 1000 && unit < units.length - 1) {
            value /= 1000;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, units[unit]);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
