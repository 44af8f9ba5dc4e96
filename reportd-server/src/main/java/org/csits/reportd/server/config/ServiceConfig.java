package org.csits.reportd.server.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.csits.reportd.manager.storage.StorageConfiguration;

/**
 * 服务配置，对应 conf/service.yaml。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceConfig {

    private SchedulerConfig scheduler = new SchedulerConfig();

    private NotificationSettings notification = new NotificationSettings();

    private StorageSettings storage = new StorageSettings();

    private CatalogConfig catalog = new CatalogConfig();

    private RemoteApiConfig remote = new RemoteApiConfig();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SchedulerConfig {

        private Boolean enabled = Boolean.TRUE;

        /**
         * 周期触发间隔（秒），仅用于状态展示，实际周期由 xxl-job 调度决定。
         */
        @JsonProperty("interval_seconds")
        private Integer intervalSeconds = 300;

        /**
         * 定时执行时等待单个导出作业的最长时间（秒）。
         */
        @JsonProperty("job_timeout_seconds")
        private Integer jobTimeoutSeconds = 300;

        @JsonProperty("poll_interval_seconds")
        private Integer pollIntervalSeconds = 10;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NotificationSettings {

        @JsonProperty("global_webhook_url")
        private String globalWebhookUrl;

        /**
         * 报表未配置模板时使用，为空时用内置模板。
         */
        @JsonProperty("default_message_template")
        private String defaultMessageTemplate;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageSettings {

        private List<StorageConfiguration> configurations = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CatalogConfig {

        private List<ReportTypeConfig> reports = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReportTypeConfig {

        @JsonProperty("report_type")
        private String reportType;

        @JsonProperty("display_name")
        private String displayName;

        @JsonProperty("default_columns")
        private List<String> defaultColumns = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RemoteApiConfig {

        @JsonProperty("base_url")
        private String baseUrl = "https://graph.microsoft.com/beta";

        @JsonProperty("authority_url")
        private String authorityUrl = "https://login.microsoftonline.com";

        @JsonProperty("tenant_id")
        private String tenantId;

        @JsonProperty("client_id")
        private String clientId;

        @JsonProperty("client_secret")
        private String clientSecret;

        private String scope = "https://graph.microsoft.com/.default";
    }
}
