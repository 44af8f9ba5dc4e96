package org.csits.reportd.dao;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * 报表完成通知配置。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationConfig {

    private boolean enabled;

    private boolean useGlobalWebhook = true;

    @JsonProperty("customWebhookURL")
    private String customWebhookUrl;

    /**
     * 为空时使用默认模板。
     */
    private String messageTemplate;
}
