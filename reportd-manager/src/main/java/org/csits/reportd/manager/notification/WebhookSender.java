package org.csits.reportd.manager.notification;

import java.io.IOException;
import java.util.Map;

/**
 * Webhook 投递。
 */
public interface WebhookSender {

    /**
     * 以 JSON 形式投递消息体，非 2xx 响应抛出异常。
     */
    void post(String url, Map<String, Object> payload) throws IOException;
}
