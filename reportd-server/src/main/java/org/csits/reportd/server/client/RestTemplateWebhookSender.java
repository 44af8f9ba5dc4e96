package org.csits.reportd.server.client;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.csits.reportd.manager.notification.WebhookSender;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Component
@RequiredArgsConstructor
public class RestTemplateWebhookSender implements WebhookSender {

    private final RestTemplate restTemplate;

    @Override
    public void post(String url, Map<String, Object> payload) throws IOException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<String> response = restTemplate.exchange(URI.create(url), HttpMethod.POST,
                new HttpEntity<>(payload, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new IOException("Webhook 返回 HTTP " + response.getStatusCodeValue());
            }
        } catch (RestClientException | IllegalArgumentException e) {
            throw new IOException("Webhook 投递失败: " + e.getMessage(), e);
        }
    }
}
