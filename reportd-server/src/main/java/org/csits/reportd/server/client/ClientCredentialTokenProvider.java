package org.csits.reportd.server.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * OAuth2 客户端凭据令牌，按 租户/客户端/scope 缓存到过期前一分钟。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClientCredentialTokenProvider {

    private static final long EXPIRY_MARGIN_SECONDS = 60L;

    private final RestTemplate restTemplate;
    private final Clock clock;

    private final Map<String, CachedToken> cache = new ConcurrentHashMap<>();

    public String getToken(String authorityUrl, String tenantId, String clientId, String clientSecret, String scope)
        throws IOException {
        if (isBlank(tenantId) || isBlank(clientId) || isBlank(clientSecret)) {
            throw new IOException("客户端凭据未配置完整: tenantId/clientId/clientSecret");
        }
        String key = tenantId + "|" + clientId + "|" + scope;
        CachedToken cached = cache.get(key);
        Instant now = clock.instant();
        if (cached != null && now.isBefore(cached.expiresAt)) {
            return cached.token;
        }

        String url = trimSlash(authorityUrl) + "/" + tenantId + "/oauth2/v2.0/token";
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);
        form.add("scope", scope);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        JsonNode response;
        try {
            response = restTemplate.postForObject(url, new HttpEntity<>(form, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw new IOException("获取访问令牌失败: " + e.getMessage(), e);
        }
        if (response == null || !response.hasNonNull("access_token")) {
            throw new IOException("令牌响应缺少 access_token");
        }
        String token = response.get("access_token").asText();
        long expiresIn = response.path("expires_in").asLong(3600L);
        cache.put(key, new CachedToken(token, now.plusSeconds(Math.max(0L, expiresIn - EXPIRY_MARGIN_SECONDS))));
        log.debug("已获取访问令牌: tenant={}, scope={}, expiresIn={}s", tenantId, scope, expiresIn);
        return token;
    }

    static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    private static final class CachedToken {

        private final String token;
        private final Instant expiresAt;

        CachedToken(String token, Instant expiresAt) {
            this.token = token;
            this.expiresAt = expiresAt;
        }
    }
}
