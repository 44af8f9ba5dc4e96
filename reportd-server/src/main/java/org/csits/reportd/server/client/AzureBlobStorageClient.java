package org.csits.reportd.server.client;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.manager.security.HmacSigner;
import org.csits.reportd.manager.storage.StorageAuthMethod;
import org.csits.reportd.manager.storage.StorageClient;
import org.csits.reportd.manager.storage.StorageConfiguration;
import org.csits.reportd.manager.storage.StorageTransferException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriUtils;

/**
 * Blob 存储客户端：Put Blob 上传，服务 SAS 生成只读链接。
 * <p>
 * SHARED_KEY 用账户密钥签名请求；SAS_TOKEN 把令牌拼到地址上；CLIENT_CREDENTIAL 使用 Bearer 令牌上传，
 * 但该方式无法生成服务 SAS，链接生成会失败。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AzureBlobStorageClient implements StorageClient {

    static final String API_VERSION = "2023-11-03";

    static final String STORAGE_SCOPE = "https://storage.azure.com/.default";

    private static final String AUTHORITY_URL = "https://login.microsoftonline.com";

    private static final DateTimeFormatter HTTP_DATE =
        DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US);

    private static final DateTimeFormatter SAS_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    private final RestTemplate restTemplate;
    private final HmacSigner hmacSigner;
    private final ClientCredentialTokenProvider tokenProvider;
    private final Clock clock;

    @Override
    public void upload(StorageConfiguration configuration, String objectName, byte[] content, String contentType)
        throws StorageTransferException {
        String blobUrl = blobUrl(configuration, objectName);
        HttpHeaders headers = new HttpHeaders();
        headers.set("x-ms-blob-type", "BlockBlob");
        headers.set("x-ms-date", HTTP_DATE.format(ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC)));
        headers.set("x-ms-version", API_VERSION);
        headers.set(HttpHeaders.CONTENT_TYPE, contentType);

        String target = blobUrl;
        switch (authMethod(configuration)) {
            case SHARED_KEY:
                requireKey(configuration);
                String stringToSign = sharedKeyStringToSign("PUT", content.length, contentType, headers,
                    canonicalizedResource(configuration, objectName));
                String signature = sign(configuration, stringToSign);
                headers.set(HttpHeaders.AUTHORIZATION, "SharedKey " + configuration.getAccountName() + ":" + signature);
                break;
            case SAS_TOKEN:
                target = blobUrl + "?" + sasToken(configuration);
                break;
            case CLIENT_CREDENTIAL:
                headers.setBearerAuth(bearerToken(configuration));
                break;
            default:
                throw new StorageTransferException("不支持的鉴权方式: " + configuration.getAuthMethod());
        }

        try {
            ResponseEntity<String> response = restTemplate.exchange(URI.create(target), HttpMethod.PUT,
                new HttpEntity<>(content, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new StorageTransferException("上传失败: HTTP " + response.getStatusCodeValue());
            }
        } catch (RestClientException e) {
            throw new StorageTransferException("上传失败: " + e.getMessage(), e);
        }
        log.info("已上传: container={}, blob={}, size={}", configuration.getContainerName(), objectName,
            content.length);
    }

    @Override
    public String generateDownloadLink(StorageConfiguration configuration, String objectName, Duration validity)
        throws StorageTransferException {
        String blobUrl = blobUrl(configuration, objectName);
        switch (authMethod(configuration)) {
            case SAS_TOKEN:
                return blobUrl + "?" + sasToken(configuration);
            case SHARED_KEY:
                requireKey(configuration);
                String expiry = SAS_DATE.format(
                    ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC).plus(validity));
                String signature = sign(configuration, sasStringToSign(configuration, objectName, expiry));
                return blobUrl
                    + "?sv=" + API_VERSION
                    + "&sr=b"
                    + "&sp=r"
                    + "&se=" + URLEncoder.encode(expiry, StandardCharsets.UTF_8)
                    + "&sig=" + URLEncoder.encode(signature, StandardCharsets.UTF_8);
            default:
                throw new StorageTransferException(
                    "Shareable links require SHARED_KEY or SAS_TOKEN authentication, got " + configuration.getAuthMethod());
        }
    }

    String blobUrl(StorageConfiguration configuration, String objectName) {
        return configuration.resolveEndpoint() + "/" + configuration.getContainerName() + "/"
            + encodePath(objectName);
    }

    static String sharedKeyStringToSign(String verb, long contentLength, String contentType, HttpHeaders headers,
                                        String canonicalizedResource) {
        Map<String, String> msHeaders = new TreeMap<>();
        headers.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.startsWith("x-ms-")) {
                msHeaders.put(lower, String.join(",", values).trim());
            }
        });
        StringBuilder sb = new StringBuilder();
        sb.append(verb).append('\n')
            .append('\n')                                            // Content-Encoding
            .append('\n')                                            // Content-Language
            .append(contentLength == 0 ? "" : String.valueOf(contentLength)).append('\n')
            .append('\n')                                            // Content-MD5
            .append(contentType == null ? "" : contentType).append('\n')
            .append('\n')                                            // Date
            .append('\n')                                            // If-Modified-Since
            .append('\n')                                            // If-Match
            .append('\n')                                            // If-None-Match
            .append('\n')                                            // If-Unmodified-Since
            .append('\n');                                           // Range
        for (Map.Entry<String, String> e : msHeaders.entrySet()) {
            sb.append(e.getKey()).append(':').append(e.getValue()).append('\n');
        }
        sb.append(canonicalizedResource);
        return sb.toString();
    }

    static String canonicalizedResource(StorageConfiguration configuration, String objectName) {
        return "/" + configuration.getAccountName() + "/" + configuration.getContainerName() + "/"
            + encodePath(objectName);
    }

    /**
     * 服务 SAS（2020-12-06 及以后版本的字段顺序），只读权限，blob 级别。
     */
    static String sasStringToSign(StorageConfiguration configuration, String objectName, String expiry) {
        return String.join("\n", Arrays.asList(
            "r",                                                     // signedPermissions
            "",                                                      // signedStart
            expiry,
            "/blob/" + configuration.getAccountName() + "/" + configuration.getContainerName() + "/" + objectName,
            "",                                                      // signedIdentifier
            "",                                                      // signedIP
            "",                                                      // signedProtocol
            API_VERSION,
            "b",                                                     // signedResource
            "",                                                      // signedSnapshotTime
            "",                                                      // signedEncryptionScope
            "",                                                      // rscc
            "",                                                      // rscd
            "",                                                      // rsce
            "",                                                      // rscl
            ""));                                                    // rsct
    }

    private static StorageAuthMethod authMethod(StorageConfiguration configuration) {
        return configuration.getAuthMethod() != null ? configuration.getAuthMethod() : StorageAuthMethod.SHARED_KEY;
    }

    private static String encodePath(String objectName) {
        String[] segments = objectName.split("/", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                sb.append('/');
            }
            sb.append(UriUtils.encodePathSegment(segments[i], StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    private static String sasToken(StorageConfiguration configuration) throws StorageTransferException {
        String token = configuration.getSasToken();
        if (token == null || token.trim().isEmpty()) {
            throw new StorageTransferException("存储配置 '" + configuration.getName() + "' 缺少 SAS 令牌");
        }
        return token.startsWith("?") ? token.substring(1) : token;
    }

    private static void requireKey(StorageConfiguration configuration) throws StorageTransferException {
        if (configuration.getAccountKey() == null || configuration.getAccountKey().trim().isEmpty()) {
            throw new StorageTransferException("存储配置 '" + configuration.getName() + "' 缺少账户密钥");
        }
    }

    private String sign(StorageConfiguration configuration, String stringToSign) throws StorageTransferException {
        try {
            return hmacSigner.signBase64(configuration.getAccountKey(), stringToSign);
        } catch (IllegalArgumentException e) {
            throw new StorageTransferException("存储配置 '" + configuration.getName() + "' 签名失败: " + e.getMessage(), e);
        }
    }

    private String bearerToken(StorageConfiguration configuration) throws StorageTransferException {
        try {
            return tokenProvider.getToken(AUTHORITY_URL, configuration.getTenantId(), configuration.getClientId(),
                configuration.getClientSecret(), STORAGE_SCOPE);
        } catch (IOException e) {
            throw new StorageTransferException("存储鉴权失败: " + e.getMessage(), e);
        }
    }
}
