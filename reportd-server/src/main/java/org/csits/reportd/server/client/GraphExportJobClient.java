package org.csits.reportd.server.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.manager.remote.ExportJobRequest;
import org.csits.reportd.manager.remote.ExportJobState;
import org.csits.reportd.manager.remote.ExportJobStatus;
import org.csits.reportd.manager.remote.RemoteJobClient;
import org.csits.reportd.manager.remote.RemoteJobException;
import org.csits.reportd.server.config.ServiceConfig;
import org.csits.reportd.server.service.ServiceConfigService;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriUtils;

/**
 * 设备管理 API 导出作业客户端（deviceManagement/reports/exportJobs）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphExportJobClient implements RemoteJobClient {

    private static final String EXPORT_JOBS_PATH = "/deviceManagement/reports/exportJobs";

    private final RestTemplate restTemplate;
    private final ServiceConfigService serviceConfigService;
    private final ClientCredentialTokenProvider tokenProvider;

    @Override
    public String createExportJob(ExportJobRequest request) throws RemoteJobException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reportName", request.getReportType());
        if (request.getFilter() != null) {
            body.put("filter", request.getFilter());
        }
        if (request.getColumns() != null && !request.getColumns().isEmpty()) {
            body.put("select", request.getColumns());
        }
        body.put("format", request.getFormat());

        JsonNode response = exchange(HttpMethod.POST, baseUrl() + EXPORT_JOBS_PATH, body);
        if (response == null || !response.hasNonNull("id")) {
            throw new RemoteJobException("导出作业响应缺少 id");
        }
        return response.get("id").asText();
    }

    @Override
    public ExportJobStatus getExportJobStatus(String jobId) throws RemoteJobException {
        String url = baseUrl() + EXPORT_JOBS_PATH + "('" + UriUtils.encodePathSegment(jobId, "UTF-8") + "')";
        JsonNode response = exchange(HttpMethod.GET, url, null);
        if (response == null) {
            throw new RemoteJobException("导出作业状态响应为空: " + jobId);
        }
        String raw = response.path("status").asText(null);
        ExportJobStatus status = new ExportJobStatus();
        status.setJobId(jobId);
        status.setRawStatus(raw);
        status.setState(ExportJobState.fromValue(raw));
        status.setDownloadHandle(response.path("url").asText(null));
        JsonNode error = response.path("error");
        if (error.isTextual()) {
            status.setErrorMessage(error.asText());
        } else if (error.isObject()) {
            status.setErrorMessage(error.path("message").asText(null));
        }
        return status;
    }

    @Override
    public byte[] downloadExportJobData(String downloadHandle) throws RemoteJobException {
        if (downloadHandle == null || downloadHandle.trim().isEmpty()) {
            throw new RemoteJobException("下载地址为空");
        }
        try {
            // 预签名地址，不带鉴权头
            ResponseEntity<byte[]> response = restTemplate.exchange(URI.create(downloadHandle), HttpMethod.GET,
                HttpEntity.EMPTY, byte[].class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new RemoteJobException("下载导出数据失败: HTTP " + response.getStatusCodeValue());
            }
            log.info("导出数据已下载: size={}", response.getBody().length);
            return response.getBody();
        } catch (RestClientException | IllegalArgumentException e) {
            throw new RemoteJobException("下载导出数据失败: " + e.getMessage(), e);
        }
    }

    private JsonNode exchange(HttpMethod method, String url, Object body) throws RemoteJobException {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken());
        headers.setAccept(java.util.Collections.singletonList(MediaType.APPLICATION_JSON));
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(URI.create(url), method,
                new HttpEntity<>(body, headers), JsonNode.class);
            return response.getBody();
        } catch (RestClientException e) {
            throw new RemoteJobException(method + " " + url + " 失败: " + e.getMessage(), e);
        }
    }

    private String accessToken() throws RemoteJobException {
        ServiceConfig.RemoteApiConfig remote = serviceConfigService.getServiceConfig().getRemote();
        try {
            return tokenProvider.getToken(remote.getAuthorityUrl(), remote.getTenantId(), remote.getClientId(),
                remote.getClientSecret(), remote.getScope());
        } catch (IOException e) {
            throw new RemoteJobException("设备管理 API 鉴权失败: " + e.getMessage(), e);
        }
    }

    private String baseUrl() {
        return ClientCredentialTokenProvider.trimSlash(serviceConfigService.getServiceConfig().getRemote().getBaseUrl());
    }
}
