package org.csits.reportd.server.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.time.LocalDateTime;
import java.util.Arrays;
import org.csits.reportd.manager.remote.ExportJobRequest;
import org.csits.reportd.manager.remote.ExportJobState;
import org.csits.reportd.manager.remote.ExportJobStatus;
import org.csits.reportd.manager.remote.RemoteJobException;
import org.csits.reportd.server.MutableClock;
import org.csits.reportd.server.config.ServiceConfig;
import org.csits.reportd.server.service.ServiceConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class GraphExportJobClientTest {

    private static final String JOBS = "https://graph.example/beta/deviceManagement/reports/exportJobs";

    private MockRestServiceServer server;
    private GraphExportJobClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        ServiceConfig config = new ServiceConfig();
        config.getRemote().setBaseUrl("https://graph.example/beta/");
        config.getRemote().setAuthorityUrl("https://login.example");
        config.getRemote().setTenantId("tenant");
        config.getRemote().setClientId("client");
        config.getRemote().setClientSecret("secret");
        MutableClock clock = MutableClock.utc(LocalDateTime.of(2024, 1, 1, 9, 0));
        client = new GraphExportJobClient(restTemplate, new ServiceConfigService(config),
            new ClientCredentialTokenProvider(restTemplate, clock));
    }

    private void expectToken() {
        server.expect(once(), requestTo("https://login.example/tenant/oauth2/v2.0/token"))
            .andExpect(method(HttpMethod.POST))
            .andRespond(withSuccess("{\"access_token\":\"tok\",\"expires_in\":3600}", MediaType.APPLICATION_JSON));
    }

    @Test
    void createAndStatus_tokenIsCached() throws Exception {
        expectToken();
        server.expect(requestTo(JOBS))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", "Bearer tok"))
            .andExpect(content().json("{\"reportName\":\"Devices\",\"filter\":\"OS eq 'Windows'\","
                + "\"select\":[\"DeviceName\"],\"format\":\"csv\"}"))
            .andRespond(withSuccess("{\"id\":\"Devices_abc\",\"status\":\"notStarted\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(JOBS + "('Devices_abc')"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess("{\"id\":\"Devices_abc\",\"status\":\"completed\",\"url\":\"https://dl/x.zip\"}",
                MediaType.APPLICATION_JSON));

        String jobId = client.createExportJob(ExportJobRequest.builder().reportType("Devices")
            .filter("OS eq 'Windows'").columns(Arrays.asList("DeviceName")).format("csv").build());
        ExportJobStatus status = client.getExportJobStatus(jobId);

        assertThat(jobId).isEqualTo("Devices_abc");
        assertThat(status.getState()).isEqualTo(ExportJobState.COMPLETED);
        assertThat(status.getDownloadHandle()).isEqualTo("https://dl/x.zip");
        server.verify();
    }

    @Test
    void status_failedWithErrorObject() throws Exception {
        expectToken();
        server.expect(requestTo(JOBS + "('j')"))
            .andRespond(withSuccess("{\"status\":\"failed\",\"error\":{\"message\":\"quota\"}}",
                MediaType.APPLICATION_JSON));

        ExportJobStatus status = client.getExportJobStatus("j");

        assertThat(status.getState()).isEqualTo(ExportJobState.FAILED);
        assertThat(status.getErrorMessage()).isEqualTo("quota");
    }

    @Test
    void create_serverErrorWrapped() {
        expectToken();
        server.expect(requestTo(JOBS)).andRespond(withServerError());

        assertThatThrownBy(() -> client.createExportJob(ExportJobRequest.builder().reportType("Devices")
            .format("csv").build())).isInstanceOf(RemoteJobException.class);
    }

    @Test
    void download_noAuthHeader() throws Exception {
        server.expect(requestTo("https://dl/x.zip"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess(new byte[] {1, 2}, MediaType.APPLICATION_OCTET_STREAM));

        assertThat(client.downloadExportJobData("https://dl/x.zip")).containsExactly((byte) 1, (byte) 2);
    }

    @Test
    void missingCredentials() {
        ServiceConfig config = new ServiceConfig();
        RestTemplate restTemplate = new RestTemplate();
        GraphExportJobClient unconfigured = new GraphExportJobClient(restTemplate, new ServiceConfigService(config),
            new ClientCredentialTokenProvider(restTemplate, MutableClock.utc(LocalDateTime.of(2024, 1, 1, 0, 0))));

        assertThatThrownBy(() -> unconfigured.getExportJobStatus("j")).isInstanceOf(RemoteJobException.class);
    }
}
