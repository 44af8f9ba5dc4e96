package org.csits.reportd.server.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import org.csits.reportd.manager.security.BouncyCastleHmacSigner;
import org.csits.reportd.manager.storage.StorageAuthMethod;
import org.csits.reportd.manager.storage.StorageConfiguration;
import org.csits.reportd.manager.storage.StorageTransferException;
import org.csits.reportd.server.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class AzureBlobStorageClientTest {

    private static final String KEY = "c2VjcmV0LWtleQ==";
    private static final byte[] CONTENT = "id\n1\n".getBytes(StandardCharsets.UTF_8);

    private final BouncyCastleHmacSigner signer = new BouncyCastleHmacSigner();
    private MockRestServiceServer server;
    private AzureBlobStorageClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        MutableClock clock = MutableClock.utc(LocalDateTime.of(2024, 1, 1, 9, 0));
        client = new AzureBlobStorageClient(restTemplate, signer,
            new ClientCredentialTokenProvider(restTemplate, clock), clock);
    }

    private static StorageConfiguration config(StorageAuthMethod method) {
        StorageConfiguration c = new StorageConfiguration();
        c.setName("primary");
        c.setAccountName("acct");
        c.setContainerName("reports");
        c.setAuthMethod(method);
        c.setAccountKey(KEY);
        c.setSasToken("?sv=2023-11-03&sig=abc");
        c.setTenantId("t");
        c.setClientId("c");
        c.setClientSecret("s");
        return c;
    }

    @Test
    void upload_sharedKeySignsCanonicalRequest() throws Exception {
        String stringToSign = "PUT\n\n\n5\n\ntext/csv\n\n\n\n\n\n\n"
            + "x-ms-blob-type:BlockBlob\n"
            + "x-ms-date:Mon, 01 Jan 2024 09:00:00 GMT\n"
            + "x-ms-version:2023-11-03\n"
            + "/acct/reports/reports/x.csv";
        server.expect(requestTo("https://acct.blob.core.windows.net/reports/reports/x.csv"))
            .andExpect(method(HttpMethod.PUT))
            .andExpect(header("x-ms-blob-type", "BlockBlob"))
            .andExpect(header("Authorization", "SharedKey acct:" + signer.signBase64(KEY, stringToSign)))
            .andRespond(withStatus(HttpStatus.CREATED));

        client.upload(config(StorageAuthMethod.SHARED_KEY), "reports/x.csv", CONTENT, "text/csv");

        server.verify();
    }

    @Test
    void upload_sasTokenAppendedToUrl() throws Exception {
        server.expect(requestTo("https://acct.blob.core.windows.net/reports/a%20b.csv?sv=2023-11-03&sig=abc"))
            .andExpect(method(HttpMethod.PUT))
            .andRespond(withStatus(HttpStatus.CREATED));

        client.upload(config(StorageAuthMethod.SAS_TOKEN), "a b.csv", CONTENT, "text/csv");

        server.verify();
    }

    @Test
    void upload_clientCredentialUsesBearer() throws Exception {
        server.expect(requestTo("https://login.microsoftonline.com/t/oauth2/v2.0/token"))
            .andExpect(method(HttpMethod.POST))
            .andRespond(withSuccess("{\"access_token\":\"tok\",\"expires_in\":3600}",
                org.springframework.http.MediaType.APPLICATION_JSON));
        server.expect(requestTo("https://acct.blob.core.windows.net/reports/x.csv"))
            .andExpect(header("Authorization", "Bearer tok"))
            .andRespond(withStatus(HttpStatus.CREATED));

        client.upload(config(StorageAuthMethod.CLIENT_CREDENTIAL), "x.csv", CONTENT, "text/csv");

        server.verify();
    }

    @Test
    void upload_serverErrorWrapped() {
        server.expect(requestTo("https://acct.blob.core.windows.net/reports/x.csv"))
            .andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThatThrownBy(() -> client.upload(config(StorageAuthMethod.SAS_TOKEN), "x.csv", CONTENT, "text/csv"))
            .isInstanceOf(StorageTransferException.class)
            .hasMessageContaining("上传失败");
    }

    @Test
    void generateDownloadLink_sharedKeyServiceSas() throws Exception {
        String stringToSign = "r\n\n2024-01-08T09:00:00Z\n/blob/acct/reports/reports/x.csv\n\n\n\n2023-11-03\nb\n\n\n\n\n\n\n";
        String signature = signer.signBase64(KEY, stringToSign);

        String link = client.generateDownloadLink(config(StorageAuthMethod.SHARED_KEY), "reports/x.csv",
            Duration.ofDays(7));

        assertThat(link).isEqualTo("https://acct.blob.core.windows.net/reports/reports/x.csv"
            + "?sv=2023-11-03&sr=b&sp=r&se=2024-01-08T09%3A00%3A00Z&sig="
            + URLEncoder.encode(signature, StandardCharsets.UTF_8));
    }

    @Test
    void generateDownloadLink_sasToken() throws Exception {
        assertThat(client.generateDownloadLink(config(StorageAuthMethod.SAS_TOKEN), "x.csv", Duration.ofDays(1)))
            .isEqualTo("https://acct.blob.core.windows.net/reports/x.csv?sv=2023-11-03&sig=abc");
    }

    @Test
    void generateDownloadLink_clientCredentialUnsupported() {
        assertThatThrownBy(() -> client.generateDownloadLink(config(StorageAuthMethod.CLIENT_CREDENTIAL), "x.csv",
            Duration.ofDays(1))).isInstanceOf(StorageTransferException.class);
    }

    @Test
    void customEndpoint() {
        StorageConfiguration c = config(StorageAuthMethod.SAS_TOKEN);
        c.setEndpoint("http://127.0.0.1:10000/devstoreaccount1/");
        assertThat(client.blobUrl(c, "d/x.csv")).isEqualTo("http://127.0.0.1:10000/devstoreaccount1/reports/d/x.csv");
    }
}
