package org.csits.reportd.server.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.csits.reportd.manager.storage.StorageAuthMethod;
import org.csits.reportd.server.config.ServiceConfig;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.DefaultResourceLoader;

class YamlConfigLoaderTest {

    private final YamlConfigLoader loader = new YamlConfigLoader();

    @Test
    void loadServiceConfig_fromClasspath() throws Exception {
        ServiceConfig config = loader.loadServiceConfig(new ClassPathResource("conf/service-test.yaml"));

        assertThat(config.getScheduler().getJobTimeoutSeconds()).isEqualTo(120);
        assertThat(config.getScheduler().getPollIntervalSeconds()).isEqualTo(5);
        assertThat(config.getNotification().getGlobalWebhookUrl()).isEqualTo("https://hooks.example/global");
        assertThat(config.getStorage().getConfigurations()).hasSize(2);
        assertThat(config.getStorage().getConfigurations().get(1).getAuthMethod())
            .isEqualTo(StorageAuthMethod.SAS_TOKEN);
        assertThat(config.getCatalog().getReports().get(0).getDefaultColumns())
            .containsExactly("DeviceName", "OS", "OSVersion");
        assertThat(config.getRemote().getTenantId()).isEqualTo("tenant-1");
        assertThat(config.getRemote().getBaseUrl()).isEqualTo("https://graph.microsoft.com/beta");
    }

    @Test
    void loadServiceConfigFromString_defaultsForMissingSections() throws Exception {
        ServiceConfig config = loader.loadServiceConfigFromString("scheduler:\n  enabled: false\nunknown: 1\n");

        assertThat(config.getScheduler().getEnabled()).isFalse();
        assertThat(config.getScheduler().getJobTimeoutSeconds()).isEqualTo(300);
        assertThat(config.getStorage().getConfigurations()).isEmpty();
    }

    @Test
    void loadServiceConfigFromString_emptySectionsGetDefaults() throws Exception {
        ServiceConfig config = loader.loadServiceConfigFromString(
            "scheduler:\n  enabled: true\nnotification:\nstorage:\n  configurations:\ncatalog:\n");

        assertThat(config.getNotification()).isNotNull();
        assertThat(config.getNotification().getGlobalWebhookUrl()).isNull();
        assertThat(config.getStorage().getConfigurations()).isEmpty();
        assertThat(config.getCatalog().getReports()).isEmpty();
        assertThat(config.getRemote()).isNotNull();
        assertThat(new ServiceConfigService(config).globalWebhookUrl()).isNull();
    }

    @Test
    void serviceConfigService_lookups() {
        ServiceConfigService service = new ServiceConfigService(loader, new DefaultResourceLoader(),
            "classpath:conf/service-test.yaml");

        assertThat(service.findStorageConfiguration("primary")).isPresent();
        assertThat(service.findStorageConfiguration("missing")).isEmpty();
        assertThat(service.findStorageConfiguration(null)).isEmpty();
        assertThat(service.defaultColumns("Devices")).hasSize(3);
        assertThat(service.globalWebhookUrl()).isEqualTo("https://hooks.example/global");
    }

    @Test
    void serviceConfigService_missingFileUsesDefaults() {
        ServiceConfigService service = new ServiceConfigService(loader, new DefaultResourceLoader(),
            "classpath:conf/does-not-exist.yaml");

        assertThat(service.getServiceConfig().getScheduler().getIntervalSeconds()).isEqualTo(300);
        assertThat(service.getServiceConfig().getStorage().getConfigurations()).isEmpty();
    }
}
