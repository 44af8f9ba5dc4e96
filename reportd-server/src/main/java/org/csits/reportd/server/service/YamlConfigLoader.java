package org.csits.reportd.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import org.csits.reportd.server.config.ServiceConfig;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * 使用 Jackson YAML 将配置文件映射为 Java 对象。
 */
@Component
public class YamlConfigLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ServiceConfig loadServiceConfig(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return withDefaults(yamlMapper.readValue(in, ServiceConfig.class));
        }
    }

    public ServiceConfig loadServiceConfigFromString(String yaml) throws IOException {
        return withDefaults(yamlMapper.readValue(new StringReader(yaml), ServiceConfig.class));
    }

    /**
     * 空段落（如只写了 notification:）被映射为 null，这里补回默认值。
     */
    private static ServiceConfig withDefaults(ServiceConfig config) {
        if (config == null) {
            return new ServiceConfig();
        }
        if (config.getScheduler() == null) {
            config.setScheduler(new ServiceConfig.SchedulerConfig());
        }
        if (config.getNotification() == null) {
            config.setNotification(new ServiceConfig.NotificationSettings());
        }
        if (config.getStorage() == null) {
            config.setStorage(new ServiceConfig.StorageSettings());
        }
        if (config.getStorage().getConfigurations() == null) {
            config.getStorage().setConfigurations(new ArrayList<>());
        }
        if (config.getCatalog() == null) {
            config.setCatalog(new ServiceConfig.CatalogConfig());
        }
        if (config.getCatalog().getReports() == null) {
            config.getCatalog().setReports(new ArrayList<>());
        }
        if (config.getRemote() == null) {
            config.setRemote(new ServiceConfig.RemoteApiConfig());
        }
        return config;
    }
}
