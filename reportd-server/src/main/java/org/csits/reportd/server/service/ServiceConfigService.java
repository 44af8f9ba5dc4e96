package org.csits.reportd.server.service;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.manager.storage.StorageConfiguration;
import org.csits.reportd.server.config.ServiceConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

/**
 * 加载服务配置（调度、通知、存储配置、报表目录）。首次访问时读取并缓存。
 */
@Slf4j
@Service
public class ServiceConfigService {

    private final YamlConfigLoader yamlConfigLoader;
    private final ResourceLoader resourceLoader;
    private final String location;

    private volatile ServiceConfig cached;

    @Autowired
    public ServiceConfigService(YamlConfigLoader yamlConfigLoader, ResourceLoader resourceLoader,
                                @Value("${reportd.conf.service-config:classpath:conf/service.yaml}") String location) {
        this.yamlConfigLoader = yamlConfigLoader;
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    /**
     * 直接使用给定配置，不读取文件。
     */
    public ServiceConfigService(ServiceConfig config) {
        this.yamlConfigLoader = null;
        this.resourceLoader = null;
        this.location = null;
        this.cached = config;
    }

    public ServiceConfig getServiceConfig() {
        ServiceConfig config = cached;
        if (config == null) {
            synchronized (this) {
                if (cached == null) {
                    cached = load();
                }
                config = cached;
            }
        }
        return config;
    }

    private ServiceConfig load() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("服务配置不存在，使用默认配置: {}", location);
            return new ServiceConfig();
        }
        try {
            ServiceConfig config = yamlConfigLoader.loadServiceConfig(resource);
            log.info("服务配置已加载: {}, storageConfigurations={}", location,
                config.getStorage().getConfigurations().size());
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("服务配置无法解析: " + location, e);
        }
    }

    public Optional<StorageConfiguration> findStorageConfiguration(String name) {
        if (name == null || name.trim().isEmpty()) {
            return Optional.empty();
        }
        for (StorageConfiguration c : getServiceConfig().getStorage().getConfigurations()) {
            if (name.equals(c.getName())) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    /**
     * 报表类型的默认列，目录中没有时返回空列表（即全部列）。
     */
    public List<String> defaultColumns(String reportType) {
        for (ServiceConfig.ReportTypeConfig type : getServiceConfig().getCatalog().getReports()) {
            if (type.getReportType() != null && type.getReportType().equals(reportType)) {
                return type.getDefaultColumns() != null ? type.getDefaultColumns() : Collections.<String>emptyList();
            }
        }
        return Collections.emptyList();
    }

    public String globalWebhookUrl() {
        ServiceConfig.NotificationSettings notification = getServiceConfig().getNotification();
        return notification != null ? notification.getGlobalWebhookUrl() : null;
    }
}
