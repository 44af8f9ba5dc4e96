package org.csits.reportd.manager.storage;

/**
 * 报表引用的存储配置名不存在。
 */
public class UnknownStorageConfigurationException extends StorageException {

    private final String configurationName;

    public UnknownStorageConfigurationException(String configurationName) {
        super("Storage configuration '" + configurationName + "' not found");
        this.configurationName = configurationName;
    }

    public String getConfigurationName() {
        return configurationName;
    }
}
