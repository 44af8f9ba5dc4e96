package org.csits.reportd.manager.storage;

import lombok.Data;

/**
 * 命名的对象存储配置。
 */
@Data
public class StorageConfiguration {

    private String name;

    private String accountName;

    private String containerName;

    /**
     * 为空时使用 https://{accountName}.blob.core.windows.net。
     */
    private String endpoint;

    private StorageAuthMethod authMethod = StorageAuthMethod.SHARED_KEY;

    private String accountKey;

    private String sasToken;

    private String tenantId;

    private String clientId;

    private String clientSecret;

    public String resolveEndpoint() {
        if (endpoint != null && !endpoint.trim().isEmpty()) {
            return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        }
        return "https://" + accountName + ".blob.core.windows.net";
    }
}
