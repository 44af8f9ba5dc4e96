package org.csits.reportd.manager.storage;

import java.time.Duration;

/**
 * 对象存储客户端。
 */
public interface StorageClient {

    void upload(StorageConfiguration configuration, String objectName, byte[] content, String contentType)
        throws StorageTransferException;

    /**
     * 生成限时只读链接。
     */
    String generateDownloadLink(StorageConfiguration configuration, String objectName, Duration validity)
        throws StorageTransferException;
}
