package org.csits.reportd.manager.storage;

/**
 * 上传或鉴权失败。
 */
public class StorageTransferException extends StorageException {

    public StorageTransferException(String message) {
        super(message);
    }

    public StorageTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
