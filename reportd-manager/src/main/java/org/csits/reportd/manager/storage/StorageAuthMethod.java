package org.csits.reportd.manager.storage;

/**
 * 对象存储鉴权方式。
 */
public enum StorageAuthMethod {
    SHARED_KEY,
    SAS_TOKEN,
    CLIENT_CREDENTIAL
}
