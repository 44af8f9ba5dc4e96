package org.csits.reportd.manager.archive;

import java.io.IOException;

/**
 * 归档不可读或缺少数据文件。
 */
public class ArchiveExtractionException extends IOException {

    public ArchiveExtractionException(String message) {
        super(message);
    }

    public ArchiveExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
