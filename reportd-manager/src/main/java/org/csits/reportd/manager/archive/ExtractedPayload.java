package org.csits.reportd.manager.archive;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 从导出归档中选出的数据文件。
 */
@Data
@AllArgsConstructor
public class ExtractedPayload {

    private String fileName;

    private byte[] content;

    /**
     * 未找到期望扩展名、改用其他 csv/json 文件时为 true。
     */
    private boolean fallbackUsed;

    public long size() {
        return content != null ? content.length : 0L;
    }
}
