package org.csits.reportd.server.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class UploadResult {

    private String storageConfigName;

    /**
     * 完整对象名（目录 + 文件名）。
     */
    private String objectName;

    private String fileName;

    private long fileSize;

    private String downloadLink;

    private Integer linkExpirationDays;
}
