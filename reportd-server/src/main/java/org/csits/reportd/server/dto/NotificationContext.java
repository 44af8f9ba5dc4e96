package org.csits.reportd.server.dto;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * 渲染通知消息所需的执行信息。
 */
@Data
@Builder
public class NotificationContext {

    private boolean success;

    private String error;

    private String jobId;

    private Integer recordCount;

    private Long fileSize;

    private String format;

    private String downloadLink;

    private Integer linkExpirationDays;

    private LocalDateTime timestamp;
}
