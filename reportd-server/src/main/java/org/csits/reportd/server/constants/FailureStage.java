package org.csits.reportd.server.constants;

/**
 * 报表执行失败所处的阶段。
 */
public enum FailureStage {
    JOB,
    DOWNLOAD,
    EXTRACTION,
    UPLOAD,
    INTERNAL
}
