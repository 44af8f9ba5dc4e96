package org.csits.reportd.server.constants;

/**
 * 导出作业轮询状态。
 */
public enum JobState {
    CREATED,
    POLLING,
    COMPLETED,
    FAILED,
    TIMED_OUT
}
