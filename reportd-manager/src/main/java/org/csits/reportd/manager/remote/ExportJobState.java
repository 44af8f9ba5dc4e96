package org.csits.reportd.manager.remote;

import java.util.Locale;

/**
 * 远端导出作业状态。
 */
public enum ExportJobState {
    QUEUED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    UNKNOWN;

    /**
     * 按远端返回值解析，大小写不敏感；notStarted 视为进行中。
     */
    public static ExportJobState fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "queued":
                return QUEUED;
            case "notstarted":
            case "inprogress":
            case "in_progress":
                return IN_PROGRESS;
            case "completed":
                return COMPLETED;
            case "failed":
                return FAILED;
            default:
                return UNKNOWN;
        }
    }
}
