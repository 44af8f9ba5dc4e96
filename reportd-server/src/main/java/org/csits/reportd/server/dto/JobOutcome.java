package org.csits.reportd.server.dto;

import java.time.Duration;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.csits.reportd.server.constants.JobState;

/**
 * 导出作业轮询的终态结果。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobOutcome {

    private JobState state;

    /**
     * 创建失败时为空。
     */
    private String jobId;

    private String downloadHandle;

    private String error;

    private Duration elapsed;

    public boolean isCompleted() {
        return state == JobState.COMPLETED;
    }
}
