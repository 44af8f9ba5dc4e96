package org.csits.reportd.manager.remote;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExportJobStatus {

    private String jobId;

    private ExportJobState state;

    /**
     * 远端原始状态值，用于日志。
     */
    private String rawStatus;

    private String downloadHandle;

    private String errorMessage;
}
