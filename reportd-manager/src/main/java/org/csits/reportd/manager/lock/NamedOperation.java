package org.csits.reportd.manager.lock;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class NamedOperation {

    private String identifier;

    private Instant startedAt;

    private long timeoutSeconds;

    /**
     * 注册序号，用于区分同一标识的先后两次注册。
     */
    private long sequence;
}
