package org.csits.reportd.dao;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个触发时刻。weekday 为 1..7（1 = 周日），为空表示每天。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduleTrigger {

    private Integer weekday;

    private int hour;

    private int minute;

    public static ScheduleTrigger daily(int hour, int minute) {
        return new ScheduleTrigger(null, hour, minute);
    }
}
