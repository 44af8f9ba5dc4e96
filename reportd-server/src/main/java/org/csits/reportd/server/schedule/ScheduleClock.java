package org.csits.reportd.server.schedule;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.csits.reportd.dao.ScheduleTrigger;
import org.springframework.stereotype.Component;

/**
 * 计算触发时刻。时间均为服务时区下的本地时间，“当前时间”只从注入的 Clock 获取。
 */
@Component
@RequiredArgsConstructor
public class ScheduleClock {

    private static final int DAYS_PER_WEEK = 7;

    private final Clock clock;

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * 所有触发器中严格晚于 after 的最早时刻。
     *
     * @return 触发器为空时为空
     * @throws IllegalArgumentException 触发器取值越界
     */
    public Optional<LocalDateTime> nextRun(List<ScheduleTrigger> schedule, LocalDateTime after) {
        if (schedule == null || schedule.isEmpty()) {
            return Optional.empty();
        }
        LocalDateTime earliest = null;
        for (ScheduleTrigger trigger : schedule) {
            LocalDateTime candidate = nextRun(trigger, after);
            if (earliest == null || candidate.isBefore(earliest)) {
                earliest = candidate;
            }
        }
        return Optional.of(earliest);
    }

    public LocalDateTime nextRun(ScheduleTrigger trigger, LocalDateTime after) {
        validate(trigger);
        LocalDate day = after.toLocalDate();
        // 8 天内必有命中：当天时刻已过时，下周同一天仍在范围内
        for (int i = 0; i <= DAYS_PER_WEEK; i++) {
            LocalDate date = day.plusDays(i);
            if (trigger.getWeekday() != null && weekdayNumber(date.getDayOfWeek()) != trigger.getWeekday()) {
                continue;
            }
            LocalDateTime candidate = date.atTime(trigger.getHour(), trigger.getMinute());
            if (candidate.isAfter(after)) {
                return candidate;
            }
        }
        throw new IllegalStateException("无法计算下次运行时间: " + trigger);
    }

    public void validate(ScheduleTrigger trigger) {
        if (trigger == null) {
            throw new IllegalArgumentException("触发器不能为空");
        }
        Integer weekday = trigger.getWeekday();
        if (weekday != null && (weekday < 1 || weekday > DAYS_PER_WEEK)) {
            throw new IllegalArgumentException("weekday 取值 1..7: " + weekday);
        }
        if (trigger.getHour() < 0 || trigger.getHour() > 23) {
            throw new IllegalArgumentException("hour 取值 0..23: " + trigger.getHour());
        }
        if (trigger.getMinute() < 0 || trigger.getMinute() > 59) {
            throw new IllegalArgumentException("minute 取值 0..59: " + trigger.getMinute());
        }
    }

    /**
     * 1 = 周日，7 = 周六。
     */
    public static int weekdayNumber(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % DAYS_PER_WEEK + 1;
    }
}
