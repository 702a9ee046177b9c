package net.driftwatch.core.model;

import java.time.Duration;
import java.time.Instant;

/** (userId, kind) 당 하나. nextRunAt은 스케줄러가 실행 후 항상 전진시킨다. */
public record ScheduleConfig(
        Long id,
        String userId,
        String kind,              // 예: "work_orders"
        Duration interval,
        ActiveHours activeHours,  // null = 제한 없음
        boolean enabled,
        Instant lastRunAt,
        Instant nextRunAt,
        int consecutiveFailures,
        String lastError,
        Instant createdAt,
        Instant updatedAt
) {
    public static ScheduleConfig ofNew(String userId, String kind, Duration interval,
                                       ActiveHours activeHours, boolean enabled, Instant nextRunAt) {
        return new ScheduleConfig(null, userId, kind, interval, activeHours, enabled,
                null, nextRunAt, 0, null, null, null);
    }

    public ScheduleConfig withSettings(Duration interval, ActiveHours activeHours, boolean enabled, Instant nextRunAt) {
        return new ScheduleConfig(id, userId, kind, interval, activeHours, enabled,
                lastRunAt, nextRunAt, consecutiveFailures, lastError, createdAt, updatedAt);
    }
}
