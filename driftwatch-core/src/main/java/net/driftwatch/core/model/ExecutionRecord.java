package net.driftwatch.core.model;

import java.time.Duration;
import java.time.Instant;

/** 실행 1회 감사 로그. completedAt이 세팅되면 불변. */
public record ExecutionRecord(
        Long id,
        Long scheduleId,
        String userId,
        String kind,
        TriggerKind triggerKind,
        Instant startedAt,
        Instant completedAt,   // null = 실행 중(또는 중단)
        boolean success,
        int itemsProcessed,
        int itemsAdded,
        int itemsUpdated,
        int itemsRemoved,
        int itemsFailed,
        Duration duration,
        String errorMessage,
        String errorDetails,
        String changeSummary
) {
    public static ExecutionRecord started(ScheduleConfig schedule, TriggerKind trigger, Instant startedAt) {
        return new ExecutionRecord(null, schedule.id(), schedule.userId(), schedule.kind(), trigger, startedAt,
                null, false, 0, 0, 0, 0, 0, null, null, null, null);
    }

    public boolean isOpen() {
        return completedAt == null;
    }
}
