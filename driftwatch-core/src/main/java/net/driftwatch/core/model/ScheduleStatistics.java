package net.driftwatch.core.model;

import java.time.Duration;
import java.time.Instant;

/** 롤링 윈도우 내 완료된 실행 기준 집계. */
public record ScheduleStatistics(
        String userId,
        String kind,
        Instant windowStart,
        long totalRuns,
        long successfulRuns,
        long failedRuns,
        Duration averageDuration,
        long totalItemsProcessed,
        Instant lastSuccessAt,
        Instant lastFailureAt
) {
    public static ScheduleStatistics empty(String userId, String kind, Instant windowStart) {
        return new ScheduleStatistics(userId, kind, windowStart, 0, 0, 0, Duration.ZERO, 0, null, null);
    }

    /** 0.0 ~ 1.0, 실행 이력이 없으면 0 */
    public double successRate() {
        return totalRuns == 0 ? 0.0 : (double) successfulRuns / totalRuns;
    }
}
