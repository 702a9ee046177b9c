package net.driftwatch.core.model;

import java.time.Duration;
import java.time.Instant;

/** 실행 종료 시 ExecutionRecord에 기록할 값 묶음. */
public record ExecutionResult(
        Instant completedAt,
        Duration duration,
        boolean success,
        int itemsProcessed,
        int itemsAdded,
        int itemsUpdated,
        int itemsRemoved,
        int itemsFailed,
        String errorMessage,
        String errorDetails,
        String changeSummary
) {
    public static ExecutionResult succeeded(Instant startedAt, Instant completedAt, int processed, ChangeSummary summary) {
        return new ExecutionResult(completedAt, Duration.between(startedAt, completedAt), true, processed,
                summary.addedCount(), summary.updatedCount(), summary.removedCount(), 0,
                null, null, summary.describe());
    }

    public static ExecutionResult failed(Instant startedAt, Instant completedAt, String errorMessage, String errorDetails) {
        return new ExecutionResult(completedAt, Duration.between(startedAt, completedAt), false,
                0, 0, 0, 0, 0, errorMessage, errorDetails, null);
    }
}
