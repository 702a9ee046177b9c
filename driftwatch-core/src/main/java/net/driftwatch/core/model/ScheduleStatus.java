package net.driftwatch.core.model;

import java.time.Duration;

/** 상태 리포트 한 줄. overdue는 nextRunAt이 지난 만큼(지나지 않았으면 ZERO). */
public record ScheduleStatus(
        ScheduleConfig schedule,
        State state,
        boolean running,
        Duration overdue
) {
    public enum State { PAUSED, FAILING, RUNNING, OVERDUE, ACTIVE }

    public boolean needsAttention() {
        return state == State.FAILING || state == State.OVERDUE;
    }
}
