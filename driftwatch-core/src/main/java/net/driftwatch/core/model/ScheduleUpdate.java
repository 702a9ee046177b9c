package net.driftwatch.core.model;

import java.time.Duration;

/**
 * 부분 수정. null 필드는 "변경 없음".
 * activeHours 해제는 {@link #withoutActiveHours()}로 명시한다.
 */
public final class ScheduleUpdate {
    private final Duration interval;
    private final ActiveHours activeHours;
    private final boolean clearActiveHours;
    private final Boolean enabled;

    private ScheduleUpdate(Duration interval, ActiveHours activeHours, boolean clearActiveHours, Boolean enabled) {
        this.interval = interval;
        this.activeHours = activeHours;
        this.clearActiveHours = clearActiveHours;
        this.enabled = enabled;
    }

    public static ScheduleUpdate none() {
        return new ScheduleUpdate(null, null, false, null);
    }

    public ScheduleUpdate withInterval(Duration interval) {
        return new ScheduleUpdate(interval, activeHours, clearActiveHours, enabled);
    }

    public ScheduleUpdate withActiveHours(ActiveHours activeHours) {
        return new ScheduleUpdate(interval, activeHours, false, enabled);
    }

    public ScheduleUpdate withoutActiveHours() {
        return new ScheduleUpdate(interval, null, true, enabled);
    }

    public ScheduleUpdate withEnabled(boolean enabled) {
        return new ScheduleUpdate(interval, activeHours, clearActiveHours, enabled);
    }

    public Duration intervalOr(Duration current) {
        return interval != null ? interval : current;
    }

    public ActiveHours activeHoursOr(ActiveHours current) {
        if (clearActiveHours) return null;
        return activeHours != null ? activeHours : current;
    }

    public boolean enabledOr(boolean current) {
        return enabled != null ? enabled : current;
    }

    @Override
    public String toString() {
        return "ScheduleUpdate{" +
                "interval=" + interval +
                ", activeHours=" + (clearActiveHours ? "cleared" : activeHours) +
                ", enabled=" + enabled +
                '}';
    }
}
