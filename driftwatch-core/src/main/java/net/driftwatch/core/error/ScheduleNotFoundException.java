package net.driftwatch.core.error;

public class ScheduleNotFoundException extends RuntimeException {
    private final long scheduleId;

    public ScheduleNotFoundException(long scheduleId) {
        super("Schedule not found: id=" + scheduleId);
        this.scheduleId = scheduleId;
    }

    public long getScheduleId() {
        return scheduleId;
    }
}
