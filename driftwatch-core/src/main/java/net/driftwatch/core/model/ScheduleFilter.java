package net.driftwatch.core.model;

/** 목록 조회 조건. null 필드는 조건에서 제외. */
public record ScheduleFilter(String userId, String kind, boolean enabledOnly) {

    public static ScheduleFilter all() {
        return new ScheduleFilter(null, null, false);
    }

    public static ScheduleFilter forUser(String userId) {
        return new ScheduleFilter(userId, null, false);
    }

    public static ScheduleFilter enabled() {
        return new ScheduleFilter(null, null, true);
    }
}
