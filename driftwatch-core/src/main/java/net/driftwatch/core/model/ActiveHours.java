package net.driftwatch.core.model;

/**
 * 실행 허용 시간대. 시(hour) 단위 반개구간 [startHour, endHour).
 * 자정을 넘는 구간(예: 22~6)은 지원하지 않는다.
 */
public record ActiveHours(int startHour, int endHour) {

    public boolean contains(int hour) {
        return startHour <= hour && hour < endHour;
    }

    public boolean isWellFormed() {
        return startHour >= 0 && startHour < endHour && endHour <= 24;
    }

    @Override
    public String toString() {
        return "[" + startHour + "," + endHour + ")";
    }
}
