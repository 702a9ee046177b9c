package net.driftwatch.core.service;

import net.driftwatch.core.model.ActiveHours;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * 다음 실행 시각 계산.
 * <ul>
 *   <li>활성 시간대 없음: now + interval</li>
 *   <li>now가 시간대 안: now + interval (시간대 끝으로 클램프하지 않음)</li>
 *   <li>now가 시간대 밖: 시작 시각 정각. now.hour &lt; start면 당일, 아니면 다음 날</li>
 * </ul>
 * 오프셋은 매번 zone에서 다시 구한다(DST 전환 대응).
 */
public final class NextRunCalculator {
    private final ZoneId zone;

    public NextRunCalculator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone);
    }

    public Instant next(Instant now, Duration interval, ActiveHours activeHours) {
        Objects.requireNonNull(now); Objects.requireNonNull(interval);
        if (activeHours == null) {
            return now.plus(interval);
        }
        ZonedDateTime local = now.atZone(zone);
        int hour = local.getHour();
        if (activeHours.contains(hour)) {
            return now.plus(interval);
        }
        LocalDate day = hour < activeHours.startHour()
                ? local.toLocalDate()
                : local.toLocalDate().plusDays(1);
        // DST gap에 걸리면 ZonedDateTime이 gap 직후로 밀어준다
        return day.atTime(activeHours.startHour(), 0).atZone(zone).toInstant();
    }

    public boolean withinActiveHours(Instant at, ActiveHours activeHours) {
        return activeHours == null || activeHours.contains(at.atZone(zone).getHour());
    }

    public ZoneId zone() {
        return zone;
    }
}
