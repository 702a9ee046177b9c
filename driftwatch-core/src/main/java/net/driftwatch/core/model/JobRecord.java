package net.driftwatch.core.model;

import java.time.LocalDate;

/** 스크레이퍼가 돌려주는 작업 1건. scheduledDate는 미정일 수 있다(null). */
public record JobRecord(
        String id,
        String groupKey,       // 매장/고객 식별자
        LocalDate scheduledDate,
        String serviceType,
        int quantity
) {}
