package net.driftwatch.core.spi;

import net.driftwatch.core.model.ScheduleConfig;
import net.driftwatch.core.model.ScheduleFilter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduleRepository {
    /** (USER_ID, KIND) 기준 멱등 upsert. 존재하면 설정값/nextRunAt만 갱신 */
    ScheduleConfig upsert(ScheduleConfig config) throws Exception;

    Optional<ScheduleConfig> findById(long id) throws Exception;
    Optional<ScheduleConfig> findByUserAndKind(String userId, String kind) throws Exception;
    List<ScheduleConfig> findAll(ScheduleFilter filter) throws Exception;

    List<ScheduleConfig> findEnabled() throws Exception;

    /** ENABLED + NEXT_RUN_AT <= now, NEXT_RUN_AT 오름차순 */
    List<ScheduleConfig> findDue(Instant now) throws Exception;

    void updateNextRun(long id, Instant nextRunAt) throws Exception;

    /** 실행 결과 반영: 성공이면 실패 카운트 0, 실패면 +1 (원자적 UPDATE) */
    void recordOutcome(long id, Instant lastRunAt, Instant nextRunAt, boolean success, String error) throws Exception;

    boolean deleteById(long id) throws Exception;
    boolean deleteByUserAndKind(String userId, String kind) throws Exception;
}
