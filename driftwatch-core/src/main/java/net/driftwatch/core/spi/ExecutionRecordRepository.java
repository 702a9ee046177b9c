package net.driftwatch.core.spi;

import net.driftwatch.core.model.ExecutionRecord;
import net.driftwatch.core.model.ExecutionResult;
import net.driftwatch.core.model.ScheduleStatistics;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ExecutionRecordRepository {
    /** 실행 시작 기록. 생성된 ID가 채워진 레코드 반환 */
    ExecutionRecord insertStarted(ExecutionRecord started) throws Exception;

    /** COMPLETED_AT IS NULL인 행만 종료 처리. 이미 종료된 행이면 false */
    boolean complete(long id, ExecutionResult result) throws Exception;

    Optional<ExecutionRecord> findById(long id) throws Exception;

    /** 최신순 페이징 */
    List<ExecutionRecord> findByUserAndKind(String userId, String kind, int limit, int offset) throws Exception;

    /** 종료되지 않은 실행(프로세스 중단으로 남은 것 포함) */
    List<ExecutionRecord> findOpen() throws Exception;

    /** STARTED_AT >= since 이고 종료된 실행 기준 집계 */
    ScheduleStatistics statistics(String userId, String kind, Instant since) throws Exception;
}
