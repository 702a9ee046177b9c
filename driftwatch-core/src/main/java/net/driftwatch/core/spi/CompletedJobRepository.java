package net.driftwatch.core.spi;

import java.util.Set;

/** 사용자가 완료 처리한 작업. 완료 작업이 목록에서 빠지는 건 "삭제" 알림 대상이 아니다. */
public interface CompletedJobRepository {
    Set<String> findJobIds(String userId) throws Exception;

    void markCompleted(String userId, String jobId) throws Exception;
}
