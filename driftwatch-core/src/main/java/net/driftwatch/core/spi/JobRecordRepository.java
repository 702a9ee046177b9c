package net.driftwatch.core.spi;

import net.driftwatch.core.model.JobRecord;

import java.util.Collection;
import java.util.List;

/** (userId, kind)별 현재 작업 집합. 다음 실행의 "이전 스냅샷"이 된다. */
public interface JobRecordRepository {
    List<JobRecord> findAll(String userId, String kind) throws Exception;

    /** (USER_ID, KIND, JOB_ID) 기준 멱등 upsert */
    void upsertAll(String userId, String kind, Collection<JobRecord> records) throws Exception;

    int deleteByIds(String userId, String kind, Collection<String> jobIds) throws Exception;
}
