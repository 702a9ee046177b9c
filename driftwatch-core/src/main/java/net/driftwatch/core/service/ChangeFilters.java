package net.driftwatch.core.service;

import net.driftwatch.core.model.ChangeRecord;
import net.driftwatch.core.model.JobRecord;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Predicate;

/** 알림 전 가시성 필터. 분류에는 관여하지 않는다. */
public final class ChangeFilters {
    private static final String JOB_ID_PREFIX = "W-";

    private ChangeFilters() {}

    /** groupKey가 주어진 집합에 속하는 작업만 */
    public static Predicate<JobRecord> groupKeyIn(Set<String> groupKeys) {
        Set<String> keys = Set.copyOf(groupKeys);
        return job -> job.groupKey() != null && keys.contains(job.groupKey());
    }

    /** 사용자가 완료 처리한 작업의 Removed는 숨긴다. 다른 유형은 통과. */
    public static Predicate<ChangeRecord> excludingCompletedRemovals(Set<String> completedJobIds) {
        Set<String> completed = new HashSet<>();
        for (String id : completedJobIds) completed.add(normalizeJobId(id));
        return change -> !(change instanceof ChangeRecord.Removed removed
                && completed.contains(normalizeJobId(removed.job().id())));
    }

    /** "W-123" 과 "123" 을 같은 작업으로 본다 */
    static String normalizeJobId(String jobId) {
        if (jobId == null) return "";
        String id = jobId.trim();
        return id.startsWith(JOB_ID_PREFIX) ? id.substring(JOB_ID_PREFIX.length()) : id;
    }
}
