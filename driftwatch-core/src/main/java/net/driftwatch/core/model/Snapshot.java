package net.driftwatch.core.model;

import java.util.List;

/** 스크레이퍼 1회 호출 결과 전체. 순서는 의미 없다. */
public record Snapshot(List<JobRecord> jobs) {
    public Snapshot {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public static Snapshot empty() {
        return new Snapshot(List.of());
    }

    public int size() {
        return jobs.size();
    }
}
