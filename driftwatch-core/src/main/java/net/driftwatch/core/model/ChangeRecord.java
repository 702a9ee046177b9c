package net.driftwatch.core.model;

import java.time.LocalDate;
import java.util.List;

/**
 * 두 스냅샷 사이의 변경 1건. 저장하지 않는 휘발성 값.
 * 정렬 키는 {@link #sortId()}.
 */
public interface ChangeRecord {

    enum Type { SWAPPED, DATE_CHANGED, REPLACED, ADDED, REMOVED }

    Type type();

    /** 카테고리 내부 정렬 기준 id */
    String sortId();

    /** 이 변경에 관여한 작업들(가시성 필터용) */
    List<JobRecord> jobs();

    record Added(JobRecord job) implements ChangeRecord {
        @Override public Type type() { return Type.ADDED; }
        @Override public String sortId() { return job.id(); }
        @Override public List<JobRecord> jobs() { return List.of(job); }
    }

    record Removed(JobRecord job) implements ChangeRecord {
        @Override public Type type() { return Type.REMOVED; }
        @Override public String sortId() { return job.id(); }
        @Override public List<JobRecord> jobs() { return List.of(job); }
    }

    record DateChanged(JobRecord job, LocalDate oldDate, LocalDate newDate) implements ChangeRecord {
        @Override public Type type() { return Type.DATE_CHANGED; }
        @Override public String sortId() { return job.id(); }
        @Override public List<JobRecord> jobs() { return List.of(job); }
    }

    /** jobA.id < jobB.id. jobA/jobB는 현재 스냅샷 기준 레코드. */
    record Swapped(JobRecord jobA, JobRecord jobB, LocalDate oldDateA, LocalDate oldDateB) implements ChangeRecord {
        @Override public Type type() { return Type.SWAPPED; }
        @Override public String sortId() { return jobA.id(); }
        @Override public List<JobRecord> jobs() { return List.of(jobA, jobB); }
    }

    record Replaced(JobRecord removedJob, JobRecord addedJob, LocalDate sharedDate) implements ChangeRecord {
        @Override public Type type() { return Type.REPLACED; }
        @Override public String sortId() { return removedJob.id(); }
        @Override public List<JobRecord> jobs() { return List.of(removedJob, addedJob); }
    }
}
