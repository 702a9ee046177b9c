package net.driftwatch.core.model;

import java.util.List;
import java.util.function.Predicate;

/** 정렬된 변경 목록 + 유형별 집계. */
public record ChangeSummary(List<ChangeRecord> changes) {
    public ChangeSummary {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public static ChangeSummary empty() {
        return new ChangeSummary(List.of());
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int size() {
        return changes.size();
    }

    public int count(ChangeRecord.Type type) {
        return (int) changes.stream().filter(c -> c.type() == type).count();
    }

    public <T extends ChangeRecord> List<T> ofType(Class<T> cls) {
        return changes.stream().filter(cls::isInstance).map(cls::cast).toList();
    }

    /** 신규로 잡힌 작업 수 (교체로 들어온 작업 포함) */
    public int addedCount() {
        return count(ChangeRecord.Type.ADDED) + count(ChangeRecord.Type.REPLACED);
    }

    /** 날짜가 바뀐 작업 수 (스왑은 2건) */
    public int updatedCount() {
        return count(ChangeRecord.Type.DATE_CHANGED) + 2 * count(ChangeRecord.Type.SWAPPED);
    }

    public int removedCount() {
        return count(ChangeRecord.Type.REMOVED) + count(ChangeRecord.Type.REPLACED);
    }

    /** 분류는 유지한 채 보이는 항목만 남긴다. */
    public ChangeSummary filter(Predicate<? super ChangeRecord> visible) {
        return new ChangeSummary(changes.stream().filter(visible).toList());
    }

    public String describe() {
        return "swapped=" + count(ChangeRecord.Type.SWAPPED) +
                ",dateChanged=" + count(ChangeRecord.Type.DATE_CHANGED) +
                ",replaced=" + count(ChangeRecord.Type.REPLACED) +
                ",added=" + count(ChangeRecord.Type.ADDED) +
                ",removed=" + count(ChangeRecord.Type.REMOVED);
    }
}
