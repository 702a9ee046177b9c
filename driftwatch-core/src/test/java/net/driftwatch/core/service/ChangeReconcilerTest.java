package net.driftwatch.core.service;

import net.driftwatch.core.model.ChangeRecord;
import net.driftwatch.core.model.ChangeRecord.Added;
import net.driftwatch.core.model.ChangeRecord.DateChanged;
import net.driftwatch.core.model.ChangeRecord.Removed;
import net.driftwatch.core.model.ChangeRecord.Replaced;
import net.driftwatch.core.model.ChangeRecord.Swapped;
import net.driftwatch.core.model.ChangeSummary;
import net.driftwatch.core.model.JobRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeReconcilerTest {

    private final ChangeReconciler reconciler = new ChangeReconciler();

    private static LocalDate jan(int day) {
        return LocalDate.of(2024, 1, day);
    }

    private static JobRecord job(String id, LocalDate date) {
        return new JobRecord(id, "S-1", date, "FILTER", 1);
    }

    private static JobRecord job(String id, String store, LocalDate date) {
        return new JobRecord(id, store, date, "FILTER", 1);
    }

    @Test
    @DisplayName("스왑 + 날짜변경 + 신규 혼합 시나리오: 정확히 4건")
    void mixedScenario() {
        var previous = List.of(job("W1", jan(10)), job("W2", jan(11)), job("W3", jan(12)));
        var current = List.of(job("W1", jan(13)), job("W2", jan(12)), job("W3", jan(11)),
                job("W4", jan(14)), job("W5", jan(10)));

        ChangeSummary s = reconciler.reconcile(previous, current);

        assertEquals(4, s.size());
        assertThat(s.changes().get(0)).isInstanceOfSatisfying(Swapped.class, sw -> {
            assertEquals("W2", sw.jobA().id());
            assertEquals("W3", sw.jobB().id());
            assertEquals(jan(11), sw.oldDateA());
            assertEquals(jan(12), sw.oldDateB());
        });
        assertThat(s.changes().get(1)).isInstanceOfSatisfying(DateChanged.class, dc -> {
            assertEquals("W1", dc.job().id());
            assertEquals(jan(10), dc.oldDate());
            assertEquals(jan(13), dc.newDate());
        });
        // W5는 W1과 같은 날짜지만 W1은 이동이지 삭제가 아니므로 Replaced가 아니다
        assertThat(s.changes().get(2)).isEqualTo(new Added(job("W4", jan(14))));
        assertThat(s.changes().get(3)).isEqualTo(new Added(job("W5", jan(10))));
    }

    @Test
    @DisplayName("맞교환 1건은 Swapped 1건, DateChanged 없음 (입력 순서 무관)")
    void swapIsSymmetric() {
        var previous = List.of(job("B", jan(2)), job("A", jan(1)));
        var current = List.of(job("A", jan(2)), job("B", jan(1)));

        ChangeSummary s = reconciler.reconcile(previous, current);
        ChangeSummary reversedInput = reconciler.reconcile(reversed(previous), reversed(current));

        assertEquals(1, s.size());
        assertEquals(0, s.count(ChangeRecord.Type.DATE_CHANGED));
        Swapped sw = s.ofType(Swapped.class).get(0);
        assertEquals("A", sw.jobA().id());
        assertEquals("B", sw.jobB().id());
        assertEquals(s, reversedInput);
    }

    @Test
    @DisplayName("같은 스냅샷 비교는 빈 결과")
    void identicalSnapshotsAreEmpty() {
        var snap = List.of(job("W1", jan(1)), job("W2", null), job("W3", jan(3)));
        assertTrue(reconciler.reconcile(snap, snap).isEmpty());
        assertTrue(reconciler.reconcile(List.of(), List.of()).isEmpty());
        assertTrue(reconciler.reconcile(null, null).isEmpty());
    }

    @Test
    @DisplayName("같은 날짜의 삭제/신규는 Replaced")
    void replacementOnSameDate() {
        var previous = List.of(job("W1", jan(5)), job("W2", jan(6)));
        var current = List.of(job("W2", jan(6)), job("W9", jan(5)));

        ChangeSummary s = reconciler.reconcile(previous, current);

        assertEquals(1, s.size());
        Replaced r = s.ofType(Replaced.class).get(0);
        assertEquals("W1", r.removedJob().id());
        assertEquals("W9", r.addedJob().id());
        assertEquals(jan(5), r.sharedDate());
        assertEquals(1, s.addedCount());
        assertEquals(1, s.removedCount());
    }

    @Test
    @DisplayName("교체 후보가 여럿이면 id가 작은 쪽끼리 짝짓고, 재배정하지 않는다")
    void replacementTieBreak() {
        var previous = List.of(job("R2", jan(5)), job("R1", jan(5)));
        var current = List.of(job("A3", jan(5)), job("A1", jan(5)), job("A2", jan(5)));

        ChangeSummary s = reconciler.reconcile(previous, current);

        List<Replaced> replaced = s.ofType(Replaced.class);
        assertEquals(2, replaced.size());
        assertEquals("R1", replaced.get(0).removedJob().id());
        assertEquals("A1", replaced.get(0).addedJob().id());
        assertEquals("R2", replaced.get(1).removedJob().id());
        assertEquals("A2", replaced.get(1).addedJob().id());
        assertThat(s.ofType(Added.class)).extracting(a -> a.job().id()).containsExactly("A3");
        assertThat(s.ofType(Removed.class)).isEmpty();
    }

    @Test
    @DisplayName("날짜 미정(null)은 교체로 보지 않는다")
    void nullDatesNeverReplace() {
        var previous = List.of(job("W1", null));
        var current = List.of(job("W2", null));

        ChangeSummary s = reconciler.reconcile(previous, current);

        assertThat(s.changes()).containsExactly(new Added(job("W2", null)), new Removed(job("W1", null)));
    }

    @Test
    @DisplayName("null → 날짜 확정은 DateChanged")
    void nullSafeDateChange() {
        ChangeSummary s = reconciler.reconcile(List.of(job("W1", null)), List.of(job("W1", jan(3))));
        assertThat(s.changes()).containsExactly(new DateChanged(job("W1", jan(3)), null, jan(3)));
    }

    @Test
    @DisplayName("3자 순환 이동은 스왑이 아니다")
    void threeWayRotationIsNotSwap() {
        var previous = List.of(job("A", jan(1)), job("B", jan(2)), job("C", jan(3)));
        var current = List.of(job("A", jan(2)), job("B", jan(3)), job("C", jan(1)));

        ChangeSummary s = reconciler.reconcile(previous, current);

        assertEquals(3, s.count(ChangeRecord.Type.DATE_CHANGED));
        assertEquals(0, s.count(ChangeRecord.Type.SWAPPED));
    }

    @Test
    @DisplayName("스왑 상대가 여럿이면 작은 id와 짝짓는다")
    void swapPartnerTieBreak() {
        var previous = List.of(job("A", jan(1)), job("B", jan(2)), job("C", jan(2)));
        var current = List.of(job("A", jan(2)), job("B", jan(1)), job("C", jan(1)));

        ChangeSummary s = reconciler.reconcile(previous, current);

        Swapped sw = s.ofType(Swapped.class).get(0);
        assertEquals("A", sw.jobA().id());
        assertEquals("B", sw.jobB().id());
        assertThat(s.ofType(DateChanged.class)).extracting(d -> d.job().id()).containsExactly("C");
    }

    @Test
    @DisplayName("출력 순서: Swapped, DateChanged, Replaced, Added, Removed")
    void outputOrder() {
        var previous = List.of(
                job("S1", jan(1)), job("S2", jan(2)),
                job("D1", jan(3)),
                job("R1", jan(20)),
                job("X1", jan(30)));
        var current = List.of(
                job("S1", jan(2)), job("S2", jan(1)),
                job("D1", jan(4)),
                job("N1", jan(20)),
                job("N2", jan(25)));

        ChangeSummary s = reconciler.reconcile(previous, current);

        assertThat(s.changes()).extracting(ChangeRecord::type).containsExactly(
                ChangeRecord.Type.SWAPPED,
                ChangeRecord.Type.DATE_CHANGED,
                ChangeRecord.Type.REPLACED,
                ChangeRecord.Type.ADDED,
                ChangeRecord.Type.REMOVED);
        assertEquals("swapped=1,dateChanged=1,replaced=1,added=1,removed=1", s.describe());
        assertEquals(3, s.updatedCount());
    }

    @Test
    @DisplayName("중복 id는 마지막 것이 이긴다")
    void duplicateIdLastWins() {
        var previous = List.of(job("W1", jan(1)));
        var current = List.of(job("W1", jan(9)), job("W1", jan(1)));

        assertTrue(reconciler.reconcile(previous, current).isEmpty());
    }

    @Test
    @DisplayName("가시성 필터는 관여 작업 중 하나라도 맞으면 보인다")
    void visibilityFilter() {
        var previous = List.of(job("A", "S-1", jan(1)), job("B", "S-2", jan(2)), job("C", "S-2", jan(5)));
        var current = List.of(job("A", "S-1", jan(2)), job("B", "S-2", jan(1)), job("D", "S-3", jan(7)));

        ChangeSummary all = reconciler.reconcile(previous, current);
        ChangeSummary visible = reconciler.reconcile(previous, current, ChangeFilters.groupKeyIn(Set.of("S-1")));

        assertEquals(3, all.size());
        // A/B 스왑은 S-1이 관여하므로 보이고, C 삭제와 D 신규는 숨겨진다
        assertThat(visible.changes()).hasSize(1).first().isInstanceOf(Swapped.class);
    }

    @Test
    @DisplayName("완료 처리한 작업의 삭제는 숨긴다 (W- 접두어 무시)")
    void completedRemovalsHidden() {
        var previous = List.of(job("W-100", jan(1)), job("W-200", jan(2)));
        var current = List.<JobRecord>of();

        ChangeSummary s = reconciler.reconcile(previous, current)
                .filter(ChangeFilters.excludingCompletedRemovals(Set.of("100")));

        assertThat(s.changes()).containsExactly(new Removed(job("W-200", jan(2))));
    }

    private static <T> List<T> reversed(List<T> in) {
        List<T> copy = new ArrayList<>(in);
        Collections.reverse(copy);
        return copy;
    }
}
