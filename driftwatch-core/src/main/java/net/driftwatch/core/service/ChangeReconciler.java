package net.driftwatch.core.service;

import net.driftwatch.core.model.ChangeRecord;
import net.driftwatch.core.model.ChangeSummary;
import net.driftwatch.core.model.JobRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * 이전/현재 스냅샷 비교. 순수 함수(저장/IO 없음)이며 어떤 입력에도 실패하지 않는다.
 *
 * <p>단계별로 앞 단계가 가져간 id는 다시 쓰지 않는다.
 * <ol>
 *   <li>id로 인덱싱 → removed / added / common</li>
 *   <li>common 중 날짜가 달라진 것 = 날짜 변경 후보</li>
 *   <li>후보 중 날짜를 정확히 맞바꾼 쌍 → Swapped (상대가 여럿이면 사전순으로 작은 id)</li>
 *   <li>남은 후보 → DateChanged</li>
 *   <li>같은 날짜의 (removed, added) → Replaced (added id 오름차순으로 하나만, 연쇄 재배정 없음)</li>
 *   <li>나머지 → Added / Removed</li>
 * </ol>
 * 출력 순서: Swapped, DateChanged, Replaced, Added, Removed. 카테고리 내부는 id 오름차순.
 *
 * <p>Replaced 판정은 우연히 같은 날짜에 잡힌 무관한 작업도 교체로 본다. 알려진 모호성이며 의도적으로 그대로 둔다.
 */
public final class ChangeReconciler {

    public ChangeSummary reconcile(Collection<JobRecord> previous, Collection<JobRecord> current) {
        return reconcile(previous, current, null);
    }

    /**
     * @param visibility null이면 전부 보인다. 변경에 관여한 작업 중 하나라도 통과하면 보인다.
     *                   분류 자체에는 영향이 없다.
     */
    public ChangeSummary reconcile(Collection<JobRecord> previous,
                                   Collection<JobRecord> current,
                                   Predicate<? super JobRecord> visibility) {
        SortedMap<String, JobRecord> prev = index(previous);
        SortedMap<String, JobRecord> cur = index(current);

        List<String> removedIds = new ArrayList<>();
        List<String> addedIds = new ArrayList<>();
        TreeSet<String> candidates = new TreeSet<>();

        for (String id : prev.keySet()) {
            if (!cur.containsKey(id)) removedIds.add(id);
        }
        for (var e : cur.entrySet()) {
            JobRecord before = prev.get(e.getKey());
            if (before == null) {
                addedIds.add(e.getKey());
            } else if (!Objects.equals(before.scheduledDate(), e.getValue().scheduledDate())) {
                candidates.add(e.getKey());
            }
        }

        List<ChangeRecord> swapped = detectSwaps(candidates, prev, cur);

        List<ChangeRecord> dateChanged = new ArrayList<>();
        for (String id : candidates) {   // detectSwaps가 쌍을 제거한 나머지
            dateChanged.add(new ChangeRecord.DateChanged(cur.get(id),
                    prev.get(id).scheduledDate(), cur.get(id).scheduledDate()));
        }

        // 날짜별 added id (오름차순)
        Map<LocalDate, TreeSet<String>> addedByDate = new HashMap<>();
        for (String id : addedIds) {
            LocalDate date = cur.get(id).scheduledDate();
            if (date != null) addedByDate.computeIfAbsent(date, d -> new TreeSet<>()).add(id);
        }

        List<ChangeRecord> replaced = new ArrayList<>();
        Set<String> claimed = new HashSet<>();
        for (String removedId : removedIds) {
            LocalDate date = prev.get(removedId).scheduledDate();
            if (date == null) continue;
            TreeSet<String> sameDay = addedByDate.get(date);
            if (sameDay == null || sameDay.isEmpty()) continue;
            String addedId = sameDay.pollFirst();
            replaced.add(new ChangeRecord.Replaced(prev.get(removedId), cur.get(addedId), date));
            claimed.add(removedId);
            claimed.add(addedId);
        }

        List<ChangeRecord> out = new ArrayList<>(swapped);
        out.addAll(dateChanged);
        out.addAll(replaced);
        for (String id : addedIds) {
            if (!claimed.contains(id)) out.add(new ChangeRecord.Added(cur.get(id)));
        }
        for (String id : removedIds) {
            if (!claimed.contains(id)) out.add(new ChangeRecord.Removed(prev.get(id)));
        }

        if (visibility != null) {
            out.removeIf(c -> c.jobs().stream().noneMatch(visibility));
        }
        return new ChangeSummary(out);
    }

    /** 맞교환 쌍을 찾아 candidates에서 제거하고 Swapped 목록을 돌려준다. */
    private static List<ChangeRecord> detectSwaps(TreeSet<String> candidates,
                                                  Map<String, JobRecord> prev,
                                                  Map<String, JobRecord> cur) {
        // (old → new) 이동별 id 집합
        Map<DateMove, TreeSet<String>> byMove = new HashMap<>();
        for (String id : candidates) {
            byMove.computeIfAbsent(moveOf(id, prev, cur), m -> new TreeSet<>()).add(id);
        }

        List<ChangeRecord> swapped = new ArrayList<>();
        Set<String> paired = new HashSet<>();
        for (String a : candidates) {
            if (paired.contains(a)) continue;
            DateMove move = moveOf(a, prev, cur);
            TreeSet<String> partners = byMove.get(move.reversed());
            if (partners == null) continue;
            String b = null;
            for (String p : partners) {
                if (!p.equals(a) && !paired.contains(p)) { b = p; break; }
            }
            if (b == null) continue;

            paired.add(a);
            paired.add(b);
            byMove.get(move).remove(a);
            partners.remove(b);
            swapped.add(new ChangeRecord.Swapped(cur.get(a), cur.get(b), move.from(), move.to()));
        }
        candidates.removeAll(paired);
        return swapped;
    }

    private static DateMove moveOf(String id, Map<String, JobRecord> prev, Map<String, JobRecord> cur) {
        return new DateMove(prev.get(id).scheduledDate(), cur.get(id).scheduledDate());
    }

    /** id 없는 레코드는 무시. 같은 id가 반복되면 마지막 것이 남는다. */
    private static SortedMap<String, JobRecord> index(Collection<JobRecord> records) {
        SortedMap<String, JobRecord> map = new TreeMap<>();
        if (records == null) return map;
        for (JobRecord r : records) {
            if (r != null && r.id() != null) map.put(r.id(), r);
        }
        return map;
    }

    private record DateMove(LocalDate from, LocalDate to) {
        DateMove reversed() { return new DateMove(to, from); }
    }
}
