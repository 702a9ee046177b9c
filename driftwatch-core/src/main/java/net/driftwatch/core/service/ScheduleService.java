package net.driftwatch.core.service;

import net.driftwatch.core.model.*;
import net.driftwatch.core.spi.Clock;
import net.driftwatch.core.spi.CompletedJobRepository;
import net.driftwatch.core.spi.ExecutionRecordRepository;
import net.driftwatch.core.spi.ScheduleRepository;
import net.driftwatch.core.spi.TxRunner;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** 사용자 관점 조회/관리 API. 변경은 스케줄러를 거친다. */
public final class ScheduleService {
    public static final int MAX_HISTORY_PAGE = 500;

    private final JobScheduler scheduler;
    private final ScheduleRepository schedules;
    private final ExecutionRecordRepository history;
    private final CompletedJobRepository completedJobs;
    private final TxRunner tx;
    private final Clock clock;
    private final Policy policy;

    /** 상태 판정/통계 기준값 */
    public record Policy(Duration misfireGrace, Duration statisticsWindow, int failureAlertThreshold) {
        public static Policy defaults() {
            return new Policy(Duration.ofMinutes(60), Duration.ofDays(30), 5);
        }
    }

    public ScheduleService(JobScheduler scheduler,
                           ScheduleRepository schedules,
                           ExecutionRecordRepository history,
                           CompletedJobRepository completedJobs,
                           TxRunner tx,
                           Clock clock,
                           Policy policy) {
        this.scheduler = scheduler;
        this.schedules = schedules;
        this.history = history;
        this.completedJobs = completedJobs;
        this.tx = tx;
        this.clock = clock;
        this.policy = policy;
    }

    public ScheduleConfig createOrUpdateSchedule(String userId, String kind, Duration interval,
                                                 ActiveHours activeHours, boolean enabled) throws Exception {
        long id = scheduler.add(userId, kind, interval, activeHours, enabled);
        return tx.required(() -> schedules.findById(id)).orElseThrow();
    }

    public ScheduleConfig updateSchedule(long scheduleId, ScheduleUpdate update) throws Exception {
        return scheduler.update(scheduleId, update);
    }

    public Optional<ScheduleConfig> getSchedule(String userId, String kind) throws Exception {
        return tx.required(() -> schedules.findByUserAndKind(userId, kind));
    }

    public boolean deleteSchedule(String userId, String kind) throws Exception {
        Optional<ScheduleConfig> s = getSchedule(userId, kind);
        if (s.isEmpty()) return false;
        return scheduler.remove(s.get().id());
    }

    public List<ScheduleConfig> listSchedules(ScheduleFilter filter) throws Exception {
        return tx.required(() -> schedules.findAll(filter == null ? ScheduleFilter.all() : filter));
    }

    public boolean triggerNow(long scheduleId) throws Exception {
        return scheduler.triggerNow(scheduleId);
    }

    /** 최신순. limit은 1..500으로 보정 */
    public List<ExecutionRecord> getHistory(String userId, String kind, int limit, int offset) throws Exception {
        int l = Math.max(1, Math.min(limit, MAX_HISTORY_PAGE));
        int o = Math.max(0, offset);
        return tx.required(() -> history.findByUserAndKind(userId, kind, l, o));
    }

    public ScheduleStatistics getStatistics(String userId, String kind) throws Exception {
        Instant since = clock.now().minus(policy.statisticsWindow());
        return tx.required(() -> history.statistics(userId, kind, since));
    }

    /** 전체 스케줄 상태. 판정 순서: PAUSED, FAILING, RUNNING, OVERDUE, ACTIVE */
    public List<ScheduleStatus> statusReport() throws Exception {
        Instant now = clock.now();
        List<ScheduleConfig> all = listSchedules(ScheduleFilter.all());
        List<ScheduleStatus> out = new ArrayList<>(all.size());
        for (ScheduleConfig s : all) {
            out.add(statusOf(s, now));
        }
        return out;
    }

    ScheduleStatus statusOf(ScheduleConfig s, Instant now) {
        boolean running = scheduler.isRunning(s.id());
        Duration overdue = s.nextRunAt() != null && s.nextRunAt().isBefore(now)
                ? Duration.between(s.nextRunAt(), now)
                : Duration.ZERO;

        ScheduleStatus.State state;
        if (!s.enabled()) state = ScheduleStatus.State.PAUSED;
        else if (s.consecutiveFailures() >= policy.failureAlertThreshold()) state = ScheduleStatus.State.FAILING;
        else if (running) state = ScheduleStatus.State.RUNNING;
        else if (overdue.compareTo(policy.misfireGrace()) > 0) state = ScheduleStatus.State.OVERDUE;
        else state = ScheduleStatus.State.ACTIVE;
        return new ScheduleStatus(s, state, running, overdue);
    }

    /** 완료 처리한 작업은 목록에서 빠져도 "삭제" 알림을 보내지 않는다. */
    public void markJobCompleted(String userId, String jobId) throws Exception {
        tx.required(() -> { completedJobs.markCompleted(userId, jobId); return null; });
    }
}
