package net.driftwatch.core.service;

import net.driftwatch.core.error.ScrapeException;
import net.driftwatch.core.model.*;
import net.driftwatch.core.spi.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 스케줄 1회 실행.
 * 시작 기록 → 이전 작업 집합 로드 → 수집(tx 밖) → 비교 → 작업 집합 저장 → 종료 기록 → 알림.
 * 어떤 경로로 끝나든 종료 기록과 nextRunAt 전진은 반드시 수행한다.
 */
public final class ExecutionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);
    private static final int MAX_ERROR_DETAILS = 4000;

    private final ScheduleRepository schedules;
    private final ExecutionRecordRepository history;
    private final JobRecordRepository jobRecords;
    private final CompletedJobRepository completedJobs;
    private final Scraper scraper;
    private final Notifier notifier;
    private final ChangeReconciler reconciler;
    private final NextRunCalculator nextRun;
    private final TxRunner tx;
    private final Clock clock;

    public ExecutionCoordinator(ScheduleRepository schedules,
                                ExecutionRecordRepository history,
                                JobRecordRepository jobRecords,
                                CompletedJobRepository completedJobs,
                                Scraper scraper,
                                Notifier notifier,
                                ChangeReconciler reconciler,
                                NextRunCalculator nextRun,
                                TxRunner tx,
                                Clock clock) {
        this.schedules = schedules;
        this.history = history;
        this.jobRecords = jobRecords;
        this.completedJobs = completedJobs;
        this.scraper = scraper;
        this.notifier = notifier;
        this.reconciler = reconciler;
        this.nextRun = nextRun;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 종료된 실행 기록을 돌려준다. 종료 기록 저장 자체가 실패하면 예외 전파.
     * {@link Error}도 실패로 종료 기록을 남긴 뒤 그대로 다시 던진다.
     */
    public ExecutionRecord run(ScheduleConfig schedule, TriggerKind trigger) throws Exception {
        ExecutionRecord started = tx.required(() ->
                history.insertStarted(ExecutionRecord.started(schedule, trigger, clock.now())));
        log.info("Run started: scheduleId={} user={} kind={} trigger={} executionId={}",
                schedule.id(), schedule.userId(), schedule.kind(), trigger, started.id());

        ExecutionResult result;
        ChangeSummary toNotify = ChangeSummary.empty();
        Error fatal = null;
        try {
            List<JobRecord> previous = tx.required(() ->
                    jobRecords.findAll(schedule.userId(), schedule.kind()));

            // 외부 호출은 트랜잭션 밖에서
            Snapshot current = scraper.fetch(new CredentialsRef(schedule.userId(), schedule.kind()));

            ChangeSummary summary = reconciler.reconcile(previous, current.jobs());
            List<String> gone = disappearedIds(previous, current);

            tx.required(() -> {
                jobRecords.upsertAll(schedule.userId(), schedule.kind(), current.jobs());
                jobRecords.deleteByIds(schedule.userId(), schedule.kind(), gone);
                return null;
            });

            result = ExecutionResult.succeeded(started.startedAt(), clock.now(), current.size(), summary);

            // 첫 실행(기준선)은 알리지 않는다
            if (!previous.isEmpty() && !summary.isEmpty()) {
                Set<String> completed = tx.required(() -> completedJobs.findJobIds(schedule.userId()));
                toNotify = summary.filter(ChangeFilters.excludingCompletedRemovals(completed));
            }
        } catch (ScrapeException e) {
            log.warn("Scrape failed: scheduleId={} user={} kind={} error={}",
                    schedule.id(), schedule.userId(), schedule.kind(), e.getMessage());
            result = ExecutionResult.failed(started.startedAt(), clock.now(),
                    e.getMessage() != null ? e.getMessage() : "scrape failed", describe(e));
        } catch (Exception e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            log.error("Run failed: scheduleId={} user={} kind={}",
                    schedule.id(), schedule.userId(), schedule.kind(), e);
            result = ExecutionResult.failed(started.startedAt(), clock.now(),
                    e.getClass().getSimpleName() + ": " + e.getMessage(), describe(e));
        } catch (Error e) {
            // 기록을 닫고 nextRunAt을 전진시킨 뒤 다시 던진다
            log.error("Run aborted by error: scheduleId={} user={} kind={}",
                    schedule.id(), schedule.userId(), schedule.kind(), e);
            fatal = e;
            result = ExecutionResult.failed(started.startedAt(), clock.now(),
                    e.getClass().getSimpleName() + ": " + e.getMessage(), describe(e));
        }

        ExecutionRecord finished;
        try {
            finished = finish(started, result);
        } catch (Exception e) {
            if (fatal != null) {
                fatal.addSuppressed(e);
                throw fatal;
            }
            throw e;
        }
        if (fatal != null) throw fatal;

        if (result.success() && !toNotify.isEmpty()) {
            notifyQuietly(schedule, toNotify);
        }
        return finished;
    }

    private ExecutionRecord finish(ExecutionRecord started, ExecutionResult result) throws Exception {
        return tx.required(() -> {
            history.complete(started.id(), result);

            // 실행 중 설정이 바뀌었을 수 있으니 최신 값으로 다음 실행 계산
            Optional<ScheduleConfig> latest = schedules.findById(started.scheduleId());
            if (latest.isPresent()) {
                ScheduleConfig s = latest.get();
                Instant next = nextRun.next(result.completedAt(), s.interval(), s.activeHours());
                schedules.recordOutcome(s.id(), result.completedAt(), next, result.success(), result.errorMessage());
                log.info("Run finished: scheduleId={} success={} changes={} nextRunAt={}",
                        s.id(), result.success(), result.changeSummary(), next);
            } else {
                log.info("Schedule removed while running, history kept: scheduleId={} executionId={}",
                        started.scheduleId(), started.id());
            }
            return history.findById(started.id()).orElseThrow();
        });
    }

    private void notifyQuietly(ScheduleConfig schedule, ChangeSummary changes) {
        try {
            notifier.notify(schedule.userId(), schedule.kind(), changes.changes());
        } catch (Exception e) {
            log.warn("Notify failed (ignored): user={} kind={} changes={} error={}",
                    schedule.userId(), schedule.kind(), changes.size(), e.toString());
        }
    }

    private static List<String> disappearedIds(List<JobRecord> previous, Snapshot current) {
        Set<String> now = new HashSet<>();
        for (JobRecord j : current.jobs()) now.add(j.id());
        return previous.stream()
                .map(JobRecord::id)
                .filter(id -> !now.contains(id))
                .toList();
    }

    /** 예외 클래스와 cause 체인 */
    static String describe(Throwable e) {
        StringBuilder sb = new StringBuilder();
        Throwable t = e;
        int depth = 0;
        while (t != null && depth++ < 10) {
            if (sb.length() > 0) sb.append(" <- ");
            sb.append(t.getClass().getName());
            if (t.getMessage() != null) sb.append(": ").append(t.getMessage());
            t = t.getCause();
        }
        return sb.length() > MAX_ERROR_DETAILS ? sb.substring(0, MAX_ERROR_DETAILS) : sb.toString();
    }
}
