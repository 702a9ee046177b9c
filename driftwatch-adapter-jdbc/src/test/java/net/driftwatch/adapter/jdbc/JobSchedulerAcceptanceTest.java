package net.driftwatch.adapter.jdbc;

import net.driftwatch.adapter.jdbc.repo.JdbcCompletedJobRepository;
import net.driftwatch.adapter.jdbc.repo.JdbcExecutionRecordRepository;
import net.driftwatch.adapter.jdbc.repo.JdbcJobRecordRepository;
import net.driftwatch.adapter.jdbc.repo.JdbcScheduleRepository;
import net.driftwatch.core.error.PersistenceException;
import net.driftwatch.core.error.ScheduleConfigException;
import net.driftwatch.core.error.ScheduleNotFoundException;
import net.driftwatch.core.error.SchedulerNotInitializedException;
import net.driftwatch.core.maintenance.RecoveryService;
import net.driftwatch.core.model.*;
import net.driftwatch.core.service.*;
import net.driftwatch.core.spi.ExecutionRecordRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.sql.SQLException;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class JobSchedulerAcceptanceTest extends TestSupport {

    static final Instant T0 = Instant.parse("2024-01-10T10:00:00Z");
    static final Duration INTERVAL = Duration.ofHours(1);
    static final Duration GRACE = Duration.ofMinutes(60);

    JdbcTxRunner tx;
    TestClock clock;
    JdbcScheduleRepository schedules;
    JdbcExecutionRecordRepository history;
    JdbcJobRecordRepository jobRecords;
    NextRunCalculator nextRun;
    RecoveryService recovery;
    ScriptedScraper scraper;
    ExecutionCoordinator coordinator;
    AbstractJobScheduler scheduler;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        clock = new TestClock(T0);
        schedules = new JdbcScheduleRepository(clock);
        history = new JdbcExecutionRecordRepository();
        jobRecords = new JdbcJobRecordRepository(clock);
        nextRun = new NextRunCalculator(ZoneOffset.UTC);
        recovery = new RecoveryService(schedules, history, nextRun, tx, clock);
    }

    @BeforeEach
    void reset() throws Exception {
        clock.set(T0);
        deleteAll(tx);
        scraper = new ScriptedScraper();
        coordinator = new ExecutionCoordinator(schedules, history, jobRecords, new JdbcCompletedJobRepository(clock),
                scraper, new RecordingNotifier(), new ChangeReconciler(), nextRun, tx, clock);
        scheduler = polling();
    }

    @AfterEach
    void stop() {
        scheduler.shutdown(Duration.ofSeconds(5));
    }

    private PollingJobScheduler polling() {
        return new PollingJobScheduler(schedules, coordinator, recovery, nextRun, tx, clock, GRACE,
                AbstractJobScheduler.workerPool(4));
    }

    private ScheduleConfig load(long id) throws Exception {
        return tx.required(() -> schedules.findById(id)).orElseThrow();
    }

    private void setNextRun(long id, Instant at) throws Exception {
        tx.required(() -> { schedules.updateNextRun(id, at); return null; });
    }

    private List<ExecutionRecord> runs(String user, String kind) throws Exception {
        return tx.required(() -> history.findByUserAndKind(user, kind, 100, 0));
    }

    private void awaitIdle(long id) {
        await().atMost(5, TimeUnit.SECONDS).until(() -> !scheduler.isRunning(id));
    }

    @Test
    @DisplayName("start 전에는 모든 연산이 SchedulerNotInitializedException")
    void operationsBeforeStartFail() {
        assertFalse(scheduler.isStarted());
        assertThatThrownBy(() -> scheduler.add("u1", "a", INTERVAL, null, true))
                .isInstanceOf(SchedulerNotInitializedException.class);
        assertThatThrownBy(() -> scheduler.tick(T0)).isInstanceOf(SchedulerNotInitializedException.class);
        assertThatThrownBy(() -> scheduler.triggerNow(1L)).isInstanceOf(SchedulerNotInitializedException.class);
        assertThatThrownBy(() -> scheduler.update(1L, ScheduleUpdate.none())).isInstanceOf(SchedulerNotInitializedException.class);
        assertThatThrownBy(() -> scheduler.remove(1L)).isInstanceOf(SchedulerNotInitializedException.class);
    }

    @Test
    @DisplayName("잘못된 설정은 저장 전에 거부")
    void invalidConfigRejected() throws Exception {
        scheduler.start();

        assertThatThrownBy(() -> scheduler.add("u1", "a", Duration.ZERO, null, true))
                .isInstanceOf(ScheduleConfigException.class);
        assertThatThrownBy(() -> scheduler.add("u1", "a", Duration.ofMinutes(-5), null, true))
                .isInstanceOf(ScheduleConfigException.class);
        assertThatThrownBy(() -> scheduler.add("u1", "a", INTERVAL, new ActiveHours(10, 10), true))
                .isInstanceOf(ScheduleConfigException.class);
        assertThatThrownBy(() -> scheduler.add("u1", "a", INTERVAL, new ActiveHours(20, 25), true))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(tx.required(() -> schedules.findAll(ScheduleFilter.all()))).isEmpty();
    }

    @Test
    @DisplayName("add: 초기 nextRunAt 계산, 같은 (user, kind)는 덮어쓰기")
    void addComputesNextRunAndUpserts() throws Exception {
        scheduler.start();

        long id = scheduler.add("u1", "a", INTERVAL, null, true);
        assertEquals(T0.plus(INTERVAL), load(id).nextRunAt());

        // 20시 기준 9~17시 → 다음 날 09:00
        clock.set(Instant.parse("2024-01-10T20:00:00Z"));
        long again = scheduler.add("u1", "a", Duration.ofMinutes(30), new ActiveHours(9, 17), true);

        assertEquals(id, again);
        ScheduleConfig s = load(id);
        assertEquals(Duration.ofMinutes(30), s.interval());
        assertEquals(Instant.parse("2024-01-11T09:00:00Z"), s.nextRunAt());
    }

    @Test
    @DisplayName("update: 부분 수정, lastRun 유지, nextRun 재계산")
    void updatePreservesLastRun() throws Exception {
        scheduler.start();
        long id = scheduler.add("u1", "a", INTERVAL, new ActiveHours(9, 17), true);
        tx.required(() -> { schedules.recordOutcome(id, T0.minusSeconds(60), T0.plusSeconds(60), true, null); return null; });

        clock.advance(Duration.ofMinutes(10));
        ScheduleConfig updated = scheduler.update(id, ScheduleUpdate.none()
                .withInterval(Duration.ofMinutes(5))
                .withoutActiveHours());

        assertEquals(Duration.ofMinutes(5), updated.interval());
        assertNull(updated.activeHours());
        assertTrue(updated.enabled());
        assertEquals(T0.minusSeconds(60), updated.lastRunAt());
        assertEquals(clock.now().plus(Duration.ofMinutes(5)), updated.nextRunAt());

        ScheduleConfig paused = scheduler.update(id, ScheduleUpdate.none().withEnabled(false));
        assertFalse(paused.enabled());
        assertEquals(Duration.ofMinutes(5), paused.interval());

        assertThatThrownBy(() -> scheduler.update(999_999L, ScheduleUpdate.none()))
                .isInstanceOf(ScheduleNotFoundException.class);
        assertThatThrownBy(() -> scheduler.update(id, ScheduleUpdate.none().withInterval(Duration.ZERO)))
                .isInstanceOf(ScheduleConfigException.class);
    }

    @Test
    void removeDeletesOrFailsForUnknownId() throws Exception {
        scheduler.start();
        long id = scheduler.add("u1", "a", INTERVAL, null, true);

        assertTrue(scheduler.remove(id));
        assertThat(tx.required(() -> schedules.findById(id))).isEmpty();
        assertThatThrownBy(() -> scheduler.remove(id)).isInstanceOf(ScheduleNotFoundException.class);
    }

    @Test
    @DisplayName("10분 늦은 스케줄(grace 60분)은 다음 tick에 실행되고 nextRun = now + interval")
    void lateWithinGraceRuns() throws Exception {
        scheduler.start();
        long id = scheduler.add("u1", "a", INTERVAL, null, true);
        setNextRun(id, T0.minus(Duration.ofMinutes(10)));

        int dispatched = scheduler.tick(clock.now());

        assertEquals(1, dispatched);
        await().atMost(5, TimeUnit.SECONDS).until(() -> runs("u1", "a").size() == 1 && !scheduler.isRunning(id));
        ExecutionRecord r = runs("u1", "a").get(0);
        assertEquals(TriggerKind.SCHEDULED, r.triggerKind());
        assertTrue(r.success());
        assertEquals(T0.plus(INTERVAL), load(id).nextRunAt());
    }

    @Test
    @DisplayName("grace를 넘긴 스케줄은 실행하지 않고 now 기준으로 재계산")
    void lateBeyondGraceIsSkipped() throws Exception {
        scheduler.start();
        long id = scheduler.add("u1", "a", INTERVAL, null, true);
        setNextRun(id, T0.minus(Duration.ofHours(3)));

        assertEquals(0, scheduler.tick(clock.now()));

        assertEquals(T0.plus(INTERVAL), load(id).nextRunAt());
        assertThat(runs("u1", "a")).isEmpty();
        assertEquals(0, scraper.calls.get());
    }

    @Test
    @DisplayName("활성 시간대 밖 due는 실행하지 않고 시간대 시작으로 미룬다")
    void outsideActiveHoursIsDeferred() throws Exception {
        scheduler.start();
        long id = scheduler.add("u1", "a", INTERVAL, new ActiveHours(9, 17), true);
        clock.set(Instant.parse("2024-01-10T20:00:00Z"));
        setNextRun(id, clock.now().minusSeconds(30));

        assertEquals(0, scheduler.tick(clock.now()));

        assertEquals(Instant.parse("2024-01-11T09:00:00Z"), load(id).nextRunAt());
        assertThat(runs("u1", "a")).isEmpty();
    }

    @Test
    @DisplayName("동시 tick에서도 같은 스케줄은 한 번만 실행")
    void concurrentTicksNeverOverlap() throws Exception {
        scheduler.start();
        long id = scheduler.add("u1", "a", INTERVAL, null, true);
        setNextRun(id, T0.minusSeconds(5));

        CountDownLatch gate = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        scraper.blockUntil(gate, entered);

        int threads = 8;
        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(es.submit(() -> {
                start.await();
                return scheduler.tick(clock.now());
            }));
        }
        start.countDown();

        int total = 0;
        for (Future<Integer> f : futures) total += f.get(5, TimeUnit.SECONDS);
        es.shutdown();

        assertEquals(1, total, "exactly one tick should dispatch");
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        assertTrue(scheduler.isRunning(id));

        // 실행 중에는 다음 tick도 수동 실행도 건너뛴다
        assertEquals(0, scheduler.tick(clock.now()));
        assertFalse(scheduler.triggerNow(id));

        gate.countDown();
        awaitIdle(id);

        assertEquals(1, scraper.calls.get());
        assertEquals(1, scraper.maxActive.get());
        assertThat(runs("u1", "a")).hasSize(1);
    }

    @Test
    @DisplayName("triggerNow는 nextRun과 무관하게 MANUAL로 실행")
    void triggerNowRunsManual() throws Exception {
        scheduler.start();
        long id = scheduler.add("u1", "a", INTERVAL, null, true);   // nextRun은 1시간 뒤

        assertTrue(scheduler.triggerNow(id));
        await().atMost(5, TimeUnit.SECONDS).until(() -> runs("u1", "a").size() == 1 && !scheduler.isRunning(id));

        assertEquals(TriggerKind.MANUAL, runs("u1", "a").get(0).triggerKind());
        assertThatThrownBy(() -> scheduler.triggerNow(999_999L)).isInstanceOf(ScheduleNotFoundException.class);
    }

    @Test
    @DisplayName("Manual 스케줄러: tick은 아무것도 실행하지 않는다")
    void manualSchedulerIgnoresTicks() throws Exception {
        scheduler.shutdown(Duration.ofSeconds(1));
        scheduler = new ManualJobScheduler(schedules, coordinator, recovery, nextRun, tx, clock, GRACE,
                AbstractJobScheduler.workerPool(2));
        scheduler.start();
        long id = scheduler.add("u1", "a", INTERVAL, null, true);
        setNextRun(id, T0.minusSeconds(60));

        assertEquals(0, scheduler.tick(clock.now()));
        assertThat(runs("u1", "a")).isEmpty();

        assertTrue(scheduler.triggerNow(id));
        awaitIdle(id);
        await().atMost(5, TimeUnit.SECONDS).until(() -> runs("u1", "a").size() == 1);
    }

    @Test
    @DisplayName("재시작 복구: 열린 기록 종료, grace 이내는 RECOVERY 실행, 초과는 재계산")
    void restartRecovery() throws Exception {
        // 이전 프로세스가 남긴 상태
        ScheduleConfig recent = tx.required(() -> schedules.upsert(ScheduleConfig.ofNew(
                "u1", "recent", INTERVAL, null, true, T0.minus(Duration.ofMinutes(5)))));
        ScheduleConfig stale = tx.required(() -> schedules.upsert(ScheduleConfig.ofNew(
                "u1", "stale", INTERVAL, null, true, T0.minus(Duration.ofHours(3)))));
        ScheduleConfig blank = tx.required(() -> schedules.upsert(ScheduleConfig.ofNew(
                "u1", "blank", INTERVAL, null, true, null)));
        ExecutionRecord open = tx.required(() -> history.insertStarted(
                ExecutionRecord.started(recent, TriggerKind.SCHEDULED, T0.minus(Duration.ofMinutes(70)))));

        scheduler.start();
        scheduler.start();   // 두 번째 호출은 무시

        ExecutionRecord closed = tx.required(() -> history.findById(open.id())).orElseThrow();
        assertFalse(closed.isOpen());
        assertFalse(closed.success());
        assertEquals(RecoveryService.INTERRUPTED, closed.errorMessage());

        assertEquals(T0.plus(INTERVAL), load(stale.id()).nextRunAt());
        assertEquals(T0.plus(INTERVAL), load(blank.id()).nextRunAt());
        assertEquals(T0.minus(Duration.ofMinutes(5)), load(recent.id()).nextRunAt());

        assertEquals(1, scheduler.tick(clock.now()));
        await().atMost(5, TimeUnit.SECONDS).until(() -> runs("u1", "recent").size() == 2 && !scheduler.isRunning(recent.id()));
        assertEquals(TriggerKind.RECOVERY, runs("u1", "recent").get(0).triggerKind());
        assertThat(runs("u1", "stale")).isEmpty();
    }

    @Test
    @DisplayName("shutdown 후에는 디스패치하지 않는다")
    void noDispatchAfterShutdown() throws Exception {
        scheduler.start();
        long id = scheduler.add("u1", "a", INTERVAL, null, true);
        setNextRun(id, T0.minusSeconds(1));

        scheduler.shutdown(Duration.ofSeconds(1));

        assertEquals(0, scheduler.tick(clock.now()));
        assertFalse(scheduler.isRunning(id));
        assertThat(runs("u1", "a")).isEmpty();
    }

    @Test
    @DisplayName("종료 기록 저장이 실패해도 실행 중 표시는 풀리고 다음 실행을 받는다")
    void finalizeFailureReleasesMarker() throws Exception {
        FailingCompletion failing = new FailingCompletion(history);
        ExecutionCoordinator broken = new ExecutionCoordinator(schedules, failing, jobRecords,
                new JdbcCompletedJobRepository(clock), scraper, new RecordingNotifier(), new ChangeReconciler(),
                nextRun, tx, clock);
        scheduler.shutdown(Duration.ofSeconds(1));
        scheduler = new PollingJobScheduler(schedules, broken, recovery, nextRun, tx, clock, GRACE,
                AbstractJobScheduler.workerPool(2));
        scheduler.start();
        long id = scheduler.add("u1", "a", INTERVAL, null, true);

        failing.failNext.set(true);
        assertTrue(scheduler.triggerNow(id));
        await().atMost(5, TimeUnit.SECONDS).until(() -> scraper.calls.get() == 1 && !scheduler.isRunning(id));

        // 종료 tx 전체가 롤백: 기록은 열린 채 남고(다음 기동 시 복구) 스케줄 결과도 반영되지 않음
        assertThat(tx.required(history::findOpen)).hasSize(1);
        assertEquals(0, load(id).consecutiveFailures());

        assertTrue(scheduler.triggerNow(id));
        await().atMost(5, TimeUnit.SECONDS).until(() -> scraper.calls.get() == 2 && !scheduler.isRunning(id));
        await().atMost(5, TimeUnit.SECONDS).until(() -> runs("u1", "a").stream().anyMatch(ExecutionRecord::success));
        assertThat(runs("u1", "a")).hasSize(2);
    }

    @Test
    @DisplayName("update로 nextRun을 다시 잡으면 복구 대상에서 빠지고 활성 시간대 검사를 받는다")
    void updateClearsPendingRecovery() throws Exception {
        ScheduleConfig recent = tx.required(() -> schedules.upsert(ScheduleConfig.ofNew(
                "u1", "a", INTERVAL, null, true, T0.minus(Duration.ofMinutes(5)))));
        scheduler.start();

        scheduler.update(recent.id(), ScheduleUpdate.none().withActiveHours(new ActiveHours(9, 17)));
        assertEquals(T0.plus(INTERVAL), load(recent.id()).nextRunAt());

        // 나중에 시간대 밖에서 due가 되면 일반 실행처럼 미뤄져야 한다
        clock.set(Instant.parse("2024-01-10T20:00:00Z"));
        setNextRun(recent.id(), clock.now().minusSeconds(30));

        assertEquals(0, scheduler.tick(clock.now()));
        assertEquals(Instant.parse("2024-01-11T09:00:00Z"), load(recent.id()).nextRunAt());
        assertThat(runs("u1", "a")).isEmpty();
    }

    @Test
    @DisplayName("triggerNow가 먼저 실행하면 복구 표시는 소비된다")
    void triggerNowConsumesPendingRecovery() throws Exception {
        ScheduleConfig recent = tx.required(() -> schedules.upsert(ScheduleConfig.ofNew(
                "u1", "a", INTERVAL, new ActiveHours(9, 17), true, T0.minus(Duration.ofMinutes(5)))));
        scheduler.start();

        assertTrue(scheduler.triggerNow(recent.id()));
        awaitIdle(recent.id());
        await().atMost(5, TimeUnit.SECONDS).until(() -> runs("u1", "a").size() == 1);
        assertEquals(TriggerKind.MANUAL, runs("u1", "a").get(0).triggerKind());

        clock.set(Instant.parse("2024-01-10T20:00:00Z"));
        setNextRun(recent.id(), clock.now().minusSeconds(30));

        assertEquals(0, scheduler.tick(clock.now()));
        assertThat(runs("u1", "a")).hasSize(1);
    }

    /** 다음 complete 한 번을 SQL 오류로 실패시킨다 */
    static final class FailingCompletion implements ExecutionRecordRepository {
        final AtomicBoolean failNext = new AtomicBoolean();
        private final ExecutionRecordRepository delegate;

        FailingCompletion(ExecutionRecordRepository delegate) {
            this.delegate = delegate;
        }

        @Override
        public ExecutionRecord insertStarted(ExecutionRecord started) throws Exception {
            return delegate.insertStarted(started);
        }

        @Override
        public boolean complete(long id, ExecutionResult result) throws Exception {
            if (failNext.compareAndSet(true, false)) {
                throw new PersistenceException("complete failed", new SQLException("disk full"));
            }
            return delegate.complete(id, result);
        }

        @Override
        public Optional<ExecutionRecord> findById(long id) throws Exception {
            return delegate.findById(id);
        }

        @Override
        public List<ExecutionRecord> findByUserAndKind(String userId, String kind, int limit, int offset) throws Exception {
            return delegate.findByUserAndKind(userId, kind, limit, offset);
        }

        @Override
        public List<ExecutionRecord> findOpen() throws Exception {
            return delegate.findOpen();
        }

        @Override
        public ScheduleStatistics statistics(String userId, String kind, Instant since) throws Exception {
            return delegate.statistics(userId, kind, since);
        }
    }
}
