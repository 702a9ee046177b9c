package net.driftwatch.core.service;

import net.driftwatch.core.error.ScheduleConfigException;
import net.driftwatch.core.error.ScheduleNotFoundException;
import net.driftwatch.core.error.SchedulerNotInitializedException;
import net.driftwatch.core.maintenance.RecoveryService;
import net.driftwatch.core.model.ActiveHours;
import net.driftwatch.core.model.ScheduleConfig;
import net.driftwatch.core.model.ScheduleUpdate;
import net.driftwatch.core.model.TriggerKind;
import net.driftwatch.core.spi.Clock;
import net.driftwatch.core.spi.ScheduleRepository;
import net.driftwatch.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 공통 구현: 설정 관리, 실행 중 표시, 워커 풀 제출, 종료.
 * 언제 due를 디스패치할지는 하위 클래스의 {@link #tick(Instant)}가 정한다.
 */
public abstract class AbstractJobScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(AbstractJobScheduler.class);

    protected final ScheduleRepository schedules;
    protected final ExecutionCoordinator coordinator;
    protected final RecoveryService recovery;
    protected final NextRunCalculator nextRun;
    protected final TxRunner tx;
    protected final Clock clock;
    protected final Duration misfireGrace;

    private final ExecutorService workers;
    // 실행 중 스케줄 ID. 추가에 성공한 쪽만 실행한다.
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();
    // 재시작 복구에서 grace 이내로 분류된 스케줄. 첫 due 판정, update, triggerNow 중 먼저 오는 쪽에서 소비
    protected final Set<Long> pendingRecovery = ConcurrentHashMap.newKeySet();
    private volatile boolean started;
    private volatile boolean stopping;

    protected AbstractJobScheduler(ScheduleRepository schedules,
                                   ExecutionCoordinator coordinator,
                                   RecoveryService recovery,
                                   NextRunCalculator nextRun,
                                   TxRunner tx,
                                   Clock clock,
                                   Duration misfireGrace,
                                   ExecutorService workers) {
        this.schedules = schedules;
        this.coordinator = coordinator;
        this.recovery = recovery;
        this.nextRun = nextRun;
        this.tx = tx;
        this.clock = clock;
        this.misfireGrace = misfireGrace;
        this.workers = workers;
    }

    /** 이름 붙은 데몬 스레드 고정 풀 */
    public static ExecutorService workerPool(int threads) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "driftwatch-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, threads), tf);
    }

    @Override
    public synchronized void start() throws Exception {
        if (started) return;
        RecoveryService.RecoveryReport report = recovery.recover(misfireGrace);
        pendingRecovery.addAll(report.runNow);
        started = true;
        log.info("Scheduler started ({}): {}", getClass().getSimpleName(), report);
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public long add(String userId, String kind, Duration interval, ActiveHours activeHours, boolean enabled) throws Exception {
        ensureStarted();
        if (userId == null || userId.isBlank() || kind == null || kind.isBlank()) {
            throw new ScheduleConfigException("userId and kind are required");
        }
        validate(interval, activeHours);
        Instant next = nextRun.next(clock.now(), interval, activeHours);

        ScheduleConfig saved = tx.required(() -> {
            var existing = schedules.findByUserAndKind(userId, kind);
            ScheduleConfig config = existing
                    .map(s -> s.withSettings(interval, activeHours, enabled, next))
                    .orElseGet(() -> ScheduleConfig.ofNew(userId, kind, interval, activeHours, enabled, next));
            return schedules.upsert(config);
        });
        log.info("Schedule saved: id={} user={} kind={} interval={} activeHours={} enabled={} nextRunAt={}",
                saved.id(), userId, kind, interval, activeHours, enabled, next);
        return saved.id();
    }

    @Override
    public ScheduleConfig update(long scheduleId, ScheduleUpdate update) throws Exception {
        ensureStarted();
        ScheduleConfig current = load(scheduleId);

        Duration interval = update.intervalOr(current.interval());
        ActiveHours hours = update.activeHoursOr(current.activeHours());
        boolean enabled = update.enabledOr(current.enabled());
        validate(interval, hours);

        Instant next = nextRun.next(clock.now(), interval, hours);
        ScheduleConfig saved = tx.required(() ->
                schedules.upsert(current.withSettings(interval, hours, enabled, next)));
        // nextRunAt을 새로 잡았으므로 복구 대상에서 제외
        pendingRecovery.remove(scheduleId);
        log.info("Schedule updated: id={} {} nextRunAt={}", scheduleId, update, next);
        return saved;
    }

    @Override
    public boolean remove(long scheduleId) throws Exception {
        ensureStarted();
        boolean removed = tx.required(() -> schedules.deleteById(scheduleId));
        if (!removed) throw new ScheduleNotFoundException(scheduleId);
        pendingRecovery.remove(scheduleId);
        // 실행 중이면 그 실행은 끝까지 가고 이력만 남는다
        log.info("Schedule removed: id={} running={}", scheduleId, isRunning(scheduleId));
        return true;
    }

    @Override
    public boolean triggerNow(long scheduleId) throws Exception {
        ensureStarted();
        ScheduleConfig s = load(scheduleId);
        if (!claim(scheduleId)) {
            log.info("Manual trigger skipped, already running: id={}", scheduleId);
            return false;
        }
        pendingRecovery.remove(scheduleId);
        return submit(s, TriggerKind.MANUAL);
    }

    @Override
    public boolean isRunning(long scheduleId) {
        return inFlight.contains(scheduleId);
    }

    @Override
    public void shutdown(Duration grace) {
        stopping = true;
        workers.shutdown();
        try {
            if (!workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Shutdown grace {} elapsed, abandoning runs: {}", grace, Set.copyOf(inFlight));
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Scheduler stopped");
    }

    protected void ensureStarted() {
        if (!started) throw new SchedulerNotInitializedException();
    }

    protected boolean claim(long scheduleId) {
        return !stopping && inFlight.add(scheduleId);
    }

    protected void release(long scheduleId) {
        inFlight.remove(scheduleId);
    }

    /** claim된 스케줄을 워커에 넘긴다. 거절되면 표시를 풀고 false */
    protected boolean submit(ScheduleConfig s, TriggerKind trigger) {
        try {
            workers.execute(() -> runAndRelease(s, trigger));
            return true;
        } catch (RejectedExecutionException e) {
            release(s.id());
            log.warn("Dispatch rejected (stopping?): scheduleId={} trigger={}", s.id(), trigger);
            return false;
        }
    }

    private void runAndRelease(ScheduleConfig s, TriggerKind trigger) {
        try {
            coordinator.run(s, trigger);
        } catch (Exception e) {
            // 종료 기록 실패. 열린 기록은 다음 기동 시 복구된다.
            log.error("Run could not be finalized: scheduleId={} trigger={}", s.id(), trigger, e);
        } catch (Error e) {
            log.error("Run aborted by error: scheduleId={} trigger={}", s.id(), trigger, e);
            throw e;
        } finally {
            release(s.id());
        }
    }

    /** now 기준으로 nextRunAt만 다시 잡는다(실행하지 않음). */
    protected void reschedule(ScheduleConfig s, Instant now, String reason) throws Exception {
        Instant next = nextRun.next(now, s.interval(), s.activeHours());
        tx.required(() -> { schedules.updateNextRun(s.id(), next); return null; });
        log.info("Schedule skipped ({}): id={} was due {} → nextRunAt={}", reason, s.id(), s.nextRunAt(), next);
    }

    protected ScheduleConfig load(long scheduleId) throws Exception {
        return tx.required(() -> schedules.findById(scheduleId))
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    static void validate(Duration interval, ActiveHours activeHours) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new ScheduleConfigException("interval must be positive: " + interval);
        }
        if (activeHours != null && !activeHours.isWellFormed()) {
            throw new ScheduleConfigException("activeHours must satisfy 0 <= start < end <= 24: " + activeHours);
        }
    }
}
