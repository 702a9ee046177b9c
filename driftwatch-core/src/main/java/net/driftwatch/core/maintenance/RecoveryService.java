package net.driftwatch.core.maintenance;

import net.driftwatch.core.model.ExecutionRecord;
import net.driftwatch.core.model.ExecutionResult;
import net.driftwatch.core.model.ScheduleConfig;
import net.driftwatch.core.service.NextRunCalculator;
import net.driftwatch.core.spi.Clock;
import net.driftwatch.core.spi.ExecutionRecordRepository;
import net.driftwatch.core.spi.ScheduleRepository;
import net.driftwatch.core.spi.TxRunner;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class RecoveryService {
    private final ScheduleRepository schedules;
    private final ExecutionRecordRepository history;
    private final NextRunCalculator nextRun;
    private final TxRunner tx;
    private final Clock clock;

    public static final String INTERRUPTED = "interrupted";

    public RecoveryService(ScheduleRepository schedules,
                           ExecutionRecordRepository history,
                           NextRunCalculator nextRun,
                           TxRunner tx,
                           Clock clock) {
        this.schedules = schedules;
        this.history = history;
        this.nextRun = nextRun;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 재시작 복구. 스케줄러가 작업을 받기 전에 한 번 실행한다.
     * - 열린 실행 기록을 "interrupted" 실패로 종료
     * - nextRunAt 없는 스케줄에 값 채움
     * - 지난 nextRunAt: grace 이내면 즉시 실행 대상, 넘었으면 now 기준 재계산
     */
    public RecoveryReport recover(Duration misfireGrace) throws Exception {
        Instant now = clock.now();
        RecoveryReport r = new RecoveryReport();

        // 1) 중단된 실행 종료
        r.closedInterrupted = closeInterruptedRuns(now);

        // 2) 지난 스케줄 분류
        List<ScheduleConfig> enabled = tx.required(schedules::findEnabled);
        for (ScheduleConfig s : enabled) {
            if (s.nextRunAt() == null) {
                Instant next = nextRun.next(now, s.interval(), s.activeHours());
                tx.required(() -> { schedules.updateNextRun(s.id(), next); return null; });
                r.initialized++;
            } else if (!s.nextRunAt().isAfter(now)) {
                Duration late = Duration.between(s.nextRunAt(), now);
                if (late.compareTo(misfireGrace) <= 0) {
                    r.runNow.add(s.id());
                } else {
                    Instant next = nextRun.next(now, s.interval(), s.activeHours());
                    tx.required(() -> { schedules.updateNextRun(s.id(), next); return null; });
                    r.rescheduled++;
                }
            }
        }

        r.timestamp = now;
        return r;
    }

    /** 실패 카운트에는 반영하지 않는다. 스케줄 자체의 실패가 아니다. */
    public int closeInterruptedRuns(Instant now) throws Exception {
        List<ExecutionRecord> open = tx.required(history::findOpen);
        int closed = 0;
        for (ExecutionRecord e : open) {
            ExecutionResult result = ExecutionResult.failed(e.startedAt(), now, INTERRUPTED,
                    "process stopped before the run was finalized");
            if (tx.required(() -> history.complete(e.id(), result))) closed++;
        }
        return closed;
    }

    public static final class RecoveryReport {
        public Instant timestamp;
        public int closedInterrupted;
        public int initialized;
        public int rescheduled;
        public final List<Long> runNow = new ArrayList<>();

        @Override public String toString() {
            return "RecoveryReport{" +
                    "timestamp=" + timestamp +
                    ", closedInterrupted=" + closedInterrupted +
                    ", initialized=" + initialized +
                    ", rescheduled=" + rescheduled +
                    ", runNow=" + runNow +
                    '}';
        }
    }
}
