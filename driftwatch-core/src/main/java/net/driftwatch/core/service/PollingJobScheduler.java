package net.driftwatch.core.service;

import net.driftwatch.core.maintenance.RecoveryService;
import net.driftwatch.core.model.ScheduleConfig;
import net.driftwatch.core.model.TriggerKind;
import net.driftwatch.core.spi.Clock;
import net.driftwatch.core.spi.ScheduleRepository;
import net.driftwatch.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/** 주기적 tick으로 due 스케줄을 찾아 실행한다. */
public final class PollingJobScheduler extends AbstractJobScheduler {
    private static final Logger log = LoggerFactory.getLogger(PollingJobScheduler.class);

    public PollingJobScheduler(ScheduleRepository schedules,
                               ExecutionCoordinator coordinator,
                               RecoveryService recovery,
                               NextRunCalculator nextRun,
                               TxRunner tx,
                               Clock clock,
                               Duration misfireGrace,
                               ExecutorService workers) {
        super(schedules, coordinator, recovery, nextRun, tx, clock, misfireGrace, workers);
    }

    /**
     * due 스케줄마다:
     * - 실행 중이면 건너뜀
     * - grace보다 늦은 정기 실행은 실행하지 않고 now 기준 재계산
     * - 활성 시간대 밖이면 재계산
     * - 재시작 복구 대상이면 RECOVERY로 실행
     */
    @Override
    public int tick(Instant now) throws Exception {
        ensureStarted();
        List<ScheduleConfig> due = tx.required(() -> schedules.findDue(now));
        int dispatched = 0;
        for (ScheduleConfig s : due) {
            if (!claim(s.id())) {
                log.debug("Still running, skip: scheduleId={}", s.id());
                continue;
            }
            boolean submitted = false;
            try {
                // 목록을 읽은 뒤 다른 tick이 이미 실행을 끝냈을 수 있다
                Optional<ScheduleConfig> fresh = tx.required(() -> schedules.findById(s.id()));
                boolean recovering = pendingRecovery.remove(s.id());
                if (fresh.isEmpty() || !isDue(fresh.get(), now)) continue;
                ScheduleConfig current = fresh.get();

                if (!recovering) {
                    Duration late = Duration.between(current.nextRunAt(), now);
                    if (late.compareTo(misfireGrace) > 0) {
                        reschedule(current, now, "misfired by " + late);
                        continue;
                    }
                    if (!nextRun.withinActiveHours(now, current.activeHours())) {
                        reschedule(current, now, "outside active hours " + current.activeHours());
                        continue;
                    }
                }

                submitted = submit(current, recovering ? TriggerKind.RECOVERY : TriggerKind.SCHEDULED);
                if (submitted) dispatched++;
            } finally {
                // submit이 성공하면 워커가 해제한다
                if (!submitted) release(s.id());
            }
        }
        if (dispatched > 0) log.debug("Tick at {}: due={} dispatched={}", now, due.size(), dispatched);
        return dispatched;
    }

    private static boolean isDue(ScheduleConfig s, Instant now) {
        return s.enabled() && s.nextRunAt() != null && !s.nextRunAt().isAfter(now);
    }
}
