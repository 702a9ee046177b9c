package net.driftwatch.core.service;

import net.driftwatch.core.maintenance.RecoveryService;
import net.driftwatch.core.spi.Clock;
import net.driftwatch.core.spi.ScheduleRepository;
import net.driftwatch.core.spi.TxRunner;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

/** tick으로는 아무것도 실행하지 않는다. triggerNow만 동작(외부 트리거 환경, 테스트). */
public final class ManualJobScheduler extends AbstractJobScheduler {

    public ManualJobScheduler(ScheduleRepository schedules,
                              ExecutionCoordinator coordinator,
                              RecoveryService recovery,
                              NextRunCalculator nextRun,
                              TxRunner tx,
                              Clock clock,
                              Duration misfireGrace,
                              ExecutorService workers) {
        super(schedules, coordinator, recovery, nextRun, tx, clock, misfireGrace, workers);
    }

    @Override
    public int tick(Instant now) {
        ensureStarted();
        return 0;
    }
}
