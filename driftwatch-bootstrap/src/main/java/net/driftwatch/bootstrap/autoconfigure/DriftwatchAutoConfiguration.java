package net.driftwatch.bootstrap.autoconfigure;

import net.driftwatch.bootstrap.lifecycle.SchedulerLifecycle;
import net.driftwatch.bootstrap.notify.LoggingNotifier;
import net.driftwatch.bootstrap.props.DriftwatchProperties;
import net.driftwatch.core.maintenance.RecoveryService;
import net.driftwatch.core.service.*;
import net.driftwatch.core.spi.*;
import net.driftwatch.integration.spring.DriftwatchSpringConfig;
import net.driftwatch.integration.spring.sched.DriftwatchSchedulers;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.ZoneId;

@AutoConfiguration
@EnableConfigurationProperties(DriftwatchProperties.class)
@Import(DriftwatchSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class DriftwatchAutoConfiguration {

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(Notifier.class)
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public NextRunCalculator nextRunCalculator(DriftwatchProperties props) {
        return new NextRunCalculator(ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ChangeReconciler changeReconciler() {
        return new ChangeReconciler();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionCoordinator executionCoordinator(ScheduleRepository schedules,
                                                     ExecutionRecordRepository history,
                                                     JobRecordRepository jobRecords,
                                                     CompletedJobRepository completedJobs,
                                                     Scraper scraper,
                                                     Notifier notifier,
                                                     ChangeReconciler reconciler,
                                                     NextRunCalculator nextRun,
                                                     TxRunner tx,
                                                     Clock clock) {
        return new ExecutionCoordinator(schedules, history, jobRecords, completedJobs, scraper, notifier,
                reconciler, nextRun, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecoveryService recoveryService(ScheduleRepository schedules,
                                           ExecutionRecordRepository history,
                                           NextRunCalculator nextRun,
                                           TxRunner tx,
                                           Clock clock) {
        return new RecoveryService(schedules, history, nextRun, tx, clock);
    }

    // --- 스케줄러 구현 선택 (driftwatch.scheduler.mode) ---

    @Bean
    @ConditionalOnMissingBean(JobScheduler.class)
    @ConditionalOnProperty(prefix = "driftwatch.scheduler", name = "mode", havingValue = "polling", matchIfMissing = true)
    public JobScheduler pollingJobScheduler(ScheduleRepository schedules,
                                            ExecutionCoordinator coordinator,
                                            RecoveryService recovery,
                                            NextRunCalculator nextRun,
                                            TxRunner tx,
                                            Clock clock,
                                            DriftwatchProperties props) {
        var s = props.getScheduler();
        return new PollingJobScheduler(schedules, coordinator, recovery, nextRun, tx, clock,
                s.getMisfireGrace(), AbstractJobScheduler.workerPool(s.getWorkerThreads()));
    }

    @Bean
    @ConditionalOnMissingBean(JobScheduler.class)
    @ConditionalOnProperty(prefix = "driftwatch.scheduler", name = "mode", havingValue = "manual")
    public JobScheduler manualJobScheduler(ScheduleRepository schedules,
                                           ExecutionCoordinator coordinator,
                                           RecoveryService recovery,
                                           NextRunCalculator nextRun,
                                           TxRunner tx,
                                           Clock clock,
                                           DriftwatchProperties props) {
        var s = props.getScheduler();
        return new ManualJobScheduler(schedules, coordinator, recovery, nextRun, tx, clock,
                s.getMisfireGrace(), AbstractJobScheduler.workerPool(s.getWorkerThreads()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleService scheduleService(JobScheduler scheduler,
                                           ScheduleRepository schedules,
                                           ExecutionRecordRepository history,
                                           CompletedJobRepository completedJobs,
                                           TxRunner tx,
                                           Clock clock,
                                           DriftwatchProperties props) {
        var policy = new ScheduleService.Policy(
                props.getScheduler().getMisfireGrace(),
                props.getStatistics().getWindow(),
                props.getScheduler().getFailureAlertThreshold());
        return new ScheduleService(scheduler, schedules, history, completedJobs, tx, clock, policy);
    }

    // --- 주기 tick (프로퍼티로 on/off, 주기는 driftwatch.scheduler.tick-delay-ms) ---

    @Bean
    @ConditionalOnProperty(prefix = "driftwatch.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public DriftwatchSchedulers driftwatchSchedulers(JobScheduler scheduler, Clock clock) {
        return new DriftwatchSchedulers(scheduler, clock);
    }

    @Bean
    public SchedulerLifecycle schedulerLifecycle(JobScheduler scheduler, DriftwatchProperties props) {
        return new SchedulerLifecycle(scheduler, props.getScheduler().getShutdownGrace());
    }
}
