package net.driftwatch.integration.spring.sched;

import net.driftwatch.core.service.JobScheduler;
import net.driftwatch.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

public class DriftwatchSchedulers {
    private static final Logger log = LoggerFactory.getLogger(DriftwatchSchedulers.class);

    private final JobScheduler scheduler;
    private final Clock clock;

    public DriftwatchSchedulers(JobScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${driftwatch.scheduler.tick-delay-ms:30000}")
    public void tick() throws Exception {
        // ApplicationRunner가 start()를 끝내기 전이면 건너뜀
        if (!scheduler.isStarted()) {
            log.debug("Scheduler not started yet, tick skipped");
            return;
        }
        int dispatched = scheduler.tick(clock.now());
        if (dispatched > 0) log.info("Tick dispatched {} schedule(s)", dispatched);
    }
}
