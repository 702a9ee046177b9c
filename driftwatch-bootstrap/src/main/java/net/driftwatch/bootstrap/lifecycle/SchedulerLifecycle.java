package net.driftwatch.bootstrap.lifecycle;

import net.driftwatch.core.service.JobScheduler;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.time.Duration;

/** 기동 시 재시작 복구 후 start, 컨텍스트 종료 시 grace 동안 대기 후 shutdown */
public class SchedulerLifecycle implements ApplicationRunner, DisposableBean {
    private final JobScheduler scheduler;
    private final Duration shutdownGrace;

    public SchedulerLifecycle(JobScheduler scheduler, Duration shutdownGrace) {
        this.scheduler = scheduler;
        this.shutdownGrace = shutdownGrace;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        scheduler.start();
    }

    @Override
    public void destroy() {
        scheduler.shutdown(shutdownGrace);
    }
}
