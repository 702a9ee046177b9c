package net.driftwatch.integration.spring;

import net.driftwatch.adapter.jdbc.repo.JdbcCompletedJobRepository;
import net.driftwatch.adapter.jdbc.repo.JdbcExecutionRecordRepository;
import net.driftwatch.adapter.jdbc.repo.JdbcJobRecordRepository;
import net.driftwatch.adapter.jdbc.repo.JdbcScheduleRepository;
import net.driftwatch.core.spi.*;
import net.driftwatch.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Instant;

@Configuration
public class DriftwatchSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean public Clock systemClock() { return Instant::now; }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public ScheduleRepository scheduleRepository(Clock clock) { return new JdbcScheduleRepository(clock); }
    @Bean public ExecutionRecordRepository executionRecordRepository() { return new JdbcExecutionRecordRepository(); }
    @Bean public JobRecordRepository jobRecordRepository(Clock clock) { return new JdbcJobRecordRepository(clock); }
    @Bean public CompletedJobRepository completedJobRepository(Clock clock) { return new JdbcCompletedJobRepository(clock); }
}
