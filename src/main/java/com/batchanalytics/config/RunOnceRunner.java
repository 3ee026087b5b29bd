package com.batchanalytics.config;

import com.batchanalytics.domain.model.ExecutionResult;
import com.batchanalytics.domain.model.JobStatus;
import com.batchanalytics.domain.service.SchedulerLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * {@code app.scheduler.mode=once}: run a single tick, wait for its jobs and exit.
 * Exit code is 1 when any job did not succeed.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.scheduler.mode", havingValue = "once")
@RequiredArgsConstructor
public class RunOnceRunner implements ApplicationRunner {

    private final SchedulerLoop schedulerLoop;
    private final Clock clock;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(ApplicationArguments args) {
        List<ExecutionResult> results = schedulerLoop.runOnce(clock.instant());
        long failed = results.stream().filter(r -> r.getStatus() != JobStatus.SUCCEEDED).count();
        int exitCode = failed > 0 ? 1 : 0;
        log.info("Single run finished: {} jobs, {} not succeeded, exiting with {}", results.size(), failed, exitCode);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }
}
