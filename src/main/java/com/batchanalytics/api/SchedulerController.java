package com.batchanalytics.api;

import com.batchanalytics.domain.model.ExecutionResult;
import com.batchanalytics.domain.model.RuleDefinition;
import com.batchanalytics.domain.model.TickReport;
import com.batchanalytics.domain.port.RuleStore;
import com.batchanalytics.domain.service.ExecutionEngine;
import com.batchanalytics.domain.service.SchedulerLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Operator API for the scheduler.
 *
 * Endpoints:
 * - GET /api/v1/scheduler/jobs/{jobId} - Job status and outcome
 * - GET /api/v1/scheduler/rules - Rules that currently load
 * - POST /api/v1/scheduler/ticks - Evaluate rules now
 * - GET /api/v1/scheduler/health - Liveness and in-flight job count
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final RuleStore ruleStore;
    private final SchedulerLoop schedulerLoop;
    private final ExecutionEngine executionEngine;
    private final Clock clock;

    /**
     * Get job status.
     *
     * GET /api/v1/scheduler/jobs/{jobId}
     *
     * Job ids contain '@' and ':' (e.g. {@code r1@2024-03-01T09:00:00Z}); URL-encode them.
     */
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<ExecutionResult> getJob(@PathVariable String jobId) {
        log.info("Get job: jobId={}", jobId);

        return ruleStore.findJob(jobId)
                .map(ExecutionResult::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Valid, enabled rules. Rejected rules are left out (see the logs).
     */
    @GetMapping("/rules")
    public ResponseEntity<List<RuleDefinition>> listRules() {
        return ResponseEntity.ok(ruleStore.loadRules());
    }

    /**
     * Run a tick now. Jobs keep running after the response; poll them by id.
     *
     * Instants already fired are not fired again, so this is safe to repeat.
     */
    @PostMapping("/ticks")
    public ResponseEntity<TickReport> tick() {
        log.info("Manual tick requested");

        return ResponseEntity.ok(schedulerLoop.tick(clock.instant()));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", schedulerLoop.isRunning() ? "UP" : "STOPPED",
                "inFlightJobs", executionEngine.getInFlightCount()
        ));
    }
}
