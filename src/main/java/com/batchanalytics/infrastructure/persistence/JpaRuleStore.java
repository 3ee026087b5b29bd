package com.batchanalytics.infrastructure.persistence;

import com.batchanalytics.domain.exception.ResultWriteException;
import com.batchanalytics.domain.exception.RuleDefinitionException;
import com.batchanalytics.domain.exception.StoreUnavailableException;
import com.batchanalytics.domain.model.AggregateRow;
import com.batchanalytics.domain.model.JobExecution;
import com.batchanalytics.domain.model.JobStatus;
import com.batchanalytics.domain.model.RuleDefinition;
import com.batchanalytics.domain.model.RuleRecord;
import com.batchanalytics.domain.port.RuleStore;
import com.batchanalytics.domain.service.RuleDefinitionFactory;
import com.batchanalytics.infrastructure.persistence.entity.AggregateResultEntity;
import com.batchanalytics.infrastructure.persistence.entity.JobExecutionEntity;
import com.batchanalytics.infrastructure.persistence.entity.RuleDefinitionEntity;
import com.batchanalytics.infrastructure.persistence.repository.AggregateResultRepository;
import com.batchanalytics.infrastructure.persistence.repository.JobExecutionRepository;
import com.batchanalytics.infrastructure.persistence.repository.RuleDefinitionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * {@link RuleStore} over Spring Data JPA.
 *
 * Reads that fail become {@link StoreUnavailableException}, writes that fail become
 * {@link ResultWriteException}; callers never see Spring's exception types.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaRuleStore implements RuleStore {

    private static final EnumSet<JobStatus> OPEN_STATUSES =
            EnumSet.of(JobStatus.PENDING, JobStatus.RUNNING, JobStatus.RETRYING);

    private final RuleDefinitionRepository ruleRepository;
    private final JobExecutionRepository jobRepository;
    private final AggregateResultRepository resultRepository;
    private final RuleDefinitionFactory ruleFactory;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Override
    public List<RuleDefinition> loadRules() {
        List<RuleDefinitionEntity> entities;
        try {
            entities = ruleRepository.findByEnabledTrueOrderByRuleIdAsc();
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Cannot load rule definitions: " + e.getMessage(), e);
        }

        List<RuleDefinition> rules = new ArrayList<>(entities.size());
        for (RuleDefinitionEntity entity : entities) {
            try {
                rules.add(ruleFactory.create(toRecord(entity)));
            } catch (RuleDefinitionException e) {
                log.warn("Skipping rule {}: {}", e.getRuleId(), e.getMessage());
                Counter.builder("rule.definitions.rejected")
                        .tag("reason", e.getClass().getSimpleName())
                        .register(meterRegistry)
                        .increment();
            }
        }
        log.debug("Loaded {} rules ({} rejected)", rules.size(), entities.size() - rules.size());
        return rules;
    }

    @Override
    public boolean createPending(JobExecution job) {
        try {
            if (jobRepository.existsById(job.getJobId())) {
                return false;
            }
            JobExecutionEntity entity = toEntity(job, null);
            entity.setNewEntity(true);
            jobRepository.saveAndFlush(entity);
            return true;
        } catch (DataIntegrityViolationException e) {
            // lost the insert race to another instance
            log.debug("Job {} inserted concurrently", job.getJobId());
            return false;
        } catch (DataAccessException | TransactionException e) {
            throw new ResultWriteException(job.getJobId(), "Cannot create job " + job.getJobId(), e);
        }
    }

    @Override
    public boolean markClaimed(String jobId, Instant startedAt) {
        try {
            return jobRepository.claim(jobId, startedAt, JobStatus.PENDING, JobStatus.RUNNING) == 1;
        } catch (DataAccessException | TransactionException e) {
            throw new ResultWriteException(jobId, "Cannot claim job " + jobId, e);
        }
    }

    @Override
    public void recordExecution(JobExecution job) {
        try {
            JobExecutionEntity existing = jobRepository.findById(job.getJobId()).orElse(null);
            jobRepository.save(toEntity(job, existing));
        } catch (DataAccessException | TransactionException e) {
            throw new ResultWriteException(job.getJobId(), "Cannot record job " + job.getJobId(), e);
        }
    }

    @Override
    public void recordResults(JobExecution job, List<AggregateRow> rows) {
        List<AggregateResultEntity> entities = rows.stream()
                .map(row -> AggregateResultEntity.builder()
                        .jobId(job.getJobId())
                        .ruleId(job.getRuleId())
                        .timeBucket(row.getTimeBucket())
                        .aggregatedMetricName(row.getAggregatedMetricName())
                        .aggregatedValue(row.getValue())
                        .build())
                .toList();
        try {
            resultRepository.saveAll(entities);
            log.debug("Stored {} aggregate rows for job {}", entities.size(), job.getJobId());
        } catch (DataAccessException | TransactionException e) {
            throw new ResultWriteException(job.getJobId(), "Cannot store results of job " + job.getJobId(), e);
        }
    }

    @Override
    public Optional<JobExecution> findJob(String jobId) {
        try {
            return jobRepository.findById(jobId).map(JpaRuleStore::toDomain);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Cannot read job " + jobId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int failAbandoned(Instant cutoff, String reason) {
        try {
            return jobRepository.failStale(OPEN_STATUSES, JobStatus.FAILED, reason, cutoff, clock.instant());
        } catch (DataAccessException | TransactionException e) {
            throw new ResultWriteException(null, "Cannot fail abandoned jobs", e);
        }
    }

    static RuleRecord toRecord(RuleDefinitionEntity entity) {
        return RuleRecord.builder()
                .ruleId(entity.getRuleId())
                .tableName(entity.getTableName())
                .metricName(entity.getMetricName())
                .aggregation(entity.getAggregation())
                .granularity(entity.getGranularity())
                .scheduleName(entity.getScheduleName())
                .filterPredicate(entity.getFilterPredicate())
                .build();
    }

    static JobExecutionEntity toEntity(JobExecution job, JobExecutionEntity existing) {
        JobExecutionEntity entity = existing != null ? existing : new JobExecutionEntity();
        entity.setJobId(job.getJobId());
        entity.setRuleId(job.getRuleId());
        entity.setTableName(job.getTableName());
        entity.setMetricName(job.getMetricName());
        entity.setScheduledAt(job.getScheduledAt());
        entity.setStatus(job.getStatus());
        entity.setAttemptCount(job.getAttemptCount());
        entity.setGeneratedSqlQuery(job.getGeneratedQuery());
        entity.setRecordCount(job.getRecordCount());
        entity.setErrorMessage(job.getErrorMessage());
        entity.setStartedAt(job.getStartedAt());
        entity.setFinishedAt(job.getFinishedAt());
        return entity;
    }

    static JobExecution toDomain(JobExecutionEntity entity) {
        return JobExecution.builder()
                .jobId(entity.getJobId())
                .ruleId(entity.getRuleId())
                .tableName(entity.getTableName())
                .metricName(entity.getMetricName())
                .scheduledAt(entity.getScheduledAt())
                .status(entity.getStatus())
                .attemptCount(entity.getAttemptCount())
                .generatedQuery(entity.getGeneratedSqlQuery())
                .recordCount(entity.getRecordCount())
                .errorMessage(entity.getErrorMessage())
                .startedAt(entity.getStartedAt())
                .finishedAt(entity.getFinishedAt())
                .build();
    }
}
