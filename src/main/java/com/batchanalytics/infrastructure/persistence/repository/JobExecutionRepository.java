package com.batchanalytics.infrastructure.persistence.repository;

import com.batchanalytics.domain.model.JobStatus;
import com.batchanalytics.infrastructure.persistence.entity.JobExecutionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;

/**
 * Job execution rows.
 *
 * Claiming is a single conditional UPDATE: the database row lock makes it atomic, so of
 * two concurrent claims on the same job exactly one sees an update count of 1.
 */
@Repository
public interface JobExecutionRepository extends JpaRepository<JobExecutionEntity, String> {

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE JobExecutionEntity j SET j.status = :running, j.startedAt = :startedAt, j.updatedAt = :startedAt " +
           "WHERE j.jobId = :jobId AND j.status = :pending")
    int claim(
            @Param("jobId") String jobId,
            @Param("startedAt") Instant startedAt,
            @Param("pending") JobStatus pending,
            @Param("running") JobStatus running
    );

    /**
     * Fail non-terminal jobs not touched since {@code cutoff}.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE JobExecutionEntity j SET j.status = :failed, j.errorMessage = :reason, " +
           "j.finishedAt = :now, j.updatedAt = :now " +
           "WHERE j.status IN :open AND j.updatedAt < :cutoff")
    int failStale(
            @Param("open") Collection<JobStatus> open,
            @Param("failed") JobStatus failed,
            @Param("reason") String reason,
            @Param("cutoff") Instant cutoff,
            @Param("now") Instant now
    );
}
