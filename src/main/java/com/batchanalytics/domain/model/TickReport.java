package com.batchanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * What one scheduler tick did. Jobs keep running after the tick returns; their
 * futures are in {@link #jobs}.
 */
@Value
@Builder
public class TickReport {

    Instant evaluatedAt;
    Instant scheduledAt;
    int rulesLoaded;
    List<String> dueRuleIds;
    int submitted;
    boolean storeUnavailable;

    @JsonIgnore
    List<CompletableFuture<JobExecution>> jobs;

    public static TickReport storeUnavailable(Instant now) {
        return TickReport.builder()
                .evaluatedAt(now)
                .dueRuleIds(List.of())
                .jobs(List.of())
                .storeUnavailable(true)
                .build();
    }
}
