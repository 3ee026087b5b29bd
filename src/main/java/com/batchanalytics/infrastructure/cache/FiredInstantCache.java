package com.batchanalytics.infrastructure.cache;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Last instant each rule fired for.
 *
 * Kept in Redis so a restarted or second scheduler instance does not re-evaluate
 * instants that were already handled, with a local copy that always wins when newer
 * and serves alone whenever Redis is down.
 *
 * Only an optimisation: the unique job id in the rule store is what prevents double
 * execution.
 *
 * Failure Handling:
 * - Redis errors propagate to the circuit breaker, which opens after repeated failures
 * - Falls back to the local map
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FiredInstantCache {

    static final String KEY = "rule:fired";
    static final long TTL_SECONDS = 24 * 3600;

    private final RedisTemplate<String, String> redisTemplate;
    private final Map<String, Instant> local = new ConcurrentHashMap<>();

    /**
     * Last fired instant per rule id, for the rules that have one.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "lastFiredFallback")
    public Map<String, Instant> lastFired(Collection<String> ruleIds) {
        Map<String, Instant> result = new HashMap<>();
        List<String> ids = new ArrayList<>(ruleIds);
        if (ids.isEmpty()) {
            return result;
        }
        HashOperations<String, String, String> fired = redisTemplate.opsForHash();
        List<String> values = fired.multiGet(KEY, ids);
        for (int i = 0; i < ids.size(); i++) {
            String value = values != null && i < values.size() ? values.get(i) : null;
            if (value == null) {
                continue;
            }
            try {
                result.put(ids.get(i), Instant.parse(value));
            } catch (DateTimeParseException e) {
                log.warn("Ignoring malformed fired instant for rule {}: {}", ids.get(i), value);
            }
        }
        mergeLocal(ids, result);
        return result;
    }

    /**
     * Record that {@code ruleIds} fired for {@code instant}: one write for the whole tick.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "markFiredFallback")
    public void markFired(Collection<String> ruleIds, Instant instant) {
        if (ruleIds.isEmpty()) {
            return;
        }
        markLocal(ruleIds, instant);
        Map<String, String> values = new HashMap<>();
        ruleIds.forEach(id -> values.put(id, instant.toString()));
        redisTemplate.<String, String>opsForHash().putAll(KEY, values);
        redisTemplate.expire(KEY, TTL_SECONDS, TimeUnit.SECONDS);
        log.debug("Marked {} rules fired at {}", ruleIds.size(), instant);
    }

    private void markLocal(Collection<String> ruleIds, Instant instant) {
        for (String id : ruleIds) {
            local.merge(id, instant, (a, b) -> a.isAfter(b) ? a : b);
        }
    }

    private void mergeLocal(List<String> ids, Map<String, Instant> result) {
        for (String id : ids) {
            Instant mine = local.get(id);
            if (mine != null) {
                result.merge(id, mine, (a, b) -> a.isAfter(b) ? a : b);
            }
        }
    }

    // Fallback methods (circuit breaker)

    Map<String, Instant> lastFiredFallback(Collection<String> ruleIds, Exception e) {
        log.warn("Redis unavailable, using local fired instants: {}", e.getMessage());
        Map<String, Instant> result = new HashMap<>();
        mergeLocal(new ArrayList<>(ruleIds), result);
        return result;
    }

    void markFiredFallback(Collection<String> ruleIds, Instant instant, Exception e) {
        log.warn("Redis unavailable, fired instants kept locally only: {}", e.getMessage());
        markLocal(ruleIds, instant);
    }
}
