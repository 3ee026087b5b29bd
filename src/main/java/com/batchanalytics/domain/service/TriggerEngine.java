package com.batchanalytics.domain.service;

import com.batchanalytics.domain.exception.UnknownScheduleException;
import com.batchanalytics.domain.model.RuleCatalog;
import com.batchanalytics.domain.model.RuleDefinition;
import com.batchanalytics.domain.model.ScheduleSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which rules are due at an evaluation instant.
 *
 * A rule is due when its schedule's cron matches {@code now} at minute resolution and
 * it has not fired yet for that minute. Never reads the clock; callers pass {@code now}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TriggerEngine {

    private final RuleCatalog catalog;

    public Set<String> dueRules(Instant now, Collection<RuleDefinition> rules, Map<String, Instant> lastFired) {
        Set<String> due = new LinkedHashSet<>();
        for (RuleDefinition rule : rules) {
            try {
                if (dueInstant(now, rule, lastFired.get(rule.getRuleId())).isPresent()) {
                    due.add(rule.getRuleId());
                }
            } catch (UnknownScheduleException e) {
                log.warn("Skipping rule: {}", e.getMessage());
            }
        }
        return due;
    }

    /**
     * The matching minute if the rule is due at {@code now}, empty otherwise.
     *
     * @throws UnknownScheduleException if the rule's schedule name is not mapped
     */
    public Optional<Instant> dueInstant(Instant now, RuleDefinition rule, Instant lastFired) {
        ScheduleSpec schedule = resolve(rule);
        ZonedDateTime minute = now.atZone(schedule.getZone()).truncatedTo(ChronoUnit.MINUTES);
        if (!matches(schedule, minute)) {
            return Optional.empty();
        }
        Instant instant = minute.toInstant();
        if (lastFired != null && !lastFired.isBefore(instant)) {
            return Optional.empty();
        }
        return Optional.of(instant);
    }

    public ScheduleSpec resolve(RuleDefinition rule) {
        return catalog.schedule(rule.getScheduleName())
                .orElseThrow(() -> new UnknownScheduleException(rule.getRuleId(), rule.getScheduleName()));
    }

    /**
     * A minute matches when the first fire time strictly after the previous second is
     * the minute itself.
     */
    static boolean matches(ScheduleSpec schedule, ZonedDateTime minute) {
        ZonedDateTime next = schedule.getExpression().next(minute.minusSeconds(1));
        return next != null && next.toInstant().equals(minute.toInstant());
    }
}
