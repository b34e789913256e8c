package com.whereq.tally.scheduler;

import com.whereq.tally.exception.ValidationException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Cron evaluation on Spring's {@link CronExpression}. Standard five-field
 * expressions are accepted and fire at second zero.
 */
@Component
public class CronScheduleEvaluator implements ScheduleEvaluator {

    @Override
    public void validate(String expression, ZoneId zone) {
        parse(expression);
    }

    @Override
    public Optional<Instant> next(String expression, ZoneId zone, Instant after) {
        ZonedDateTime next = parse(expression).next(after.atZone(zone));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }

    static String normalize(String expression) {
        String trimmed = expression.trim();
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }

    private CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("Cron expression is required");
        }
        try {
            return CronExpression.parse(normalize(expression));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }
}
