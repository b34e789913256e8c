package com.whereq.tally.scheduler;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Computes fire times of a schedule expression
 */
public interface ScheduleEvaluator {

    /**
     * Check an expression and zone without computing anything
     *
     * @throws com.whereq.tally.exception.ValidationException if either is invalid
     */
    void validate(String expression, ZoneId zone);

    /**
     * Next fire strictly after {@code after}
     *
     * @return empty if the expression never fires again
     * @throws com.whereq.tally.exception.ValidationException if the expression is invalid
     */
    Optional<Instant> next(String expression, ZoneId zone, Instant after);
}
