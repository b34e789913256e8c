package com.whereq.tally.scheduler;

import com.whereq.tally.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronScheduleEvaluatorTest {

    private final CronScheduleEvaluator evaluator = new CronScheduleEvaluator();

    private static final Instant MIDNIGHT = Instant.parse("2024-03-01T00:00:00Z");

    @Test
    void fiveFieldExpressionShouldFireAtSecondZero() {
        assertThat(CronScheduleEvaluator.normalize("0 2 * * *")).isEqualTo("0 0 2 * * *");
        assertThat(CronScheduleEvaluator.normalize(" */15 * * * * * ")).isEqualTo("*/15 * * * * *");
    }

    @Test
    void shouldComputeNextFireInUtc() {
        assertThat(evaluator.next("0 2 * * *", ZoneOffset.UTC, MIDNIGHT))
            .contains(Instant.parse("2024-03-01T02:00:00Z"));
    }

    @Test
    void shouldEvaluateInJobZone() {
        assertThat(evaluator.next("0 2 * * *", ZoneId.of("America/New_York"), MIDNIGHT))
            .contains(Instant.parse("2024-03-01T07:00:00Z"));
    }

    @Test
    void nextShouldBeStrictlyAfter() {
        Instant twoAm = Instant.parse("2024-03-01T02:00:00Z");

        assertThat(evaluator.next("0 2 * * *", ZoneOffset.UTC, twoAm))
            .contains(Instant.parse("2024-03-02T02:00:00Z"));
    }

    @Test
    void shouldAcceptSecondsField() {
        assertThat(evaluator.next("*/30 * * * * *", ZoneOffset.UTC, MIDNIGHT))
            .contains(Instant.parse("2024-03-01T00:00:30Z"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"61 * * * *", "not a cron", "* * *", "0 25 * * *"})
    void shouldRejectInvalidExpressions(String expression) {
        assertThatThrownBy(() -> evaluator.validate(expression, ZoneOffset.UTC))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Invalid cron expression");
    }

    @Test
    void shouldRejectBlankExpression() {
        assertThatThrownBy(() -> evaluator.validate("  ", ZoneOffset.UTC))
            .isInstanceOf(ValidationException.class);
    }
}
