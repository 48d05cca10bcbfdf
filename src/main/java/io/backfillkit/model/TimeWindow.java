package io.backfillkit.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open {@code [from, to)} interval in UTC.
 */
public record TimeWindow(Instant from, Instant to) {

    public Duration duration() {
        return Duration.between(from, to);
    }

    public double hours() {
        return duration().toMillis() / 3_600_000d;
    }

    public boolean emptyOrInverted() {
        return !to.isAfter(from);
    }
}
