package io.backfillkit.util;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Canonical text forms used wherever a timestamp or a chunk size takes part in an identity hash
 * or in generated SQL. Keeping one rendering here is what makes plan ids reproducible.
 */
public final class Timestamps {
    private static final DateTimeFormatter CANONICAL = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return CANONICAL.format(instant.truncatedTo(ChronoUnit.MILLIS));
    }

    /**
     * Accepts ISO instants ({@code 2025-01-01T00:00:00Z}), offset date-times and bare local
     * date-times, which are read as UTC.
     */
    public static Instant parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("timestamp is blank");
        }
        String value = raw.trim();
        try {
            return Instant.parse(value).truncatedTo(ChronoUnit.MILLIS);
        } catch (DateTimeParseException ignored) {
            // fall through to the wider formats
        }
        try {
            return OffsetDateTime.parse(value).toInstant().truncatedTo(ChronoUnit.MILLIS);
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unparseable timestamp: " + raw, e);
        }
    }

    public static String formatHours(double hours) {
        return BigDecimal.valueOf(hours).stripTrailingZeros().toPlainString();
    }
}
