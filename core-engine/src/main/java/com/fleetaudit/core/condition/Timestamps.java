package com.fleetaudit.core.condition;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Lenient ISO-8601 timestamp reading for date conditions.
 *
 * <p>
 * Accepted string forms: {@code 2024-01-31T12:00:00.123Z},
 * {@code 2024-01-31T12:00:00}, {@code 2024-01-31} and explicit offsets such as
 * {@code 2024-01-31T12:00:00+02:00}. Values without an offset are read as UTC.
 * Temporal objects produced by YAML or JSON loaders are accepted as well.
 * </p>
 *
 * @since 1.0.0
 */
public final class Timestamps {

    private Timestamps() {
    }

    /**
     * @param value string or temporal value, may be {@code null}
     * @return the instant, or empty if the value is not a recognised timestamp
     */
    public static Optional<Instant> parse(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Instant i) {
            return Optional.of(i);
        }
        if (value instanceof Date d) {
            return Optional.of(d.toInstant());
        }
        if (value instanceof OffsetDateTime o) {
            return Optional.of(o.toInstant());
        }
        if (value instanceof ZonedDateTime z) {
            return Optional.of(z.toInstant());
        }
        if (value instanceof LocalDateTime l) {
            return Optional.of(l.toInstant(ZoneOffset.UTC));
        }
        if (value instanceof LocalDate ld) {
            return Optional.of(ld.atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        if (value instanceof String s) {
            return parseString(s.trim());
        }
        return Optional.empty();
    }

    private static Optional<Instant> parseString(String s) {
        if (s.isEmpty()) {
            return Optional.empty();
        }
        String local = stripZulu(s);
        return attempt(() -> LocalDateTime.parse(local, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                        .toInstant(ZoneOffset.UTC))
                .or(() -> attempt(() -> LocalDate.parse(local, DateTimeFormatter.ISO_LOCAL_DATE)
                        .atStartOfDay(ZoneOffset.UTC).toInstant()))
                .or(() -> attempt(() -> OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                        .toInstant()));
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static String stripZulu(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == 'Z') {
            end--;
        }
        return s.substring(0, end);
    }
}
