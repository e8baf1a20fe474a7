package com.libragraph.cadence.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Parses externally supplied timestamps into UTC {@link Instant}s.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>ISO-8601 instants and offset date-times ({@code 2024-01-01T10:00:00Z},
 *       {@code 2024-01-01T12:00:00+02:00})</li>
 *   <li>ISO-8601 local date-times without offset, treated as UTC</li>
 *   <li>RFC 1123 / RFC 2822 mail headers ({@code Mon, 1 Jan 2024 10:00:00 +0000}),
 *       with or without the trailing {@code (UTC)} comment</li>
 * </ul>
 * Naive values are coerced to UTC, never interpreted in the JVM's local zone.
 */
public final class UtcTimestamps {

    private static final List<DateTimeFormatter> MAIL_FORMATS = List.of(
            DateTimeFormatter.RFC_1123_DATE_TIME,
            DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm:ss Z", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d MMM yyyy HH:mm:ss Z", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm:ss z", Locale.ENGLISH)
    );

    private UtcTimestamps() {
    }

    /**
     * Parses {@code text} in any accepted form.
     *
     * @return the UTC instant, or empty if the value is blank or unparsable
     */
    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = stripComment(text.trim());

        Optional<Instant> parsed = tryParse(() -> OffsetDateTime.parse(value).toInstant());
        if (parsed.isEmpty()) {
            parsed = tryParse(() -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
        }
        for (int i = 0; parsed.isEmpty() && i < MAIL_FORMATS.size(); i++) {
            DateTimeFormatter format = MAIL_FORMATS.get(i);
            parsed = tryParse(() -> ZonedDateTime.parse(value, format).toInstant());
        }
        return parsed;
    }

    /**
     * Parses {@code text}, falling back to {@code fallback} when it cannot be parsed.
     */
    public static Instant parseOr(String text, Instant fallback) {
        Objects.requireNonNull(fallback, "fallback cannot be null");
        return parse(text).orElse(fallback);
    }

    /** Coerces a date-time without offset to UTC. */
    public static Instant ensureUtc(LocalDateTime naive) {
        Objects.requireNonNull(naive, "naive cannot be null");
        return naive.toInstant(ZoneOffset.UTC);
    }

    private static Optional<Instant> tryParse(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static String stripComment(String value) {
        int paren = value.indexOf('(');
        return paren > 0 ? value.substring(0, paren).trim() : value;
    }
}
