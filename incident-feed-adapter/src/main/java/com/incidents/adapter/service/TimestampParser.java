package com.incidents.adapter.service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Lenient parsing of the timestamp texts found on observations.
 * Accepts ISO-8601 instants and offset date-times, ISO local date-times (read in the region zone)
 * and RFC-1123 dates as used by RSS pubDate.
 */
public final class TimestampParser {

    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}.*");

    private TimestampParser() {
    }

    /**
     * True when the text starts like an ISO date (yyyy-MM-dd...)
     */
    public static boolean looksLikeIsoDate(String text) {
        return text != null && ISO_DATE_PREFIX.matcher(text.trim()).matches();
    }

    public static Optional<Instant> parse(String text, ZoneId zone) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();

        if (looksLikeIsoDate(value)) {
            Optional<Instant> withOffset = parseWith(value, v -> OffsetDateTime.parse(v).toInstant());
            return withOffset.isPresent()
                    ? withOffset
                    : parseWith(value, v -> LocalDateTime.parse(v).atZone(zone).toInstant());
        }
        return parseWith(value, v -> ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
    }

    private static Optional<Instant> parseWith(String value, Function<String, Instant> parser) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
