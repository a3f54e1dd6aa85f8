package com.aind.metadata.service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lenient timestamp parsing for the start/end ordering checks. Formats are tried in order;
 * time-of-day values are placed on 1900-01-01 so that two of them still compare.
 */
final class TimestampParser {

    static final LocalDate TIME_ONLY_ANCHOR = LocalDate.of(1900, 1, 1);

    private static final DateTimeFormatter TWELVE_HOUR = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("h:mm a")
            .toFormatter(Locale.US);

    private static final DateTimeFormatter TWENTY_FOUR_HOUR = DateTimeFormatter.ofPattern("H:mm", Locale.US);

    private static final List<Function<String, LocalDateTime>> FORMATS = List.of(
            text -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME),
            // offsets are compared on the UTC timeline
            text -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                    .withOffsetSameInstant(ZoneOffset.UTC)
                    .toLocalDateTime(),
            text -> LocalTime.parse(text, TWELVE_HOUR).atDate(TIME_ONLY_ANCHOR),
            text -> LocalTime.parse(text, TWENTY_FOUR_HOUR).atDate(TIME_ONLY_ANCHOR)
    );

    private TimestampParser() {
    }

    static Optional<LocalDateTime> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();
        for (Function<String, LocalDateTime> format : FORMATS) {
            Optional<LocalDateTime> parsed = attempt(format, text);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDateTime> attempt(Function<String, LocalDateTime> format, String text) {
        try {
            return Optional.of(format.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
