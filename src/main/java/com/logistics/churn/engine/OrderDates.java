package com.logistics.churn.engine;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Order date parsing and day arithmetic shared by the aggregation and detection passes.
 *
 * Accepted formats, tried in order: ISO date-time, ISO date-time with offset (the offset is
 * dropped), {@code yyyy-MM-dd HH:mm:ss}, {@code yyyy-MM-dd HH:mm}, ISO date (start of day),
 * {@code dd.MM.yyyy HH:mm:ss}, {@code dd.MM.yyyy}. The first format that parses wins.
 */
public final class OrderDates {

    private static final DateTimeFormatter SPACED_DATE_TIME =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter SPACED_DATE_MINUTES =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter DOTTED_DATE_TIME =
            DateTimeFormatter.ofPattern("dd.MM.uuuu HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter DOTTED_DATE =
            DateTimeFormatter.ofPattern("dd.MM.uuuu").withResolverStyle(ResolverStyle.STRICT);

    private static final List<Function<String, LocalDateTime>> PARSERS = List.of(
            s -> LocalDateTime.parse(s, DateTimeFormatter.ISO_LOCAL_DATE_TIME),
            s -> OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toLocalDateTime(),
            s -> LocalDateTime.parse(s, SPACED_DATE_TIME),
            s -> LocalDateTime.parse(s, SPACED_DATE_MINUTES),
            s -> LocalDate.parse(s, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(),
            s -> LocalDateTime.parse(s, DOTTED_DATE_TIME),
            s -> LocalDate.parse(s, DOTTED_DATE).atStartOfDay()
    );

    private OrderDates() {}

    public static Optional<LocalDateTime> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (Function<String, LocalDateTime> parser : PARSERS) {
            try {
                return Optional.of(parser.apply(value));
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        return Optional.empty();
    }

    /**
     * Whole days from {@code from} to {@code to}, truncated toward zero.
     */
    public static long daysBetween(LocalDateTime from, LocalDateTime to) {
        return ChronoUnit.DAYS.between(from, to);
    }

    public static long daysBetween(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to);
    }
}
