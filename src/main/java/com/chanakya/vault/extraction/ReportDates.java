package com.chanakya.vault.extraction;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Best-effort parsing of the date strings extraction models produce when they ignore the
 * requested {@code yyyy-MM-dd} format.
 */
final class ReportDates {

    private static final List<DateTimeFormatter> DATE_FORMATS = formatters(
            "uuuu/M/d",
            "uuuu.M.d",
            "uuuu-M-d",
            "M/d/uuuu",
            "d/M/uuuu",
            "M-d-uuuu",
            "d.M.uuuu",
            "MMMM d, uuuu",
            "MMM d, uuuu",
            "MMMM d uuuu",
            "MMM d uuuu",
            "d MMMM uuuu",
            "d MMM uuuu",
            "d MMMM, uuuu",
            "d MMM, uuuu"
    );

    private static final List<DateTimeFormatter> MONTH_FORMATS = formatters(
            "uuuu-MM",
            "uuuu/MM",
            "MMMM uuuu",
            "MMM uuuu",
            "MMMM, uuuu",
            "MM/uuuu"
    );

    private static final DateTimeFormatter YEAR_FORMAT = formatters("uuuu").get(0);

    private ReportDates() {}

    static Optional<LocalDate> parseLenient(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();

        Optional<LocalDate> parsed = tryParse(value,
                text -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                        .withOffsetSameInstant(ZoneOffset.UTC)
                        .toLocalDate());
        if (parsed.isPresent()) {
            return parsed;
        }
        parsed = tryParse(value,
                text -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toLocalDate());
        if (parsed.isPresent()) {
            return parsed;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            parsed = tryParse(value, text -> LocalDate.parse(text, format));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        for (DateTimeFormatter format : MONTH_FORMATS) {
            parsed = tryParse(value, text -> YearMonth.parse(text, format).atDay(1));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return tryParse(value, text -> Year.parse(text, YEAR_FORMAT).atDay(1));
    }

    static String format(LocalDate date) {
        return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
    }

    private static Optional<LocalDate> tryParse(String value, Function<String, LocalDate> parser) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static List<DateTimeFormatter> formatters(String... patterns) {
        return Arrays.stream(patterns)
                .map(pattern -> new DateTimeFormatterBuilder()
                        .parseCaseInsensitive()
                        .appendPattern(pattern)
                        .toFormatter(Locale.ENGLISH)
                        .withResolverStyle(ResolverStyle.STRICT))
                .toList();
    }
}
