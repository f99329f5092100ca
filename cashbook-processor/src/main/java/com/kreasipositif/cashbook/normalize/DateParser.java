package com.kreasipositif.cashbook.normalize;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Optional;

/**
 * Parses the date notations found in exports and pasted entries. A trailing time is ignored.
 *
 * <p>Formats are tried in order; the first that matches wins:
 * <ol>
 *   <li>{@code 31/12/2024}</li>
 *   <li>{@code 2024-12-31}</li>
 *   <li>{@code 31-12-2024}</li>
 *   <li>{@code 31/12/24} (years 2000-2099)</li>
 * </ol>
 */
public final class DateParser {

    private static final List<DateTimeFormatter> FORMATS = List.of(
            DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuu-M-d").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d-M-uuuu").withResolverStyle(ResolverStyle.STRICT),
            new DateTimeFormatterBuilder()
                    .appendPattern("d/M/")
                    .appendValueReduced(ChronoField.YEAR, 2, 2, 2000)
                    .toFormatter()
                    .withResolverStyle(ResolverStyle.STRICT));

    private DateParser() {
    }

    public static Optional<LocalDate> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String datePart = raw.trim().split("\\s+")[0];
        return FORMATS.stream()
                .map(format -> tryParse(datePart, format))
                .flatMap(Optional::stream)
                .findFirst();
    }

    private static Optional<LocalDate> tryParse(String text, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(text, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
