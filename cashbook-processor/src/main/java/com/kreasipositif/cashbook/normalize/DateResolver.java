package com.kreasipositif.cashbook.normalize;

import com.kreasipositif.cashbook.config.CashBookProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.Year;
import java.time.YearMonth;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Produces an operation date for a row, falling back step by step when the row has none.
 *
 * <h3>Chain (first success wins)</h3>
 * <ol>
 *   <li>The row's own date cell.</li>
 *   <li>The date of another row in the same file with the same document key.</li>
 *   <li>Year and month in the file name ({@code 2024-11}, {@code 2024_11}, {@code 202411});
 *       the last valid match counts; resolves to the last day of that month.</li>
 *   <li>A four-digit period: December 31 of that year.</li>
 *   <li>December 31 of the current year, unless {@code cash-book.dates.current-year-fallback} is off.</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class DateResolver {

    private static final Pattern YEAR_MONTH = Pattern.compile("(\\d{4})[_\\-]?(\\d{2})");
    private static final Pattern FOUR_DIGIT_YEAR = Pattern.compile("\\d{4}");
    private static final MonthDay YEAR_END = MonthDay.of(12, 31);

    private final Clock clock;
    private final CashBookProperties properties;

    /**
     * @param rawDate     the row's date cell, possibly blank
     * @param documentKey key used for the sibling-row lookup; blank skips that step
     * @param context     per-file fallback inputs
     * @return the resolved date, or empty when every step failed
     */
    public Optional<ResolvedDate> resolve(String rawDate, String documentKey, DateContext context) {
        Optional<LocalDate> own = DateParser.parse(rawDate);
        if (own.isPresent()) {
            return own.map(date -> new ResolvedDate(date, DateSource.ROW));
        }
        if (documentKey != null && !documentKey.isBlank()) {
            LocalDate sibling = context.datesByDocument().get(documentKey);
            if (sibling != null) {
                return Optional.of(new ResolvedDate(sibling, DateSource.SIBLING_ROW));
            }
        }
        Optional<LocalDate> fromName = fromFileName(context.fileName());
        if (fromName.isPresent()) {
            return fromName.map(date -> new ResolvedDate(date, DateSource.FILE_NAME));
        }
        Optional<LocalDate> fromPeriod = fromPeriod(context.period());
        if (fromPeriod.isPresent()) {
            return fromPeriod.map(date -> new ResolvedDate(date, DateSource.PERIOD));
        }
        if (properties.getDates().isCurrentYearFallback()) {
            return Optional.of(new ResolvedDate(Year.now(clock).atMonthDay(YEAR_END), DateSource.CURRENT_YEAR));
        }
        return Optional.empty();
    }

    /**
     * Last day of the last valid year-month found in {@code fileName}. Years outside 2000-2100
     * and months outside 1-12 are ignored so that embedded identifiers do not count.
     */
    public Optional<LocalDate> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        LocalDate found = null;
        Matcher matcher = YEAR_MONTH.matcher(fileName);
        int start = 0;
        while (start < fileName.length() && matcher.find(start)) {
            int year = Integer.parseInt(matcher.group(1));
            int month = Integer.parseInt(matcher.group(2));
            if (year >= 2000 && year <= 2100 && month >= 1 && month <= 12) {
                found = YearMonth.of(year, month).atEndOfMonth();
            }
            start = matcher.start() + 1;
        }
        return Optional.ofNullable(found);
    }

    private Optional<LocalDate> fromPeriod(String period) {
        if (period == null || !FOUR_DIGIT_YEAR.matcher(period.trim()).matches()) {
            return Optional.empty();
        }
        return Optional.of(Year.of(Integer.parseInt(period.trim())).atMonthDay(YEAR_END));
    }
}
