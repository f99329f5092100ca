package com.kreasipositif.cashbook.normalize;

import com.kreasipositif.cashbook.CashBookFixtures;
import com.kreasipositif.cashbook.config.CashBookProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DateResolverTest {

    private CashBookProperties properties;
    private DateResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new CashBookProperties();
        resolver = new DateResolver(CashBookFixtures.CLOCK, properties);
    }

    @Test
    @DisplayName("The row's own date wins over every fallback")
    void resolve_ownDate() {
        DateContext context = new DateContext("ventas_202401.csv", "2023",
                Map.of("33|1", LocalDate.of(2024, 2, 2)));

        assertThat(resolver.resolve("05/03/2024", "33|1", context))
                .contains(new ResolvedDate(LocalDate.of(2024, 3, 5), DateSource.ROW));
    }

    @Test
    @DisplayName("A row without date borrows the date of a sibling row of the same document")
    void resolve_siblingRow() {
        DateContext context = new DateContext("ventas_202401.csv", "",
                Map.of("33|100", LocalDate.of(2024, 2, 10)));

        assertThat(resolver.resolve("", "33|100", context))
                .contains(new ResolvedDate(LocalDate.of(2024, 2, 10), DateSource.SIBLING_ROW));
    }

    @Test
    @DisplayName("A blank document key skips the sibling lookup")
    void resolve_blankKey_skipsSibling() {
        DateContext context = new DateContext("ventas_2024-01.csv", "", Map.of("", LocalDate.of(2020, 1, 1)));

        assertThat(resolver.resolve("", "", context))
                .contains(new ResolvedDate(LocalDate.of(2024, 1, 31), DateSource.FILE_NAME));
    }

    @Test
    @DisplayName("File name: the last valid year-month wins and resolves to the month end")
    void resolve_fileName_lastValidMatch() {
        DateContext context = new DateContext("ventas_2023-05_resumen_2024-02.csv", "", Map.of());

        assertThat(resolver.resolve("", "", context))
                .contains(new ResolvedDate(LocalDate.of(2024, 2, 29), DateSource.FILE_NAME));
    }

    @Test
    @DisplayName("File name: digits of an embedded tax id are not taken for a year")
    void resolve_fileName_ignoresEmbeddedIdentifiers() {
        assertThat(resolver.fromFileName("RCV_VENTA_76123456_202411.csv"))
                .contains(LocalDate.of(2024, 11, 30));
        assertThat(resolver.fromFileName("export_2024-13.csv")).isEmpty();
        assertThat(resolver.fromFileName("ventas.csv")).isEmpty();
    }

    @Test
    @DisplayName("A year-month preceded by another digit in the file name is still found")
    void resolve_fileName_yearMonthAfterLeadingDigit() {
        assertThat(resolver.fromFileName("ventas1202403.csv")).contains(LocalDate.of(2024, 3, 31));
        assertThat(resolver.fromFileName("compras_9_2023-07.csv")).contains(LocalDate.of(2023, 7, 31));
    }

    @Test
    @DisplayName("A four-digit period resolves to December 31 of that year")
    void resolve_period() {
        DateContext context = new DateContext("export_2024-13.csv", " 2023 ", Map.of());

        assertThat(resolver.resolve("sin fecha", "", context))
                .contains(new ResolvedDate(LocalDate.of(2023, 12, 31), DateSource.PERIOD));
    }

    @Test
    @DisplayName("Without any hint the date is December 31 of the current year")
    void resolve_currentYear() {
        DateContext context = new DateContext("ventas.csv", "", Map.of());

        assertThat(resolver.resolve("", "", context))
                .contains(new ResolvedDate(LocalDate.of(2025, 12, 31), DateSource.CURRENT_YEAR));
    }

    @Test
    @DisplayName("With the current-year fallback switched off the chain can end empty")
    void resolve_fallbackDisabled_isEmpty() {
        properties.getDates().setCurrentYearFallback(false);
        DateContext context = new DateContext("ventas.csv", "24", Map.of());

        assertThat(resolver.resolve("", "", context)).isEmpty();
    }
}
