package com.kreasipositif.cashbook.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * A user edit: the only two things that may change after ingestion.
 *
 * @param openingBalance new opening amount, or {@code null} to keep the current one
 * @param dateChanges    new operation date keyed by the correlative the user saw
 */
public record LedgerEdit(BigDecimal openingBalance, Map<Integer, LocalDate> dateChanges) {

    public LedgerEdit {
        dateChanges = dateChanges == null ? Map.of() : Map.copyOf(dateChanges);
    }

    public static LedgerEdit openingBalance(BigDecimal amount) {
        return new LedgerEdit(amount, Map.of());
    }

    public static LedgerEdit dateChange(int correlative, LocalDate date) {
        return new LedgerEdit(null, Map.of(correlative, date));
    }
}
