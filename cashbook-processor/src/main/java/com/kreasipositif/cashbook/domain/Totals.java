package com.kreasipositif.cashbook.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Period aggregates derived from a {@link Ledger}. Always recomputed, never edited.
 */
@Value
@Builder
@Jacksonized
public class Totals {

    /** Flow of opening and income entries. */
    BigDecimal totalIncomeFlow;

    /** Flow of expense entries. */
    BigDecimal totalExpenseFlow;

    /** {@code totalIncomeFlow - totalExpenseFlow}. */
    BigDecimal netFlow;

    /** Tax basis of opening and income entries. */
    BigDecimal incomeTaxBasis;

    /** Tax basis of expense entries. */
    BigDecimal expenseTaxBasis;

    /** {@code incomeTaxBasis - expenseTaxBasis}. */
    BigDecimal netTaxBasisResult;
}
