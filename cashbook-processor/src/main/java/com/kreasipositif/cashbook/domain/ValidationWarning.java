package com.kreasipositif.cashbook.domain;

/**
 * Advisory finding about an assembled ledger. Never blocks ledger production.
 */
public record ValidationWarning(Kind kind, String message) {

    public enum Kind {
        DUPLICATE_DOCUMENT,
        BASIS_EXCEEDS_FLOW,
        CORRELATIVE_IRREGULARITY
    }
}
