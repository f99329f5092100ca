package com.kreasipositif.cashbook.domain;

import java.util.List;
import java.util.Locale;

/**
 * Fields the column mapper can resolve from export headers.
 */
public enum CanonicalField {
    DOCUMENT_TYPE,
    FOLIO,
    DATE,
    COUNTERPARTY_ID,
    NAME,
    NET_AMOUNT,
    EXEMPT_AMOUNT,
    TOTAL_AMOUNT,
    FIXED_ASSET_NET,
    NON_RECOVERABLE_TAX,
    TOBACCO_CIGARS,
    TOBACCO_CIGARETTES,
    TOBACCO_PROCESSED,
    NON_CREDITABLE_TAX,
    OTHER_TAX,
    FOLIO_FROM,
    FOLIO_TO;

    /** Purchase columns that add to the tax basis on top of net and exempt. */
    public static final List<CanonicalField> PURCHASE_BASIS_ADJUSTMENTS = List.of(
            FIXED_ASSET_NET,
            NON_RECOVERABLE_TAX,
            TOBACCO_CIGARS,
            TOBACCO_CIGARETTES,
            TOBACCO_PROCESSED,
            NON_CREDITABLE_TAX,
            OTHER_TAX);

    /**
     * Resolves a configuration key such as {@code net-amount} or {@code NET_AMOUNT}.
     *
     * @throws IllegalArgumentException if the key names no field
     */
    public static CanonicalField fromKey(String key) {
        return valueOf(key.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT));
    }
}
