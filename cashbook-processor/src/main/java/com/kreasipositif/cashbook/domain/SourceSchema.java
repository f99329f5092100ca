package com.kreasipositif.cashbook.domain;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * The three export layouts the pipeline understands.
 */
public enum SourceSchema {

    /** Per-document sales register: invoices, credit and debit notes. */
    SALES_DETAIL(RecordOrigin.SALES_DETAIL, EnumSet.of(CanonicalField.DOCUMENT_TYPE, CanonicalField.DATE)),

    /** Per-document purchase register, with the extra basis-adjustment columns. */
    PURCHASE_DETAIL(RecordOrigin.PURCHASE_DETAIL, EnumSet.of(CanonicalField.DOCUMENT_TYPE, CanonicalField.DATE)),

    /** Daily or monthly receipt summary, one row per document type. The date column is optional. */
    SALES_SUMMARY(RecordOrigin.SALES_SUMMARY, EnumSet.of(CanonicalField.DOCUMENT_TYPE));

    private final RecordOrigin origin;
    private final Set<CanonicalField> requiredFields;

    SourceSchema(RecordOrigin origin, Set<CanonicalField> requiredFields) {
        this.origin = origin;
        this.requiredFields = requiredFields;
    }

    public RecordOrigin getOrigin() {
        return origin;
    }

    public Set<CanonicalField> getRequiredFields() {
        return EnumSet.copyOf(requiredFields);
    }

    /**
     * Resolves a configuration key such as {@code sales-detail} or {@code SALES_DETAIL}.
     *
     * @throws IllegalArgumentException if the key names no schema
     */
    public static SourceSchema fromKey(String key) {
        return valueOf(key.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT));
    }
}
