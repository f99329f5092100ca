package com.kreasipositif.cashbook.domain;

/**
 * Pipeline stage that produced a {@link CanonicalRecord}. Diagnostics only.
 */
public enum RecordOrigin {
    OPENING_BALANCE,
    SALES_DETAIL,
    SALES_SUMMARY,
    PURCHASE_DETAIL,
    MANUAL_PAYMENT,
    PROFESSIONAL_FEE
}
