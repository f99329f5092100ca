package com.kreasipositif.cashbook.classify;

/**
 * Fiscal family of a document type; the classification rules are written against these.
 */
public enum DocumentCategory {
    INVOICE,
    PURCHASE_INVOICE,
    CREDIT_NOTE,
    DEBIT_NOTE,
    AFFECTED_RECEIPT,
    EXEMPT_RECEIPT,
    PAYMENT_VOUCHER,
    DISPATCH_GUIDE
}
