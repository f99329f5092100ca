package com.kreasipositif.cashbook.domain;

/**
 * Book owner data printed on the ledger.
 *
 * @param period commercial year such as {@code "2024"}, or empty
 */
public record LedgerHeader(String taxpayerId, String taxpayerName, String period) {
}
