package com.kreasipositif.cashbook.exception;

/**
 * A ledger handed back by a caller that breaks the single-opening-entry rule or lacks entry data.
 */
public class InvalidLedgerException extends RuntimeException {

    public InvalidLedgerException(String message) {
        super(message);
    }
}
