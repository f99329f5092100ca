package com.kreasipositif.cashbook.exception;

/**
 * An edit that refers to entries the ledger does not have, or carries an impossible value.
 */
public class InvalidLedgerEditException extends RuntimeException {

    public InvalidLedgerEditException(String message) {
        super(message);
    }
}
