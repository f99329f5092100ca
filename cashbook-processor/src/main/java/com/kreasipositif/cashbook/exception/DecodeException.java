package com.kreasipositif.cashbook.exception;

/**
 * No configured encoding produced a non-empty row set.
 */
public class DecodeException extends IngestionException {

    public DecodeException(String sourceName, String message) {
        super(sourceName, message);
    }
}
