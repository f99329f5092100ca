package com.kreasipositif.cashbook.exception;

import lombok.Getter;

/**
 * A source file that cannot contribute any record. The file is skipped; the rest of the batch continues.
 */
@Getter
public abstract class IngestionException extends RuntimeException {

    private final String sourceName;

    protected IngestionException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }
}
