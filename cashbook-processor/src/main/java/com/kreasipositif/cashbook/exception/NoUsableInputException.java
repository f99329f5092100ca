package com.kreasipositif.cashbook.exception;

import com.kreasipositif.cashbook.domain.ProcessingWarning;
import lombok.Getter;

import java.util.List;

/**
 * Nothing in the request could be ingested, so no ledger is produced.
 */
@Getter
public class NoUsableInputException extends RuntimeException {

    private final List<ProcessingWarning> warnings;

    public NoUsableInputException(String message, List<ProcessingWarning> warnings) {
        super(message);
        this.warnings = List.copyOf(warnings);
    }
}
