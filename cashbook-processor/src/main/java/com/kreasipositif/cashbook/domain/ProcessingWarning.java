package com.kreasipositif.cashbook.domain;

/**
 * A file, line or row that was skipped while ingesting input.
 *
 * @param source     file name or manual block name
 * @param lineNumber line the problem was found on, {@code null} for file-level problems
 * @param message    what was skipped and why
 */
public record ProcessingWarning(String source, Integer lineNumber, String message) {

    public static ProcessingWarning forFile(String source, String message) {
        return new ProcessingWarning(source, null, message);
    }

    public static ProcessingWarning forLine(String source, int lineNumber, String message) {
        return new ProcessingWarning(source, lineNumber, message);
    }

    @Override
    public String toString() {
        return lineNumber == null
                ? "%s: %s".formatted(source, message)
                : "%s (line %d): %s".formatted(source, lineNumber, message);
    }
}
