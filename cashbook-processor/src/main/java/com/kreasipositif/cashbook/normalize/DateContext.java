package com.kreasipositif.cashbook.normalize;

import java.time.LocalDate;
import java.util.Map;

/**
 * Per-file inputs for the date fallback chain.
 *
 * @param fileName        name of the export, searched for a year and month
 * @param period          caller-supplied commercial year, may be empty
 * @param datesByDocument first parsable date seen for each document key of the file
 */
public record DateContext(String fileName, String period, Map<String, LocalDate> datesByDocument) {

    public DateContext {
        datesByDocument = Map.copyOf(datesByDocument);
    }
}
