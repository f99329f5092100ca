package com.kreasipositif.cashbook.domain;

import java.util.List;

/**
 * Records produced from one input (a file or a manual block) and the warnings raised on the way.
 */
public record IngestionResult(List<CanonicalRecord> records, List<ProcessingWarning> warnings) {

    public static IngestionResult empty() {
        return new IngestionResult(List.of(), List.of());
    }
}
