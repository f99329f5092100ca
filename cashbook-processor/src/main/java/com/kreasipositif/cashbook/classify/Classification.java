package com.kreasipositif.cashbook.classify;

import com.kreasipositif.cashbook.domain.OperationKind;
import com.kreasipositif.cashbook.domain.SourceSchema;

/**
 * Outcome of the classification rules for one row: what the document is and which way the money goes.
 */
public record Classification(SourceSchema schema, DocumentType documentType, OperationKind operationKind) {
}
