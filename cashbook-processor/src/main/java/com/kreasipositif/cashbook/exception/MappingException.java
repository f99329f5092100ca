package com.kreasipositif.cashbook.exception;

import com.kreasipositif.cashbook.domain.CanonicalField;
import com.kreasipositif.cashbook.domain.SourceSchema;
import lombok.Getter;

import java.util.Set;

/**
 * The headers of a file do not cover the fields its schema requires.
 */
@Getter
public class MappingException extends IngestionException {

    private final SourceSchema schema;
    private final Set<CanonicalField> missingFields;

    public MappingException(String sourceName, SourceSchema schema, Set<CanonicalField> missingFields) {
        super(sourceName, "No column found for %s in %s file".formatted(missingFields, schema));
        this.schema = schema;
        this.missingFields = missingFields;
    }
}
