package com.kreasipositif.cashbook.mapping;

import com.kreasipositif.cashbook.domain.CanonicalField;
import com.kreasipositif.cashbook.domain.RawRow;
import com.kreasipositif.cashbook.domain.SourceSchema;
import com.kreasipositif.cashbook.normalize.AmountParser;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Resolved header for each canonical field found in one file.
 */
public record ColumnMapping(SourceSchema schema, Map<CanonicalField, String> headers) {

    public ColumnMapping {
        headers = Map.copyOf(headers);
    }

    public boolean has(CanonicalField field) {
        return headers.containsKey(field);
    }

    /** Cell text for {@code field}; empty when the file has no such column. */
    public String text(RawRow row, CanonicalField field) {
        return row.get(headers.get(field)).trim();
    }

    /** Cell amount for {@code field}; zero when the file has no such column or the cell is blank. */
    public BigDecimal amount(RawRow row, CanonicalField field) {
        return AmountParser.parse(text(row, field));
    }
}
