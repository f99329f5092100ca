package com.kreasipositif.cashbook.mapping;

import com.kreasipositif.cashbook.domain.CanonicalField;
import com.kreasipositif.cashbook.domain.RawRow;
import com.kreasipositif.cashbook.domain.SourceSchema;

import java.math.BigDecimal;

/**
 * A raw row read through its {@link ColumnMapping}: canonical fields with amounts normalized.
 * Absent columns read as empty text or zero.
 *
 * @param basisAdjustments sum of the purchase-only columns that add to the tax basis; zero for sales
 */
public record SourceRow(int lineNumber,
                        String documentType,
                        String folio,
                        String rawDate,
                        String counterpartyId,
                        String name,
                        BigDecimal netAmount,
                        BigDecimal exemptAmount,
                        BigDecimal totalAmount,
                        BigDecimal basisAdjustments,
                        String folioFrom,
                        String folioTo) {

    public static SourceRow from(RawRow row, ColumnMapping mapping) {
        BigDecimal adjustments = BigDecimal.ZERO;
        if (mapping.schema() == SourceSchema.PURCHASE_DETAIL) {
            for (CanonicalField field : CanonicalField.PURCHASE_BASIS_ADJUSTMENTS) {
                adjustments = adjustments.add(mapping.amount(row, field));
            }
        }
        return new SourceRow(
                row.lineNumber(),
                mapping.text(row, CanonicalField.DOCUMENT_TYPE),
                mapping.text(row, CanonicalField.FOLIO),
                mapping.text(row, CanonicalField.DATE),
                mapping.text(row, CanonicalField.COUNTERPARTY_ID),
                mapping.text(row, CanonicalField.NAME),
                mapping.amount(row, CanonicalField.NET_AMOUNT),
                mapping.amount(row, CanonicalField.EXEMPT_AMOUNT),
                mapping.amount(row, CanonicalField.TOTAL_AMOUNT),
                adjustments,
                mapping.text(row, CanonicalField.FOLIO_FROM),
                mapping.text(row, CanonicalField.FOLIO_TO));
    }

    /**
     * {@code "<from> al <to>"} when both ends of the folio range are present, otherwise empty.
     */
    public String folioRange() {
        return folioFrom.isEmpty() || folioTo.isEmpty() ? "" : folioFrom + " al " + folioTo;
    }

    /**
     * Key under which rows of the same document share a date: document type plus folio, or
     * plus folio range for summaries. Empty when the row carries no identifier.
     */
    public String documentKey(SourceSchema schema) {
        String identifier = schema == SourceSchema.SALES_SUMMARY ? folioRange() : folio;
        return identifier.isEmpty() ? "" : documentType + "|" + identifier;
    }
}
