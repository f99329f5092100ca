package com.kreasipositif.cashbook.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything needed for one ingestion pass.
 */
@Value
@Builder
public class CashBookRequest {

    LedgerHeader header;

    @Builder.Default
    BigDecimal openingBalance = BigDecimal.ZERO;

    /** Export files, processed in this order. */
    @Singular
    List<SourceDocument> sources;

    /** Pasted block in the six-field payment format; may be {@code null}. */
    String manualPayments;

    /** Pasted block in the eight-field professional-fee format; may be {@code null}. */
    String professionalFees;

    public boolean hasManualInput() {
        return (manualPayments != null && !manualPayments.isBlank())
                || (professionalFees != null && !professionalFees.isBlank());
    }
}
