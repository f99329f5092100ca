package com.kreasipositif.cashbook.domain;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One cash book operation, independent of the export it was read from.
 *
 * <p>Instances are immutable. The only fields a user may change afterwards are the
 * opening balance amount and the operation date; both changes go through
 * {@code LedgerAssembler#reassemble} so ordering and correlatives are recomputed.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
public class CanonicalRecord {

    /** Opening, income or expense. The sign of both amounts is implied by this field. */
    @NotNull
    OperationKind operationKind;

    /** Folio, a folio range such as {@code "1001 al 1250"}, or a textual descriptor. */
    String documentNumber;

    /** Fiscal document-type code as text (e.g. {@code "33"}), or a free label for manual entries. */
    String documentType;

    /** Tax identifier of the counterparty; empty for aggregated entries. */
    String counterpartyId;

    LocalDate operationDate;

    /** Human-readable narrative. */
    String description;

    /** Total cash effect of the document, never negative. */
    @NotNull
    BigDecimal flowAmount;

    /** Portion of the document affecting the taxable base, never negative, may be zero. */
    @NotNull
    BigDecimal taxBasisAmount;

    RecordOrigin origin;
}
