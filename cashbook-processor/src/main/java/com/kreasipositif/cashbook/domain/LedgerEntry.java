package com.kreasipositif.cashbook.domain;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A record at its final position in the {@link Ledger}.
 */
@Value
@Builder
@Jacksonized
public class LedgerEntry {

    /** 1-based position in the ordered ledger. */
    int correlative;

    @NotNull
    @Valid
    CanonicalRecord record;
}
