package com.kreasipositif.cashbook.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A ledger together with everything derived from it. Produced as one unit and never patched.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CashBookResult {

    Ledger ledger;

    Totals totals;

    List<ProcessingWarning> processingWarnings;

    List<ValidationWarning> validationWarnings;
}
