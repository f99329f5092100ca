package com.kreasipositif.cashbook.domain;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * The assembled cash book: header data plus the ordered, numbered entries.
 *
 * <p>A ledger produced by the assembler always starts with exactly one
 * {@link OperationKind#OPENING} entry and numbers its entries 1..N. Ledgers are
 * never modified; an edit produces a new ledger.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Ledger {

    /** Tax identifier of the book owner. */
    String taxpayerId;

    /** Legal name of the book owner. */
    String taxpayerName;

    /** Commercial year as entered by the caller, e.g. {@code "2024"}; may be empty. */
    String period;

    @NotNull
    List<@NotNull @Valid LedgerEntry> entries;

    public int size() {
        return entries.size();
    }

    public List<CanonicalRecord> records() {
        return entries.stream().map(LedgerEntry::getRecord).toList();
    }
}
