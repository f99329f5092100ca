package com.kreasipositif.cashbook.service;

import com.kreasipositif.cashbook.domain.CashBookResult;
import com.kreasipositif.cashbook.domain.LedgerEdit;

/**
 * Holds the current cash book of one editing session.
 *
 * <p>The result is never modified: each {@link #apply(LedgerEdit)} computes a new one from the
 * current ledger and swaps it in whole, so {@link #current()} always returns a consistent
 * ledger, totals and warnings. Warnings raised while reading the input are kept across edits.
 */
public class CashBookSession {

    private final CashBookService service;
    private volatile CashBookResult current;

    public CashBookSession(CashBookService service, CashBookResult initial) {
        this.service = service;
        this.current = initial;
    }

    public CashBookResult current() {
        return current;
    }

    public synchronized CashBookResult apply(LedgerEdit edit) {
        CashBookResult next = service.applyEdit(current.getLedger(), edit);
        current = next.toBuilder()
                .processingWarnings(current.getProcessingWarnings())
                .build();
        return current;
    }
}
