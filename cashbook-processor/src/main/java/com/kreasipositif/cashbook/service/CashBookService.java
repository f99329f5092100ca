package com.kreasipositif.cashbook.service;

import com.kreasipositif.cashbook.batch.SourceDocumentProcessor;
import com.kreasipositif.cashbook.domain.CanonicalRecord;
import com.kreasipositif.cashbook.domain.CashBookRequest;
import com.kreasipositif.cashbook.domain.CashBookResult;
import com.kreasipositif.cashbook.domain.IngestionResult;
import com.kreasipositif.cashbook.domain.Ledger;
import com.kreasipositif.cashbook.domain.LedgerEdit;
import com.kreasipositif.cashbook.domain.LedgerEntry;
import com.kreasipositif.cashbook.domain.OperationKind;
import com.kreasipositif.cashbook.domain.ProcessingWarning;
import com.kreasipositif.cashbook.domain.SourceDocument;
import com.kreasipositif.cashbook.exception.IngestionException;
import com.kreasipositif.cashbook.exception.InvalidLedgerEditException;
import com.kreasipositif.cashbook.exception.InvalidLedgerException;
import com.kreasipositif.cashbook.exception.NoUsableInputException;
import com.kreasipositif.cashbook.ledger.LedgerAssembler;
import com.kreasipositif.cashbook.ledger.LedgerValidator;
import com.kreasipositif.cashbook.ledger.TotalsCalculator;
import com.kreasipositif.cashbook.manual.ManualEntryParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Builds a cash book from a request, and rebuilds it after user edits.
 *
 * <h3>Ingestion</h3>
 * <p>Export files are processed one after another in the order given, then the payment block,
 * then the professional-fee block. A file that cannot be decoded or mapped adds a warning and
 * is skipped; the rest continue. The run fails with {@link NoUsableInputException} only when the
 * request carries nothing at all, or when every file failed and the manual blocks produced no
 * record.
 *
 * <h3>Edits</h3>
 * <p>An edit replaces the opening amount and/or some operation dates, then assembly, totals
 * and validation run again as one step on the new records.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CashBookService {

    private final SourceDocumentProcessor sourceDocumentProcessor;
    private final ManualEntryParser manualEntryParser;
    private final LedgerAssembler ledgerAssembler;
    private final TotalsCalculator totalsCalculator;
    private final LedgerValidator ledgerValidator;

    // ─── Public API ───────────────────────────────────────────────────────────

    public CashBookResult generate(CashBookRequest request) {
        if (request.getSources().isEmpty() && !request.hasManualInput()) {
            throw new NoUsableInputException("No export files or manual entries were supplied", List.of());
        }
        if (request.getOpeningBalance().signum() < 0) {
            throw new IllegalArgumentException("Opening balance must not be negative: " + request.getOpeningBalance());
        }
        String period = request.getHeader().period();
        List<CanonicalRecord> records = new ArrayList<>();
        List<ProcessingWarning> warnings = new ArrayList<>();

        int failedFiles = 0;
        for (SourceDocument source : request.getSources()) {
            try {
                collect(sourceDocumentProcessor.process(source, period), records, warnings);
            } catch (IngestionException e) {
                failedFiles++;
                log.warn("Skipping file '{}': {}", e.getSourceName(), e.getMessage());
                warnings.add(ProcessingWarning.forFile(e.getSourceName(), "File skipped: " + e.getMessage()));
            }
        }

        int recordsBeforeManual = records.size();
        collect(manualEntryParser.parsePayments(request.getManualPayments()), records, warnings);
        collect(manualEntryParser.parseProfessionalFees(request.getProfessionalFees()), records, warnings);
        boolean manualProducedRecords = records.size() > recordsBeforeManual;

        if (failedFiles == request.getSources().size() && !manualProducedRecords) {
            throw new NoUsableInputException("None of the supplied input could be used", warnings);
        }

        Ledger ledger = ledgerAssembler.assemble(request.getHeader(), request.getOpeningBalance(), records);
        return recompute(ledger, warnings);
    }

    /**
     * Applies {@code edit} to {@code ledger} and recomputes everything derived from it.
     *
     * @throws InvalidLedgerEditException for a negative opening amount or an unknown correlative
     * @throws InvalidLedgerException     when an entry lacks its record, kind or amounts
     */
    public CashBookResult applyEdit(Ledger ledger, LedgerEdit edit) {
        requireComplete(ledger);
        BigDecimal opening = edit.openingBalance();
        if (opening != null && opening.signum() < 0) {
            throw new InvalidLedgerEditException("Opening balance must not be negative: " + opening);
        }
        Map<Integer, LedgerEntry> byCorrelative = ledger.getEntries().stream()
                .collect(Collectors.toMap(LedgerEntry::getCorrelative, entry -> entry, (first, second) -> first));
        Set<Integer> unknown = edit.dateChanges().keySet().stream()
                .filter(correlative -> !byCorrelative.containsKey(correlative))
                .collect(Collectors.toCollection(TreeSet::new));
        if (!unknown.isEmpty()) {
            throw new InvalidLedgerEditException("Unknown correlatives: " + unknown);
        }

        List<LedgerEntry> edited = ledger.getEntries().stream()
                .map(entry -> LedgerEntry.builder()
                        .correlative(entry.getCorrelative())
                        .record(applyTo(entry, opening, edit.dateChanges()))
                        .build())
                .toList();
        Ledger rebuilt = ledgerAssembler.reassemble(ledger.toBuilder().entries(edited).build());
        log.info("Applied edit to ledger '{}': opening {}, {} date changes",
                ledger.getTaxpayerId(), opening != null ? opening : "unchanged", edit.dateChanges().size());
        return recompute(rebuilt, List.of());
    }

    /**
     * Starts an editing session on a freshly generated cash book.
     */
    public CashBookSession openSession(CashBookRequest request) {
        return new CashBookSession(this, generate(request));
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private CashBookResult recompute(Ledger ledger, List<ProcessingWarning> processingWarnings) {
        return CashBookResult.builder()
                .ledger(ledger)
                .totals(totalsCalculator.calculate(ledger))
                .processingWarnings(List.copyOf(processingWarnings))
                .validationWarnings(ledgerValidator.validate(ledger))
                .build();
    }

    private static void requireComplete(Ledger ledger) {
        if (ledger.getEntries() == null) {
            throw new InvalidLedgerException("A ledger needs its entries");
        }
        for (LedgerEntry entry : ledger.getEntries()) {
            CanonicalRecord record = entry == null ? null : entry.getRecord();
            if (record == null || record.getOperationKind() == null
                    || record.getFlowAmount() == null || record.getTaxBasisAmount() == null) {
                throw new InvalidLedgerException("Entry %s lacks its record, kind or amounts"
                        .formatted(entry == null ? "?" : String.valueOf(entry.getCorrelative())));
            }
        }
    }

    private static CanonicalRecord applyTo(LedgerEntry entry, BigDecimal opening, Map<Integer, LocalDate> dateChanges) {
        CanonicalRecord record = entry.getRecord();
        if (opening != null && record.getOperationKind() == OperationKind.OPENING) {
            record = record.withFlowAmount(opening);
        }
        LocalDate newDate = dateChanges.get(entry.getCorrelative());
        return newDate != null ? record.withOperationDate(newDate) : record;
    }

    private static void collect(IngestionResult result, List<CanonicalRecord> records, List<ProcessingWarning> warnings) {
        records.addAll(result.records());
        warnings.addAll(result.warnings());
    }
}
