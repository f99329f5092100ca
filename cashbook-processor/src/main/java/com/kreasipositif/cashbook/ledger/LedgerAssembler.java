package com.kreasipositif.cashbook.ledger;

import com.kreasipositif.cashbook.domain.CanonicalRecord;
import com.kreasipositif.cashbook.domain.Ledger;
import com.kreasipositif.cashbook.domain.LedgerEntry;
import com.kreasipositif.cashbook.domain.LedgerHeader;
import com.kreasipositif.cashbook.domain.OperationKind;
import com.kreasipositif.cashbook.domain.RecordOrigin;
import com.kreasipositif.cashbook.exception.InvalidLedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * Orders records into a numbered ledger behind a single opening entry.
 *
 * <p>Non-opening records are stable-sorted by operation date, so records sharing a date keep
 * their arrival order. The opening entry is always first, whatever its date. Correlatives run
 * 1..N over the final order. Every call rebuilds the whole ledger; nothing is patched in place.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerAssembler {

    static final String OPENING_DESCRIPTION = "Saldo Inicial";

    private static final Pattern FOUR_DIGIT_YEAR = Pattern.compile("\\d{4}");
    private static final Comparator<CanonicalRecord> BY_DATE =
            Comparator.comparing(CanonicalRecord::getOperationDate, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final Clock clock;

    /**
     * Builds a ledger from freshly ingested records, given in arrival order.
     */
    public Ledger assemble(LedgerHeader header, BigDecimal openingBalance, List<CanonicalRecord> records) {
        CanonicalRecord opening = CanonicalRecord.builder()
                .operationKind(OperationKind.OPENING)
                .documentNumber("")
                .documentType("")
                .counterpartyId(header.taxpayerId())
                .operationDate(openingDate(header.period()))
                .description(OPENING_DESCRIPTION)
                .flowAmount(openingBalance)
                .taxBasisAmount(BigDecimal.ZERO)
                .origin(RecordOrigin.OPENING_BALANCE)
                .build();
        Ledger ledger = number(header, opening, records);
        log.info("Assembled ledger for '{}' period '{}': {} entries", header.taxpayerId(), header.period(), ledger.size());
        return ledger;
    }

    /**
     * Rebuilds an existing ledger, for instance after its opening amount or some dates changed.
     * Applying it to an untouched assembled ledger returns an equal ledger.
     *
     * @throws InvalidLedgerException unless the ledger has exactly one opening entry
     */
    public Ledger reassemble(Ledger ledger) {
        List<CanonicalRecord> openings = ledger.records().stream()
                .filter(record -> record.getOperationKind() == OperationKind.OPENING)
                .toList();
        if (openings.size() != 1) {
            throw new InvalidLedgerException(
                    "A ledger needs exactly one opening entry, found %d".formatted(openings.size()));
        }
        List<CanonicalRecord> others = ledger.records().stream()
                .filter(record -> record.getOperationKind() != OperationKind.OPENING)
                .toList();
        LedgerHeader header = new LedgerHeader(ledger.getTaxpayerId(), ledger.getTaxpayerName(), ledger.getPeriod());
        return number(header, openings.get(0), others);
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private Ledger number(LedgerHeader header, CanonicalRecord opening, List<CanonicalRecord> records) {
        List<CanonicalRecord> ordered = new ArrayList<>(records.size() + 1);
        List<CanonicalRecord> sorted = new ArrayList<>(records);
        sorted.sort(BY_DATE);
        ordered.add(opening);
        ordered.addAll(sorted);

        List<LedgerEntry> entries = IntStream.range(0, ordered.size())
                .mapToObj(i -> LedgerEntry.builder().correlative(i + 1).record(ordered.get(i)).build())
                .toList();
        return Ledger.builder()
                .taxpayerId(header.taxpayerId())
                .taxpayerName(header.taxpayerName())
                .period(header.period())
                .entries(entries)
                .build();
    }

    private LocalDate openingDate(String period) {
        if (period != null && FOUR_DIGIT_YEAR.matcher(period.trim()).matches()) {
            return LocalDate.of(Integer.parseInt(period.trim()), 1, 1);
        }
        return Year.now(clock).atDay(1);
    }
}
