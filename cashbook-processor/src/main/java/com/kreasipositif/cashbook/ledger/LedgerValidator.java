package com.kreasipositif.cashbook.ledger;

import com.kreasipositif.cashbook.domain.CanonicalRecord;
import com.kreasipositif.cashbook.domain.Ledger;
import com.kreasipositif.cashbook.domain.LedgerEntry;
import com.kreasipositif.cashbook.domain.OperationKind;
import com.kreasipositif.cashbook.domain.ValidationWarning;
import com.kreasipositif.cashbook.domain.ValidationWarning.Kind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Local consistency checks on an assembled ledger. Findings are advisory and never stop the ledger.
 *
 * <ul>
 *   <li>Possible duplicates: non-opening entries sharing document number, document type and kind.</li>
 *   <li>Tax basis above flow by more than one peso.</li>
 *   <li>Correlatives that are not exactly 1..N.</li>
 * </ul>
 * Each check reports at most one warning, quoting up to {@value #MAX_EXAMPLES} examples.
 */
@Slf4j
@Component
public class LedgerValidator {

    static final int MAX_EXAMPLES = 5;

    private static final BigDecimal ROUNDING_TOLERANCE = BigDecimal.ONE;

    public List<ValidationWarning> validate(Ledger ledger) {
        List<ValidationWarning> warnings = new ArrayList<>();
        checkDuplicates(ledger, warnings);
        checkBasisWithinFlow(ledger, warnings);
        checkCorrelatives(ledger, warnings);
        if (!warnings.isEmpty()) {
            log.info("Ledger for '{}' has {} validation warnings", ledger.getTaxpayerId(), warnings.size());
        }
        return List.copyOf(warnings);
    }

    private void checkDuplicates(Ledger ledger, List<ValidationWarning> warnings) {
        Map<DocumentKey, Long> counts = ledger.records().stream()
                .filter(record -> record.getOperationKind() != OperationKind.OPENING)
                .collect(Collectors.groupingBy(DocumentKey::of, LinkedHashMap::new, Collectors.counting()));
        List<String> duplicated = counts.entrySet().stream()
                .filter(entry -> entry.getValue() > 1)
                .map(entry -> entry.getKey().documentNumber())
                .distinct()
                .limit(MAX_EXAMPLES)
                .toList();
        if (!duplicated.isEmpty()) {
            warnings.add(new ValidationWarning(Kind.DUPLICATE_DOCUMENT,
                    "Possible duplicate documents: " + String.join(", ", duplicated)));
        }
    }

    private void checkBasisWithinFlow(Ledger ledger, List<ValidationWarning> warnings) {
        List<Integer> offending = ledger.getEntries().stream()
                .filter(entry -> exceedsFlow(entry.getRecord()))
                .map(LedgerEntry::getCorrelative)
                .toList();
        if (!offending.isEmpty()) {
            String examples = offending.stream()
                    .limit(MAX_EXAMPLES)
                    .map(String::valueOf)
                    .collect(Collectors.joining(", "));
            warnings.add(new ValidationWarning(Kind.BASIS_EXCEEDS_FLOW,
                    "Tax basis exceeds the flow amount in %d entries (correlatives %s)".formatted(offending.size(), examples)));
        }
    }

    private void checkCorrelatives(Ledger ledger, List<ValidationWarning> warnings) {
        List<LedgerEntry> entries = ledger.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getCorrelative() != i + 1) {
                warnings.add(new ValidationWarning(Kind.CORRELATIVE_IRREGULARITY,
                        "Correlative %d found at position %d; expected 1..%d"
                                .formatted(entries.get(i).getCorrelative(), i + 1, entries.size())));
                return;
            }
        }
    }

    private static boolean exceedsFlow(CanonicalRecord record) {
        return record.getTaxBasisAmount().compareTo(record.getFlowAmount().add(ROUNDING_TOLERANCE)) > 0;
    }

    private record DocumentKey(String documentNumber, String documentType, OperationKind kind) {
        static DocumentKey of(CanonicalRecord record) {
            return new DocumentKey(record.getDocumentNumber(), record.getDocumentType(), record.getOperationKind());
        }
    }
}
