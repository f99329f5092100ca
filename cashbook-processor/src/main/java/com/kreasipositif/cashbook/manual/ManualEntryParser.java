package com.kreasipositif.cashbook.manual;

import com.kreasipositif.cashbook.domain.CanonicalRecord;
import com.kreasipositif.cashbook.domain.IngestionResult;
import com.kreasipositif.cashbook.domain.OperationKind;
import com.kreasipositif.cashbook.domain.ProcessingWarning;
import com.kreasipositif.cashbook.domain.RecordOrigin;
import com.kreasipositif.cashbook.domain.RowOutcome;
import com.kreasipositif.cashbook.normalize.AmountParser;
import com.kreasipositif.cashbook.normalize.DateParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.batch.item.file.transform.FieldSet;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Parses the two pasted-text formats for documents that never appear in the registers.
 *
 * <h3>Payments (6 fields)</h3>
 * <pre>
 *   kind, document number, document type, date, narrative, amount
 *   2,1203,"Boleta de servicio",15/03/2024,"Luz oficina","$48.900"
 * </pre>
 * Flow is the amount, tax basis is zero.
 *
 * <h3>Professional fees (8 fields)</h3>
 * <pre>
 *   kind, document number, document type, counterparty id, date, name, paid amount, gross amount
 *   2,87,"BHE",12.345.678-9,30/04/2024,"Ana Rojas","$151,077","$173,850"
 * </pre>
 * Flow is the paid amount, tax basis is the gross amount.
 *
 * <p>Kind is {@code 1}/{@code INCOME}/{@code INGRESO} or {@code 2}/{@code EXPENSE}/{@code EGRESO}.
 * A first line that names columns and has no parsable date is a header and is skipped. Every
 * other line stands alone: a bad line becomes a line-numbered warning and parsing continues.
 */
@Slf4j
@Component
public class ManualEntryParser {

    public static final String PAYMENTS_SOURCE = "manual-payments";
    public static final String FEES_SOURCE = "professional-fees";

    private static final int PAYMENT_FIELDS = 6;
    private static final int FEE_FIELDS = 8;

    private static final Set<String> HEADER_KEYWORDS = Set.of(
            "tipo", "fecha", "monto", "glosa", "documento", "rut", "operación", "operacion",
            "type", "date", "amount");

    // ─── Public API ───────────────────────────────────────────────────────────

    public IngestionResult parsePayments(String text) {
        return parse(text, PAYMENTS_SOURCE, PAYMENT_FIELDS, 3, this::toPayment);
    }

    public IngestionResult parseProfessionalFees(String text) {
        return parse(text, FEES_SOURCE, FEE_FIELDS, 4, this::toFee);
    }

    // ─── line formats ────────────────────────────────────────────────────────

    private RowOutcome<CanonicalRecord> toPayment(FieldSet fields) {
        Optional<OperationKind> kind = parseKind(fields.readString(0));
        if (kind.isEmpty()) {
            return RowOutcome.rejected(kindError(fields.readString(0)));
        }
        Optional<LocalDate> date = DateParser.parse(fields.readString(3));
        if (date.isEmpty()) {
            return RowOutcome.rejected("Unreadable date '%s'".formatted(fields.readString(3)));
        }
        return parseAmount(fields.readString(5)).flatMap(amount -> RowOutcome.accepted(CanonicalRecord.builder()
                .operationKind(kind.get())
                .documentNumber(fields.readString(1))
                .documentType(fields.readString(2))
                .counterpartyId("")
                .operationDate(date.get())
                .description(fields.readString(4))
                .flowAmount(amount)
                .taxBasisAmount(BigDecimal.ZERO)
                .origin(RecordOrigin.MANUAL_PAYMENT)
                .build()));
    }

    private RowOutcome<CanonicalRecord> toFee(FieldSet fields) {
        Optional<OperationKind> kind = parseKind(fields.readString(0));
        if (kind.isEmpty()) {
            return RowOutcome.rejected(kindError(fields.readString(0)));
        }
        Optional<LocalDate> date = DateParser.parse(fields.readString(4));
        if (date.isEmpty()) {
            return RowOutcome.rejected("Unreadable date '%s'".formatted(fields.readString(4)));
        }
        String name = fields.readString(5);
        return parseAmount(fields.readString(6)).flatMap(paid ->
                parseAmount(fields.readString(7)).flatMap(gross -> RowOutcome.accepted(CanonicalRecord.builder()
                        .operationKind(kind.get())
                        .documentNumber(fields.readString(1))
                        .documentType(fields.readString(2))
                        .counterpartyId(fields.readString(3))
                        .operationDate(date.get())
                        .description(name.isEmpty() ? "Honorarios" : "Honorarios - " + name)
                        .flowAmount(paid)
                        .taxBasisAmount(gross)
                        .origin(RecordOrigin.PROFESSIONAL_FEE)
                        .build())));
    }

    // ─── shared parsing ──────────────────────────────────────────────────────

    private IngestionResult parse(String text, String source, int expectedFields, int dateField,
                                  LineFormat format) {
        if (text == null || text.isBlank()) {
            return IngestionResult.empty();
        }
        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer(",");
        tokenizer.setQuoteCharacter('"');
        tokenizer.setStrict(false);

        List<CanonicalRecord> records = new ArrayList<>();
        List<ProcessingWarning> warnings = new ArrayList<>();
        String[] lines = text.split("\\R");
        boolean firstLine = true;
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].isBlank()) {
                continue;
            }
            int lineNumber = i + 1;
            FieldSet fields = tokenizer.tokenize(lines[i].trim());
            if (firstLine) {
                firstLine = false;
                if (isHeader(lines[i], fields, dateField)) {
                    log.debug("{}: skipping header line {}", source, lineNumber);
                    continue;
                }
            }
            RowOutcome<CanonicalRecord> outcome = fields.getFieldCount() == expectedFields
                    ? format.toRecord(fields)
                    : RowOutcome.rejected("Expected %d fields but found %d".formatted(expectedFields, fields.getFieldCount()));
            if (outcome.isAccepted()) {
                records.add(outcome.value());
            } else {
                log.debug("{}: line {} skipped: {}", source, lineNumber, outcome.reason());
                warnings.add(ProcessingWarning.forLine(source, lineNumber, outcome.reason()));
            }
        }
        log.info("Manual block '{}': {} records, {} warnings", source, records.size(), warnings.size());
        return new IngestionResult(List.copyOf(records), List.copyOf(warnings));
    }

    private static boolean isHeader(String line, FieldSet fields, int dateField) {
        String lower = line.toLowerCase(Locale.ROOT);
        boolean namesColumns = HEADER_KEYWORDS.stream().anyMatch(lower::contains);
        boolean hasDate = fields.getFieldCount() > dateField && DateParser.parse(fields.readString(dateField)).isPresent();
        return namesColumns && !hasDate;
    }

    static Optional<OperationKind> parseKind(String raw) {
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "1", "INCOME", "INGRESO" -> Optional.of(OperationKind.INCOME);
            case "2", "EXPENSE", "EGRESO" -> Optional.of(OperationKind.EXPENSE);
            default -> Optional.empty();
        };
    }

    private static String kindError(String raw) {
        return "0".equals(raw.trim())
                ? "Opening balance cannot be entered as a manual line"
                : "Unknown operation kind '%s'".formatted(raw);
    }

    private static RowOutcome<BigDecimal> parseAmount(String raw) {
        try {
            BigDecimal amount = AmountParser.parseStrict(raw);
            return amount.signum() < 0
                    ? RowOutcome.rejected("Negative amount '%s'".formatted(raw))
                    : RowOutcome.accepted(amount);
        } catch (NumberFormatException e) {
            return RowOutcome.rejected(e.getMessage());
        }
    }

    @FunctionalInterface
    private interface LineFormat {
        RowOutcome<CanonicalRecord> toRecord(FieldSet fields);
    }
}
