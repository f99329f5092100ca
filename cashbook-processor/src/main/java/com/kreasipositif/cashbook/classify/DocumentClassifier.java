package com.kreasipositif.cashbook.classify;

import com.kreasipositif.cashbook.domain.CanonicalRecord;
import com.kreasipositif.cashbook.domain.OperationKind;
import com.kreasipositif.cashbook.domain.RowOutcome;
import com.kreasipositif.cashbook.domain.SourceSchema;
import com.kreasipositif.cashbook.mapping.SourceRow;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the simplified-regime rules that turn an export row into a cash book record.
 *
 * <h3>Operation kind</h3>
 * <table>
 *   <caption>kind by schema and category</caption>
 *   <tr><th>Schema</th><th>Income</th><th>Expense</th></tr>
 *   <tr><td>sales detail</td><td>invoices, debit notes</td><td>credit notes</td></tr>
 *   <tr><td>sales summary</td><td>receipts, payment vouchers</td><td></td></tr>
 *   <tr><td>purchase detail</td><td>credit notes</td><td>invoices, purchase invoices, debit notes</td></tr>
 * </table>
 * Any other code (dispatch guides, invoices inside a summary, unknown codes) is ignored.
 *
 * <h3>Amounts</h3>
 * Flow is {@code |total|}. Basis is {@code |net + exempt|}; purchases add the fixed-asset,
 * non-recoverable, tobacco, non-creditable and other-tax columns. VAT never enters the basis.
 * Rows with a zero total carry no economic event and are ignored.
 */
@Component
public class DocumentClassifier {

    static final String SUMMARY_DESCRIPTION = "Resumen ventas boletas del día - ";
    static final String SUMMARY_WITHOUT_RANGE = "Z";

    private static final Pattern CODE_IN_PARENTHESES = Pattern.compile("\\((\\d{1,9})\\)");
    private static final Pattern BARE_CODE = Pattern.compile("\\d{1,9}");

    /**
     * Decides whether the row belongs in the ledger and in which direction.
     */
    public RowOutcome<Classification> classify(SourceSchema schema, SourceRow row) {
        OptionalInt code = parseCode(row.documentType());
        if (code.isEmpty()) {
            return RowOutcome.ignored("no document type code in '%s'".formatted(row.documentType()));
        }
        Optional<DocumentType> type = DocumentType.fromCode(code.getAsInt());
        if (type.isEmpty()) {
            return RowOutcome.ignored("unknown document type %d".formatted(code.getAsInt()));
        }
        Optional<OperationKind> kind = operationKind(schema, type.get().getCategory());
        if (kind.isEmpty()) {
            return RowOutcome.ignored("document type %d is not booked from %s".formatted(code.getAsInt(), schema));
        }
        if (row.totalAmount().signum() == 0) {
            return RowOutcome.ignored("zero total");
        }
        return RowOutcome.accepted(new Classification(schema, type.get(), kind.get()));
    }

    /**
     * Builds the record for a classified row once its operation date is known.
     */
    public CanonicalRecord toRecord(Classification classification, SourceRow row, LocalDate operationDate) {
        BigDecimal basis = row.netAmount().add(row.exemptAmount()).add(row.basisAdjustments());
        DocumentType type = classification.documentType();
        boolean summary = classification.schema() == SourceSchema.SALES_SUMMARY;

        String documentNumber = summary
                ? (row.folioRange().isEmpty() ? SUMMARY_WITHOUT_RANGE : row.folioRange())
                : row.folio();
        String description = summary
                ? SUMMARY_DESCRIPTION + type.getOfficialName()
                : withName(detailPrefix(classification), row.name());

        return CanonicalRecord.builder()
                .operationKind(classification.operationKind())
                .documentNumber(documentNumber)
                .documentType(String.valueOf(type.getCode()))
                .counterpartyId(summary ? "" : row.counterpartyId())
                .operationDate(operationDate)
                .description(description)
                .flowAmount(row.totalAmount().abs())
                .taxBasisAmount(basis.abs())
                .origin(classification.schema().getOrigin())
                .build();
    }

    /**
     * Reads the numeric code from {@code "Boleta Electrónica(39)"} or a bare {@code "39"}. Codes longer
     * than nine digits are not document types and read as absent.
     */
    public OptionalInt parseCode(String rawType) {
        if (rawType == null) {
            return OptionalInt.empty();
        }
        Matcher inParentheses = CODE_IN_PARENTHESES.matcher(rawType);
        if (inParentheses.find()) {
            return OptionalInt.of(Integer.parseInt(inParentheses.group(1)));
        }
        String trimmed = rawType.trim();
        if (BARE_CODE.matcher(trimmed).matches()) {
            return OptionalInt.of(Integer.parseInt(trimmed));
        }
        return OptionalInt.empty();
    }

    // ─── rules ───────────────────────────────────────────────────────────────

    Optional<OperationKind> operationKind(SourceSchema schema, DocumentCategory category) {
        OperationKind kind = switch (schema) {
            case SALES_DETAIL -> switch (category) {
                case INVOICE, DEBIT_NOTE -> OperationKind.INCOME;
                case CREDIT_NOTE -> OperationKind.EXPENSE;
                default -> null;
            };
            case SALES_SUMMARY -> switch (category) {
                case AFFECTED_RECEIPT, EXEMPT_RECEIPT, PAYMENT_VOUCHER -> OperationKind.INCOME;
                default -> null;
            };
            case PURCHASE_DETAIL -> switch (category) {
                case INVOICE, PURCHASE_INVOICE, DEBIT_NOTE -> OperationKind.EXPENSE;
                case CREDIT_NOTE -> OperationKind.INCOME;
                default -> null;
            };
        };
        return Optional.ofNullable(kind);
    }

    private static String detailPrefix(Classification classification) {
        String side = classification.schema() == SourceSchema.PURCHASE_DETAIL ? "Compra" : "Venta";
        return switch (classification.documentType().getCategory()) {
            case CREDIT_NOTE -> "NC " + side;
            case DEBIT_NOTE -> "ND " + side;
            default -> side;
        };
    }

    private static String withName(String prefix, String name) {
        return name == null || name.isBlank() ? prefix : prefix + " - " + name;
    }
}
