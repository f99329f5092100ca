package com.kreasipositif.cashbook.classify;

import com.kreasipositif.cashbook.domain.CanonicalRecord;
import com.kreasipositif.cashbook.domain.OperationKind;
import com.kreasipositif.cashbook.domain.RecordOrigin;
import com.kreasipositif.cashbook.domain.RowOutcome;
import com.kreasipositif.cashbook.domain.SourceSchema;
import com.kreasipositif.cashbook.mapping.SourceRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentClassifierTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 5);

    private final DocumentClassifier classifier = new DocumentClassifier();

    private static SourceRow row(String type, long net, long exempt, long adjustments, long total) {
        return new SourceRow(2, type, "100", "05/03/2024", "11.111.111-1", "Cliente SpA",
                BigDecimal.valueOf(net), BigDecimal.valueOf(exempt), BigDecimal.valueOf(total),
                BigDecimal.valueOf(adjustments), "", "");
    }

    @ParameterizedTest(name = "{0} code {1} -> {2}")
    @DisplayName("Operation kind follows the schema and document family")
    @CsvSource({
            "SALES_DETAIL,    33,  INCOME",
            "SALES_DETAIL,    34,  INCOME",
            "SALES_DETAIL,    56,  INCOME",
            "SALES_DETAIL,    110, INCOME",
            "SALES_DETAIL,    61,  EXPENSE",
            "SALES_DETAIL,    112, EXPENSE",
            "SALES_SUMMARY,   39,  INCOME",
            "SALES_SUMMARY,   41,  INCOME",
            "SALES_SUMMARY,   48,  INCOME",
            "PURCHASE_DETAIL, 33,  EXPENSE",
            "PURCHASE_DETAIL, 46,  EXPENSE",
            "PURCHASE_DETAIL, 56,  EXPENSE",
            "PURCHASE_DETAIL, 914, EXPENSE",
            "PURCHASE_DETAIL, 61,  INCOME"
    })
    void classify_kind(SourceSchema schema, String code, OperationKind expected) {
        RowOutcome<Classification> outcome = classifier.classify(schema, row(code, 100, 0, 0, 119));

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.value().operationKind()).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0} code {1} is ignored")
    @DisplayName("Out-of-place or unknown documents are ignored, not rejected")
    @CsvSource({
            "SALES_DETAIL,    52",
            "SALES_DETAIL,    39",
            "SALES_SUMMARY,   33",
            "SALES_SUMMARY,   61",
            "PURCHASE_DETAIL, 52",
            "PURCHASE_DETAIL, 39",
            "SALES_DETAIL,    999",
            "SALES_DETAIL,    Factura"
    })
    void classify_ignored(SourceSchema schema, String type) {
        assertThat(classifier.classify(schema, row(type, 100, 0, 0, 119)).status())
                .isEqualTo(RowOutcome.Status.IGNORED);
    }

    @Test
    @DisplayName("A zero total is ignored")
    void classify_zeroTotal() {
        assertThat(classifier.classify(SourceSchema.SALES_DETAIL, row("33", 0, 0, 0, 0)).status())
                .isEqualTo(RowOutcome.Status.IGNORED);
    }

    @Test
    @DisplayName("Detail record: flow is the total, basis leaves VAT out")
    void toRecord_salesInvoice() {
        SourceRow row = row("Factura Electrónica(33)", 100000, 5000, 0, 124000);
        Classification classification = classifier.classify(SourceSchema.SALES_DETAIL, row).value();

        CanonicalRecord record = classifier.toRecord(classification, row, DATE);

        assertThat(record.getOperationKind()).isEqualTo(OperationKind.INCOME);
        assertThat(record.getDocumentNumber()).isEqualTo("100");
        assertThat(record.getDocumentType()).isEqualTo("33");
        assertThat(record.getCounterpartyId()).isEqualTo("11.111.111-1");
        assertThat(record.getOperationDate()).isEqualTo(DATE);
        assertThat(record.getDescription()).isEqualTo("Venta - Cliente SpA");
        assertThat(record.getFlowAmount()).isEqualByComparingTo("124000");
        assertThat(record.getTaxBasisAmount()).isEqualByComparingTo("105000");
        assertThat(record.getOrigin()).isEqualTo(RecordOrigin.SALES_DETAIL);
    }

    @Test
    @DisplayName("Negative amounts on notes are booked as absolute values")
    void toRecord_negativeCreditNote() {
        SourceRow row = row("61", -10000, 0, 0, -11900);
        Classification classification = classifier.classify(SourceSchema.PURCHASE_DETAIL, row).value();

        CanonicalRecord record = classifier.toRecord(classification, row, DATE);

        assertThat(record.getOperationKind()).isEqualTo(OperationKind.INCOME);
        assertThat(record.getFlowAmount()).isEqualByComparingTo("11900");
        assertThat(record.getTaxBasisAmount()).isEqualByComparingTo("10000");
        assertThat(record.getDescription()).isEqualTo("NC Compra - Cliente SpA");
    }

    @Test
    @DisplayName("Purchase basis includes the adjustment columns")
    void toRecord_purchaseAdjustments() {
        SourceRow row = row("33", 200000, 0, 38000, 238000);
        Classification classification = classifier.classify(SourceSchema.PURCHASE_DETAIL, row).value();

        assertThat(classifier.toRecord(classification, row, DATE).getTaxBasisAmount()).isEqualByComparingTo("238000");
    }

    @Test
    @DisplayName("Debit notes get the ND prefix; a missing name leaves the prefix alone")
    void toRecord_debitNoteWithoutName() {
        SourceRow row = new SourceRow(2, "56", "9", "", "", " ", BigDecimal.TEN, BigDecimal.ZERO,
                BigDecimal.TEN, BigDecimal.ZERO, "", "");
        Classification classification = classifier.classify(SourceSchema.SALES_DETAIL, row).value();

        assertThat(classifier.toRecord(classification, row, DATE).getDescription()).isEqualTo("ND Venta");
    }

    @Test
    @DisplayName("Summary record: folio range or Z as number, no counterparty, fixed description")
    void toRecord_summary() {
        SourceRow withRange = new SourceRow(2, "Boleta Electrónica(39)", "", "", "99", "", BigDecimal.valueOf(50000),
                BigDecimal.ZERO, BigDecimal.valueOf(59500), BigDecimal.ZERO, "1001", "1250");
        SourceRow withoutRange = new SourceRow(3, "41", "", "", "", "", BigDecimal.ZERO,
                BigDecimal.valueOf(12000), BigDecimal.valueOf(12000), BigDecimal.ZERO, "", "");

        CanonicalRecord first = classifier.toRecord(
                classifier.classify(SourceSchema.SALES_SUMMARY, withRange).value(), withRange, DATE);
        CanonicalRecord second = classifier.toRecord(
                classifier.classify(SourceSchema.SALES_SUMMARY, withoutRange).value(), withoutRange, DATE);

        assertThat(first.getDocumentNumber()).isEqualTo("1001 al 1250");
        assertThat(first.getCounterpartyId()).isEmpty();
        assertThat(first.getDescription()).isEqualTo(DocumentClassifier.SUMMARY_DESCRIPTION + "Boleta Electrónica");
        assertThat(first.getOrigin()).isEqualTo(RecordOrigin.SALES_SUMMARY);
        assertThat(second.getDocumentNumber()).isEqualTo(DocumentClassifier.SUMMARY_WITHOUT_RANGE);
        assertThat(second.getTaxBasisAmount()).isEqualByComparingTo("12000");
    }

    @Test
    @DisplayName("Codes are read from parentheses or bare digits")
    void parseCode() {
        assertThat(classifier.parseCode("Boleta Electrónica(39)")).hasValue(39);
        assertThat(classifier.parseCode("Nota de Crédito (61) electrónica")).hasValue(61);
        assertThat(classifier.parseCode(" 33 ")).hasValue(33);
        assertThat(classifier.parseCode("Factura")).isEmpty();
        assertThat(classifier.parseCode("33A")).isEmpty();
        assertThat(classifier.parseCode("")).isEmpty();
        assertThat(classifier.parseCode(null)).isEmpty();
    }

    @Test
    @DisplayName("Codes wider than nine digits read as absent and the row is ignored")
    void parseCode_oversizedCode() {
        assertThat(classifier.parseCode("Otro(99999999999)")).isEmpty();
        assertThat(classifier.parseCode("99999999999")).isEmpty();
        assertThat(classifier.parseCode("Otro(999999999)")).hasValue(999_999_999);

        assertThat(classifier.classify(SourceSchema.SALES_SUMMARY, row("Otro(99999999999)", 100, 0, 0, 119)).status())
                .isEqualTo(RowOutcome.Status.IGNORED);
    }

    @Test
    @DisplayName("Dispatch guides have no kind in any schema")
    void operationKind_dispatchGuide() {
        for (SourceSchema schema : SourceSchema.values()) {
            assertThat(classifier.operationKind(schema, DocumentCategory.DISPATCH_GUIDE)).isEqualTo(Optional.empty());
        }
    }
}
