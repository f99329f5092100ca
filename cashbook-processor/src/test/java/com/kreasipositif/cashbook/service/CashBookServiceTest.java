package com.kreasipositif.cashbook.service;

import com.kreasipositif.cashbook.CashBookFixtures;
import com.kreasipositif.cashbook.domain.CanonicalRecord;
import com.kreasipositif.cashbook.domain.CashBookRequest;
import com.kreasipositif.cashbook.domain.CashBookResult;
import com.kreasipositif.cashbook.domain.LedgerEdit;
import com.kreasipositif.cashbook.domain.LedgerEntry;
import com.kreasipositif.cashbook.domain.LedgerHeader;
import com.kreasipositif.cashbook.domain.OperationKind;
import com.kreasipositif.cashbook.domain.ProcessingWarning;
import com.kreasipositif.cashbook.domain.SourceSchema;
import com.kreasipositif.cashbook.domain.ValidationWarning;
import com.kreasipositif.cashbook.exception.InvalidLedgerEditException;
import com.kreasipositif.cashbook.exception.InvalidLedgerException;
import com.kreasipositif.cashbook.exception.NoUsableInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import static com.kreasipositif.cashbook.CashBookFixtures.numbered;
import static com.kreasipositif.cashbook.CashBookFixtures.opening;
import static com.kreasipositif.cashbook.CashBookFixtures.record;
import static com.kreasipositif.cashbook.CashBookFixtures.source;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CashBookServiceTest {

    private static final LedgerHeader HEADER = new LedgerHeader("76.123.456-7", "Comercial Test SpA", "2024");

    private CashBookService service;

    @BeforeEach
    void setUp() {
        service = CashBookFixtures.service();
    }

    private static CashBookRequest.CashBookRequestBuilder allExports() {
        return CashBookRequest.builder()
                .header(HEADER)
                .source(source("ventas_202403.csv", SourceSchema.SALES_DETAIL))
                .source(source("resumen_boletas_2024-03.csv", SourceSchema.SALES_SUMMARY))
                .source(source("compras_2024-03.csv", SourceSchema.PURCHASE_DETAIL));
    }

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("All three exports end up in one ledger ordered by date behind the opening entry")
        void allExports_ledger() {
            CashBookResult result = service.generate(allExports().build());

            assertThat(result.getProcessingWarnings()).isEmpty();
            assertThat(result.getValidationWarnings()).isEmpty();
            assertThat(result.getLedger().getEntries()).extracting(LedgerEntry::getCorrelative)
                    .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
            assertThat(result.getLedger().records()).extracting(CanonicalRecord::getDocumentNumber)
                    .containsExactly("", "1001", "501", "55", "1002", "1003", "502", "20", "1001 al 1250", "Z");
            assertThat(result.getLedger().records().get(0).getOperationKind()).isEqualTo(OperationKind.OPENING);
        }

        @Test
        @DisplayName("All three exports: totals split flow and basis by direction")
        void allExports_totals() {
            CashBookResult result = service.generate(allExports().build());

            assertThat(result.getTotals().getTotalIncomeFlow()).isEqualByComparingTo("276200");
            assertThat(result.getTotals().getTotalExpenseFlow()).isEqualByComparingTo("368900");
            assertThat(result.getTotals().getNetFlow()).isEqualByComparingTo("-92700");
            assertThat(result.getTotals().getIncomeTaxBasis()).isEqualByComparingTo("242000");
            assertThat(result.getTotals().getExpenseTaxBasis()).isEqualByComparingTo("348000");
            assertThat(result.getTotals().getNetTaxBasisResult()).isEqualByComparingTo("-106000");
        }

        @Test
        @DisplayName("Manual payments and fees join the exports; withheld fees trigger the basis warning")
        void manualBlocks() {
            CashBookResult result = service.generate(allExports()
                    .openingBalance(BigDecimal.valueOf(100000))
                    .manualPayments("2,1203,Boleta de servicio,15/03/2024,Luz oficina,48.900")
                    .professionalFees("2,87,BHE,12.345.678-9,30/04/2024,Ana Rojas,\"$151,077\",\"$173,850\"")
                    .build());

            assertThat(result.getLedger().size()).isEqualTo(12);
            assertThat(result.getTotals().getTotalIncomeFlow()).isEqualByComparingTo("376200");
            assertThat(result.getTotals().getTotalExpenseFlow()).isEqualByComparingTo("568877");
            assertThat(result.getLedger().records().get(11).getDescription()).isEqualTo("Honorarios - Ana Rojas");
            assertThat(result.getValidationWarnings()).extracting(ValidationWarning::kind)
                    .containsExactly(ValidationWarning.Kind.BASIS_EXCEEDS_FLOW);
        }

        @Test
        @DisplayName("An unusable file is skipped with a file-level warning; the others continue")
        void unusableFile_isSkipped() {
            CashBookResult result = service.generate(CashBookRequest.builder()
                    .header(HEADER)
                    .source(source("sin_columnas.csv", SourceSchema.PURCHASE_DETAIL))
                    .source(source("ventas_202403.csv", SourceSchema.SALES_DETAIL))
                    .build());

            assertThat(result.getLedger().size()).isEqualTo(5);
            assertThat(result.getProcessingWarnings()).singleElement().satisfies(warning -> {
                assertThat(warning.source()).isEqualTo("sin_columnas.csv");
                assertThat(warning.lineNumber()).isNull();
                assertThat(warning.message()).startsWith("File skipped: No column found");
            });
        }

        @Test
        @DisplayName("Line warnings from manual blocks are reported alongside the ledger")
        void manualLineWarnings() {
            CashBookResult result = service.generate(CashBookRequest.builder()
                    .header(HEADER)
                    .manualPayments("1,1,Boleta,01/03/2024,ok,100\n9,2,Boleta,01/03/2024,bad,100")
                    .build());

            assertThat(result.getLedger().size()).isEqualTo(2);
            assertThat(result.getProcessingWarnings()).extracting(ProcessingWarning::toString)
                    .containsExactly("manual-payments (line 2): Unknown operation kind '9'");
        }

        @Test
        @DisplayName("An empty request is refused")
        void emptyRequest() {
            assertThatThrownBy(() -> service.generate(CashBookRequest.builder().header(HEADER).build()))
                    .isInstanceOf(NoUsableInputException.class)
                    .hasMessage("No export files or manual entries were supplied");
        }

        @Test
        @DisplayName("When every file fails and no manual line is usable the run fails with all warnings")
        void nothingUsable() {
            CashBookRequest request = CashBookRequest.builder()
                    .header(HEADER)
                    .source(source("sin_columnas.csv", SourceSchema.SALES_DETAIL))
                    .manualPayments("1,1,Boleta,32/01/2024,bad,100")
                    .build();

            assertThatThrownBy(() -> service.generate(request))
                    .isInstanceOfSatisfying(NoUsableInputException.class, e -> {
                        assertThat(e.getMessage()).isEqualTo("None of the supplied input could be used");
                        assertThat(e.getWarnings()).extracting(ProcessingWarning::source)
                                .containsExactly("sin_columnas.csv", "manual-payments");
                    });
        }

        @Test
        @DisplayName("A failed file is fine when manual lines produced records")
        void failedFile_manualRecords() {
            CashBookResult result = service.generate(CashBookRequest.builder()
                    .header(HEADER)
                    .source(source("sin_columnas.csv", SourceSchema.SALES_DETAIL))
                    .manualPayments("1,1,Boleta,01/03/2024,ok,100")
                    .build());

            assertThat(result.getLedger().size()).isEqualTo(2);
            assertThat(result.getProcessingWarnings()).hasSize(1);
        }

        @Test
        @DisplayName("A negative opening balance is refused")
        void negativeOpening() {
            CashBookRequest request = allExports().openingBalance(BigDecimal.valueOf(-1)).build();

            assertThatThrownBy(() -> service.generate(request)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("applyEdit")
    class ApplyEdit {

        @Test
        @DisplayName("Changing the opening balance shifts income and net flow by the difference")
        void openingBalance() {
            CashBookResult before = service.generate(allExports().build());

            CashBookResult after = service.applyEdit(before.getLedger(), LedgerEdit.openingBalance(BigDecimal.valueOf(500000)));

            assertThat(after.getLedger().records().get(0).getFlowAmount()).isEqualByComparingTo("500000");
            assertThat(after.getTotals().getTotalIncomeFlow()).isEqualByComparingTo("776200");
            assertThat(after.getTotals().getNetFlow()).isEqualByComparingTo("407300");
            assertThat(after.getTotals().getIncomeTaxBasis()).isEqualByComparingTo("242000");
            assertThat(after.getLedger().size()).isEqualTo(before.getLedger().size());
        }

        @Test
        @DisplayName("Changing a date moves the entry and renumbers the ledger")
        void dateChange() {
            CashBookResult before = service.generate(allExports().build());

            CashBookResult after = service.applyEdit(before.getLedger(), LedgerEdit.dateChange(2, LocalDate.of(2024, 12, 1)));

            assertThat(after.getLedger().records()).extracting(CanonicalRecord::getDocumentNumber)
                    .containsExactly("", "501", "55", "1002", "1003", "502", "20", "1001 al 1250", "Z", "1001");
            assertThat(after.getLedger().getEntries().get(9).getCorrelative()).isEqualTo(10);
            assertThat(after.getTotals()).isEqualTo(before.getTotals());
            assertThat(after.getProcessingWarnings()).isEmpty();
        }

        @Test
        @DisplayName("An edit that changes nothing yields the same ledger")
        void noChange() {
            CashBookResult before = service.generate(allExports().build());

            CashBookResult after = service.applyEdit(before.getLedger(), new LedgerEdit(null, Map.of()));

            assertThat(after.getLedger()).isEqualTo(before.getLedger());
        }

        @Test
        @DisplayName("Unknown correlatives are refused and listed")
        void unknownCorrelative() {
            CashBookResult before = service.generate(allExports().build());
            LedgerEdit edit = new LedgerEdit(null, Map.of(
                    99, LocalDate.of(2024, 1, 1), 0, LocalDate.of(2024, 1, 1), 3, LocalDate.of(2024, 1, 1)));

            assertThatThrownBy(() -> service.applyEdit(before.getLedger(), edit))
                    .isInstanceOf(InvalidLedgerEditException.class)
                    .hasMessage("Unknown correlatives: [0, 99]");
        }

        @Test
        @DisplayName("A negative opening balance is refused")
        void negativeOpening() {
            CashBookResult before = service.generate(allExports().build());

            assertThatThrownBy(() -> service.applyEdit(before.getLedger(), LedgerEdit.openingBalance(BigDecimal.valueOf(-5))))
                    .isInstanceOf(InvalidLedgerEditException.class);
        }

        @Test
        @DisplayName("A returned ledger whose entry lacks an amount is refused before recomputing")
        void incompleteEntry() {
            CanonicalRecord sale = record(OperationKind.INCOME, "1001", "33", LocalDate.of(2024, 3, 5), 119000, 100000);
            LedgerEdit edit = LedgerEdit.openingBalance(BigDecimal.TEN);

            assertThatThrownBy(() -> service.applyEdit(numbered(opening(0), sale.withFlowAmount(null)), edit))
                    .isInstanceOf(InvalidLedgerException.class)
                    .hasMessageContaining("Entry 2");
            assertThatThrownBy(() -> service.applyEdit(numbered(opening(0), sale.withOperationKind(null)), edit))
                    .isInstanceOf(InvalidLedgerException.class);
        }
    }
}
