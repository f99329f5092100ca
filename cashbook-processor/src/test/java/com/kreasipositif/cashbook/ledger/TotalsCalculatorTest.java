package com.kreasipositif.cashbook.ledger;

import com.kreasipositif.cashbook.CashBookFixtures;
import com.kreasipositif.cashbook.domain.OperationKind;
import com.kreasipositif.cashbook.domain.Totals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static com.kreasipositif.cashbook.CashBookFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;

class TotalsCalculatorTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 1);

    private final TotalsCalculator calculator = new TotalsCalculator();

    @Test
    @DisplayName("Opening counts as income; nets are income minus expense")
    void calculate() {
        Totals totals = calculator.calculate(CashBookFixtures.numbered(
                CashBookFixtures.opening(40500),
                record(OperationKind.INCOME, "1", "39", DATE, 119000, 50000),
                record(OperationKind.EXPENSE, "2", "33", DATE, 119000, 100000)));

        assertThat(totals.getTotalIncomeFlow()).isEqualByComparingTo("159500");
        assertThat(totals.getTotalExpenseFlow()).isEqualByComparingTo("119000");
        assertThat(totals.getNetFlow()).isEqualByComparingTo("40500");
        assertThat(totals.getIncomeTaxBasis()).isEqualByComparingTo("50000");
        assertThat(totals.getExpenseTaxBasis()).isEqualByComparingTo("100000");
        assertThat(totals.getNetTaxBasisResult()).isEqualByComparingTo("-50000");
    }

    @Test
    @DisplayName("A ledger with only the opening entry totals to the opening amount")
    void calculate_openingOnly() {
        Totals totals = calculator.calculate(CashBookFixtures.numbered(CashBookFixtures.opening(0)));

        assertThat(totals.getTotalIncomeFlow()).isZero();
        assertThat(totals.getTotalExpenseFlow()).isZero();
        assertThat(totals.getNetFlow()).isZero();
        assertThat(totals.getNetTaxBasisResult()).isZero();
    }
}
