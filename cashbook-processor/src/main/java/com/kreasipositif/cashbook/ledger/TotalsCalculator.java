package com.kreasipositif.cashbook.ledger;

import com.kreasipositif.cashbook.domain.CanonicalRecord;
import com.kreasipositif.cashbook.domain.Ledger;
import com.kreasipositif.cashbook.domain.Totals;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;

/**
 * Period aggregates. The opening balance counts as income.
 */
@Component
public class TotalsCalculator {

    public Totals calculate(Ledger ledger) {
        List<CanonicalRecord> inflows = ledger.records().stream()
                .filter(record -> record.getOperationKind().isInflow())
                .toList();
        List<CanonicalRecord> outflows = ledger.records().stream()
                .filter(record -> !record.getOperationKind().isInflow())
                .toList();

        BigDecimal incomeFlow = sum(inflows, CanonicalRecord::getFlowAmount);
        BigDecimal expenseFlow = sum(outflows, CanonicalRecord::getFlowAmount);
        BigDecimal incomeBasis = sum(inflows, CanonicalRecord::getTaxBasisAmount);
        BigDecimal expenseBasis = sum(outflows, CanonicalRecord::getTaxBasisAmount);

        return Totals.builder()
                .totalIncomeFlow(incomeFlow)
                .totalExpenseFlow(expenseFlow)
                .netFlow(incomeFlow.subtract(expenseFlow))
                .incomeTaxBasis(incomeBasis)
                .expenseTaxBasis(expenseBasis)
                .netTaxBasisResult(incomeBasis.subtract(expenseBasis))
                .build();
    }

    private static BigDecimal sum(List<CanonicalRecord> records, Function<CanonicalRecord, BigDecimal> amount) {
        return records.stream().map(amount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
