package com.kreasipositif.cashbook.controller.dto;

import com.kreasipositif.cashbook.domain.Ledger;
import com.kreasipositif.cashbook.domain.LedgerEdit;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Edit request: the ledger as last returned, plus the changes to apply. When the same
 * correlative appears twice the last change wins.
 */
@Schema(description = "Opening balance and date changes to apply to a ledger")
public record LedgerEditRequest(
        @Schema(description = "Ledger as returned by the previous call")
        @NotNull @Valid Ledger ledger,
        @Schema(description = "New opening balance; omit to keep the current one", example = "500000")
        @PositiveOrZero BigDecimal openingBalance,
        @Schema(description = "Operation date changes")
        @Valid List<DateChangeDto> dateChanges) {

    public LedgerEdit toEdit() {
        Map<Integer, LocalDate> changes = dateChanges == null
                ? Map.of()
                : dateChanges.stream().collect(Collectors.toMap(
                        DateChangeDto::correlative, DateChangeDto::operationDate, (first, last) -> last));
        return new LedgerEdit(openingBalance, changes);
    }
}
