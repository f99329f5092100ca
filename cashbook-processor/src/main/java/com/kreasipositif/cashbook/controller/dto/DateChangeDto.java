package com.kreasipositif.cashbook.controller.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;

@Schema(description = "New operation date for one ledger entry")
public record DateChangeDto(
        @Schema(description = "Correlative of the entry as shown in the ledger", example = "4")
        @Positive int correlative,
        @Schema(description = "New operation date (ISO)", example = "2024-03-15")
        @NotNull LocalDate operationDate) {
}
