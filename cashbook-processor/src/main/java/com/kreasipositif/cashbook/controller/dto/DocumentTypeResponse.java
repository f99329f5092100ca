package com.kreasipositif.cashbook.controller.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

/**
 * Catalog entry used by the renderer to label document type codes.
 */
@Getter
@Builder
@Schema(description = "Document type code with its official name")
public class DocumentTypeResponse {

    @Schema(description = "Document type code", example = "33")
    private final int code;

    @Schema(description = "Official name", example = "Factura Electrónica")
    private final String name;

    @Schema(description = "Fiscal family of the document", example = "INVOICE")
    private final String category;
}
