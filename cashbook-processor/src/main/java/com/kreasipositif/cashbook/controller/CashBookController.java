package com.kreasipositif.cashbook.controller;

import com.kreasipositif.cashbook.classify.DocumentType;
import com.kreasipositif.cashbook.controller.dto.DocumentTypeResponse;
import com.kreasipositif.cashbook.controller.dto.ErrorResponseDto;
import com.kreasipositif.cashbook.controller.dto.LedgerEditRequest;
import com.kreasipositif.cashbook.domain.CashBookRequest;
import com.kreasipositif.cashbook.domain.CashBookResult;
import com.kreasipositif.cashbook.domain.LedgerHeader;
import com.kreasipositif.cashbook.domain.SourceDocument;
import com.kreasipositif.cashbook.domain.SourceSchema;
import com.kreasipositif.cashbook.service.CashBookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * REST API for building and editing a cash book.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/cash-book")
@RequiredArgsConstructor
@Tag(name = "Cash Book", description = "Build the cash book from tax-portal exports and recompute it after edits")
public class CashBookController {

    private final CashBookService cashBookService;

    // ─── POST /api/v1/cash-book ───────────────────────────────────────────────

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Build a cash book",
            description = "Reads sales detail, sales summary and purchase detail exports (any number of each) "
                    + "plus optional pasted payment and professional-fee lines, and returns the ordered ledger, "
                    + "its totals and every warning raised. Files that cannot be read are skipped with a warning.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Cash book built",
                            content = @Content(schema = @Schema(implementation = CashBookResult.class))),
                    @ApiResponse(responseCode = "422", description = "No usable input in the request",
                            content = @Content(schema = @Schema(implementation = ErrorResponseDto.class)))
            })
    public ResponseEntity<CashBookResult> generate(
            @Parameter(description = "Sales register exports (per document)")
            @RequestParam(value = "salesDetail", required = false) List<MultipartFile> salesDetail,
            @Parameter(description = "Receipt summary exports (per document type and day)")
            @RequestParam(value = "salesSummary", required = false) List<MultipartFile> salesSummary,
            @Parameter(description = "Purchase register exports (per document)")
            @RequestParam(value = "purchaseDetail", required = false) List<MultipartFile> purchaseDetail,
            @Parameter(description = "Pasted payment lines: kind, number, type, date, narrative, amount")
            @RequestParam(value = "manualPayments", required = false) String manualPayments,
            @Parameter(description = "Pasted fee lines: kind, number, type, counterparty id, date, name, paid, gross")
            @RequestParam(value = "professionalFees", required = false) String professionalFees,
            @Parameter(description = "Commercial year", example = "2024")
            @RequestParam(value = "period", defaultValue = "") String period,
            @Parameter(description = "Cash at the start of the period", example = "0")
            @RequestParam(value = "openingBalance", defaultValue = "0") BigDecimal openingBalance,
            @Parameter(description = "Tax identifier of the book owner", example = "76.123.456-7")
            @RequestParam(value = "taxpayerId", defaultValue = "") String taxpayerId,
            @Parameter(description = "Legal name of the book owner")
            @RequestParam(value = "taxpayerName", defaultValue = "") String taxpayerName) throws IOException {

        CashBookRequest.CashBookRequestBuilder request = CashBookRequest.builder()
                .header(new LedgerHeader(taxpayerId.trim(), taxpayerName.trim(), period.trim()))
                .openingBalance(openingBalance)
                .manualPayments(manualPayments)
                .professionalFees(professionalFees);
        addSources(request, salesDetail, SourceSchema.SALES_DETAIL);
        addSources(request, salesSummary, SourceSchema.SALES_SUMMARY);
        addSources(request, purchaseDetail, SourceSchema.PURCHASE_DETAIL);

        CashBookRequest built = request.build();
        log.info("Building cash book for '{}' period '{}' from {} files", taxpayerId, period, built.getSources().size());
        return ResponseEntity.ok(cashBookService.generate(built));
    }

    // ─── POST /api/v1/cash-book/edits ────────────────────────────────────────

    @PostMapping(value = "/edits", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Apply an edit",
            description = "Changes the opening balance and/or operation dates of a ledger previously returned by this API, "
                    + "then re-orders, re-numbers, re-totals and re-validates it.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Recomputed cash book",
                            content = @Content(schema = @Schema(implementation = CashBookResult.class))),
                    @ApiResponse(responseCode = "400", description = "Unknown correlative, negative balance or malformed ledger",
                            content = @Content(schema = @Schema(implementation = ErrorResponseDto.class)))
            })
    public ResponseEntity<CashBookResult> applyEdit(@Valid @RequestBody LedgerEditRequest request) {
        return ResponseEntity.ok(cashBookService.applyEdit(request.ledger(), request.toEdit()));
    }

    // ─── GET /api/v1/cash-book/document-types ────────────────────────────────

    @GetMapping(value = "/document-types", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "List document types",
            description = "Document type codes known to the classifier, with official names.",
            responses = @ApiResponse(responseCode = "200", description = "Catalog",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = DocumentTypeResponse.class)))))
    public ResponseEntity<List<DocumentTypeResponse>> documentTypes() {
        return ResponseEntity.ok(Arrays.stream(DocumentType.values())
                .map(type -> DocumentTypeResponse.builder()
                        .code(type.getCode())
                        .name(type.getOfficialName())
                        .category(type.getCategory().name())
                        .build())
                .toList());
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private static void addSources(CashBookRequest.CashBookRequestBuilder request,
                                   List<MultipartFile> files, SourceSchema schema) throws IOException {
        if (files == null) {
            return;
        }
        for (MultipartFile file : files) {
            if (!file.isEmpty()) {
                String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : file.getName();
                request.source(new SourceDocument(name, schema, file.getBytes()));
            }
        }
    }
}
