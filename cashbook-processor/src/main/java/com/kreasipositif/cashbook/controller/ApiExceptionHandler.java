package com.kreasipositif.cashbook.controller;

import com.kreasipositif.cashbook.controller.dto.ErrorResponseDto;
import com.kreasipositif.cashbook.domain.ProcessingWarning;
import com.kreasipositif.cashbook.exception.InvalidLedgerEditException;
import com.kreasipositif.cashbook.exception.InvalidLedgerException;
import com.kreasipositif.cashbook.exception.NoUsableInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NoUsableInputException.class)
    public ResponseEntity<ErrorResponseDto> handleNoUsableInput(NoUsableInputException ex) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "NO_USABLE_INPUT", ex.getMessage(), Map.of(
                "warnings", ex.getWarnings().stream().map(ProcessingWarning::toString).toList()));
    }

    @ExceptionHandler({InvalidLedgerEditException.class, InvalidLedgerException.class})
    public ResponseEntity<ErrorResponseDto> handleInvalidEdit(RuntimeException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_EDIT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadableUpload(IOException ex) {
        log.warn("Could not read uploaded file: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "UNREADABLE_UPLOAD", "Could not read an uploaded file",
                Map.of("reason", String.valueOf(ex.getMessage())));
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details));
    }
}
