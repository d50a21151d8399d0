package com.cueleague.scoring.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders every rejection as {@code {code, message, retryable}}. Request body
 * validation failures are reported as {@link ScoringErrorKind#CONSTRAINT_VIOLATION}
 * with the offending fields attached.
 */
@RestControllerAdvice
public class ScoringExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ScoringExceptionHandler.class);

    @ExceptionHandler(ScoringException.class)
    public ResponseEntity<ScoringErrorResponse> handle(ScoringException ex) {
        return respond(ex.getKind(), ex.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ScoringErrorResponse> handleInvalidRequest(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        String message = fieldErrors.isEmpty()
                ? "Scoring request is invalid"
                : "Scoring request is invalid: " + String.join("; ", fieldErrors.values());
        log.debug("Rejected scoring request body: {}", fieldErrors);
        return respond(ScoringErrorKind.CONSTRAINT_VIOLATION, message, fieldErrors);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ScoringErrorResponse> handleOptimisticLock(ObjectOptimisticLockingFailureException ex) {
        log.warn("Concurrent scoring write lost the optimistic lock race: {}", ex.getMessage());
        return respond(
                ScoringErrorKind.WRITE_CONFLICT,
                "The record changed while your action was being saved; refresh and try again",
                Map.of()
        );
    }

    private static ResponseEntity<ScoringErrorResponse> respond(
            ScoringErrorKind kind,
            String message,
            Map<String, String> fieldErrors
    ) {
        return ResponseEntity
                .status(kind.status())
                .body(new ScoringErrorResponse(kind.code(), message, kind.retryable(), fieldErrors));
    }

    public record ScoringErrorResponse(
            String code,
            String message,
            boolean retryable,
            @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, String> fieldErrors
    ) {
    }
}
