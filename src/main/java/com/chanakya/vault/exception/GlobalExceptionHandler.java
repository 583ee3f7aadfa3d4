package com.chanakya.vault.exception;

import com.chanakya.vault.model.dto.response.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final ErrorResponse ACCESS_UNAVAILABLE = new ErrorResponse(
            "access_unavailable", "This access link is invalid or no longer available");

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("validation_error", message)));
    }

    @ExceptionHandler(InvalidScopeException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidScope(InvalidScopeException ex) {
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("invalid_scope", ex.getMessage())));
    }

    @ExceptionHandler(ScopeForbiddenException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleForbidden(ScopeForbiddenException ex) {
        return Mono.just(ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(new ErrorResponse("forbidden", ex.getMessage())));
    }

    @ExceptionHandler(GrantNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleNotFound(GrantNotFoundException ex) {
        return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("not_found", ex.getMessage())));
    }

    /**
     * Unknown, expired and revoked tokens share one response so a viewer cannot tell them apart.
     */
    @ExceptionHandler({InvalidTokenException.class, GrantUnavailableException.class})
    public Mono<ResponseEntity<ErrorResponse>> handleAccessUnavailable(RuntimeException ex) {
        return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).body(ACCESS_UNAVAILABLE));
    }

    @ExceptionHandler(ReportConflictException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleConflict(ReportConflictException ex) {
        return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("conflict", ex.getMessage())));
    }

    @ExceptionHandler(ExtractionException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleExtraction(ExtractionException ex) {
        log.error("Extraction error: {}", ex.getMessage(), ex);
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("extraction_error", "Failed to extract data from the document")));
    }

    @ExceptionHandler(TokenAllocationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleTokenAllocation(TokenAllocationException ex) {
        log.error("event=token_allocation_failed attempts={}", ex.getAttempts());
        return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("token_unavailable", "Could not issue an access link, try again")));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("validation_error", ex.getMessage())));
    }
}
