package com.pipelineparser.exception;

import com.pipelineparser.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(PipelineProcessingException.class)
    public Mono<ResponseEntity<ErrorResponse>> handlePipelineProcessing(PipelineProcessingException ex) {
        log.error("Pipeline processing failed: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Validation failed: " + errors);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid request body: " + ex.getReason());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        String reason = ex.getReason();
        if (reason == null) {
            HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
            reason = status != null ? status.getReasonPhrase() : ex.getStatusCode().toString();
        }
        log.warn("Request rejected: {} {}", ex.getStatusCode(), reason);
        return respond(ex.getStatusCode(), reason);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error: " + ex.getMessage());
    }

    private Mono<ResponseEntity<ErrorResponse>> respond(HttpStatusCode status, String detail) {
        ErrorResponse error = ErrorResponse.builder()
                .status(status.value())
                .detail(detail)
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(status).body(error));
    }
}
