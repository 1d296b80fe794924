package com.bko.delegation.api;

import com.bko.delegation.error.OrchestrationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(OrchestrationException.class)
    public ResponseEntity<ApiError> handleOrchestration(OrchestrationException ex) {
        HttpStatus status = ex.getCode().status();
        if (status.is5xxServerError()) {
            log.warn("Delegation request failed. code={}, sessionId={}, message={}", ex.getCode(), ex.getSessionId(), ex.getMessage());
        } else {
            log.info("Delegation request rejected. code={}, sessionId={}, message={}", ex.getCode(), ex.getSessionId(), ex.getMessage());
        }
        ApiError body = new ApiError(ex.getCode().name(), ex.getMessage(), ex.getSessionId(), ex.getCounters(),
                ex.getRemediation(), Instant.now());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidRequest(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        ApiError body = new ApiError("INVALID_REQUEST", message, null, Map.of(),
                "Correct the request fields and retry.", Instant.now());
        return ResponseEntity.badRequest().body(body);
    }
}
