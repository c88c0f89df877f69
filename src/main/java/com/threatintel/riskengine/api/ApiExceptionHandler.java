package com.threatintel.riskengine.api;

import com.threatintel.riskengine.domain.service.correlation.CorrelationRunAbortedException;
import com.threatintel.riskengine.domain.service.correlation.CorrelationRunInProgressException;
import com.threatintel.riskengine.domain.service.correlation.ThreadNotFoundException;
import com.threatintel.riskengine.domain.service.disagreement.DisagreementNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(CorrelationRunInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleRunInProgress(CorrelationRunInProgressException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "success", false,
                "code", "RUN_IN_PROGRESS",
                "message", ex.getMessage(),
                "retryable", ex.isRetryable()
        ));
    }

    @ExceptionHandler(CorrelationRunAbortedException.class)
    public ResponseEntity<Map<String, Object>> handleRunAborted(CorrelationRunAbortedException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "success", false,
                "code", "RUN_ABORTED",
                "message", ex.getMessage(),
                "retryable", true
        ));
    }

    @ExceptionHandler({ThreadNotFoundException.class, DisagreementNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                "success", false,
                "code", "NOT_FOUND",
                "message", ex.getMessage()
        ));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.warn("[Api] bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "code", "BAD_REQUEST",
                "message", String.valueOf(ex.getMessage())
        ));
    }
}
