package com.baykanat.health.store.api.exception;

import com.baykanat.health.store.domain.exception.ErrorCode;
import com.baykanat.health.store.domain.exception.HealthStoreException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** REST hatalarını tek yerde toplar: 400 validasyon, ErrorCode eşlemesi, 500 diğer. */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /** Domain hataları → ErrorCode'a göre status; mesaj sebebi taşır. */
    @ExceptionHandler(HealthStoreException.class)
    public ResponseEntity<Map<String, Object>> handleHealthStoreException(HealthStoreException ex) {
        HttpStatus status = statusOf(ex.getCode());
        if (status.is5xxServerError()) {
            log.error("{}: {}", ex.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("{}: {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status)
                .body(errorBody(status, ex.getCode(), ex.getMessage(), null));
    }

    /** @RequestBody validasyon hataları → 400, alan bazlı detay. */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", error.getField(),
                        "message", error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"
                ))
                .toList();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, null, "Validation failed", fieldErrors));
    }

    /** @RequestParam validasyon hataları → 400. */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(ConstraintViolationException ex) {
        List<Map<String, String>> violations = ex.getConstraintViolations().stream()
                .map(v -> Map.of(
                        "field", v.getPropertyPath().toString(),
                        "message", v.getMessage()
                ))
                .toList();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, null, "Validation failed", violations));
    }

    /** MVC yerleşik method validasyonu → 400. */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<Map<String, Object>> handleMethodValidation(HandlerMethodValidationException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, null, "Validation failed", null));
    }

    /** Eksik zorunlu parametre → 400. */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParam(MissingServletRequestParameterException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, null,
                        "Missing required parameter: " + ex.getParameterName(), null));
    }

    /** Tip uyuşmazlığı (ör. limit=abc) → 400. */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, null, "Invalid value for parameter: " + ex.getName(), null));
    }

    /** Okunamayan JSON gövdesi → 400. */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, null, "Malformed request body", null));
    }

    /** Beklenmeyen hatalar → 500, istemciye jenerik mesaj. */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, null, "An unexpected error occurred", null));
    }

    static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case MALFORMED_DATE, INVALID_TIMESTAMP, INVALID_DATE_FORMAT,
                    QUERY_EXECUTION_FAILED, INVALID_TOOL_ARGUMENTS -> HttpStatus.BAD_REQUEST;
            case PARTITION_NOT_FOUND, UNKNOWN_TOOL -> HttpStatus.NOT_FOUND;
            case STORAGE_WRITE_FAILED, PARTITION_READ_FAILED, INVENTORY_READ_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    /** Ortak hata gövdesi oluşturur. */
    private Map<String, Object> errorBody(HttpStatus status, ErrorCode code, String message, Object details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        if (code != null) {
            body.put("code", code.name());
        }
        body.put("message", message);
        if (details != null) {
            body.put("details", details);
        }
        return body;
    }
}
