package com.baykanat.insider.warehouse.api.exception;

import com.baykanat.insider.warehouse.domain.exception.QueryValidationException;
import com.baykanat.insider.warehouse.domain.exception.RefreshFailureException;
import com.baykanat.insider.warehouse.domain.exception.StatementTimeoutException;
import com.baykanat.insider.warehouse.domain.exception.UnknownJobException;
import com.baykanat.insider.warehouse.domain.exception.UnknownQueryException;
import com.baykanat.insider.warehouse.domain.exception.UnknownViewException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** REST hatalarını tek yerde toplar: 400 validasyon, 404 bilinmeyen isim, 504 timeout, 503 refresh, 500 diğer. */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final int REFRESH_RETRY_AFTER_SECONDS = 60;

    /** Bilinmeyen sorgu → 404 (QueryValidationException alt tipi olduğu için önce yakalanır). */
    @ExceptionHandler(UnknownQueryException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownQuery(UnknownQueryException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(errorBody(HttpStatus.NOT_FOUND, ex.getMessage(), null));
    }

    @ExceptionHandler({UnknownViewException.class, UnknownJobException.class})
    public ResponseEntity<Map<String, Object>> handleUnknownName(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(errorBody(HttpStatus.NOT_FOUND, ex.getMessage(), null));
    }

    /** Parametre/sayfalama hataları → 400, alan bazlı detay. */
    @ExceptionHandler(QueryValidationException.class)
    public ResponseEntity<Map<String, Object>> handleQueryValidation(QueryValidationException ex) {
        List<Map<String, String>> violations = ex.getViolations().entrySet().stream()
                .map(entry -> Map.of("field", entry.getKey(), "message", entry.getValue()))
                .toList();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, ex.getMessage(), violations.isEmpty() ? null : violations));
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
                .body(errorBody(HttpStatus.BAD_REQUEST, "Validation failed", fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, "Malformed request body", null));
    }

    /** Statement timeout → 504. */
    @ExceptionHandler(StatementTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleStatementTimeout(StatementTimeoutException ex) {
        log.warn("Statement timeout: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(errorBody(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage(), null));
    }

    /** View refresh başarısız → 503 + Retry-After; önceki içerik hâlâ okunabilir. */
    @ExceptionHandler(RefreshFailureException.class)
    public ResponseEntity<Map<String, Object>> handleRefreshFailure(RefreshFailureException ex) {
        log.error("Refresh failed: {}", ex.getMessage());

        HttpHeaders headers = new HttpHeaders();
        headers.set("Retry-After", String.valueOf(REFRESH_RETRY_AFTER_SECONDS));

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .headers(headers)
                .body(errorBody(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), Map.of("views", ex.getViewNames())));
    }

    /** Beklenmeyen hatalar → 500, istemciye jenerik mesaj. */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", null));
    }

    private Map<String, Object> errorBody(HttpStatus status, String message, Object details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        if (details != null) {
            body.put("details", details);
        }
        return body;
    }
}
