package org.caureq.caureqalertdesk.api.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqalertdesk.engine.ConditionEvaluationException;
import org.caureq.caureqalertdesk.engine.InvalidStateException;
import org.caureq.caureqalertdesk.engine.NotFoundException;
import org.caureq.caureqalertdesk.engine.StoreUnavailableException;
import org.caureq.caureqalertdesk.jobs.SweepInProgressException;
import org.caureq.caureqalertdesk.service.DuplicateRuleException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private ApiError build(ErrorCode code, String msg, String cid, Map<String,Object> details) {
        return new ApiError(Instant.now(), code, msg, cid, details);
    }

    private String cid(HttpServletRequest req) {
        return req.getHeader("X-Correlation-Id");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
                                                     HttpServletRequest req) {
        var fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> Map.of("field", e.getField(), "message", String.valueOf(e.getDefaultMessage())))
                .toList();
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Validation error", cid(req), Map.of("fieldErrors", fieldErrors))
        );
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Malformed request: " + ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException ex, HttpServletRequest req) {
        var code = switch (ex.resource()) {
            case "alert" -> ErrorCode.ALERT_NOT_FOUND;
            case "rule" -> ErrorCode.RULE_NOT_FOUND;
            default -> ErrorCode.NOT_FOUND;
        };
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                build(code, ex.getMessage(), cid(req), Map.of("id", ex.id()))
        );
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ApiError> handleInvalidState(InvalidStateException ex, HttpServletRequest req) {
        var details = new LinkedHashMap<String, Object>();
        details.put("alertId", ex.alertId());
        details.put("currentStatus", String.valueOf(ex.current()));
        if (ex.requested() != null) details.put("requestedStatus", ex.requested().name());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                build(ErrorCode.INVALID_TRANSITION, ex.getMessage(), cid(req), details)
        );
    }

    @ExceptionHandler(DuplicateRuleException.class)
    public ResponseEntity<ApiError> handleDuplicate(DuplicateRuleException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                build(ErrorCode.RULE_CONFLICT, ex.getMessage(), cid(req), Map.of("ruleId", ex.ruleId()))
        );
    }

    @ExceptionHandler(SweepInProgressException.class)
    public ResponseEntity<ApiError> handleSweepRunning(SweepInProgressException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                build(ErrorCode.SWEEP_RUNNING, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ApiError> handleConcurrentUpdate(OptimisticLockingFailureException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                build(ErrorCode.CONCURRENT_UPDATE, "alert was modified concurrently, retry", cid(req), Map.of())
        );
    }

    @ExceptionHandler(ConditionEvaluationException.class)
    public ResponseEntity<ApiError> handleBadRule(ConditionEvaluationException ex, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.INVALID_RULE, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiError> handleStore(StoreUnavailableException ex, HttpServletRequest req) {
        log.warn("[Api] store unavailable on {} {}: {}", req.getMethod(), req.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                build(ErrorCode.STORE_UNAVAILABLE, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArg(IllegalArgumentException ex,
                                                     HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
                build(ErrorCode.BAD_REQUEST, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex, HttpServletRequest req) {
        log.error("[Api] unhandled error on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.INTERNAL_ERROR, ex.getMessage(), cid(req), Map.of())
        );
    }
}
