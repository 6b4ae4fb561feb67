package com.motionflow.orchestrator.api;

import com.motionflow.orchestrator.lifecycle.ConcurrencyConflictException;
import com.motionflow.orchestrator.lifecycle.IllegalTransitionException;
import com.motionflow.orchestrator.lifecycle.OrderNotFoundException;
import com.motionflow.orchestrator.refund.InvalidRefundOverrideException;
import com.motionflow.orchestrator.routing.LookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps domain exceptions to HTTP responses.
 *
 * 404 unknown order, 409 stale version or disallowed transition, 400 bad
 * input, 500 for routing misconfiguration and anything unexpected.
 */
@RestControllerAdvice
class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(OrderNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(OrderNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "OrderNotFound", ex.getMessage());
    }

    /** Stale expectedVersion. The client refetches and retries. */
    @ExceptionHandler(ConcurrencyConflictException.class)
    ResponseEntity<ApiError> handleConflict(ConcurrencyConflictException ex) {
        log.info("Version conflict on order {}: {}", ex.orderId(), ex.getMessage());
        return error(HttpStatus.CONFLICT, "ConcurrencyConflict", ex.getMessage());
    }

    @ExceptionHandler(IllegalTransitionException.class)
    ResponseEntity<ApiError> handleIllegalTransition(IllegalTransitionException ex) {
        return error(HttpStatus.CONFLICT, "IllegalTransition", ex.getMessage());
    }

    @ExceptionHandler({InvalidRefundOverrideException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleBadInput(RuntimeException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "ValidationFailed", detail);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
                       MethodArgumentTypeMismatchException.class,
                       MissingServletRequestParameterException.class})
    ResponseEntity<ApiError> handleMalformed(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "MalformedRequest", ex.getMessage());
    }

    /** A phase/tier pair with no route means the deployment is misconfigured. */
    @ExceptionHandler(LookupException.class)
    ResponseEntity<ApiError> handleLookup(LookupException ex) {
        log.error("Routing lookup failed: {}", ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "RoutingMisconfigured", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String detail) {
        return ResponseEntity.status(status)
                .body(new ApiError(code, status.getReasonPhrase(), detail, Instant.now()));
    }

    record ApiError(String error, String message, String detail, Instant timestamp) {}
}
