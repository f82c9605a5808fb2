package com.chambua.standings.exception;

import com.chambua.standings.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps failures to {@link ApiError} bodies so callers can tell "retry later" from "fix your input" from
 * "contact an operator".
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(StandingsException.class)
    public ResponseEntity<ApiError> handleStandings(StandingsException e, HttpServletRequest request) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.error("[Api] {} {} -> {} {}", request.getMethod(), request.getRequestURI(), e.getCode(), e.getMessage());
        } else {
            log.info("[Api] {} {} -> {} {}", request.getMethod(), request.getRequestURI(), e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ApiError(e.getCode(), e.getCategory().name(), e.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception e, HttpServletRequest request) {
        return ResponseEntity.badRequest()
                .body(new ApiError("INVALID_REQUEST", ErrorCategory.FIX_INPUT.name(), e.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleStatus(ResponseStatusException e, HttpServletRequest request) {
        return fromErrorResponse(e, e.getReason(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception e, HttpServletRequest request) {
        if (e instanceof ErrorResponse) {
            // framework errors such as 404 for unknown paths or 405 keep their status
            return fromErrorResponse((ErrorResponse) e, e.getMessage(), request);
        }
        log.error("[Api] {} {} failed", request.getMethod(), request.getRequestURI(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("INTERNAL_ERROR", ErrorCategory.CONTACT_OPERATOR.name(), e.getMessage(), request.getRequestURI()));
    }

    private static ResponseEntity<ApiError> fromErrorResponse(ErrorResponse e, String message, HttpServletRequest request) {
        HttpStatusCode status = e.getStatusCode();
        ErrorCategory category = status.is5xxServerError() ? ErrorCategory.CONTACT_OPERATOR : ErrorCategory.FIX_INPUT;
        return ResponseEntity.status(status)
                .body(new ApiError("HTTP_" + status.value(), category.name(), message, request.getRequestURI()));
    }

    static HttpStatus statusOf(StandingsException e) {
        if (e instanceof InvalidMatchDataException) return HttpStatus.BAD_REQUEST;
        if (e instanceof TransientStoreException) return HttpStatus.SERVICE_UNAVAILABLE;
        if (e instanceof QueueOverloadException) return HttpStatus.TOO_MANY_REQUESTS;
        if (e instanceof SnapshotNotFoundException || e instanceof JobNotFoundException) return HttpStatus.NOT_FOUND;
        if (e instanceof InvalidJobStateException) return HttpStatus.CONFLICT;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
