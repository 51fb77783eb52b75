package com.expirebot.expiry.web;

import com.expirebot.expiry.appservice.AppserviceAuthenticationException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AppserviceAuthenticationException.class)
    public ResponseEntity<MatrixErrorResponse> handleAuthentication(AppserviceAuthenticationException ex) {
        log.warn("Rejected appservice request: {}", ex.getMessage());
        if (ex.isTokenPresent()) {
            return build(HttpStatus.FORBIDDEN, "M_FORBIDDEN", ex.getMessage());
        }
        return build(HttpStatus.UNAUTHORIZED, "M_UNAUTHORIZED", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<MatrixErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return build(HttpStatus.BAD_REQUEST, "M_NOT_JSON", "Request body is not a valid transaction");
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<MatrixErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
        return build(HttpStatus.BAD_REQUEST, "M_INVALID_PARAM", ex.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<MatrixErrorResponse> handleDataAccess(DataAccessException ex) {
        log.error("Database unavailable while handling request", ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "M_UNKNOWN", "Database temporarily unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<MatrixErrorResponse> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "M_UNKNOWN", "Unexpected error");
    }

    private ResponseEntity<MatrixErrorResponse> build(HttpStatus status, String errcode, String message) {
        String traceId = RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null);
        return ResponseEntity.status(status).body(new MatrixErrorResponse(errcode, message, traceId));
    }
}
