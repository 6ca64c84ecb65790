package com.mailflow.adapter.in.web;

import com.mailflow.infrastructure.context.RequestContext;
import com.mailflow.infrastructure.exception.InvalidSubscriptionException;
import com.mailflow.infrastructure.exception.MailboxAuthorizationException;
import com.mailflow.infrastructure.exception.MailboxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for unexpected errors.
 * Expected validation outcomes are handled via Result types in controllers.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(e -> e.getField() + ": " + e.getDefaultMessage())
            .orElse("Validation failed");

        log.warn("Validation error: {}", message);
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("VALIDATION_ERROR", message, RequestContext.getRequestId()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("VALIDATION_ERROR", ex.getMessage(), RequestContext.getRequestId()));
    }

    @ExceptionHandler(InvalidSubscriptionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSubscription(InvalidSubscriptionException ex) {
        log.warn("Invalid subscription: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), RequestContext.getRequestId()));
    }

    @ExceptionHandler(MailboxAuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleMailboxAuthorization(MailboxAuthorizationException ex) {
        log.error("Mailbox rejected credentials: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), RequestContext.getRequestId()));
    }

    @ExceptionHandler(MailboxException.class)
    public ResponseEntity<ErrorResponse> handleMailboxUnavailable(MailboxException ex) {
        log.warn("Mailbox unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), RequestContext.getRequestId()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred", RequestContext.getRequestId()));
    }
}
