package com.mailflow.infrastructure.exception;

import com.mailflow.domain.error.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Subscription configuration failed validation. Raised before any background work starts.
 */
public class InvalidSubscriptionException extends MailflowException {

    private final List<ValidationError> errors;

    public InvalidSubscriptionException(List<ValidationError> errors) {
        super(errors.isEmpty() ? "INVALID_SUBSCRIPTION" : errors.get(0).code(),
            errors.stream().map(ValidationError::message).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}
