package com.mailflow.infrastructure.exception;

/**
 * Base type for unexpected failures. Expected outcomes are modelled with
 * {@link com.mailflow.domain.model.Result} instead.
 */
public abstract class MailflowException extends RuntimeException {

    private final String errorCode;

    protected MailflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected MailflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the operation may succeed if attempted again on a later cycle.
     */
    public boolean isRetryable() {
        return false;
    }
}
