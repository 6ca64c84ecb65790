package com.mailflow.infrastructure.exception;

/**
 * Transient failure talking to the mailbox or messaging backend.
 * Retried on the next poll or notification rather than surfaced as fatal.
 */
public class MailboxException extends MailflowException {

    public MailboxException(String message, Throwable cause) {
        super("MAILBOX_UNAVAILABLE", message, cause);
    }

    public MailboxException(String message) {
        super("MAILBOX_UNAVAILABLE", message);
    }

    protected MailboxException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
