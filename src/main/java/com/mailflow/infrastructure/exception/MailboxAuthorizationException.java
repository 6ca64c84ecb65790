package com.mailflow.infrastructure.exception;

/**
 * The backend rejected our credentials. No further progress is possible, so this always propagates.
 */
public class MailboxAuthorizationException extends MailflowException {

    public MailboxAuthorizationException(String message, Throwable cause) {
        super("MAILBOX_UNAUTHORIZED", message, cause);
    }

    public MailboxAuthorizationException(String message) {
        super("MAILBOX_UNAUTHORIZED", message);
    }
}
