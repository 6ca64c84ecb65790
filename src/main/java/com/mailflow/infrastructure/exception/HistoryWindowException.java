package com.mailflow.infrastructure.exception;

/**
 * The history window itself could not be listed. Per-message fetch failures never raise this.
 */
public class HistoryWindowException extends MailboxException {

    private final long startHistoryId;
    private final boolean expired;

    public HistoryWindowException(long startHistoryId, boolean expired, String message, Throwable cause) {
        super(expired ? "HISTORY_EXPIRED" : "HISTORY_UNAVAILABLE", message, cause);
        this.startHistoryId = startHistoryId;
        this.expired = expired;
    }

    public long getStartHistoryId() {
        return startHistoryId;
    }

    /**
     * True when the start id is older than the history the mailbox retains.
     * Retrying with the same start id cannot succeed; the caller has to re-seed.
     */
    public boolean isExpired() {
        return expired;
    }
}
