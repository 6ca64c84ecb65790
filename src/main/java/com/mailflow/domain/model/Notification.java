package com.mailflow.domain.model;

/**
 * Change notification published by the mailbox: which account changed and the history id
 * the mailbox had reached when it published.
 */
public record Notification(String emailAddress, long historyId) {
}
