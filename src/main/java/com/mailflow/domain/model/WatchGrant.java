package com.mailflow.domain.model;

import java.time.Instant;

/**
 * What the mailbox returns when a watch is created: the history id at creation time
 * and when the watch lapses. {@code expiration} may be null when the backend omits it.
 */
public record WatchGrant(long historyId, Instant expiration) {
}
