package com.mailflow.domain.model;

/**
 * A record derived from one inbound notification, tagged with that notification's batch token.
 */
public record InboundRecord(BatchToken batchToken, RecordOutcome outcome) {
}
