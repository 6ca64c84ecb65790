package com.mailflow.domain.model;

/**
 * Result of resolving one added message: it matched the filter, it was filtered out,
 * or it could not be fetched or decoded.
 */
public sealed interface RecordOutcome permits RecordOutcome.Matched, RecordOutcome.Filtered, RecordOutcome.Failed {

    record Matched(MailRecord record) implements RecordOutcome {
    }

    record Filtered(MailRecord record) implements RecordOutcome {
    }

    record Failed(String reason, Throwable cause) implements RecordOutcome {

        public static Failed of(String reason) {
            return new Failed(reason, null);
        }
    }

    static RecordOutcome classify(MailRecord record, MailFilter filter) {
        return filter == null || filter.matches(record) ? new Matched(record) : new Filtered(record);
    }
}
