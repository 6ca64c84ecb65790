package com.mailflow.adapter.out.pubsub;

import com.mailflow.domain.model.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Builds {@link Envelope}s from the message fields Pub/Sub sends on both the pull and the push path.
 */
public final class Envelopes {

    private static final Logger log = LoggerFactory.getLogger(Envelopes.class);

    private Envelopes() {}

    public static Envelope of(String messageId, String data, Map<String, String> attributes, String publishTime) {
        return new Envelope(messageId, data == null ? "" : data, attributes, parsePublishTime(publishTime));
    }

    private static Instant parsePublishTime(String publishTime) {
        if (publishTime == null || publishTime.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(publishTime);
        } catch (DateTimeParseException e) {
            log.debug("Unparsable publishTime '{}'", publishTime);
            return null;
        }
    }
}
