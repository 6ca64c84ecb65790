package com.mailflow.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * A message as delivered by the messaging backbone, before its payload is decoded.
 */
public record Envelope(
    String messageId,
    String data,
    Map<String, String> attributes,
    Instant publishTime
) {
    public Envelope {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
