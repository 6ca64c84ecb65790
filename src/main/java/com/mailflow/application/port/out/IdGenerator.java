package com.mailflow.application.port.out;

import java.util.UUID;

/**
 * Port for generating session and subscription identifiers.
 */
public interface IdGenerator {

    /**
     * Generates a new time-ordered identifier (UUIDv7).
     */
    UUID generate();

    /**
     * Extracts the creation time from a time-based UUID, in milliseconds since epoch.
     */
    long extractTimestamp(UUID id);
}
