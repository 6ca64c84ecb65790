package com.mailflow.infrastructure.id;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import com.mailflow.application.port.out.IdGenerator;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Session and watch ids. Version 7 UUIDs sort by creation time, so log lines and
 * persisted watch files order naturally.
 */
@Component
public class UUIDv7Generator implements IdGenerator {

    private final TimeBasedEpochGenerator generator = Generators.timeBasedEpochGenerator();

    @Override
    public UUID generate() {
        return generator.generate();
    }

    /**
     * The top 48 bits of a version 7 UUID are its Unix epoch milliseconds.
     */
    @Override
    public long extractTimestamp(UUID id) {
        if (id.version() != 7) {
            throw new IllegalArgumentException("Not a version 7 UUID: " + id);
        }
        return id.getMostSignificantBits() >>> 16;
    }
}
