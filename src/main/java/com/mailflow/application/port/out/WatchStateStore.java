package com.mailflow.application.port.out;

import com.mailflow.domain.model.WatchKey;
import com.mailflow.domain.model.WatchRegistration;

import java.util.Optional;

/**
 * Durable storage of the one watch registration per (service, application) key.
 * Only a single manager instance per key is expected to write at a time.
 */
public interface WatchStateStore {

    Optional<WatchRegistration> load(WatchKey key);

    void save(WatchRegistration registration);

    void clear(WatchKey key);
}
