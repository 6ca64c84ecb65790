package com.mailflow.application.port.in;

import com.mailflow.domain.model.WatchKey;
import com.mailflow.domain.model.WatchRegistration;

import java.util.Optional;

public interface ManageWatchUseCase {

    Optional<WatchRegistration> getWatch(WatchKey key);

    /**
     * Stops the account's watch remotely and clears its persisted state, whoever created it.
     *
     * @return whether a registration was persisted for the key
     */
    boolean cancelWatch(WatchKey key);
}
