package com.mailflow.application.strategy;

import com.mailflow.domain.model.SubscriptionMode;
import com.mailflow.domain.model.WatchRegistration;
import com.mailflow.infrastructure.concurrent.CancellationSignal;

import java.util.Optional;

/**
 * One way of turning mailbox changes into batches for the output action.
 * {@link #run} blocks until the cancellation signal fires or a fatal error occurs.
 */
public interface SubscriptionStrategy {

    SubscriptionMode mode();

    void run(CancellationSignal cancellation);

    default Optional<WatchRegistration> watchRegistration() {
        return Optional.empty();
    }
}
