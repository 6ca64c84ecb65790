package com.mailflow.application.port.out;

import com.mailflow.domain.model.Envelope;

import java.time.Duration;

/**
 * Port to the messaging backbone that delivers change notifications, by pull or by push.
 * The handler may be invoked concurrently from several threads.
 */
public interface DeliveryClient {

    void start(DeliveryHandler handler);

    /**
     * Stops accepting deliveries and waits up to {@code timeout} for in-flight handlers.
     *
     * @return true if every in-flight handler finished in time
     */
    boolean stop(Duration timeout);

    boolean isRunning();

    @FunctionalInterface
    interface DeliveryHandler {
        AckDecision handle(Envelope envelope);
    }

    enum AckDecision {
        ACK,
        NACK
    }
}
