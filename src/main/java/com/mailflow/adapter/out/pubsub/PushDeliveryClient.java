package com.mailflow.adapter.out.pubsub;

import com.mailflow.application.port.out.DeliveryClient;
import com.mailflow.domain.model.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Delivery client for push subscriptions. Pub/Sub posts to the push endpoint, which hands each
 * envelope over through {@link #deliver}; the handler runs on the request thread.
 */
@Component
public class PushDeliveryClient implements DeliveryClient {

    private static final Logger log = LoggerFactory.getLogger(PushDeliveryClient.class);

    private final Object monitor = new Object();
    private volatile DeliveryHandler handler;
    private int inFlight;

    @Override
    public void start(DeliveryHandler handler) {
        synchronized (monitor) {
            if (this.handler != null) {
                throw new IllegalStateException("Push delivery already started");
            }
            this.handler = handler;
        }
        log.info("Accepting push notifications");
    }

    /**
     * Stops accepting pushes and waits for handlers already running.
     */
    @Override
    public boolean stop(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (monitor) {
            if (handler == null) {
                return true;
            }
            handler = null;
            try {
                while (inFlight > 0) {
                    long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
                    if (remainingMillis <= 0) {
                        log.warn("{} push notifications still in flight after {}", inFlight, timeout);
                        return false;
                    }
                    monitor.wait(remainingMillis);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        log.info("Stopped accepting push notifications");
        return true;
    }

    @Override
    public boolean isRunning() {
        return handler != null;
    }

    /**
     * @return the handler's decision, or empty when no listener is running
     */
    public Optional<AckDecision> deliver(Envelope envelope) {
        DeliveryHandler current;
        synchronized (monitor) {
            current = handler;
            if (current == null) {
                return Optional.empty();
            }
            inFlight++;
        }
        try {
            return Optional.of(current.handle(envelope));
        } finally {
            synchronized (monitor) {
                inFlight--;
                monitor.notifyAll();
            }
        }
    }
}
