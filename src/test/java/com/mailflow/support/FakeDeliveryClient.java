package com.mailflow.support;

import com.mailflow.application.port.out.DeliveryClient;
import com.mailflow.domain.model.Envelope;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivery client driven by the test: envelopes are handed to the handler on the calling thread.
 */
public class FakeDeliveryClient implements DeliveryClient {

    private final AtomicInteger messageIds = new AtomicInteger();
    private volatile DeliveryHandler handler;
    private volatile boolean stopped;

    @Override
    public void start(DeliveryHandler handler) {
        this.handler = handler;
    }

    @Override
    public boolean stop(Duration timeout) {
        stopped = true;
        handler = null;
        return true;
    }

    @Override
    public boolean isRunning() {
        return handler != null;
    }

    public boolean isStopped() {
        return stopped;
    }

    public AckDecision deliver(String data) {
        DeliveryHandler current = handler;
        if (current == null) {
            throw new IllegalStateException("Delivery client is not running");
        }
        return current.handle(new Envelope("msg-" + messageIds.incrementAndGet(), data, Map.of(), Instant.now()));
    }

    public AckDecision deliverNotification(long historyId) {
        String json = "{\"emailAddress\":\"me@example.com\",\"historyId\":" + Long.toUnsignedString(historyId) + "}";
        return deliver(Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8)));
    }
}
