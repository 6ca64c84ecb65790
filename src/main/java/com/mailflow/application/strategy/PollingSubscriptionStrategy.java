package com.mailflow.application.strategy;

import com.mailflow.application.service.PollingEngine;
import com.mailflow.domain.model.SubscriptionMode;
import com.mailflow.infrastructure.concurrent.CancellationSignal;

public class PollingSubscriptionStrategy implements SubscriptionStrategy {

    private final PollingEngine engine;
    private final BatchDelivery delivery;

    public PollingSubscriptionStrategy(PollingEngine engine, BatchDelivery delivery) {
        this.engine = engine;
        this.delivery = delivery;
    }

    @Override
    public SubscriptionMode mode() {
        return SubscriptionMode.POLL;
    }

    @Override
    public void run(CancellationSignal cancellation) {
        engine.run(batch -> delivery.deliver(batch, cancellation), cancellation);
    }

    public PollingEngine engine() {
        return engine;
    }
}
