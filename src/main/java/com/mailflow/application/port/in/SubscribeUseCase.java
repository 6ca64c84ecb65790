package com.mailflow.application.port.in;

import com.mailflow.domain.error.ValidationError;
import com.mailflow.domain.model.Result;
import com.mailflow.domain.model.Subscription;

import java.util.List;

public interface SubscribeUseCase {

    Result<Subscription, List<ValidationError>> prepare(SubscriptionRequest request);

    /**
     * Runs the subscription on the calling thread until it is cancelled, its end time passes,
     * or a fatal error occurs.
     */
    void run(Subscription subscription);

    boolean cancel();
}
