package com.mailflow.application.port.in;

import com.mailflow.domain.model.SubscriptionStatus;

import java.util.Optional;

public interface GetSubscriptionStatusUseCase {
    Optional<SubscriptionStatus> getStatus();
}
