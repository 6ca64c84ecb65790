package com.mailflow.application.port.out;

import com.mailflow.domain.model.Subscription;

/**
 * Supplies the delivery client matching a subscription's mode.
 */
public interface DeliveryClientFactory {

    /**
     * @throws IllegalArgumentException if the subscription's mode does not use notifications
     */
    DeliveryClient create(Subscription subscription);
}
