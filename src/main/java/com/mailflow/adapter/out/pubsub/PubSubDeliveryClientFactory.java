package com.mailflow.adapter.out.pubsub;

import com.mailflow.application.port.out.AccessTokenProvider;
import com.mailflow.application.port.out.DeliveryClient;
import com.mailflow.application.port.out.DeliveryClientFactory;
import com.mailflow.domain.model.Subscription;
import com.mailflow.infrastructure.config.AppProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class PubSubDeliveryClientFactory implements DeliveryClientFactory {

    private final RestClient.Builder restClientBuilder;
    private final AccessTokenProvider tokens;
    private final PushDeliveryClient pushDeliveryClient;
    private final AppProperties appProperties;

    public PubSubDeliveryClientFactory(
            RestClient.Builder restClientBuilder,
            AccessTokenProvider tokens,
            PushDeliveryClient pushDeliveryClient,
            AppProperties appProperties) {
        this.restClientBuilder = restClientBuilder;
        this.tokens = tokens;
        this.pushDeliveryClient = pushDeliveryClient;
        this.appProperties = appProperties;
    }

    @Override
    public DeliveryClient create(Subscription subscription) {
        return switch (subscription.mode()) {
            case PULL -> new PubSubPullDeliveryClient(restClientBuilder.clone(), tokens,
                subscription.subscriptionName(), appProperties.getPubsub());
            case PUSH -> pushDeliveryClient;
            case POLL -> throw new IllegalArgumentException("Poll subscriptions do not use a delivery client");
        };
    }
}
