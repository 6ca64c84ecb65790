package com.mailflow.application.strategy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailflow.application.port.out.DeliveryClientFactory;
import com.mailflow.application.port.out.MailboxClient;
import com.mailflow.application.service.HistoryResolver;
import com.mailflow.application.service.NotificationDecoder;
import com.mailflow.application.service.SessionState;
import com.mailflow.application.service.WatchPolicy;
import com.mailflow.domain.model.MailFilter;
import com.mailflow.domain.model.ResourceName;
import com.mailflow.domain.model.Subscription;
import com.mailflow.domain.model.SubscriptionMode;
import com.mailflow.infrastructure.config.AppProperties;
import com.mailflow.infrastructure.id.UUIDv7Generator;
import com.mailflow.support.FakeDeliveryClient;
import com.mailflow.support.InMemoryWatchStateStore;
import com.mailflow.support.RecordingMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SubscriptionStrategyFactory")
class SubscriptionStrategyFactoryTest {

    @Mock
    private MailboxClient mailbox;

    @Mock
    private DeliveryClientFactory deliveryClients;

    private SubscriptionStrategyFactory factory;
    private SessionState session;

    @BeforeEach
    void setUp() {
        RecordingMetrics metrics = new RecordingMetrics();
        factory = new SubscriptionStrategyFactory(
            new HistoryResolver(mailbox, metrics),
            mailbox,
            new NotificationDecoder(new ObjectMapper()),
            deliveryClients,
            new InMemoryWatchStateStore(),
            new UUIDv7Generator(),
            metrics,
            List.of(),
            WatchPolicy.defaults("gmail", "mailflow"),
            new AppProperties(),
            Clock.systemUTC());
        session = new SessionState(UUID.randomUUID(), Instant.now(), 0);
    }

    private static Subscription subscription(SubscriptionMode mode, boolean setupWatch) {
        ResourceName topic = ResourceName.parseTopic("projects/acme/topics/mail").getOrThrow();
        return new Subscription("sub", mode, topic, null, MailFilter.DEFAULT, Duration.ofSeconds(5), null,
            setupWatch, false, 0);
    }

    @Test
    @DisplayName("Poll mode gets the polling strategy")
    void pollModeUsesPolling() {
        SubscriptionStrategy strategy = factory.create(subscription(SubscriptionMode.POLL, false), session);

        PollingSubscriptionStrategy polling = assertInstanceOf(PollingSubscriptionStrategy.class, strategy);
        assertEquals(SubscriptionMode.POLL, polling.mode());
        verifyNoInteractions(deliveryClients);
    }

    @Test
    @DisplayName("Push mode gets a notification strategy without a watch unless requested")
    void pushModeUsesNotifications() {
        Subscription subscription = subscription(SubscriptionMode.PUSH, false);
        when(deliveryClients.create(subscription)).thenReturn(new FakeDeliveryClient());

        SubscriptionStrategy strategy = factory.create(subscription, session);

        assertInstanceOf(NotificationSubscriptionStrategy.class, strategy);
        assertEquals(SubscriptionMode.PUSH, strategy.mode());
        assertTrue(strategy.watchRegistration().isEmpty());
    }
}
