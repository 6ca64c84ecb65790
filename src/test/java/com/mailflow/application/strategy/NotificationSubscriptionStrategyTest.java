package com.mailflow.application.strategy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailflow.application.port.out.MailboxClient;
import com.mailflow.application.service.HistoryResolver;
import com.mailflow.application.service.NotificationDecoder;
import com.mailflow.application.service.NotificationListener;
import com.mailflow.application.service.SessionState;
import com.mailflow.application.service.WatchLifecycleManager;
import com.mailflow.application.service.WatchPolicy;
import com.mailflow.domain.model.HistoryEntry;
import com.mailflow.domain.model.HistoryPage;
import com.mailflow.domain.model.MailFilter;
import com.mailflow.domain.model.MailRecord;
import com.mailflow.domain.model.ResourceName;
import com.mailflow.domain.model.Subscription;
import com.mailflow.domain.model.SubscriptionMode;
import com.mailflow.domain.model.WatchGrant;
import com.mailflow.domain.model.Watermarks;
import com.mailflow.infrastructure.concurrent.CancellationSignal;
import com.mailflow.infrastructure.exception.MailboxAuthorizationException;
import com.mailflow.infrastructure.id.UUIDv7Generator;
import com.mailflow.support.FakeDeliveryClient;
import com.mailflow.support.InMemoryWatchStateStore;
import com.mailflow.support.MailFixtures;
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
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationSubscriptionStrategy")
class NotificationSubscriptionStrategyTest {

    private static final ResourceName TOPIC = ResourceName.parseTopic("projects/acme/topics/mail").getOrThrow();
    private static final ResourceName SUBSCRIPTION =
        ResourceName.parseSubscription("projects/acme/subscriptions/mail-sub").getOrThrow();

    @Mock
    private MailboxClient mailbox;

    private RecordingMetrics metrics;
    private FakeDeliveryClient deliveryClient;
    private List<List<MailRecord>> emitted;
    private CancellationSignal cancellation;

    @BeforeEach
    void setUp() {
        metrics = new RecordingMetrics();
        deliveryClient = new FakeDeliveryClient();
        emitted = new CopyOnWriteArrayList<>();
        cancellation = CancellationSignal.create();
    }

    private NotificationSubscriptionStrategy strategy(SessionState session, boolean setupWatch) {
        Subscription subscription = new Subscription("sub", SubscriptionMode.PULL, TOPIC, SUBSCRIPTION,
            MailFilter.DEFAULT, null, null, setupWatch, false, session.currentWatermark());
        NotificationListener listener = new NotificationListener(deliveryClient,
            new NotificationDecoder(new ObjectMapper()), new HistoryResolver(mailbox, metrics), session, metrics,
            MailFilter.DEFAULT, Duration.ofSeconds(1));
        WatchLifecycleManager watchManager = setupWatch
            ? new WatchLifecycleManager(mailbox, new InMemoryWatchStateStore(), new UUIDv7Generator(), metrics,
                WatchPolicy.defaults("gmail", "mailflow"), Clock.systemUTC())
            : null;
        BatchDelivery delivery = new BatchDelivery(List.of((records, c) -> emitted.add(records)), metrics);
        return new NotificationSubscriptionStrategy(subscription, session, listener, watchManager, delivery, metrics);
    }

    private Thread runInBackground(NotificationSubscriptionStrategy strategy, AtomicReference<Throwable> failure) {
        Thread runner = new Thread(() -> {
            try {
                strategy.run(cancellation);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        runner.start();
        return runner;
    }

    @Test
    @DisplayName("Should deliver each notification's matched records as one batch until cancelled")
    void shouldDeliverBatchesUntilCancelled() throws InterruptedException {
        // Given
        SessionState session = new SessionState(UUID.randomUUID(), Instant.now(), 100);
        when(mailbox.listHistory(100, null)).thenReturn(new HistoryPage(List.of(
            new HistoryEntry(120, List.of("m1")),
            new HistoryEntry(145, List.of("m2"))), null, 145));
        when(mailbox.getMessage(anyString())).thenAnswer(inv -> MailFixtures.record(inv.getArgument(0), 1));
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread runner = runInBackground(strategy(session, false), failure);
        await().atMost(Duration.ofSeconds(5)).until(deliveryClient::isRunning);

        // When
        deliveryClient.deliverNotification(150);
        await().atMost(Duration.ofSeconds(5)).until(() -> emitted.size() == 1);
        cancellation.cancel("test done");
        runner.join(5000);

        // Then
        assertFalse(runner.isAlive());
        assertNull(failure.get());
        assertEquals(List.of("m1", "m2"), emitted.get(0).stream().map(MailRecord::id).toList());
        assertTrue(deliveryClient.isStopped());
        assertEquals(2, metrics.recordsEmitted.get());
    }

    @Test
    @DisplayName("Should seed the watermark from a new watch and stop the watch at the end")
    void shouldSeedFromWatchAndStopIt() throws InterruptedException {
        // Given
        SessionState session = new SessionState(UUID.randomUUID(), Instant.now(), Watermarks.NONE);
        when(mailbox.createWatch(anyString(), anyList()))
            .thenReturn(new WatchGrant(1000, Instant.now().plus(Duration.ofDays(7))));
        AtomicReference<Throwable> failure = new AtomicReference<>();
        NotificationSubscriptionStrategy strategy = strategy(session, true);

        // When
        Thread runner = runInBackground(strategy, failure);
        await().atMost(Duration.ofSeconds(5)).until(deliveryClient::isRunning);

        // Then
        assertEquals(1000, session.currentWatermark());
        assertTrue(strategy.watchRegistration().isPresent());
        cancellation.cancel("test done");
        runner.join(5000);
        assertNull(failure.get());
        verify(mailbox).stopWatch();
    }

    @Test
    @DisplayName("Should end the run with the authorization failure")
    void shouldRethrowAuthorizationFailure() throws InterruptedException {
        SessionState session = new SessionState(UUID.randomUUID(), Instant.now(), 100);
        when(mailbox.listHistory(anyLong(), any())).thenThrow(new MailboxAuthorizationException("revoked"));
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread runner = runInBackground(strategy(session, false), failure);
        await().atMost(Duration.ofSeconds(5)).until(deliveryClient::isRunning);

        deliveryClient.deliverNotification(150);
        runner.join(5000);

        assertFalse(runner.isAlive());
        assertInstanceOf(MailboxAuthorizationException.class, failure.get());
        assertTrue(emitted.isEmpty());
        assertEquals(1, metrics.recordFailures.get());
    }
}
