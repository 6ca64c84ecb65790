package com.mailflow.integration.e2e;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailflow.application.port.in.GetSubscriptionStatusUseCase;
import com.mailflow.application.port.in.SubscribeUseCase;
import com.mailflow.application.port.in.SubscriptionRequest;
import com.mailflow.application.port.in.SubscriptionRequest.FilterOptions;
import com.mailflow.application.port.out.MailboxClient;
import com.mailflow.domain.model.HistoryEntry;
import com.mailflow.domain.model.HistoryPage;
import com.mailflow.domain.model.Subscription;
import com.mailflow.domain.model.SubscriptionStatus;
import com.mailflow.integration.base.FullStackTestBase;
import com.mailflow.support.MailFixtures;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.TestPropertySource;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

/**
 * Integration tests for a polling subscription.
 * Verifies the flow: mailbox history -> resolver -> session watermark -> Kafka
 */
@SpringBootTest
@EnabledIf("isDockerAvailable")
@TestPropertySource(properties = {
    "app.output.kafka.enabled=true",
    "app.output.kafka.topic=" + PollingSubscriptionIntegrationTest.TOPIC
})
@DisplayName("Polling Subscription E2E Tests")
@SuppressWarnings("removal")
class PollingSubscriptionIntegrationTest extends FullStackTestBase {

    static final String TOPIC = "mailflow.it.records";

    @MockBean
    private MailboxClient mailboxClient;

    @Autowired
    private SubscribeUseCase subscribeUseCase;

    @Autowired
    private GetSubscriptionStatusUseCase getSubscriptionStatusUseCase;

    @Autowired
    private ObjectMapper objectMapper;

    private CompletableFuture<Void> running;

    @AfterEach
    void tearDown() throws Exception {
        subscribeUseCase.cancel();
        if (running != null) {
            running.get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    @DisplayName("Messages added after the starting history id are published once, watermark advances")
    void shouldPublishNewMessagesAndAdvanceWatermark() throws Exception {
        // Given
        when(mailboxClient.listHistory(anyLong(), any())).thenReturn(new HistoryPage(List.of(), null, 150L));
        when(mailboxClient.listHistory(eq(100L), isNull())).thenReturn(new HistoryPage(List.of(
            new HistoryEntry(120L, List.of("m1")),
            new HistoryEntry(150L, List.of("m2"))
        ), null, 150L));
        when(mailboxClient.getMessage("m1"))
            .thenReturn(MailFixtures.record("m1", 120L, "alice@example.com", "Report", List.of("INBOX", "UNREAD")));
        when(mailboxClient.getMessage("m2"))
            .thenReturn(MailFixtures.record("m2", 150L, "bob@example.com", "Invoice", List.of("INBOX")));

        Subscription subscription = subscribeUseCase.prepare(new SubscriptionRequest(
            "it-poll", "poll", null, null, Duration.ofMillis(200), null, false, false, "100",
            FilterOptions.none())).getOrThrow();

        // When
        running = CompletableFuture.runAsync(() -> subscribeUseCase.run(subscription));

        // Then
        await().atMost(Duration.ofSeconds(10)).until(() -> getSubscriptionStatusUseCase.getStatus().isPresent());
        String sessionId = getSubscriptionStatusUseCase.getStatus().orElseThrow().sessionId().toString();

        List<ConsumerRecord<String, String>> published = new CopyOnWriteArrayList<>();
        try (KafkaConsumer<String, String> consumer = newConsumer()) {
            consumer.subscribe(List.of(TOPIC));
            await().atMost(Duration.ofSeconds(30)).until(() -> {
                consumer.poll(Duration.ofMillis(500)).forEach(record -> {
                    if (sessionId.equals(header(record, "sessionId"))) {
                        published.add(record);
                    }
                });
                return published.size() >= 2;
            });
        }

        assertEquals(List.of("m1", "m2"), published.stream().map(ConsumerRecord::key).sorted().toList());
        ConsumerRecord<String, String> first = published.stream()
            .filter(record -> "m1".equals(record.key()))
            .findFirst()
            .orElseThrow();
        JsonNode payload = objectMapper.readTree(first.value());
        assertEquals("120", payload.get("historyId").asText());
        assertEquals("alice@example.com", payload.get("from").asText());
        assertFalse(payload.has("body"));
        assertEquals("120", header(first, "historyId"));

        SubscriptionStatus status = getSubscriptionStatusUseCase.getStatus().orElseThrow();
        assertTrue(status.running());
        assertEquals(150L, status.watermark());
        assertEquals("it-poll", status.name());
    }

    private static String header(ConsumerRecord<String, String> record, String key) {
        var header = record.headers().lastHeader(key);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }

    private static KafkaConsumer<String, String> newConsumer() {
        return new KafkaConsumer<>(Map.of(
            ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers(),
            ConsumerConfig.GROUP_ID_CONFIG, "mailflow-it-" + UUID.randomUUID(),
            ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest",
            ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class,
            ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class
        ));
    }
}
