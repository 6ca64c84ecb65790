package com.mailflow.adapter.out.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailflow.application.port.out.OutputAction;
import com.mailflow.domain.model.BatchToken;
import com.mailflow.domain.model.MailRecord;
import com.mailflow.infrastructure.concurrent.CancellationSignal;
import com.mailflow.infrastructure.config.AppProperties;
import com.mailflow.infrastructure.context.SessionContext;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Publishes each matched record to Kafka, keyed by message id. Message bodies are not published.
 */
@Component
@Order(1)
@ConditionalOnProperty(prefix = "app.output.kafka", name = "enabled", havingValue = "true")
public class KafkaOutputAction implements OutputAction {

    private static final Logger log = LoggerFactory.getLogger(KafkaOutputAction.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public KafkaOutputAction(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            AppProperties appProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
    }

    @Override
    public void emit(List<MailRecord> records, CancellationSignal cancellation) {
        String topic = appProperties.getOutput().getKafka().getTopic();
        for (MailRecord record : records) {
            publish(topic, record);
        }
        log.debug("Published {} records to {}", records.size(), topic);
    }

    private void publish(String topic, MailRecord record) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(MailRecordMessage.from(record));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize message " + record.id(), e);
        }

        ProducerRecord<String, String> producerRecord = new ProducerRecord<>(topic, null, record.id(), payload);
        producerRecord.headers().add(new RecordHeader("recordId", bytes(record.id())));
        producerRecord.headers().add(new RecordHeader("historyId", bytes(Long.toUnsignedString(record.historyId()))));
        UUID sessionId = SessionContext.getSessionId();
        if (sessionId != null) {
            producerRecord.headers().add(new RecordHeader("sessionId", bytes(sessionId.toString())));
        }
        BatchToken batch = SessionContext.getBatchToken();
        if (batch != null) {
            producerRecord.headers().add(new RecordHeader("batchId", bytes(batch.toString())));
        }

        kafkaTemplate.send(producerRecord);
        log.debug("Published record: id={}, historyId={}", record.id(), Long.toUnsignedString(record.historyId()));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    public record MailRecordMessage(
        String id,
        String threadId,
        String historyId,
        String from,
        String to,
        String subject,
        String snippet,
        List<String> labels,
        boolean unread,
        Instant date
    ) {
        public static MailRecordMessage from(MailRecord record) {
            return new MailRecordMessage(
                record.id(),
                record.threadId(),
                Long.toUnsignedString(record.historyId()),
                record.from(),
                record.to(),
                record.subject(),
                record.snippet(),
                record.labels(),
                record.unread(),
                record.date()
            );
        }
    }
}
