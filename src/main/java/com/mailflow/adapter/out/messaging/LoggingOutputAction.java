package com.mailflow.adapter.out.messaging;

import com.mailflow.application.port.out.OutputAction;
import com.mailflow.domain.model.MailRecord;
import com.mailflow.infrastructure.concurrent.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(0)
public class LoggingOutputAction implements OutputAction {

    private static final Logger log = LoggerFactory.getLogger(LoggingOutputAction.class);

    @Override
    public void emit(List<MailRecord> records, CancellationSignal cancellation) {
        log.info("Received {} new messages", records.size());
        for (MailRecord record : records) {
            log.info("Message: id={}, historyId={}, from={}, subject={}, unread={}",
                record.id(), Long.toUnsignedString(record.historyId()), record.from(), record.subject(), record.unread());
        }
    }
}
