package com.mailflow.application.strategy;

import com.mailflow.application.port.out.MetricsPort;
import com.mailflow.application.port.out.OutputAction;
import com.mailflow.domain.model.MailRecord;
import com.mailflow.infrastructure.concurrent.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Hands matched records to every output action. Empty batches are skipped and a failing
 * action does not keep the others from receiving the batch.
 */
public class BatchDelivery {

    private static final Logger log = LoggerFactory.getLogger(BatchDelivery.class);

    private final List<OutputAction> outputs;
    private final MetricsPort metrics;

    public BatchDelivery(List<OutputAction> outputs, MetricsPort metrics) {
        this.outputs = List.copyOf(outputs);
        this.metrics = metrics;
    }

    public void deliver(List<MailRecord> records, CancellationSignal cancellation) {
        if (records.isEmpty()) {
            return;
        }
        for (OutputAction output : outputs) {
            try {
                output.emit(records, cancellation);
            } catch (RuntimeException e) {
                log.error("Output action {} failed for {} records: {}",
                    output.getClass().getSimpleName(), records.size(), e.getMessage(), e);
            }
        }
        metrics.incrementRecordsEmitted(records.size());
    }
}
