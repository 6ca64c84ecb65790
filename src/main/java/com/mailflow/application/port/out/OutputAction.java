package com.mailflow.application.port.out;

import com.mailflow.domain.model.MailRecord;
import com.mailflow.infrastructure.concurrent.CancellationSignal;

import java.util.List;

/**
 * Receives every non-empty batch of matched records, whichever strategy produced it.
 */
@FunctionalInterface
public interface OutputAction {

    void emit(List<MailRecord> records, CancellationSignal cancellation);
}
