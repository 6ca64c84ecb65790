package com.mailflow.infrastructure.context;

import com.mailflow.domain.model.BatchToken;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-bound subscription session and batch being processed, mirrored into the MDC
 * as {@code sessionId} and {@code batchId}.
 */
public final class SessionContext {

    private static final String SESSION_ID_KEY = "sessionId";
    private static final String BATCH_ID_KEY = "batchId";

    private static final ThreadLocal<UUID> currentSessionId = new ThreadLocal<>();
    private static final ThreadLocal<BatchToken> currentBatch = new ThreadLocal<>();

    private SessionContext() {}

    public static void set(UUID sessionId) {
        currentSessionId.set(sessionId);
        MDC.put(SESSION_ID_KEY, sessionId.toString());
    }

    public static void set(UUID sessionId, BatchToken batchToken) {
        set(sessionId);
        currentBatch.set(batchToken);
        MDC.put(BATCH_ID_KEY, batchToken.toString());
    }

    public static UUID getSessionId() {
        return currentSessionId.get();
    }

    public static BatchToken getBatchToken() {
        return currentBatch.get();
    }

    public static void clearBatch() {
        currentBatch.remove();
        MDC.remove(BATCH_ID_KEY);
    }

    public static void clear() {
        currentSessionId.remove();
        currentBatch.remove();
        MDC.remove(SESSION_ID_KEY);
        MDC.remove(BATCH_ID_KEY);
    }
}
