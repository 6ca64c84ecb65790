package com.mailflow.infrastructure.context;

import org.slf4j.MDC;

public final class RequestContext {

    private static final String REQUEST_ID_KEY = "requestId";

    private static final ThreadLocal<String> currentRequestId = new ThreadLocal<>();

    private RequestContext() {}

    public static void set(String requestId) {
        currentRequestId.set(requestId);
        MDC.put(REQUEST_ID_KEY, requestId);
    }

    public static String getRequestId() {
        return currentRequestId.get();
    }

    public static void clear() {
        currentRequestId.remove();
        MDC.remove(REQUEST_ID_KEY);
    }
}
