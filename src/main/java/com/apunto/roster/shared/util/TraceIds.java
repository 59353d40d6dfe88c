package com.apunto.roster.shared.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Helpers for the MDC keys shared by the HTTP layer and the sync pipeline.
 */
public final class TraceIds {

    public static final String TRACE_ID = "traceId";
    public static final String USER_ID = "userId";

    private TraceIds() {
    }

    /**
     * Returns the trace id bound to the current thread, creating one when absent.
     */
    public static String current() {
        String existing = MDC.get(TRACE_ID);
        if (existing != null && !existing.isBlank()) {
            return existing;
        }
        String generated = UUID.randomUUID().toString();
        MDC.put(TRACE_ID, generated);
        return generated;
    }
}
