package com.rulewise.core.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Utility for managing Rulewise-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String REQUEST_ID = "requestId";
    public static final String RULE_PATH = "rulePath";

    private MdcContext() {}

    /** Starts a pipeline run and returns its generated id. */
    public static String startRequest() {
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        setRequest(requestId);
        return requestId;
    }

    public static void setRequest(String requestId) {
        MDC.put(REQUEST_ID, requestId);
    }

    public static void setRule(String requestId, String rulePath) {
        if (requestId != null) {
            MDC.put(REQUEST_ID, requestId);
        }
        MDC.put(RULE_PATH, rulePath);
    }

    public static String currentRequest() {
        return MDC.get(REQUEST_ID);
    }

    public static void clearRule() {
        MDC.remove(RULE_PATH);
    }

    public static void clear() {
        MDC.remove(REQUEST_ID);
        MDC.remove(RULE_PATH);
    }
}
