package com.switchboard.core.logging;

import org.slf4j.MDC;

/**
 * Switchboard MDC keys for structured logging. Callers clear in a finally block.
 */
public final class MdcContext {

    public static final String OPERATION_ID = "operationId";
    public static final String USER_ID = "userId";
    public static final String STAGE = "stage";

    private MdcContext() {}

    public static void setOperation(String operationId, String userId) {
        put(OPERATION_ID, operationId);
        put(USER_ID, userId);
    }

    public static void setStage(String stage) {
        put(STAGE, stage);
    }

    public static void clearStage() {
        MDC.remove(STAGE);
    }

    public static void clear() {
        MDC.remove(OPERATION_ID);
        MDC.remove(USER_ID);
        MDC.remove(STAGE);
    }

    private static void put(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
