package com.flagship.player_progression.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the service.
 *
 * The correlation id arrives on HTTP requests (or is generated) and on Kafka
 * message headers, and is printed by the log pattern together with the
 * player currently being mutated.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String PLAYER_ID_MDC_KEY = "playerId";
    public static final String MATCH_ID_MDC_KEY = "matchId";
    public static final String OPERATION_MDC_KEY = "operation";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Tags the current thread's log lines with the player and operation being
     * executed. The tags stay in place while a failure propagates, so the
     * error handler can log them; {@link CorrelationIdFilter} and the Kafka
     * listener clear them once the request or record is done.
     */
    public static void enterPlayerScope(Long playerId, String operation) {
        if (playerId != null) {
            MDC.put(PLAYER_ID_MDC_KEY, playerId.toString());
        }
        MDC.put(OPERATION_MDC_KEY, operation);
    }

    public static void clearPlayerScope() {
        MDC.remove(PLAYER_ID_MDC_KEY);
        MDC.remove(OPERATION_MDC_KEY);
    }
}
