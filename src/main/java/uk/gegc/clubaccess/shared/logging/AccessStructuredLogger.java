package uk.gegc.clubaccess.shared.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;
import uk.gegc.clubaccess.shared.security.ActorRef;

import java.util.UUID;

/**
 * Structured logging utility for access workflows.
 * Puts the workflow identifiers into the MDC for one log line and clears them afterwards.
 */
public class AccessStructuredLogger {

    public static final String ACTOR_ID = "access.actorId";
    public static final String USER_ID = "access.userId";
    public static final String ORDER_ID = "access.orderId";
    public static final String SUBSCRIPTION_ID = "access.subscriptionId";
    public static final String ACTION = "access.action";

    private AccessStructuredLogger() {
    }

    /**
     * Log a completed (or failed) access workflow step.
     */
    public static void logAccessOperation(Logger logger, String level, String message,
                                          ActorRef actor, String action, UUID userId,
                                          UUID orderId, UUID subscriptionId, Object... additionalArgs) {
        MDC.put(ACTOR_ID, actor != null ? actor.describe() : null);
        MDC.put(ACTION, action);
        MDC.put(USER_ID, userId != null ? userId.toString() : null);
        MDC.put(ORDER_ID, orderId != null ? orderId.toString() : null);
        MDC.put(SUBSCRIPTION_ID, subscriptionId != null ? subscriptionId.toString() : null);

        try {
            switch (level.toLowerCase()) {
                case "warn" -> logger.warn(message, additionalArgs);
                case "error" -> logger.error(message, additionalArgs);
                case "debug" -> logger.debug(message, additionalArgs);
                default -> logger.info(message, additionalArgs);
            }
        } finally {
            clearAccessMDC();
        }
    }

    /**
     * Log one external provider call outcome.
     */
    public static void logSyncOperation(Logger logger, String level, String message,
                                        String provider, String operation, UUID userId, Object... additionalArgs) {
        MDC.put(USER_ID, userId != null ? userId.toString() : null);
        MDC.put(ACTION, "sync." + provider + "." + operation);

        try {
            switch (level.toLowerCase()) {
                case "warn" -> logger.warn(message, additionalArgs);
                case "error" -> logger.error(message, additionalArgs);
                case "debug" -> logger.debug(message, additionalArgs);
                default -> logger.info(message, additionalArgs);
            }
        } finally {
            clearAccessMDC();
        }
    }

    public static void clearAccessMDC() {
        MDC.remove(ACTOR_ID);
        MDC.remove(USER_ID);
        MDC.remove(ORDER_ID);
        MDC.remove(SUBSCRIPTION_ID);
        MDC.remove(ACTION);
    }
}
