package uk.gegc.clubaccess.shared.exception;

import java.util.UUID;

/**
 * Thrown when a lifecycle action is not allowed for the subscription's current state.
 */
public class InvalidSubscriptionStateException extends RuntimeException {

    private final UUID subscriptionId;
    private final String action;
    private final String currentStatus;

    public InvalidSubscriptionStateException(UUID subscriptionId, String action, String currentStatus, String message) {
        super(message);
        this.subscriptionId = subscriptionId;
        this.action = action;
        this.currentStatus = currentStatus;
    }

    public UUID getSubscriptionId() {
        return subscriptionId;
    }

    public String getAction() {
        return action;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }
}
