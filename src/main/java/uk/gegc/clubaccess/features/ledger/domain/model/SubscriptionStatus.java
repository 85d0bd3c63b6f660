package uk.gegc.clubaccess.features.ledger.domain.model;

/**
 * Stored subscription status. "Cancelled but still running" is not a status of its own:
 * it is an ACTIVE or TRIAL subscription with a cancellation timestamp.
 */
public enum SubscriptionStatus {
    ACTIVE,
    TRIAL,
    EXPIRED,
    CANCELLED,
    PAUSED;

    public boolean isLive() {
        return this == ACTIVE || this == TRIAL;
    }
}
