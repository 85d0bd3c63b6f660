package uk.gegc.clubaccess.shared.exception;

/**
 * Thrown when a second open subscription would exist for the same user, product and tariff.
 */
public class SubscriptionConflictException extends RuntimeException {

    private final String openKey;

    public SubscriptionConflictException(String openKey, String message) {
        super(message);
        this.openKey = openKey;
    }

    public SubscriptionConflictException(String openKey, String message, Throwable cause) {
        super(message, cause);
        this.openKey = openKey;
    }

    public String getOpenKey() {
        return openKey;
    }
}
