package uk.gegc.clubaccess.shared.exception;

/**
 * Failure of a community or enrollment provider call.
 * Never reaches the API: the sync coordinator turns it into a failed sync result.
 */
public class ExternalSyncException extends RuntimeException {

    private final String provider;

    public ExternalSyncException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ExternalSyncException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
