package uk.gegc.clubaccess.shared.exception;

/**
 * The payment provider did not confirm a refund. Raised before any ledger or access change.
 */
public class RefundProviderException extends RuntimeException {

    private final String provider;

    public RefundProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public RefundProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
