package uk.gegc.clubaccess.features.sync.application;

import java.util.UUID;

/**
 * External course platform the buyer is enrolled into.
 * Implementations throw {@link uk.gegc.clubaccess.shared.exception.ExternalSyncException} on any failure.
 */
public interface EnrollmentProvider {

    /**
     * @param offerIdentifier provider-specific offer id, preferred when present
     * @param tariffCode      raw fallback code
     */
    void enroll(EnrollmentOrder order, String offerIdentifier, String tariffCode);

    void cancel(UUID orderId, String reason);
}
