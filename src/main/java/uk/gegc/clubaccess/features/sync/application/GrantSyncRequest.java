package uk.gegc.clubaccess.features.sync.application;

import java.util.UUID;

/**
 * Provider calls of one grant. A {@code null} club or enrollment order skips that provider.
 */
public record GrantSyncRequest(
        UUID userId,
        String clubId,
        int communityDays,
        String source,
        EnrollmentOrder enrollmentOrder,
        String offerIdentifier,
        String tariffCode
) {

    public boolean hasCommunity() {
        return clubId != null && !clubId.isBlank();
    }

    public boolean hasEnrollment() {
        return enrollmentOrder != null;
    }
}
