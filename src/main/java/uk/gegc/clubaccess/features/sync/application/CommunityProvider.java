package uk.gegc.clubaccess.features.sync.application;

import java.util.UUID;

/**
 * Community (chat club) membership provider.
 * Implementations throw {@link uk.gegc.clubaccess.shared.exception.ExternalSyncException} on any failure.
 */
public interface CommunityProvider {

    void grantAccess(UUID userId, String clubId, int durationDays, String source);

    void revokeAccess(UUID userId, String clubId, String reason);
}
