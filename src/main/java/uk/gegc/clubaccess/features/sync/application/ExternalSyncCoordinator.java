package uk.gegc.clubaccess.features.sync.application;

import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;

import java.util.Map;
import java.util.UUID;

/**
 * Best-effort calls to the community and enrollment providers.
 *
 * <p>Every call carries its own timeout. Failures and timeouts come back as
 * {@link SyncResult#failure(String)}; nothing here throws.
 */
public interface ExternalSyncCoordinator {

    SyncResult grantCommunity(UUID userId, String clubId, int days, String source);

    SyncResult revokeCommunity(UUID userId, String clubId, String reason);

    SyncResult enroll(EnrollmentOrder order, String offerIdentifier, String tariffCode);

    SyncResult cancelEnrollment(UUID orderId, String reason);

    /**
     * Runs the community grant and the enrollment of one grant concurrently.
     *
     * @return results keyed by provider name, community first; skipped providers are absent
     */
    Map<String, SyncResult> syncGrant(GrantSyncRequest request);
}
