package uk.gegc.clubaccess.features.sync.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.clubaccess.features.sync.application.CommunityProvider;

import java.util.UUID;

/**
 * Logs community calls without contacting any provider. Default for local development.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "clubaccess.sync.community", name = "mode", havingValue = "noop", matchIfMissing = true)
public class NoopCommunityProvider implements CommunityProvider {

    @Override
    public void grantAccess(UUID userId, String clubId, int durationDays, String source) {
        log.info("[NOOP] Would grant club {} to user {} for {} day(s), source {}", clubId, userId, durationDays, source);
    }

    @Override
    public void revokeAccess(UUID userId, String clubId, String reason) {
        log.info("[NOOP] Would revoke club {} from user {}: {}", clubId, userId, reason);
    }
}
