package uk.gegc.clubaccess.features.grant.application;

import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * @param paymentId      {@code null} when granting for an existing order
 * @param subscriptionId {@code null} in record-only mode
 * @param extended       an open subscription was extended instead of creating a new one
 */
public record GrantOutcome(
        UUID orderId,
        String orderNumber,
        UUID paymentId,
        UUID subscriptionId,
        boolean extended,
        Instant accessStartAt,
        Instant accessEndAt,
        Map<String, SyncResult> syncResults,
        List<String> warnings
) {
}
