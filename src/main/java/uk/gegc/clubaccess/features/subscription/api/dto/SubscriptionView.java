package uk.gegc.clubaccess.features.subscription.api.dto;

import uk.gegc.clubaccess.features.ledger.domain.model.SubscriptionStatus;
import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record SubscriptionView(
        UUID id,
        UUID userId,
        UUID productId,
        UUID tariffId,
        UUID orderId,
        SubscriptionStatus status,
        boolean trial,
        Instant accessStartAt,
        Instant accessEndAt,
        Instant canceledAt,
        Instant cancelAt,
        Instant pausedAt,
        Instant nextChargeAt,
        boolean autoRenew,
        UUID autoRenewChangedBy,
        Instant autoRenewChangedAt,
        String autoRenewChangeReason,
        UUID paymentMethodId,
        int chargeAttempts,
        Map<String, SyncResult> syncResults,
        List<UUID> extendedByOrders,
        Instant createdAt,
        Instant updatedAt
) {
}
