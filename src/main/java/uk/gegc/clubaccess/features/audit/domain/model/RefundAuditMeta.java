package uk.gegc.clubaccess.features.audit.domain.model;

import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

public record RefundAuditMeta(
        UUID orderId,
        UUID paymentId,
        UUID subscriptionId,
        BigDecimal amount,
        String currency,
        String reason,
        String policy,
        Integer reduceDays,
        String accessOutcome,
        String orderStatus,
        String providerRefundId,
        Map<String, SyncResult> syncResults
) implements AuditMeta {
}
