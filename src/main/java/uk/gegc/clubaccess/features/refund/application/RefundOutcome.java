package uk.gegc.clubaccess.features.refund.application;

import uk.gegc.clubaccess.features.ledger.domain.model.OrderStatus;
import uk.gegc.clubaccess.features.refund.domain.model.AccessImpactPolicy;
import uk.gegc.clubaccess.features.refund.domain.model.AccessOutcome;
import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record RefundOutcome(
        UUID orderId,
        UUID paymentId,
        BigDecimal amount,
        String currency,
        OrderStatus orderStatus,
        AccessImpactPolicy policy,
        AccessOutcome accessOutcome,
        UUID subscriptionId,
        String providerRefundId,
        Map<String, SyncResult> syncResults,
        List<String> warnings
) {
}
