package uk.gegc.clubaccess.features.audit.domain.model;

import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record SubscriptionActionAuditMeta(
        UUID subscriptionId,
        UUID orderId,
        String action,
        Integer days,
        LocalDate newEndDate,
        Instant previousAccessEnd,
        Instant accessEnd,
        Boolean autoRenew,
        String reason,
        Map<String, SyncResult> syncResults,
        boolean deleted,
        List<String> warnings
) implements AuditMeta {
}
