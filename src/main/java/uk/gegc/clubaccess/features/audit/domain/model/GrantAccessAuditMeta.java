package uk.gegc.clubaccess.features.audit.domain.model;

import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;

import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

public record GrantAccessAuditMeta(
        String productName,
        String tariffName,
        LocalDate accessStart,
        LocalDate accessEnd,
        Integer days,
        String comment,
        UUID orderId,
        UUID subscriptionId,
        boolean extended,
        boolean recordOnly,
        Map<String, SyncResult> syncResults
) implements AuditMeta {
}
