package uk.gegc.clubaccess.features.audit.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record AuditRecordDto(
        UUID id,
        UUID actorId,
        String actorType,
        String action,
        UUID targetUserId,
        Instant createdAt,
        JsonNode meta
) {
}
