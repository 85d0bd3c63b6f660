package uk.gegc.clubaccess.features.audit.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.clubaccess.features.audit.api.dto.AuditRecordDto;
import uk.gegc.clubaccess.features.audit.application.AuditRecorder;
import uk.gegc.clubaccess.features.audit.domain.model.AuditMeta;
import uk.gegc.clubaccess.features.audit.domain.model.AuditRecord;
import uk.gegc.clubaccess.features.audit.domain.repository.AuditRecordRepository;
import uk.gegc.clubaccess.shared.security.ActorRef;

import java.time.Clock;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuditRecorderImpl implements AuditRecorder {

    private final AuditRecordRepository auditRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean record(ActorRef actor, String action, UUID targetUserId, AuditMeta meta) {
        try {
            ActorRef effective = actor != null ? actor : ActorRef.system();
            AuditRecord audit = new AuditRecord();
            audit.setActorId(effective.actorId());
            audit.setActorType(effective.actorType());
            audit.setAction(action);
            audit.setTargetUserId(targetUserId);
            audit.setMeta(objectMapper.writeValueAsString(meta));
            audit.setCreatedAt(clock.instant());

            auditRepository.saveAndFlush(audit);
            log.info("Audit logged: {} on user {} by {} (order {}, subscription {})",
                    action, targetUserId, effective.describe(),
                    meta != null ? meta.orderId() : null,
                    meta != null ? meta.subscriptionId() : null);
            return true;
        } catch (Exception e) {
            log.error("Failed to log {} audit for user {}: {}", action, targetUserId, e.getMessage(), e);
            // Don't throw exception to avoid breaking the main operation
            return false;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Page<AuditRecordDto> findByTargetUser(UUID targetUserId, Pageable pageable) {
        return auditRepository.findByTargetUserIdOrderByCreatedAtDesc(targetUserId, pageable)
                .map(this::toDto);
    }

    private AuditRecordDto toDto(AuditRecord audit) {
        return new AuditRecordDto(
                audit.getId(),
                audit.getActorId(),
                audit.getActorType(),
                audit.getAction(),
                audit.getTargetUserId(),
                audit.getCreatedAt(),
                readMeta(audit));
    }

    private JsonNode readMeta(AuditRecord audit) {
        try {
            return objectMapper.readTree(audit.getMeta());
        } catch (JsonProcessingException e) {
            log.warn("Audit record {} has unreadable meta: {}", audit.getId(), e.getOriginalMessage());
            return objectMapper.getNodeFactory().textNode(audit.getMeta());
        }
    }
}
