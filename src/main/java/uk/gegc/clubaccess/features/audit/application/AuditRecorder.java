package uk.gegc.clubaccess.features.audit.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.clubaccess.features.audit.api.dto.AuditRecordDto;
import uk.gegc.clubaccess.features.audit.domain.model.AuditMeta;
import uk.gegc.clubaccess.shared.security.ActorRef;

import java.util.UUID;

public interface AuditRecorder {

    /**
     * Appends one audit record. Never throws: a failed write is logged and the workflow carries on.
     *
     * @return {@code true} when the record was stored
     */
    boolean record(ActorRef actor, String action, UUID targetUserId, AuditMeta meta);

    Page<AuditRecordDto> findByTargetUser(UUID targetUserId, Pageable pageable);
}
