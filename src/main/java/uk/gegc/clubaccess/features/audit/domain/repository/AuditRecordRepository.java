package uk.gegc.clubaccess.features.audit.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.clubaccess.features.audit.domain.model.AuditRecord;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditRecordRepository extends JpaRepository<AuditRecord, UUID> {

    /**
     * Audit trail of one user, newest first.
     */
    Page<AuditRecord> findByTargetUserIdOrderByCreatedAtDesc(UUID targetUserId, Pageable pageable);

    List<AuditRecord> findByActionOrderByCreatedAtDesc(String action);
}
