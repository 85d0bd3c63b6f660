package uk.gegc.clubaccess.features.audit.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of one admin-initiated state change.
 */
@Entity
@Immutable
@Table(name = "audit_records", indexes = {
        @Index(name = "idx_audit_records_target_user", columnList = "target_user_id, created_at")
})
@Getter
@Setter
@NoArgsConstructor
public class AuditRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * {@code null} for system-initiated changes.
     */
    @Column(name = "actor_id", updatable = false)
    private UUID actorId;

    @Column(name = "actor_type", nullable = false, updatable = false, length = 16)
    private String actorType;

    @Column(name = "action", nullable = false, updatable = false, length = 100)
    private String action;

    @Column(name = "target_user_id", updatable = false)
    private UUID targetUserId;

    @Column(name = "meta", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String meta;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
