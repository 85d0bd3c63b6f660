package uk.gegc.clubaccess.features.audit.domain.model;

import java.util.UUID;

/**
 * Typed metadata snapshot attached to an audit record.
 * Every variant carries the identifiers needed to reconstruct the transition.
 */
public interface AuditMeta {

    UUID orderId();

    UUID subscriptionId();
}
