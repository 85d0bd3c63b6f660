package uk.gegc.clubaccess.features.ledger.domain.model;

public enum AccessGrantStatus {
    PENDING,
    ACTIVE,
    FAILED,
    REVOKED
}
