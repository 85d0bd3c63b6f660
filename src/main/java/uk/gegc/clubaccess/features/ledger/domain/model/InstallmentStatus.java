package uk.gegc.clubaccess.features.ledger.domain.model;

public enum InstallmentStatus {
    PENDING,
    SUCCEEDED,
    FAILED,
    CANCELLED
}
