package uk.gegc.clubaccess.features.ledger.domain.model;

public enum PaymentStatus {
    PENDING,
    PROCESSING,
    SUCCEEDED,
    FAILED,
    REFUNDED,
    CANCELED
}
