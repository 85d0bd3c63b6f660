package uk.gegc.clubaccess.features.ledger.domain.model;

public enum PaymentMethodStatus {
    ACTIVE,
    REVOKED,
    EXPIRED
}
