package uk.gegc.clubaccess.features.ledger.domain.model;

public enum OrderStatus {
    DRAFT,
    PENDING,
    PAID,
    PARTIAL,
    CANCELLED,
    REFUNDED,
    EXPIRED,
    FAILED;

    public boolean isRefundable() {
        return this == PAID || this == PARTIAL;
    }
}
