package uk.gegc.clubaccess.features.ledger.domain.model;

public enum OrderSource {
    ADMIN_GRANT,
    ADMIN_RECORD_ONLY,
    WEBHOOK
}
