package uk.gegc.clubaccess.features.ledger.domain.model;

public enum AccessGrantSource {
    PURCHASE,
    ADMIN_GRANT,
    TRIAL;

    public String wireName() {
        return name().toLowerCase();
    }
}
