package uk.gegc.clubaccess.features.grant.domain.model;

public enum GrantMode {
    /**
     * Order, payment and a new or extended subscription, followed by provider sync.
     */
    GRANT_ACCESS,
    /**
     * Order and payment only. No subscription and no provider calls.
     */
    RECORD_ONLY
}
