package uk.gegc.clubaccess.features.refund.domain.model;

/**
 * What a refund does to the access bought with the order.
 */
public enum AccessImpactPolicy {
    /**
     * End access now. Only for full refunds.
     */
    REVOKE,
    /**
     * Shorten access by a number of days.
     */
    REDUCE,
    /**
     * Keep access unchanged. Only for partial refunds.
     */
    KEEP,
    /**
     * Keep access and the order status unchanged, even when the refund completes the order.
     */
    KEEP_SUBSCRIPTION
}
