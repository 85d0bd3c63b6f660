package uk.gegc.clubaccess.features.refund.application;

/**
 * Confirmation of a refund by the payment provider.
 */
public record ProviderRefund(String refundId, String status) {
}
