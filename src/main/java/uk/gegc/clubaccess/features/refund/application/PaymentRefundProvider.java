package uk.gegc.clubaccess.features.refund.application;

import uk.gegc.clubaccess.features.ledger.domain.model.Payment;

import java.math.BigDecimal;

/**
 * Returns money through the provider that took the payment.
 */
public interface PaymentRefundProvider {

    /**
     * Matches {@link Payment#getProvider()}.
     */
    String providerKey();

    /**
     * @throws uk.gegc.clubaccess.shared.exception.RefundProviderException when the provider rejects or does not answer
     */
    ProviderRefund refund(Payment payment, BigDecimal amount, String reason);
}
