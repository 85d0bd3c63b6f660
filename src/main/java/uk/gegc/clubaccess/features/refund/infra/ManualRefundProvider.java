package uk.gegc.clubaccess.features.refund.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.clubaccess.features.ledger.domain.model.Payment;
import uk.gegc.clubaccess.features.refund.application.PaymentRefundProvider;
import uk.gegc.clubaccess.features.refund.application.ProviderRefund;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Offline payments recorded by admins. The money goes back outside this system; only a reference is issued.
 */
@Slf4j
@Component
public class ManualRefundProvider implements PaymentRefundProvider {

    static final String PROVIDER = "manual";

    @Override
    public String providerKey() {
        return PROVIDER;
    }

    @Override
    public ProviderRefund refund(Payment payment, BigDecimal amount, String reason) {
        String reference = "manual-" + UUID.randomUUID();
        log.info("Recorded manual refund {} of {} {} for payment {}", reference, amount, payment.getCurrency(), payment.getId());
        return new ProviderRefund(reference, "succeeded");
    }
}
