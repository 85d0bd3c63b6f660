package uk.gegc.clubaccess.features.refund.infra;

import com.stripe.StripeClient;
import com.stripe.exception.StripeException;
import com.stripe.model.Refund;
import com.stripe.net.RequestOptions;
import com.stripe.param.RefundCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.clubaccess.features.ledger.domain.model.Payment;
import uk.gegc.clubaccess.features.refund.application.PaymentRefundProvider;
import uk.gegc.clubaccess.features.refund.application.ProviderRefund;
import uk.gegc.clubaccess.shared.exception.RefundProviderException;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Slf4j
@Component
public class StripeRefundProvider implements PaymentRefundProvider {

    static final String PROVIDER = "stripe";

    @Autowired(required = false)
    private StripeClient stripeClient;

    StripeRefundProvider() {
    }

    StripeRefundProvider(StripeClient stripeClient) {
        this.stripeClient = stripeClient;
    }

    @Override
    public String providerKey() {
        return PROVIDER;
    }

    @Override
    public ProviderRefund refund(Payment payment, BigDecimal amount, String reason) {
        if (stripeClient == null) {
            throw new RefundProviderException(PROVIDER, "Stripe is not configured");
        }
        if (!StringUtils.hasText(payment.getProviderPaymentId())) {
            throw new RefundProviderException(PROVIDER, "Payment " + payment.getId() + " has no Stripe payment intent");
        }

        RefundCreateParams params = RefundCreateParams.builder()
                .setPaymentIntent(payment.getProviderPaymentId())
                .setAmount(toMinorUnits(amount))
                .setReason(RefundCreateParams.Reason.REQUESTED_BY_CUSTOMER)
                .putMetadata("paymentId", payment.getId().toString())
                .putMetadata("orderId", payment.getOrderId().toString())
                .putMetadata("reason", reason)
                .build();
        // keyed on payment, refunded-so-far and amount
        RequestOptions options = RequestOptions.builder()
                .setIdempotencyKey("refund-" + payment.getId() + "-" + payment.getRefundedAmount().toPlainString()
                        + "-" + amount.toPlainString())
                .build();

        try {
            Refund refund = stripeClient.refunds().create(params, options);
            log.info("Created Stripe refund id={} status={} for payment={} amount={}",
                    refund.getId(), refund.getStatus(), payment.getId(), amount);
            return new ProviderRefund(refund.getId(), refund.getStatus());
        } catch (StripeException e) {
            log.error("Stripe refund failed for payment={} amount={}: {}", payment.getId(), amount, e.getMessage());
            throw new RefundProviderException(PROVIDER, "Stripe refund failed: " + e.getMessage(), e);
        }
    }

    static long toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }
}
