package uk.gegc.clubaccess.features.refund.infra;

import com.stripe.StripeClient;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.clubaccess.features.refund.application.StripeProperties;

/**
 * Stripe client configuration. The client exists only when a secret key is configured.
 */
@Configuration
@RequiredArgsConstructor
public class StripeClientConfig {

    private final StripeProperties stripe;

    @Bean
    @ConditionalOnProperty(name = "stripe.secret-key")
    public StripeClient stripeClient() {
        return StripeClient.builder()
                .setApiKey(stripe.getSecretKey())
                .setConnectTimeout(stripe.getConnectTimeoutMs())
                .setReadTimeout(stripe.getReadTimeoutMs())
                .setMaxNetworkRetries(0)
                .build();
    }
}
