package uk.gegc.clubaccess.features.refund.application;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Stripe configuration properties for refunds.
 */
@Configuration
@ConfigurationProperties(prefix = "stripe")
@Validated
@Data
public class StripeProperties {

    /** Secret API key (server-side). Refunds through Stripe fail while it is unset. */
    private String secretKey;

    @Min(100)
    private int connectTimeoutMs = 5000;

    @Min(100)
    private int readTimeoutMs = 15000;
}
