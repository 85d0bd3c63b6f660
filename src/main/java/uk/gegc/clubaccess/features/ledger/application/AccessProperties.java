package uk.gegc.clubaccess.features.ledger.application;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults applied by the ledger when an admin grant leaves them open.
 */
@Configuration
@ConfigurationProperties(prefix = "clubaccess.access")
@Validated
@Data
public class AccessProperties {

    /**
     * Currency for grants that do not name one.
     */
    @NotBlank
    private String defaultCurrency = "EUR";

    /**
     * Window length when neither the request nor the tariff gives one.
     */
    @Min(1)
    private int defaultAccessDays = 30;

    /**
     * Auto-renew for newly created subscriptions. Only takes effect when the user has an active payment method.
     */
    private boolean defaultAutoRenew = true;

    /**
     * Provider key stamped on payments created by admin grants.
     */
    @NotBlank
    private String adminPaymentProvider = "manual";
}
