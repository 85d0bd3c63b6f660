package uk.gegc.clubaccess.features.sync.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the community and enrollment provider adapters.
 */
@Configuration
@ConfigurationProperties(prefix = "clubaccess.sync")
@Validated
@Data
public class SyncProperties {

    /**
     * Upper bound for one provider call, connect and response included.
     */
    @Min(1)
    private long timeoutMs = 10_000;

    @Min(1)
    private long connectTimeoutMs = 3_000;

    @Valid
    private Provider community = new Provider();

    @Valid
    private Provider enrollment = new Provider();

    @Data
    public static class Provider {

        /**
         * {@code http} calls the provider API, {@code noop} only logs.
         */
        @Pattern(regexp = "http|noop")
        private String mode = "noop";

        private String baseUrl;

        private String apiKey;
    }
}
