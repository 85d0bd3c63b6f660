package uk.gegc.clubaccess.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import uk.gegc.clubaccess.shared.email.EmailService;
import uk.gegc.clubaccess.shared.email.impl.NoopEmailService;

/**
 * Selects the {@link EmailService} implementation from {@code app.email.provider}.
 *
 * <ul>
 *   <li>smtp: Spring Mail based {@code EmailServiceImpl}, picked up through its own condition</li>
 *   <li>noop: logging only (default)</li>
 * </ul>
 */
@Slf4j
@Configuration
public class EmailProviderConfig {

    @Bean
    @Primary
    @ConditionalOnProperty(name = "app.email.provider", havingValue = "noop", matchIfMissing = true)
    public EmailService noopEmailService() {
        log.info("Activating No-op email service (emails will be logged but not sent)");
        return new NoopEmailService();
    }
}
