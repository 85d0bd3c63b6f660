package uk.gegc.clubaccess.features.sync.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import uk.gegc.clubaccess.features.sync.application.SyncProperties;

import java.time.Duration;

/**
 * HTTP client shared by the provider adapters. Connect and read timeouts come from {@link SyncProperties}.
 */
@Slf4j
@Configuration
public class SyncHttpClientConfig {

    @Bean(name = "syncRestTemplate")
    public RestTemplate syncRestTemplate(RestTemplateBuilder builder, SyncProperties properties) {
        log.info("Sync RestTemplate configured - connect timeout: {} ms, read timeout: {} ms",
                properties.getConnectTimeoutMs(), properties.getTimeoutMs());
        return builder
                .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(properties.getTimeoutMs()))
                .build();
    }
}
