package uk.gegc.clubaccess.features.sync.infra;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import uk.gegc.clubaccess.features.sync.application.SyncProperties;
import uk.gegc.clubaccess.shared.exception.ExternalSyncException;

import java.util.Map;
import java.util.UUID;

/**
 * JSON POST with bearer key for one provider. Anything but a 2xx becomes {@link ExternalSyncException}.
 */
class ProviderHttpSupport {

    private final RestTemplate restTemplate;
    private final String providerName;
    private final SyncProperties.Provider config;

    ProviderHttpSupport(RestTemplate restTemplate, String providerName, SyncProperties.Provider config) {
        if (config.getBaseUrl() == null || config.getBaseUrl().isBlank()) {
            throw new IllegalStateException("clubaccess.sync." + providerName + ".base-url is required in http mode");
        }
        this.restTemplate = restTemplate;
        this.providerName = providerName;
        this.config = config;
    }

    void post(String path, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            headers.setBearerAuth(config.getApiKey());
        }
        headers.set("X-Request-ID", UUID.randomUUID().toString());

        String url = stripTrailingSlash(config.getBaseUrl()) + path;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new ExternalSyncException(providerName, "HTTP " + response.getStatusCode().value() + " from " + path);
            }
        } catch (RestClientResponseException e) {
            throw new ExternalSyncException(providerName,
                    "HTTP " + e.getStatusCode().value() + " from " + path + ": " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new ExternalSyncException(providerName, providerName + " unreachable: " + e.getMessage(), e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
