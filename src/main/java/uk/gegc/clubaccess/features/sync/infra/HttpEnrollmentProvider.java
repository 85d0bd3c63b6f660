package uk.gegc.clubaccess.features.sync.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import uk.gegc.clubaccess.features.sync.application.EnrollmentOrder;
import uk.gegc.clubaccess.features.sync.application.EnrollmentProvider;
import uk.gegc.clubaccess.features.sync.application.SyncProperties;
import uk.gegc.clubaccess.features.sync.domain.model.SyncProviders;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "clubaccess.sync.enrollment", name = "mode", havingValue = "http")
public class HttpEnrollmentProvider implements EnrollmentProvider {

    private final ProviderHttpSupport http;

    public HttpEnrollmentProvider(@Qualifier("syncRestTemplate") RestTemplate restTemplate, SyncProperties properties) {
        this.http = new ProviderHttpSupport(restTemplate, SyncProviders.ENROLLMENT, properties.getEnrollment());
        log.info("Enrollment provider: HTTP at {}", properties.getEnrollment().getBaseUrl());
    }

    @Override
    public void enroll(EnrollmentOrder order, String offerIdentifier, String tariffCode) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("orderId", order.orderId().toString());
        body.put("orderNumber", order.orderNumber());
        body.put("userId", order.userId() != null ? order.userId().toString() : null);
        body.put("amount", order.amount());
        body.put("currency", order.currency());
        if (offerIdentifier != null && !offerIdentifier.isBlank()) {
            body.put("offerId", offerIdentifier);
        } else {
            body.put("tariffCode", tariffCode);
        }
        http.post("/enrollments", body);
    }

    @Override
    public void cancel(UUID orderId, String reason) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reason", reason);
        http.post("/enrollments/" + orderId + "/cancel", body);
    }
}
