package uk.gegc.clubaccess.features.sync.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import uk.gegc.clubaccess.features.sync.application.CommunityProvider;
import uk.gegc.clubaccess.features.sync.application.SyncProperties;
import uk.gegc.clubaccess.features.sync.domain.model.SyncProviders;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "clubaccess.sync.community", name = "mode", havingValue = "http")
public class HttpCommunityProvider implements CommunityProvider {

    private final ProviderHttpSupport http;

    public HttpCommunityProvider(@Qualifier("syncRestTemplate") RestTemplate restTemplate, SyncProperties properties) {
        this.http = new ProviderHttpSupport(restTemplate, SyncProviders.COMMUNITY, properties.getCommunity());
        log.info("Community provider: HTTP at {}", properties.getCommunity().getBaseUrl());
    }

    @Override
    public void grantAccess(UUID userId, String clubId, int durationDays, String source) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", userId.toString());
        body.put("clubId", clubId);
        body.put("durationDays", durationDays);
        body.put("source", source);
        http.post("/members/grant", body);
    }

    @Override
    public void revokeAccess(UUID userId, String clubId, String reason) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", userId.toString());
        body.put("clubId", clubId);
        body.put("reason", reason);
        http.post("/members/revoke", body);
    }
}
