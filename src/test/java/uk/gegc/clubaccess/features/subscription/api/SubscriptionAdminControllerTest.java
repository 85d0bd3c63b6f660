package uk.gegc.clubaccess.features.subscription.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;
import uk.gegc.clubaccess.features.subscription.application.SubscriptionActionCommand;
import uk.gegc.clubaccess.features.subscription.application.SubscriptionActionResult;
import uk.gegc.clubaccess.features.subscription.application.SubscriptionLifecycleService;
import uk.gegc.clubaccess.features.subscription.domain.model.SubscriptionAction;
import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;
import uk.gegc.clubaccess.shared.config.SecurityConfig;
import uk.gegc.clubaccess.shared.exception.InvalidSubscriptionStateException;
import uk.gegc.clubaccess.shared.exception.ResourceNotFoundException;
import uk.gegc.clubaccess.shared.security.ActorRef;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SubscriptionAdminController.class)
@Import(SecurityConfig.class)
class SubscriptionAdminControllerTest {

    private static final UUID ADMIN_ID = UUID.randomUUID();

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SubscriptionLifecycleService lifecycleService;

    @MockitoBean
    private JwtDecoder jwtDecoder;

    @Test
    @DisplayName("POST actions: extend as admin returns the result with warnings")
    void apply_extend_returnsResult() throws Exception {
        UUID subscriptionId = UUID.randomUUID();
        when(lifecycleService.apply(eq(subscriptionId), any(SubscriptionActionCommand.class), eq(ActorRef.admin(ADMIN_ID))))
                .thenReturn(new SubscriptionActionResult(null, false,
                        Map.of("community", SyncResult.failure("club not found")),
                        List.of("community_sync_failed: club not found")));

        mockMvc.perform(post("/api/v1/admin/subscriptions/{id}/actions", subscriptionId)
                        .with(adminJwt())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"extend\",\"days\":30}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(false))
                .andExpect(jsonPath("$.syncResults.community.success").value(false))
                .andExpect(jsonPath("$.warnings[0]").value("community_sync_failed: club not found"));

        verify(lifecycleService).apply(eq(subscriptionId),
                eq(new SubscriptionActionCommand(SubscriptionAction.EXTEND, 30, null, null, null)),
                eq(ActorRef.admin(ADMIN_ID)));
    }

    @Test
    @DisplayName("POST actions: zero days is rejected before the service")
    void apply_zeroDays_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/admin/subscriptions/{id}/actions", UUID.randomUUID())
                        .with(adminJwt())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"extend\",\"days\":0}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(lifecycleService);
    }

    @Test
    @DisplayName("POST actions: unknown action name is a bad request")
    void apply_unknownAction_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/admin/subscriptions/{id}/actions", UUID.randomUUID())
                        .with(adminJwt())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"teleport\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST actions: action not allowed in the current state is a conflict")
    void apply_invalidState_conflict() throws Exception {
        UUID subscriptionId = UUID.randomUUID();
        when(lifecycleService.apply(eq(subscriptionId), any(), any()))
                .thenThrow(new InvalidSubscriptionStateException(subscriptionId, "cancel", "CANCELLED",
                        "Subscription is already cancelled"));

        mockMvc.perform(post("/api/v1/admin/subscriptions/{id}/actions", subscriptionId)
                        .with(adminJwt())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"cancel\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.currentStatus").value("CANCELLED"))
                .andExpect(jsonPath("$.action").value("cancel"));
    }

    @Test
    @DisplayName("GET subscription: unknown id is not found")
    void get_unknown_notFound() throws Exception {
        UUID subscriptionId = UUID.randomUUID();
        when(lifecycleService.getSubscription(subscriptionId))
                .thenThrow(ResourceNotFoundException.of("Subscription", subscriptionId));

        mockMvc.perform(get("/api/v1/admin/subscriptions/{id}", subscriptionId).with(adminJwt()))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("non-admin token is forbidden")
    void apply_nonAdmin_forbidden() throws Exception {
        mockMvc.perform(post("/api/v1/admin/subscriptions/{id}/actions", UUID.randomUUID())
                        .with(jwt().authorities(new SimpleGrantedAuthority("ROLE_USER")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"cancel\"}"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(lifecycleService);
    }

    @Test
    @DisplayName("missing token is unauthorized")
    void get_anonymous_unauthorized() throws Exception {
        mockMvc.perform(get("/api/v1/admin/subscriptions/{id}", UUID.randomUUID()))
                .andExpect(status().isUnauthorized());
    }

    private static RequestPostProcessor adminJwt() {
        return jwt().jwt(token -> token.subject(ADMIN_ID.toString()))
                .authorities(new SimpleGrantedAuthority("ROLE_ADMIN"));
    }
}
