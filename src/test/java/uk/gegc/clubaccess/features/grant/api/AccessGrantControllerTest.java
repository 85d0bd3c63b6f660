package uk.gegc.clubaccess.features.grant.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;
import uk.gegc.clubaccess.features.grant.application.AccessGrantService;
import uk.gegc.clubaccess.features.grant.application.GrantAccessCommand;
import uk.gegc.clubaccess.features.grant.application.GrantForOrderCommand;
import uk.gegc.clubaccess.features.grant.application.GrantOutcome;
import uk.gegc.clubaccess.features.grant.domain.model.GrantMode;
import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;
import uk.gegc.clubaccess.shared.config.SecurityConfig;
import uk.gegc.clubaccess.shared.exception.SubscriptionConflictException;
import uk.gegc.clubaccess.shared.security.ActorRef;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AccessGrantController.class)
@Import(SecurityConfig.class)
class AccessGrantControllerTest {

    private static final UUID ADMIN_ID = UUID.randomUUID();

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AccessGrantService accessGrantService;

    @MockitoBean
    private JwtDecoder jwtDecoder;

    @Test
    @DisplayName("POST access-grants: created with outcome, defaults applied to the command")
    void grantAccess_created() throws Exception {
        UUID userId = UUID.randomUUID();
        UUID productId = UUID.randomUUID();
        UUID tariffId = UUID.randomUUID();
        when(accessGrantService.grantAccess(any(GrantAccessCommand.class), eq(ActorRef.admin(ADMIN_ID))))
                .thenReturn(new GrantOutcome(UUID.randomUUID(), "ADM-ABCDEF123456", UUID.randomUUID(), UUID.randomUUID(),
                        false, Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-30T23:59:59Z"),
                        Map.of("community", SyncResult.ok()), List.of()));

        mockMvc.perform(post("/api/v1/admin/access-grants")
                        .with(adminJwt())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId":"%s","productId":"%s","tariffId":"%s","days":30}
                                """.formatted(userId, productId, tariffId)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.orderNumber").value("ADM-ABCDEF123456"))
                .andExpect(jsonPath("$.extended").value(false))
                .andExpect(jsonPath("$.syncResults.community.success").value(true));

        ArgumentCaptor<GrantAccessCommand> captor = ArgumentCaptor.forClass(GrantAccessCommand.class);
        verify(accessGrantService).grantAccess(captor.capture(), eq(ActorRef.admin(ADMIN_ID)));
        GrantAccessCommand command = captor.getValue();
        assertEquals(GrantMode.GRANT_ACCESS, command.mode());
        assertEquals(30, command.days());
        assertTrue(command.grantCommunity());
        assertTrue(command.grantEnrollment());
    }

    @Test
    @DisplayName("POST access-grants: negative price and missing tariff are rejected")
    void grantAccess_invalidBody_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/admin/access-grants")
                        .with(adminJwt())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":\"%s\",\"price\":-1}".formatted(UUID.randomUUID())))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(accessGrantService);
    }

    @Test
    @DisplayName("POST access-grants: concurrent grant conflict maps to 409")
    void grantAccess_conflict() throws Exception {
        when(accessGrantService.grantAccess(any(), any()))
                .thenThrow(new SubscriptionConflictException("u:p:t", "Concurrent grant for the same user, product and tariff; retry later"));

        mockMvc.perform(post("/api/v1/admin/access-grants")
                        .with(adminJwt())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"%s\",\"productId\":\"%s\",\"tariffId\":\"%s\"}"
                                .formatted(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID())))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("POST grant-access for order: empty body uses defaults")
    void grantAccessForOrder_noBody() throws Exception {
        UUID orderId = UUID.randomUUID();
        when(accessGrantService.grantAccessForOrder(eq(orderId), any(GrantForOrderCommand.class), any()))
                .thenReturn(new GrantOutcome(orderId, "ORD-1", null, UUID.randomUUID(), true,
                        Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-03-01T23:59:59Z"), Map.of(), List.of()));

        mockMvc.perform(post("/api/v1/admin/orders/{orderId}/grant-access", orderId).with(adminJwt()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.extended").value(true));

        ArgumentCaptor<GrantForOrderCommand> captor = ArgumentCaptor.forClass(GrantForOrderCommand.class);
        verify(accessGrantService).grantAccessForOrder(eq(orderId), captor.capture(), eq(ActorRef.admin(ADMIN_ID)));
        assertNull(captor.getValue().customDays());
        assertFalse(captor.getValue().extendFromCurrent());
    }

    @Test
    @DisplayName("non-admin token is forbidden")
    void grantAccess_nonAdmin_forbidden() throws Exception {
        mockMvc.perform(post("/api/v1/admin/access-grants")
                        .with(jwt().authorities(new SimpleGrantedAuthority("ROLE_USER")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isForbidden());
    }

    private static RequestPostProcessor adminJwt() {
        return jwt().jwt(token -> token.subject(ADMIN_ID.toString()))
                .authorities(new SimpleGrantedAuthority("ROLE_ADMIN"));
    }
}
