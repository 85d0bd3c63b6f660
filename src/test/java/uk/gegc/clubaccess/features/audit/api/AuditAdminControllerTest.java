package uk.gegc.clubaccess.features.audit.api;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.clubaccess.features.audit.api.dto.AuditRecordDto;
import uk.gegc.clubaccess.features.audit.application.AuditRecorder;
import uk.gegc.clubaccess.shared.config.SecurityConfig;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AuditAdminController.class)
@Import(SecurityConfig.class)
class AuditAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AuditRecorder auditRecorder;

    @MockitoBean
    private JwtDecoder jwtDecoder;

    @Test
    @DisplayName("GET audit: returns the user's trail")
    void listForUser_ok() throws Exception {
        UUID userId = UUID.randomUUID();
        PageRequest page = PageRequest.of(0, 20);
        AuditRecordDto dto = new AuditRecordDto(UUID.randomUUID(), UUID.randomUUID(), "ADMIN", "admin.grant_access",
                userId, Instant.parse("2026-01-01T08:00:00Z"),
                JsonNodeFactory.instance.objectNode().put("comment", "welcome"));
        when(auditRecorder.findByTargetUser(userId, page)).thenReturn(new PageImpl<>(List.of(dto), page, 1));

        mockMvc.perform(get("/api/v1/admin/audit").param("targetUserId", userId.toString())
                        .with(jwt().authorities(new SimpleGrantedAuthority("ROLE_ADMIN"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].action").value("admin.grant_access"))
                .andExpect(jsonPath("$.content[0].meta.comment").value("welcome"));
    }

    @Test
    @DisplayName("GET audit: page size above 100 is rejected")
    void listForUser_pageTooLarge_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/admin/audit")
                        .param("targetUserId", UUID.randomUUID().toString())
                        .param("size", "500")
                        .with(jwt().authorities(new SimpleGrantedAuthority("ROLE_ADMIN"))))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(auditRecorder);
    }

    @Test
    @DisplayName("GET audit: non-admin token is forbidden")
    void listForUser_nonAdmin_forbidden() throws Exception {
        mockMvc.perform(get("/api/v1/admin/audit")
                        .param("targetUserId", UUID.randomUUID().toString())
                        .with(jwt().authorities(new SimpleGrantedAuthority("ROLE_USER"))))
                .andExpect(status().isForbidden());
    }
}
