package uk.gegc.clubaccess.shared.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ActorRef")
class ActorRefTest {

    @Test
    @DisplayName("UUID subject becomes an admin actor")
    void fromJwt_uuidSubject() {
        UUID adminId = UUID.randomUUID();

        ActorRef actor = ActorRef.fromJwt(jwt(adminId.toString()));

        assertEquals(ActorRef.admin(adminId), actor);
        assertEquals(adminId.toString(), actor.describe());
    }

    @Test
    @DisplayName("missing or malformed subject falls back to system")
    void fromJwt_noUsableSubject() {
        assertTrue(ActorRef.fromJwt(null).isSystem());
        assertTrue(ActorRef.fromJwt(jwt("service-account")).isSystem());
        assertEquals("SYSTEM", ActorRef.fromJwt(jwt("service-account")).describe());
    }

    private static Jwt jwt(String subject) {
        return Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject(subject)
                .issuedAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
    }
}
