package uk.gegc.clubaccess.shared.security;

import org.springframework.security.oauth2.jwt.Jwt;

import java.util.UUID;

/**
 * Who is acting. Resolved once by the controller and passed explicitly into every service call.
 *
 * @param actorId   administrator id, {@code null} for system-initiated actions
 * @param actorType {@code ADMIN} or {@code SYSTEM}
 */
public record ActorRef(UUID actorId, String actorType) {

    public static final String ADMIN = "ADMIN";
    public static final String SYSTEM = "SYSTEM";

    public static ActorRef admin(UUID actorId) {
        return new ActorRef(actorId, ADMIN);
    }

    public static ActorRef system() {
        return new ActorRef(null, SYSTEM);
    }

    /**
     * Builds the actor from the JWT subject. A missing or non-UUID subject yields a system actor.
     */
    public static ActorRef fromJwt(Jwt jwt) {
        if (jwt == null || jwt.getSubject() == null || jwt.getSubject().isBlank()) {
            return system();
        }
        try {
            return admin(UUID.fromString(jwt.getSubject().trim()));
        } catch (IllegalArgumentException e) {
            return system();
        }
    }

    public boolean isSystem() {
        return actorId == null;
    }

    public String describe() {
        return isSystem() ? SYSTEM : actorId.toString();
    }
}
