package uk.gegc.clubaccess.shared.security;

import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.List;

/**
 * Maps the JWT claim {@code role} (e.g. "ADMIN") to a Spring Security authority ("ROLE_ADMIN").
 * Tokens without the claim get {@code ROLE_USER}.
 */
public final class JwtRoleConverter implements Converter<Jwt, AbstractAuthenticationToken> {

    static final String ROLE_CLAIM = "role";

    @Override
    public AbstractAuthenticationToken convert(Jwt jwt) {
        String role = jwt.getClaimAsString(ROLE_CLAIM);
        String authority = role != null && !role.isBlank()
                ? "ROLE_" + role.trim().toUpperCase()
                : "ROLE_USER";
        return new JwtAuthenticationToken(jwt, List.of(new SimpleGrantedAuthority(authority)), jwt.getSubject());
    }
}
