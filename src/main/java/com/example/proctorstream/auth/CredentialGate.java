package com.example.proctorstream.auth;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Collection;
import java.util.Date;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Verifies the bearer credential presented at connection time and turns its claims into a
 * {@link ConnectionPrincipal}.
 */
@Component
public class CredentialGate {

    private static final Logger logger = LoggerFactory.getLogger(CredentialGate.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtParser parser;

    public CredentialGate(@Value("${app.auth.jwt-secret}") String jwtSecret, Clock clock) {
        this.parser = Jwts.parser()
                .verifyWith(Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8)))
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public ConnectionPrincipal authenticate(HttpHeaders headers, URI uri) {
        String token = extractToken(headers, uri)
                .orElseThrow(() -> new CredentialRejectedException(
                        CredentialRejectedException.Reason.MISSING_TOKEN, "Authentication token required"));
        return verify(token);
    }

    public ConnectionPrincipal verify(String token) {
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            logger.info("Rejected expired token for subject {}", e.getClaims().getSubject());
            throw new CredentialRejectedException(CredentialRejectedException.Reason.EXPIRED_TOKEN,
                    "Authentication token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            logger.info("Rejected invalid token: {}", e.getMessage());
            throw new CredentialRejectedException(CredentialRejectedException.Reason.INVALID_TOKEN,
                    "Invalid authentication token", e);
        }

        String userId = claims.getSubject() != null ? claims.getSubject() : claims.get("userId", String.class);
        if (userId == null || userId.isBlank()) {
            throw new CredentialRejectedException(CredentialRejectedException.Reason.INVALID_TOKEN,
                    "Token carries no subject");
        }
        Role role = Role.fromClaim(claims.get("role", String.class))
                .orElseThrow(() -> new CredentialRejectedException(CredentialRejectedException.Reason.INVALID_TOKEN,
                        "Token carries no usable role"));

        ConnectionPrincipal principal = ConnectionPrincipal.builder()
                .userId(userId)
                .role(role)
                .permissions(role == Role.OBSERVER ? readPermissions(claims.get("permissions")) : Set.of())
                .sessionId(role == Role.STUDENT ? claims.get("sessionId", String.class) : null)
                .build();
        logger.debug("Authenticated {} as {}", userId, role.getWireName());
        return principal;
    }

    private static Set<Permission> readPermissions(Object claim) {
        Set<Permission> permissions = EnumSet.noneOf(Permission.class);
        if (claim instanceof Collection) {
            for (Object name : (Collection<?>) claim) {
                Permission.fromClaim(String.valueOf(name)).ifPresent(permissions::add);
            }
        }
        return Set.copyOf(permissions);
    }

    static Optional<String> extractToken(HttpHeaders headers, URI uri) {
        String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) return Optional.of(token);
        }
        if (uri != null) {
            String token = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("token");
            if (token != null && !token.isBlank()) return Optional.of(token);
        }
        return Optional.empty();
    }
}
