package com.example.proctorstream.auth;

import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import javax.crypto.SecretKey;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CredentialGateTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-42";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final URI ENDPOINT = URI.create("ws://localhost:8080/ws/proctoring");

    private final SecretKey key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));
    private CredentialGate gate;

    @BeforeEach
    void setUp() {
        gate = new CredentialGate(SECRET, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private JwtBuilder token(String subject, String role) {
        return Jwts.builder()
                .subject(subject)
                .claim("role", role)
                .issuedAt(Date.from(NOW.minusSeconds(60)))
                .expiration(Date.from(NOW.plus(Duration.ofHours(1))))
                .signWith(key);
    }

    private static HttpHeaders bearer(String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        return headers;
    }

    @Test
    void testAuthenticate_StudentFromHeader() {
        // Given
        String jwt = token("student-1", "student").claim("sessionId", "s-1").compact();

        // When
        ConnectionPrincipal principal = gate.authenticate(bearer(jwt), ENDPOINT);

        // Then
        assertEquals("student-1", principal.getUserId());
        assertEquals(Role.STUDENT, principal.getRole());
        assertEquals("s-1", principal.getSessionId());
        assertTrue(principal.getPermissions().isEmpty());
        assertFalse(principal.hasPermission(Permission.MONITOR));
    }

    @Test
    void testAuthenticate_ObserverFromQueryWithPermissions() {
        // Given
        String jwt = token("teacher-1", "observer")
                .claim("permissions", List.of("monitor_sessions", "terminate_sessions", "fly_kites"))
                .compact();

        // When
        ConnectionPrincipal principal = gate.authenticate(new HttpHeaders(), URI.create(ENDPOINT + "?token=" + jwt));

        // Then
        assertEquals(Role.OBSERVER, principal.getRole());
        assertEquals(Set.of(Permission.MONITOR, Permission.TERMINATE), principal.getPermissions());
        assertTrue(principal.hasPermission(Permission.TERMINATE));
        assertFalse(principal.hasPermission(Permission.BULK));
        assertNull(principal.getSessionId());
    }

    @Test
    void testAuthenticate_LegacyRoleNamesAreObservers() {
        // Given
        String teacher = token("teacher-1", "teacher").compact();
        String admin = token("admin-1", "ADMIN").claim("permissions", List.of("super_admin")).compact();

        // When
        ConnectionPrincipal fromTeacher = gate.verify(teacher);
        ConnectionPrincipal fromAdmin = gate.verify(admin);

        // Then
        assertEquals(Role.OBSERVER, fromTeacher.getRole());
        assertEquals(Role.OBSERVER, fromAdmin.getRole());
        assertTrue(fromAdmin.hasPermission(Permission.BULK));
    }

    @Test
    void testAuthenticate_MissingToken() {
        // When
        CredentialRejectedException e = assertThrows(CredentialRejectedException.class,
                () -> gate.authenticate(new HttpHeaders(), ENDPOINT));

        // Then
        assertEquals(CredentialRejectedException.Reason.MISSING_TOKEN, e.getReason());
        assertEquals("missing-token", e.getReason().getWireName());
    }

    @Test
    void testVerify_ExpiredToken() {
        // Given
        String jwt = token("student-1", "student")
                .expiration(Date.from(NOW.minusSeconds(5)))
                .compact();

        // When
        CredentialRejectedException e = assertThrows(CredentialRejectedException.class, () -> gate.verify(jwt));

        // Then
        assertEquals(CredentialRejectedException.Reason.EXPIRED_TOKEN, e.getReason());
    }

    @Test
    void testVerify_WrongSignature() {
        // Given
        SecretKey other = Keys.hmacShaKeyFor("another-secret-another-secret-another".getBytes(StandardCharsets.UTF_8));
        String jwt = Jwts.builder().subject("student-1").claim("role", "student").signWith(other).compact();

        // When
        CredentialRejectedException e = assertThrows(CredentialRejectedException.class, () -> gate.verify(jwt));

        // Then
        assertEquals(CredentialRejectedException.Reason.INVALID_TOKEN, e.getReason());
    }

    @Test
    void testVerify_GarbageAndUnknownRole() {
        assertEquals(CredentialRejectedException.Reason.INVALID_TOKEN,
                assertThrows(CredentialRejectedException.class, () -> gate.verify("not.a.jwt")).getReason());
        String noRole = token("student-1", "janitor").compact();
        assertEquals(CredentialRejectedException.Reason.INVALID_TOKEN,
                assertThrows(CredentialRejectedException.class, () -> gate.verify(noRole)).getReason());
    }

    @Test
    void testExtractToken_HeaderWinsOverQuery() {
        // Given
        HttpHeaders headers = bearer("from-header");

        // When / Then
        assertEquals("from-header",
                CredentialGate.extractToken(headers, URI.create(ENDPOINT + "?token=from-query")).orElseThrow());
        assertEquals("from-query",
                CredentialGate.extractToken(new HttpHeaders(), URI.create(ENDPOINT + "?token=from-query")).orElseThrow());
        assertTrue(CredentialGate.extractToken(new HttpHeaders(), null).isEmpty());
    }
}
