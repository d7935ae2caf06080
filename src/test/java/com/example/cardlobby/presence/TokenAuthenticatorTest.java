package com.example.cardlobby.presence;

import com.example.cardlobby.error.AuthenticationException;
import com.example.cardlobby.model.Identity;
import com.example.cardlobby.support.MutableClock;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TokenAuthenticatorTest {

    private static final String SECRET = "0123456789abcdef-test-secret-0123456789";

    private final MutableClock clock = MutableClock.atEpoch();
    private final TokenAuthenticator auth = new TokenAuthenticator(SECRET, clock);

    private static String signed(JwtClaimsSet claims) {
        NimbusJwtEncoder encoder = new NimbusJwtEncoder(new ImmutableSecret<>(
                new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256")));
        return encoder.encode(JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims))
                .getTokenValue();
    }

    @Test
    void issuedToken_authenticates_withOrWithoutBearerPrefix() {
        String token = auth.issue(Identity.player("u1", "Alice"), Duration.ofMinutes(10));

        assertEquals(3, token.split("\\.").length);
        Identity id = auth.authenticate(token);
        assertEquals("u1", id.userId());
        assertEquals("Alice", id.username());
        assertFalse(id.service());

        assertEquals("u1", auth.authenticate("Bearer " + token).userId());
    }

    @Test
    void serviceFlag_survivesRoundTrip() {
        String token = auth.issue(Identity.service("lobby-service"), Duration.ofMinutes(1));
        assertTrue(auth.authenticate(token).service());
    }

    @Test
    void expiredToken_isRejected() {
        String token = auth.issue(Identity.player("u1", "Alice"), Duration.ofMinutes(1));
        clock.advance(Duration.ofMinutes(2));
        AuthenticationException e = assertThrows(AuthenticationException.class, () -> auth.authenticate(token));
        assertEquals("AUTHENTICATION_FAILED", e.getCode());
        assertEquals("Authentication token expired", e.getMessage());
    }

    @Test
    void tamperedOrForeignTokens_areRejected() {
        String token = auth.issue(Identity.player("u1", "Alice"), Duration.ofMinutes(10));
        String forged = auth.issue(Identity.player("admin", "Admin"), Duration.ofMinutes(10));
        String spliced = forged.substring(0, forged.lastIndexOf('.')) + token.substring(token.lastIndexOf('.'));

        assertThrows(AuthenticationException.class, () -> auth.authenticate(spliced));
        assertThrows(AuthenticationException.class, () -> auth.authenticate(null));
        assertThrows(AuthenticationException.class, () -> auth.authenticate("  "));
        assertThrows(AuthenticationException.class, () -> auth.authenticate("no-dot"));

        TokenAuthenticator other = new TokenAuthenticator("another-secret-that-is-32-bytes-long", clock);
        assertThrows(AuthenticationException.class, () -> other.authenticate(token));
    }

    @Test
    void correctlySignedToken_withoutSubjectOrExpiry_isRejected() {
        String noExpiry = signed(JwtClaimsSet.builder().subject("u1").claim("name", "Alice").build());
        String noSubject = signed(JwtClaimsSet.builder().claim("name", "Alice")
                .expiresAt(clock.instant().plusSeconds(60)).build());

        AuthenticationException e = assertThrows(AuthenticationException.class, () -> auth.authenticate(noExpiry));
        assertEquals("Malformed authentication token", e.getMessage());
        assertThrows(AuthenticationException.class, () -> auth.authenticate(noSubject));
    }

    @Test
    void externallySignedToken_withStandardClaims_isAccepted() {
        String token = signed(JwtClaimsSet.builder().subject("u9").claim("name", "Zed")
                .expiresAt(clock.instant().plusSeconds(60)).build());

        Identity id = auth.authenticate(token);
        assertEquals("u9", id.userId());
        assertEquals("Zed", id.username());
        assertFalse(id.service());
    }

    @Test
    void shortSecret_isRefused() {
        assertThrows(IllegalArgumentException.class, () -> new TokenAuthenticator("short", clock));
        assertThrows(IllegalArgumentException.class, () -> new TokenAuthenticator("only-sixteen-chr", clock));
    }
}
