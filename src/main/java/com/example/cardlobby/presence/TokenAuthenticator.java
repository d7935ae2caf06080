package com.example.cardlobby.presence;

import com.example.cardlobby.error.AuthenticationException;
import com.example.cardlobby.model.Identity;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.JwtValidationException;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * HS256 JWT bearer tokens. The subject is the user id, {@code name} the display name and
 * {@code svc} marks a service identity; {@code exp} is required.
 * Tokens are issued by the auth service; {@link #issue} exists for the server's own
 * service identity and for tests.
 */
public class TokenAuthenticator implements Authenticator {

    static final String NAME_CLAIM = "name";
    static final String SERVICE_CLAIM = "svc";

    private final JwtDecoder decoder;
    private final JwtEncoder encoder;
    private final Clock clock;

    public TokenAuthenticator(String secret, Clock clock) {
        Objects.requireNonNull(secret, "secret");
        byte[] raw = secret.getBytes(StandardCharsets.UTF_8);
        if (raw.length < 32) throw new IllegalArgumentException("auth secret must have at least 32 bytes for HS256");
        this.clock = Objects.requireNonNull(clock, "clock");

        SecretKey key = new SecretKeySpec(raw, "HmacSHA256");
        JwtTimestampValidator timestamps = new JwtTimestampValidator(Duration.ZERO);
        timestamps.setClock(clock);
        NimbusJwtDecoder nimbus = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
        nimbus.setJwtValidator(timestamps);
        this.decoder = nimbus;
        this.encoder = new NimbusJwtEncoder(new ImmutableSecret<>(key));
    }

    @Override
    public Identity authenticate(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new AuthenticationException("Authentication token is required");
        }
        String token = credential.trim();
        if (token.regionMatches(true, 0, "Bearer ", 0, 7)) token = token.substring(7).trim();

        Jwt jwt;
        try {
            jwt = decoder.decode(token);
        } catch (JwtValidationException e) {
            throw new AuthenticationException("Authentication token expired");
        } catch (JwtException e) {
            throw new AuthenticationException("Invalid authentication token");
        }

        String userId = jwt.getSubject();
        if (userId == null || userId.isBlank() || jwt.getExpiresAt() == null) {
            throw new AuthenticationException("Malformed authentication token");
        }
        String username = jwt.getClaimAsString(NAME_CLAIM);
        Boolean service = jwt.getClaimAsBoolean(SERVICE_CLAIM);
        return new Identity(userId, username != null ? username : userId, Boolean.TRUE.equals(service));
    }

    public String issue(Identity identity, Duration ttl) {
        Instant now = clock.instant();
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .subject(identity.userId())
                .claim(NAME_CLAIM, identity.username())
                .claim(SERVICE_CLAIM, identity.service())
                .issuedAt(now)
                .expiresAt(now.plus(ttl))
                .build();
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        return encoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
    }
}
