package com.strata.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

/**
 * Issues and verifies HS256-signed session tokens.
 *
 * <p>The token is the only place authorization state lives: role, tenant and access level are
 * embedded as claims and read back on every request. Nothing is stored server-side, so there is no
 * revocation; a token stays valid until its {@code exp}.
 *
 * <p>Instances are immutable and safe to share between request threads.
 */
public final class SessionCodec {

    /** Lifetime of tokens issued at login. */
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    public static final String CLAIM_ROLE = "role";
    public static final String CLAIM_TENANT_ID = "tenant_id";
    public static final String CLAIM_ACCESS_LEVEL = "access_level";

    private static final int MIN_SECRET_BYTES = 32;

    private final SecretKey key;
    private final String issuer;
    private final Clock clock;

    public SessionCodec(String secret, String issuer) {
        this(secret, issuer, Clock.systemUTC());
    }

    /**
     * @param secret shared HMAC secret, at least 32 bytes of UTF-8
     * @param issuer value written to and required from the {@code iss} claim
     * @param clock  time source for issuance and expiry checks
     */
    public SessionCodec(String secret, String issuer, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "session secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be blank");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.issuer = issuer;
        this.clock = clock;
    }

    /**
     * Signs a token for the principal that expires {@code ttl} from now.
     */
    public String issue(Principal principal, Duration ttl) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(principal.id().toString())
                .issuer(issuer)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .claim(CLAIM_ROLE, principal.role().value())
                .claim(CLAIM_TENANT_ID, principal.tenantId() != null ? principal.tenantId().toString() : null)
                .claim(CLAIM_ACCESS_LEVEL, principal.accessLevel().value())
                .signWith(key)
                .compact();
    }

    /**
     * Verifies signature, issuer and expiry, then rebuilds the principal from the claims.
     *
     * @throws SessionTokenException if the token cannot be trusted
     */
    public Principal verify(String token) {
        if (token == null || token.isBlank()) {
            throw new SessionTokenException("Missing session token");
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new SessionTokenException("Session token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new SessionTokenException("Invalid session token", e);
        }
        return toPrincipal(claims);
    }

    private static Principal toPrincipal(Claims claims) {
        if (claims.getSubject() == null) {
            throw new SessionTokenException("Invalid session token: missing subject");
        }
        try {
            UUID id = UUID.fromString(claims.getSubject());
            Role role = Role.fromString(claims.get(CLAIM_ROLE, String.class))
                    .orElseThrow(() -> new SessionTokenException("Invalid session token: unknown role"));
            AccessLevel accessLevel = AccessLevel.fromString(claims.get(CLAIM_ACCESS_LEVEL, String.class))
                    .orElseThrow(() -> new SessionTokenException("Invalid session token: unknown access level"));
            String tenant = claims.get(CLAIM_TENANT_ID, String.class);
            return new Principal(id, role, tenant != null ? UUID.fromString(tenant) : null, accessLevel);
        } catch (IllegalArgumentException | JwtException e) {
            throw new SessionTokenException("Invalid session token claims", e);
        }
    }
}
