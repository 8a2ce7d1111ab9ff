package com.finch.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.SigningKeyResolverAdapter;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Issues and validates HMAC-signed identity tokens (JWS).
 *
 * <p>The server keeps no session state: everything needed to authenticate a request is inside
 * the token. Instances are immutable after construction and safe to share between request
 * threads.
 *
 * <p>Validation order:
 *
 * <ol>
 *   <li>parse the compact structure and read the {@code alg} header
 *   <li>reject any algorithm outside the HMAC family before the signature is looked at
 *   <li>verify the signature with the server key
 *   <li>check {@code exp} and {@code nbf} against the injected clock
 * </ol>
 *
 * <p>Every failure surfaces as the same {@link AuthenticationException}.
 */
public final class TokenService {

    /** Value of the {@code iss} claim on every token this service mints. */
    public static final String ISSUER = "finch";

    static final String EMAIL_CLAIM = "email";

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    private static final Set<String> HMAC_ALGORITHMS = Set.of(
            SignatureAlgorithm.HS256.getValue(),
            SignatureAlgorithm.HS384.getValue(),
            SignatureAlgorithm.HS512.getValue());

    private final SecretKey signingKey;
    private final Clock clock;
    private final JwtParser parser;

    public TokenService(String secret) {
        this(secret, Clock.systemUTC());
    }

    /**
     * @param secret shared HMAC secret, at least 32 bytes once UTF-8 encoded
     * @param clock  time source for minting and for expiry checks
     * @throws SigningKeyException if the secret is missing or too short for HS256
     */
    public TokenService(String secret, Clock clock) {
        this.signingKey = signingKey(secret);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.parser = Jwts.parserBuilder()
                .setSigningKeyResolver(new HmacOnlyKeyResolver(signingKey))
                .setClock(() -> Date.from(this.clock.instant()))
                .build();
    }

    /** Mints a 24h token carrying the subject and email. */
    public String issueAccessToken(UUID subjectId, String email) {
        return mint(TokenKind.ACCESS, subjectId, email);
    }

    /** Mints a 7 day token carrying only the subject. */
    public String issueRefreshToken(UUID subjectId) {
        return mint(TokenKind.REFRESH, subjectId, null);
    }

    /**
     * Verifies the token and rebuilds its claims.
     *
     * @throws AuthenticationException if the token is malformed, signed with an unexpected
     *     algorithm or key, expired, or not yet valid
     */
    public IdentityClaims validate(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationException();
        }
        try {
            Claims claims = parser.parseClaimsJws(token).getBody();
            return toIdentityClaims(claims);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getClass().getSimpleName());
            throw new AuthenticationException(e);
        }
    }

    /** Validates the token and returns its subject. */
    public UUID extractSubjectId(String token) {
        return validate(token).subjectId();
    }

    private String mint(TokenKind kind, UUID subjectId, String email) {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        // JWT timestamps have second precision
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        JwtBuilder builder = Jwts.builder()
                .setSubject(subjectId.toString())
                .setIssuer(ISSUER)
                .setIssuedAt(Date.from(now))
                .setNotBefore(Date.from(now))
                .setExpiration(Date.from(now.plus(kind.timeToLive())));
        if (email != null) {
            builder.claim(EMAIL_CLAIM, email);
        }
        return builder.signWith(signingKey, SignatureAlgorithm.HS256).compact();
    }

    private static IdentityClaims toIdentityClaims(Claims claims) {
        if (claims.getSubject() == null || claims.getExpiration() == null) {
            throw new UnsupportedJwtException("Token is missing sub or exp");
        }
        return new IdentityClaims(
                UUID.fromString(claims.getSubject()),
                claims.get(EMAIL_CLAIM, String.class),
                claims.getIssuer(),
                toInstant(claims.getIssuedAt()),
                toInstant(claims.getNotBefore()),
                toInstant(claims.getExpiration()));
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    private static SecretKey signingKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new SigningKeyException("Token signing secret is not configured");
        }
        try {
            return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        } catch (WeakKeyException e) {
            throw new SigningKeyException("Token signing secret must be at least 32 bytes", e);
        }
    }

    /**
     * Hands out the server key only for HMAC-signed tokens, so a token whose header names another
     * algorithm is refused before any signature check.
     */
    private static final class HmacOnlyKeyResolver extends SigningKeyResolverAdapter {

        private final SecretKey key;

        HmacOnlyKeyResolver(SecretKey key) {
            this.key = key;
        }

        @Override
        public Key resolveSigningKey(JwsHeader header, Claims claims) {
            String algorithm = header.getAlgorithm();
            if (!HMAC_ALGORITHMS.contains(algorithm)) {
                throw new UnsupportedJwtException("Unexpected signing algorithm: " + algorithm);
            }
            return key;
        }
    }
}
