package addressbook.security;

import addressbook.config.JwtProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.MacAlgorithm;
import io.jsonwebtoken.security.SecureDigestAlgorithm;
import jakarta.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import javax.crypto.SecretKey;
import org.springframework.stereotype.Service;

/**
 * Service for JWT token issuance and validation.
 *
 * <p>Two kinds of token are issued with the same key and algorithm:
 * <ul>
 *   <li>session (access) tokens: {@code sub} = username, lifetime from
 *       {@code app.jwt.expiration-seconds} unless the caller passes one</li>
 *   <li>email-confirmation tokens: {@code sub} = email, fixed 7-day lifetime</li>
 * </ul>
 * The {@link TokenPurpose} claim keeps the two apart at verification time.
 *
 * <p>Tokens are stateless. Validity is decided by signature, algorithm, issuer, audience,
 * purpose and expiry at the moment of verification, read from the injected {@link Clock}.
 *
 * <p><b>Security Note:</b> {@code app.jwt.secret} must be configured via environment variable
 * or secrets manager. Never commit secrets to source control.
 */
@Service
public class JwtService {

    /** Lifetime of email-confirmation tokens. */
    public static final Duration CONFIRMATION_TOKEN_TTL = Duration.ofDays(7);

    /** JWT claim name for token purpose. */
    public static final String TOKEN_USE_CLAIM = "token_use";

    /** JWT issuer claim - identifies this service as the token source. */
    private static final String ISSUER = "address-book";

    /** JWT audience claim - identifies intended token consumers. */
    private static final String AUDIENCE = "address-book-api";

    private final JwtProperties properties;
    private final Clock clock;

    private MacAlgorithm algorithm;
    private SecretKey signingKey;

    public JwtService(final JwtProperties properties, final Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Validates JWT configuration at startup and prepares the signing key.
     *
     * <p>Enforces:
     * <ul>
     *   <li>Secret must be configured (not null or blank)</li>
     *   <li>Algorithm must be an HMAC algorithm known to JJWT (HS256, HS384, HS512)</li>
     *   <li>Secret must be at least as long as the algorithm requires</li>
     * </ul>
     *
     * @throws IllegalStateException if configuration is invalid
     */
    @PostConstruct
    void validateConfiguration() {
        final String secret = properties.secret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException(
                    "app.jwt.secret must be configured. Generate with: openssl rand -base64 64");
        }

        final SecureDigestAlgorithm<?, ?> configured = Jwts.SIG.get().get(properties.algorithm());
        if (!(configured instanceof MacAlgorithm mac)) {
            throw new IllegalStateException(
                    "app.jwt.algorithm must be one of HS256, HS384, HS512 but was: " + properties.algorithm());
        }

        final byte[] keyBytes = decodeSecretKey(secret);
        if (keyBytes.length * Byte.SIZE < mac.getKeyBitLength()) {
            throw new IllegalStateException(
                    "app.jwt.secret must be at least " + mac.getKeyBitLength() + " bits for "
                            + mac.getId() + ". Current length: " + keyBytes.length + " bytes.");
        }
        if (properties.expirationSeconds() <= 0) {
            throw new IllegalStateException("app.jwt.expiration-seconds must be positive");
        }
        this.algorithm = mac;
        this.signingKey = Keys.hmacShaKeyFor(keyBytes);
    }

    /**
     * Decodes the secret key, handling both Base64 and plain-text formats.
     */
    private static byte[] decodeSecretKey(final String secret) {
        try {
            return Decoders.BASE64.decode(secret);
        } catch (IllegalArgumentException | DecodingException ex) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
    }

    /**
     * Issues a session token with the configured default lifetime.
     *
     * @param username the subject
     * @return compact signed JWT
     */
    public String issueSessionToken(final String username) {
        return issueSessionToken(username, Duration.ofSeconds(properties.expirationSeconds()));
    }

    /**
     * Issues a session token with an explicit lifetime.
     *
     * @param username the subject
     * @param ttl      token lifetime; the configured default is used when null
     * @return compact signed JWT
     */
    public String issueSessionToken(final String username, final Duration ttl) {
        final Duration effectiveTtl = ttl != null ? ttl : Duration.ofSeconds(properties.expirationSeconds());
        return buildToken(username, TokenPurpose.ACCESS, effectiveTtl);
    }

    /**
     * Issues an email-confirmation token valid for {@link #CONFIRMATION_TOKEN_TTL}.
     *
     * @param email the address to confirm
     * @return compact signed JWT
     */
    public String issueConfirmationToken(final String email) {
        return buildToken(email, TokenPurpose.EMAIL_CONFIRMATION, CONFIRMATION_TOKEN_TTL);
    }

    /**
     * Verifies a token and returns its subject.
     *
     * @param token   compact JWT
     * @param purpose the purpose the caller intends to use it for
     * @return the non-blank subject claim
     * @throws InvalidTokenException if the token cannot be trusted for this purpose
     */
    public String verify(final String token, final TokenPurpose purpose) {
        final Claims claims = parseClaims(token);
        if (purpose != TokenPurpose.fromClaim(claims.get(TOKEN_USE_CLAIM, String.class))) {
            throw new InvalidTokenException();
        }
        final String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new InvalidTokenException();
        }
        return subject;
    }

    /**
     * Returns the configured default session lifetime.
     *
     * @return lifetime in seconds
     */
    public long getExpirationSeconds() {
        return properties.expirationSeconds();
    }

    private String buildToken(final String subject, final TokenPurpose purpose, final Duration ttl) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("token subject must not be null or blank");
        }
        final Instant now = clock.instant();
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .issuer(ISSUER)
                .audience().add(AUDIENCE).and()
                .claim(TOKEN_USE_CLAIM, purpose.claimValue())
                .subject(subject)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(signingKey, algorithm)
                .compact();
    }

    private Claims parseClaims(final String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException();
        }
        try {
            final Jws<Claims> jws = Jwts.parser()
                    .verifyWith(signingKey)
                    .clock(() -> Date.from(clock.instant()))
                    .requireIssuer(ISSUER)
                    .requireAudience(AUDIENCE)
                    .build()
                    .parseSignedClaims(token);
            if (!algorithm.getId().equals(jws.getHeader().getAlgorithm())) {
                throw new InvalidTokenException();
            }
            return jws.getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException(e);
        }
    }
}
