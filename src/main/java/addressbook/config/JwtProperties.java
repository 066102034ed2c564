package addressbook.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * JWT signing settings bound once at startup from {@code app.jwt.*}.
 *
 * <ul>
 *   <li>{@code app.jwt.secret} - Base64-encoded HMAC secret (raw strings are accepted as UTF-8 bytes)</li>
 *   <li>{@code app.jwt.algorithm} - HS256, HS384 or HS512 (default HS256)</li>
 *   <li>{@code app.jwt.expiration-seconds} - session token lifetime (default 3600)</li>
 * </ul>
 *
 * @param secret            signing secret
 * @param algorithm         JWS algorithm id
 * @param expirationSeconds default session token lifetime in seconds
 */
@ConfigurationProperties(prefix = "app.jwt")
public record JwtProperties(
        String secret,
        @DefaultValue("HS256") String algorithm,
        @DefaultValue("3600") long expirationSeconds
) {
}
