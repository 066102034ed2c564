package addressbook.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine-backed side cache.
 *
 * <p>The {@code users} cache holds username lookups so that every authenticated request does
 * not hit the database to resolve the bearer token's subject. Writes that change a user
 * (confirmation, avatar) evict it.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    /** Cache of {@link addressbook.security.User} keyed by username. */
    public static final String USERS_CACHE = "users";

    private static final Logger LOG = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    public CacheManager cacheManager(@Value("${app.cache.ttl-seconds:900}") final long ttlSeconds) {
        LOG.info("Configuring Caffeine cache with TTL of {} seconds", ttlSeconds);
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager(USERS_CACHE);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(Duration.ofSeconds(ttlSeconds)));
        return cacheManager;
    }
}
