package addressbook.config;

import addressbook.api.dto.ErrorCode;
import addressbook.api.dto.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Fixed-window rate limiter for {@code GET /api/users/me}.
 *
 * <p>Each client IP gets {@code app.rate-limit.me-per-minute} requests (default 10) per
 * one-minute window. The window opens on the first request and its counter lives in a
 * Caffeine cache that expires it after the window length. Excess requests get 429 with the
 * standard error body.
 */
@Component
public class RateLimitingFilter extends OncePerRequestFilter {

    /** Path guarded by this filter. */
    public static final String LIMITED_PATH = "/api/users/me";

    private static final Logger LOG = LoggerFactory.getLogger(RateLimitingFilter.class);

    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final int requestsPerWindow;
    private final ObjectMapper objectMapper;
    private final Cache<String, AtomicInteger> counters;

    public RateLimitingFilter(
            @Value("${app.rate-limit.me-per-minute:10}") final int requestsPerWindow,
            final ObjectMapper objectMapper) {
        this.requestsPerWindow = requestsPerWindow;
        this.objectMapper = objectMapper;
        this.counters = Caffeine.newBuilder()
                .expireAfterWrite(WINDOW)
                .maximumSize(100_000)
                .build();
    }

    @Override
    protected boolean shouldNotFilter(@NonNull final HttpServletRequest request) {
        return !LIMITED_PATH.equals(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(
            @NonNull final HttpServletRequest request,
            @NonNull final HttpServletResponse response,
            @NonNull final FilterChain filterChain
    ) throws ServletException, IOException {
        final String client = request.getRemoteAddr();
        final AtomicInteger counter = counters.get(client, key -> new AtomicInteger());
        if (counter.incrementAndGet() > requestsPerWindow) {
            LOG.warn("Rate limit exceeded on {} for client {}", LIMITED_PATH, client);
            response.setStatus(ErrorCode.TOO_MANY_REQUESTS.status().value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setHeader("Retry-After", String.valueOf(WINDOW.toSeconds()));
            objectMapper.writeValue(response.getOutputStream(),
                    new ErrorResponse(ErrorCode.TOO_MANY_REQUESTS,
                            "Rate limit exceeded: " + requestsPerWindow + " per 1 minute"));
            return;
        }
        filterChain.doFilter(request, response);
    }
}
