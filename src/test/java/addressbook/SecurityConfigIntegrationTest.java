package addressbook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import addressbook.config.RateLimitingFilter;
import addressbook.security.CurrentUserResolver;
import addressbook.security.JwtAuthenticationFilter;
import addressbook.security.TestUserSetup;
import addressbook.security.User;
import addressbook.support.PostgresContainerSupport;
import jakarta.servlet.Filter;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.FilterChainProxy;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Integration tests focused on {@link addressbook.security.SecurityConfig}.
 *
 * <p>These assertions keep the custom filters registered in the right order, the public
 * paths open and the JSON 401 and 429 bodies intact.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SecurityConfigIntegrationTest extends PostgresContainerSupport {

    @Autowired
    private FilterChainProxy filterChainProxy;
    @Autowired
    private JwtAuthenticationFilter jwtAuthenticationFilter;
    @Autowired
    private RateLimitingFilter rateLimitingFilter;
    @Autowired
    private PasswordEncoder passwordEncoder;
    @Autowired
    private TestUserSetup testUserSetup;
    @Autowired
    private MockMvc mockMvc;

    @Test
    void securityFilterChain_includesJwtAndRateLimitFiltersInOrder() {
        final List<Filter> filters = filterChainProxy.getFilters("/api/users/me");

        assertThat(filters).contains(jwtAuthenticationFilter, rateLimitingFilter);
        assertThat(filters.indexOf(jwtAuthenticationFilter))
                .isLessThan(filters.indexOf(rateLimitingFilter));
    }

    @Test
    void passwordEncoder_isBcrypt() {
        assertThat(passwordEncoder).isInstanceOf(BCryptPasswordEncoder.class);
        final String encoded = passwordEncoder.encode("test");
        assertThat(encoded).startsWith("$2");
        assertThat(passwordEncoder.matches("test", encoded)).isTrue();
    }

    @Test
    void protectedEndpointWithoutToken_returnsJson401() throws Exception {
        mockMvc.perform(get("/api/contacts"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.message").value(CurrentUserResolver.CREDENTIALS_MESSAGE));
    }

    @Test
    void protectedEndpointWithGarbageToken_returnsJson401() throws Exception {
        mockMvc.perform(get("/api/contacts").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    void apiDocsArePublic() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.securitySchemes.bearerAuth").exists());
    }

    @Test
    void currentUserEndpoint_isRateLimitedPerClient() throws Exception {
        final User user = testUserSetup.confirmedUser("ratelimited");
        final String bearer = testUserSetup.bearer(user);

        for (int i = 0; i < 10; i++) {
            mockMvc.perform(get("/api/users/me")
                            .header(HttpHeaders.AUTHORIZATION, bearer)
                            .with(request -> {
                                request.setRemoteAddr("203.0.113.10");
                                return request;
                            }))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.username").value("ratelimited"));
        }

        mockMvc.perform(get("/api/users/me")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .with(request -> {
                            request.setRemoteAddr("203.0.113.10");
                            return request;
                        }))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.code").value("TOO_MANY_REQUESTS"));

        mockMvc.perform(get("/api/users/me")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .with(request -> {
                            request.setRemoteAddr("203.0.113.11");
                            return request;
                        }))
                .andExpect(status().isOk());
    }
}
