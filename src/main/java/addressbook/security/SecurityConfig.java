package addressbook.security;

import addressbook.api.dto.ErrorCode;
import addressbook.api.dto.ErrorResponse;
import addressbook.config.RateLimitingFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Stateless bearer-token security.
 *
 * <ul>
 *   <li>{@code /api/auth/**}, stored avatars and API docs are public</li>
 *   <li>everything else requires a session token resolved by {@link JwtAuthenticationFilter}</li>
 *   <li>no HTTP session, no form login, no CSRF (credentials never travel in cookies)</li>
 *   <li>401 responses use the standard {@link ErrorResponse} body with {@code WWW-Authenticate: Bearer}</li>
 * </ul>
 */
@Configuration
public class SecurityConfig {

    private static final String[] PUBLIC_PATHS = {
            "/api/auth/**",
            "/avatars/**",
            "/v3/api-docs/**",
            "/swagger-ui/**",
            "/swagger-ui.html",
            "/error"
    };

    @Bean
    public SecurityFilterChain securityFilterChain(
            final HttpSecurity http,
            final JwtAuthenticationFilter jwtAuthenticationFilter,
            final RateLimitingFilter rateLimitingFilter,
            final AuthenticationEntryPoint authenticationEntryPoint) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(PUBLIC_PATHS).permitAll()
                        .anyRequest().authenticated())
                .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint))
                .addFilterBefore(jwtAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)
                .addFilterAfter(rateLimitingFilter, UsernamePasswordAuthenticationFilter.class);
        return http.build();
    }

    /**
     * Writes the JSON 401 body for requests without a trusted bearer token.
     *
     * @param objectMapper Spring-managed mapper
     * @return entry point used by the filter chain
     */
    @Bean
    public AuthenticationEntryPoint authenticationEntryPoint(final ObjectMapper objectMapper) {
        return (request, response, authException) -> {
            response.setStatus(ErrorCode.UNAUTHORIZED.status().value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
            objectMapper.writeValue(response.getOutputStream(),
                    new ErrorResponse(ErrorCode.UNAUTHORIZED, CurrentUserResolver.CREDENTIALS_MESSAGE));
        };
    }

    /**
     * Keeps the JWT filter out of the servlet container's own chain; it runs only inside
     * the security filter chain.
     */
    @Bean
    public FilterRegistrationBean<JwtAuthenticationFilter> jwtFilterRegistration(
            final JwtAuthenticationFilter filter) {
        final FilterRegistrationBean<JwtAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<RateLimitingFilter> rateLimitFilterRegistration(
            final RateLimitingFilter filter) {
        final FilterRegistrationBean<RateLimitingFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    /**
     * Replaces Boot's generated in-memory user so no default password is logged.
     * Authentication is performed by {@link JwtAuthenticationFilter} and the auth flow, never
     * through this service.
     *
     * @return a service that knows no users
     */
    @Bean
    public UserDetailsService userDetailsService() {
        return username -> {
            throw new UsernameNotFoundException("Form authentication is not supported");
        };
    }
}
