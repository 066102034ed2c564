package addressbook.security;

import addressbook.service.UserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a bearer token into the authenticated {@link User}.
 *
 * <p>An invalid or expired token and a token naming a user that no longer exists fail with
 * the same {@link UnauthorizedException}, so callers cannot tell the two apart.
 */
@Component
public class CurrentUserResolver {

    /** Message for every bearer-token rejection. */
    public static final String CREDENTIALS_MESSAGE = "Could not validate credentials";

    private static final Logger LOG = LoggerFactory.getLogger(CurrentUserResolver.class);

    private final JwtService jwtService;
    private final UserService userService;

    public CurrentUserResolver(final JwtService jwtService, final UserService userService) {
        this.jwtService = jwtService;
        this.userService = userService;
    }

    /**
     * @param token compact session JWT
     * @return the user the token speaks for
     * @throws UnauthorizedException if the token is untrusted or the user is unknown
     */
    public User resolve(final String token) {
        final String username;
        try {
            username = jwtService.verify(token, TokenPurpose.ACCESS);
        } catch (InvalidTokenException e) {
            LOG.debug("Session token rejected");
            LOG.trace("Session token rejection details", e);
            throw new UnauthorizedException(CREDENTIALS_MESSAGE);
        }
        return userService.findByUsername(username)
                .orElseThrow(() -> new UnauthorizedException(CREDENTIALS_MESSAGE));
    }
}
