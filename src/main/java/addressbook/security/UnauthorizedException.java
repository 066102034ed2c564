package addressbook.security;

import org.springframework.security.core.AuthenticationException;

/**
 * Authentication failure raised by the application's own auth flow (bad credentials,
 * unconfirmed email, untrusted bearer token).
 *
 * <p>Extends Spring Security's {@link AuthenticationException} so the same 401 handling
 * applies whether the failure happens in a filter or in a controller.
 */
public class UnauthorizedException extends AuthenticationException {

    private static final long serialVersionUID = 1L;

    public UnauthorizedException(final String message) {
        super(message);
    }
}
