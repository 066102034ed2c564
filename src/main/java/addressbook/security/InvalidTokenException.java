package addressbook.security;

/**
 * Thrown by {@link JwtService} when a token cannot be trusted: bad signature, wrong
 * algorithm, expired, wrong purpose or missing subject.
 *
 * <p>The message is deliberately constant; the underlying parser failure is kept as the
 * cause for server-side logging only.
 */
public class InvalidTokenException extends RuntimeException {

    /** Message shared by every token rejection. */
    public static final String MESSAGE = "The token is invalid or expired";

    public InvalidTokenException() {
        super(MESSAGE);
    }

    public InvalidTokenException(final Throwable cause) {
        super(MESSAGE, cause);
    }
}
