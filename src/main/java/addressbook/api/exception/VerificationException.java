package addressbook.api.exception;

/**
 * Thrown when an email-confirmation request cannot be honoured, for example because the
 * token names an email that has no account. Mapped to HTTP 400.
 */
public class VerificationException extends RuntimeException {

    public VerificationException(final String message) {
        super(message);
    }
}
