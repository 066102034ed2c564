package addressbook.api.exception;

/**
 * Thrown when a write would violate a uniqueness rule (username, user email,
 * or a contact email within one address book).
 *
 * <p>Mapped to HTTP 409 Conflict by {@link addressbook.api.GlobalExceptionHandler}.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(final String message) {
        super(message);
    }

    public DuplicateResourceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
