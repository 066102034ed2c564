package addressbook.api.exception;

/**
 * Thrown when a requested resource is absent or belongs to another user.
 *
 * <p>This exception is caught by {@link addressbook.api.GlobalExceptionHandler}
 * and converted to an HTTP 404 Not Found response with a JSON error body.
 * Missing and foreign resources produce the same message so ownership is never revealed.
 *
 * @see addressbook.api.GlobalExceptionHandler
 */
public class ResourceNotFoundException extends RuntimeException {

    /**
     * Creates a new ResourceNotFoundException with the given message.
     *
     * @param message descriptive message indicating which resource was not found
     */
    public ResourceNotFoundException(final String message) {
        super(message);
    }
}
