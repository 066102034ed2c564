package addressbook.api.exception;

/**
 * Thrown when a request is well-formed but its content is unacceptable, for example an
 * avatar upload that is empty or not an image. The message is shown to the client; mapped
 * to HTTP 400.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(final String message) {
        super(message);
    }
}
