package addressbook.api.dto;

import org.springframework.http.HttpStatus;

/**
 * Stable machine-readable error categories returned in every {@link ErrorResponse}.
 *
 * <p>Clients branch on the code; the accompanying message is for humans and may change.
 */
public enum ErrorCode {
    CONFLICT(HttpStatus.CONFLICT),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    VALIDATION_ERROR(HttpStatus.UNPROCESSABLE_ENTITY),
    TOO_MANY_REQUESTS(HttpStatus.TOO_MANY_REQUESTS),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(final HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
