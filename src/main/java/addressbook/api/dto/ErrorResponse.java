package addressbook.api.dto;

import org.springframework.http.ResponseEntity;

/**
 * Standard error response format for REST API errors.
 *
 * <p>Returns a consistent JSON structure:
 * {@code {"code": "CONFLICT", "message": "error description"}}
 *
 * <p>Used by {@link addressbook.api.GlobalExceptionHandler} and by the security entry point so
 * that filter-level and controller-level failures look the same to clients.
 *
 * @param code    machine-readable error category
 * @param message the error message to display to the client
 */
public record ErrorResponse(ErrorCode code, String message) {

    /**
     * Builds a response entity whose HTTP status follows the error code.
     *
     * @param code    error category
     * @param message human-readable message
     * @return response entity carrying this error body
     */
    public static ResponseEntity<ErrorResponse> of(final ErrorCode code, final String message) {
        return ResponseEntity.status(code.status()).body(new ErrorResponse(code, message));
    }
}
