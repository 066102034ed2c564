package addressbook.api;

import addressbook.api.dto.ErrorCode;
import addressbook.api.dto.ErrorResponse;
import addressbook.api.exception.DuplicateResourceException;
import addressbook.api.exception.InvalidRequestException;
import addressbook.api.exception.ResourceNotFoundException;
import addressbook.api.exception.VerificationException;
import addressbook.security.InvalidTokenException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Maps exceptions to {@link ErrorResponse} bodies.
 *
 * <p>Messages of domain exceptions are shown as-is; they are written for clients. Anything
 * unexpected is logged with its stack trace and answered with a fixed message.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String INTERNAL_ERROR_MESSAGE = "An unexpected error occurred";
    static final String MALFORMED_BODY_MESSAGE = "Malformed request body";
    static final String INVALID_REQUEST_MESSAGE = "Invalid request";

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DuplicateResourceException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(final DuplicateResourceException ex) {
        return ErrorResponse.of(ErrorCode.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(final ResourceNotFoundException ex) {
        return ErrorResponse.of(ErrorCode.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(VerificationException.class)
    public ResponseEntity<ErrorResponse> handleVerification(final VerificationException ex) {
        return ErrorResponse.of(ErrorCode.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(InvalidTokenException.class)
    public ResponseEntity<ErrorResponse> handleInvalidToken(final InvalidTokenException ex) {
        LOG.debug("Rejected token: {}", ex.getMessage());
        return ErrorResponse.of(ErrorCode.BAD_REQUEST, InvalidTokenException.MESSAGE);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthentication(final AuthenticationException ex) {
        return ResponseEntity.status(ErrorCode.UNAUTHORIZED.status())
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(new ErrorResponse(ErrorCode.UNAUTHORIZED, ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(final MethodArgumentNotValidException ex) {
        final String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return ErrorResponse.of(ErrorCode.VALIDATION_ERROR, message.isEmpty() ? "Validation failed" : message);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(final HandlerMethodValidationException ex) {
        final String message = ex.getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ErrorResponse.of(ErrorCode.VALIDATION_ERROR, message.isEmpty() ? "Validation failed" : message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(final HttpMessageNotReadableException ex) {
        LOG.debug("Unreadable request body", ex);
        return ErrorResponse.of(ErrorCode.VALIDATION_ERROR, MALFORMED_BODY_MESSAGE);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(final MethodArgumentTypeMismatchException ex) {
        return ErrorResponse.of(ErrorCode.VALIDATION_ERROR, "Invalid value for parameter '" + ex.getName() + "'");
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ErrorResponse> handleMissingInput(final Exception ex) {
        return ErrorResponse.of(ErrorCode.VALIDATION_ERROR, ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(final MaxUploadSizeExceededException ex) {
        return ErrorResponse.of(ErrorCode.BAD_REQUEST, "Uploaded file is too large");
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(final InvalidRequestException ex) {
        return ErrorResponse.of(ErrorCode.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Guard failures inside the application. Their text names internals, so the client gets a
     * fixed message.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(final IllegalArgumentException ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return ErrorResponse.of(ErrorCode.BAD_REQUEST, INVALID_REQUEST_MESSAGE);
    }

    /**
     * Framework exceptions that already carry an HTTP status (unknown static resource,
     * unsupported method or media type) keep it; everything else is a 500.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(final Exception ex) {
        if (ex instanceof org.springframework.web.ErrorResponse framework) {
            final HttpStatusCode status = framework.getStatusCode();
            final ErrorCode code = status.value() == 404 ? ErrorCode.NOT_FOUND : ErrorCode.BAD_REQUEST;
            if (status.is4xxClientError()) {
                return ResponseEntity.status(status)
                        .body(new ErrorResponse(code, framework.getBody().getDetail()));
            }
        }
        LOG.error("Unhandled exception", ex);
        return ErrorResponse.of(ErrorCode.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE);
    }
}
