package addressbook.api.dto;

/**
 * Plain {@code {"message": "..."}} body used by the email-confirmation endpoints.
 *
 * @param message human-readable outcome
 */
public record MessageResponse(String message) {
}
