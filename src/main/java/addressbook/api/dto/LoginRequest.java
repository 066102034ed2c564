package addressbook.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for login, accepted as JSON or as an HTML form.
 *
 * @param username login name
 * @param password plaintext password
 */
public record LoginRequest(
        @NotBlank(message = "username must not be blank")
        String username,

        @NotBlank(message = "password must not be blank")
        String password
) {
    @Override
    public String toString() {
        return "LoginRequest[username=" + username + ", password=***]";
    }
}
