package addressbook.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for user registration.
 *
 * @param username unique login name
 * @param email    unique email address; a confirmation link is sent here
 * @param password plaintext password, hashed before storage
 */
@Schema(description = "New account registration")
public record RegisterRequest(
        @NotBlank(message = "username must not be blank")
        @Size(max = 50, message = "username must be at most {max} characters")
        String username,

        @NotBlank(message = "email must not be blank")
        @Email(message = "email must be a valid email address")
        String email,

        @NotBlank(message = "password must not be blank")
        @Size(max = 72, message = "password must be at most {max} characters")
        String password
) {
    @Override
    public String toString() {
        return "RegisterRequest[username=" + username + ", email=" + email + ", password=***]";
    }
}
