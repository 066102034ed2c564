package addressbook.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;

/**
 * Request DTO for creating a contact.
 *
 * @param firstName   first name, 1 to 50 characters
 * @param lastName    last name, 1 to 50 characters
 * @param email       email address, unique within the owner's address book
 * @param phoneNumber phone number, 10 to 15 characters
 * @param birthday    date of birth
 * @param extraInfo   optional free-text note
 */
@Schema(description = "Contact creation payload")
public record ContactRequest(
        @JsonProperty("first_name")
        @NotBlank(message = "first_name must not be blank")
        @Size(min = 1, max = 50, message = "first_name length must be between {min} and {max}")
        String firstName,

        @JsonProperty("last_name")
        @NotBlank(message = "last_name must not be blank")
        @Size(min = 1, max = 50, message = "last_name length must be between {min} and {max}")
        String lastName,

        @NotBlank(message = "email must not be blank")
        @Email(message = "email must be a valid email address")
        String email,

        @JsonProperty("phone_number")
        @NotBlank(message = "phone_number must not be blank")
        @Size(min = 10, max = 15, message = "phone_number length must be between {min} and {max}")
        String phoneNumber,

        @NotNull(message = "birthday must not be null")
        LocalDate birthday,

        @JsonProperty("extra_info")
        String extraInfo
) {
}
