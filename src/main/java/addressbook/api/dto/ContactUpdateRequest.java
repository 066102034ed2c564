package addressbook.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;

/**
 * Partial update of a contact. Null fields are left unchanged; present fields obey the same
 * rules as {@link ContactRequest}.
 */
public record ContactUpdateRequest(
        @JsonProperty("first_name")
        @Pattern(regexp = ContactUpdateRequest.NOT_BLANK, message = "first_name must not be blank")
        @Size(min = 1, max = 50, message = "first_name length must be between {min} and {max}")
        String firstName,

        @JsonProperty("last_name")
        @Pattern(regexp = ContactUpdateRequest.NOT_BLANK, message = "last_name must not be blank")
        @Size(min = 1, max = 50, message = "last_name length must be between {min} and {max}")
        String lastName,

        @Pattern(regexp = ContactUpdateRequest.NOT_BLANK, message = "email must not be blank")
        @Email(message = "email must be a valid email address")
        String email,

        @JsonProperty("phone_number")
        @Pattern(regexp = ContactUpdateRequest.NOT_BLANK, message = "phone_number must not be blank")
        @Size(min = 10, max = 15, message = "phone_number length must be between {min} and {max}")
        String phoneNumber,

        LocalDate birthday,

        @JsonProperty("extra_info")
        String extraInfo
) {
    /** Present values must contain a non-whitespace character; null still means "unchanged". */
    static final String NOT_BLANK = "(?s).*\\S.*";
}
