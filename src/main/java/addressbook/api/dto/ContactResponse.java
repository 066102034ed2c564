package addressbook.api.dto;

import addressbook.persistence.entity.ContactEntity;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Response DTO for contact data returned by the API.
 *
 * @param id          the contact's database id
 * @param firstName   first name
 * @param lastName    last name
 * @param email       email address
 * @param phoneNumber phone number
 * @param birthday    date of birth
 * @param extraInfo   free-text note, may be null
 */
public record ContactResponse(
        Long id,
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        String email,
        @JsonProperty("phone_number") String phoneNumber,
        LocalDate birthday,
        @JsonProperty("extra_info") String extraInfo
) {
    /**
     * Creates a ContactResponse from a stored contact.
     *
     * @param contact the entity to convert (must not be null)
     * @return a new ContactResponse with the contact's data
     * @throws NullPointerException if contact is null
     */
    public static ContactResponse from(final ContactEntity contact) {
        Objects.requireNonNull(contact, "contact must not be null");
        return new ContactResponse(
                contact.getId(),
                contact.getFirstName(),
                contact.getLastName(),
                contact.getEmail(),
                contact.getPhoneNumber(),
                contact.getBirthday(),
                contact.getExtraInfo()
        );
    }
}
