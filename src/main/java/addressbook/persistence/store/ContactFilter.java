package addressbook.persistence.store;

/**
 * Optional search criteria for listing contacts. Each non-blank value is matched as a
 * case-insensitive substring of the corresponding column; all present criteria must match.
 *
 * @param firstName substring of the first name, or null
 * @param lastName  substring of the last name, or null
 * @param email     substring of the email, or null
 */
public record ContactFilter(String firstName, String lastName, String email) {

    /** Filter that matches every contact. */
    public static final ContactFilter NONE = new ContactFilter(null, null, null);
}
