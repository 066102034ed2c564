package addressbook.security;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * One-way password hashing over the application's bcrypt {@link PasswordEncoder}.
 *
 * <p>Hashes embed their salt and cost factor, so verification needs nothing but the stored
 * hash. Verification never throws: null input or a malformed hash simply does not match.
 */
@Component
public class PasswordHasher {

    private final PasswordEncoder passwordEncoder;

    public PasswordHasher(final PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * @param password plaintext password, must not be null
     * @return salted bcrypt hash
     */
    public String hash(final String password) {
        if (password == null) {
            throw new IllegalArgumentException("password must not be null");
        }
        return passwordEncoder.encode(password);
    }

    /**
     * @param plainPassword candidate plaintext
     * @param hash          stored hash
     * @return true iff the plaintext matches the hash
     */
    public boolean verify(final String plainPassword, final String hash) {
        if (plainPassword == null || hash == null || hash.isEmpty()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plainPassword, hash);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
