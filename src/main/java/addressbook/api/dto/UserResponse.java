package addressbook.api.dto;

import addressbook.security.User;
import java.util.Objects;

/**
 * Public view of a user account. The password hash is never part of it.
 *
 * @param id        database id
 * @param username  login name
 * @param email     email address
 * @param avatar    avatar URL, may be null
 * @param confirmed whether the email has been confirmed
 */
public record UserResponse(
        Long id,
        String username,
        String email,
        String avatar,
        boolean confirmed
) {
    /**
     * @param user the account (must not be null)
     * @return its public view
     */
    public static UserResponse from(final User user) {
        Objects.requireNonNull(user, "user must not be null");
        return new UserResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getAvatar(),
                user.isConfirmed()
        );
    }
}
