package addressbook.security;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

/**
 * Account entity and Spring Security principal.
 *
 * <p>Key properties:
 * <ul>
 *   <li>{@code username} and {@code email} are each globally unique (named constraints so
 *       violations can be translated into specific conflict messages)</li>
 *   <li>{@code passwordHash} always holds a bcrypt hash, never the plaintext</li>
 *   <li>{@code confirmed} starts false and only ever moves to true</li>
 * </ul>
 *
 * <p>There is no delete path for users.
 */
@Entity
@Table(
        name = "users",
        uniqueConstraints = {
                @UniqueConstraint(name = User.USERNAME_CONSTRAINT, columnNames = "username"),
                @UniqueConstraint(name = User.EMAIL_CONSTRAINT, columnNames = "email")
        })
public class User implements UserDetails {

    /** Unique constraint name on {@code users.username}. */
    public static final String USERNAME_CONSTRAINT = "uq_users_username";

    /** Unique constraint name on {@code users.email}. */
    public static final String EMAIL_CONSTRAINT = "uq_users_email";

    private static final long serialVersionUID = 1L;

    private static final int AVATAR_MAX_LENGTH = 255;

    private static final Pattern BCRYPT_PATTERN = Pattern.compile("^\\$2[aby]?\\$\\d{2}\\$[./A-Za-z0-9]{53}$");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String username;

    @Column(nullable = false)
    private String email;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(length = AVATAR_MAX_LENGTH)
    private String avatar;

    @Column(nullable = false)
    private boolean confirmed = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Default constructor for JPA.
     */
    protected User() {
    }

    /**
     * Creates a new, unconfirmed user.
     *
     * @param username     unique login name
     * @param email        unique email address
     * @param passwordHash bcrypt hash of the password
     * @param avatar       avatar URL, may be null
     * @throws IllegalArgumentException if a required value is blank or the hash is not bcrypt
     */
    @SuppressFBWarnings(
            value = "CT_CONSTRUCTOR_THROW",
            justification = "Validation in constructor is intentional; class has no finalizers")
    public User(final String username, final String email, final String passwordHash, final String avatar) {
        this.username = requireNotBlank(username, "username");
        this.email = requireNotBlank(email, "email");
        Objects.requireNonNull(passwordHash, "passwordHash must not be null");
        if (!BCRYPT_PATTERN.matcher(passwordHash).matches()) {
            throw new IllegalArgumentException("passwordHash must be a bcrypt hash");
        }
        this.passwordHash = passwordHash;
        this.avatar = avatar;
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    /**
     * Marks the email as confirmed. Calling it again has no effect.
     */
    public void confirm() {
        this.confirmed = true;
    }

    /**
     * Replaces the avatar URL.
     *
     * @param avatarUrl new URL, at most 255 characters
     */
    public void changeAvatar(final String avatarUrl) {
        if (avatarUrl != null && avatarUrl.length() > AVATAR_MAX_LENGTH) {
            throw new IllegalArgumentException(
                    "avatar URL exceeds maximum length of " + AVATAR_MAX_LENGTH);
        }
        this.avatar = avatarUrl;
    }

    public Long getId() {
        return id;
    }

    @Override
    public String getUsername() {
        return username;
    }

    public String getEmail() {
        return email;
    }

    public String getAvatar() {
        return avatar;
    }

    public boolean isConfirmed() {
        return confirmed;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String getPassword() {
        return passwordHash;
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return List.of(new SimpleGrantedAuthority("ROLE_USER"));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof User other)) {
            return false;
        }
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return "User{id=" + id + ", username='" + username + "'}";
    }

    private static String requireNotBlank(final String value, final String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        return value.trim();
    }
}
