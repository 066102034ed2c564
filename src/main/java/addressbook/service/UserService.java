package addressbook.service;

import addressbook.api.exception.ResourceNotFoundException;
import addressbook.config.CacheConfig;
import addressbook.persistence.IntegrityViolationTranslator;
import addressbook.security.User;
import addressbook.security.UserRepository;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.DigestUtils;

/**
 * User directory: lookup, creation and the two mutations a user account supports
 * (email confirmation and avatar change).
 *
 * <p>Lookups by username back every authenticated request, so they are cached in the
 * {@value CacheConfig#USERS_CACHE} cache. Mutations evict the whole cache; entries are keyed
 * by username while mutations arrive by email.
 */
@Service
public class UserService {

    static final String GRAVATAR_BASE_URL = "https://www.gravatar.com/avatar/";

    private static final Logger LOG = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final IntegrityViolationTranslator integrityViolationTranslator;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton stores repository reference")
    public UserService(
            final UserRepository userRepository,
            final IntegrityViolationTranslator integrityViolationTranslator) {
        this.userRepository = userRepository;
        this.integrityViolationTranslator = integrityViolationTranslator;
    }

    @Transactional(readOnly = true)
    public Optional<User> findById(final Long id) {
        if (id == null) {
            return Optional.empty();
        }
        return userRepository.findById(id);
    }

    @Cacheable(
            value = CacheConfig.USERS_CACHE,
            key = "#username",
            condition = "#username != null && !#username.isBlank()",
            unless = "#result == null")
    @Transactional(readOnly = true)
    public Optional<User> findByUsername(final String username) {
        if (username == null || username.isBlank()) {
            return Optional.empty();
        }
        return userRepository.findByUsername(username);
    }

    @Transactional(readOnly = true)
    public Optional<User> findByEmail(final String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return userRepository.findByEmail(email);
    }

    /**
     * Persists a new, unconfirmed user.
     *
     * @param username     unique login name
     * @param email        unique email
     * @param passwordHash bcrypt hash
     * @param avatar       avatar URL; when null a Gravatar URL derived from the email is used
     * @return the stored user
     * @throws addressbook.api.exception.DuplicateResourceException if username or email is taken
     */
    @Transactional
    public User create(final String username, final String email, final String passwordHash, final String avatar) {
        final String effectiveAvatar = avatar != null ? avatar : gravatarUrl(email);
        final User user = new User(username, email, passwordHash, effectiveAvatar);
        final User saved = integrityViolationTranslator.execute(() -> userRepository.saveAndFlush(user));
        LOG.info("Registered user id={}", saved.getId());
        return saved;
    }

    /**
     * Marks the user with this email as confirmed. Unknown emails and already confirmed users
     * are left alone.
     *
     * @param email account email
     */
    @CacheEvict(value = CacheConfig.USERS_CACHE, allEntries = true)
    @Transactional
    public void confirmEmail(final String email) {
        final Optional<User> found = findByEmail(email);
        if (found.isEmpty()) {
            return;
        }
        final User user = found.get();
        if (user.isConfirmed()) {
            return;
        }
        user.confirm();
        integrityViolationTranslator.execute(() -> userRepository.saveAndFlush(user));
        LOG.info("Email confirmed for user id={}", user.getId());
    }

    /**
     * Replaces the avatar URL of the user with this email.
     *
     * @param email account email
     * @param url   new avatar URL
     * @return the updated user
     * @throws addressbook.api.exception.ResourceNotFoundException if no user has this email
     */
    @CacheEvict(value = CacheConfig.USERS_CACHE, allEntries = true)
    @Transactional
    public User updateAvatar(final String email, final String url) {
        final User user = findByEmail(email)
                .orElseThrow(() -> new ResourceNotFoundException("User is not found"));
        user.changeAvatar(url);
        return integrityViolationTranslator.execute(() -> userRepository.saveAndFlush(user));
    }

    /**
     * Builds the default avatar URL for an email address.
     *
     * @param email account email
     * @return Gravatar URL, or null if none can be derived
     */
    static String gravatarUrl(final String email) {
        if (email == null || email.isBlank()) {
            LOG.warn("Cannot derive default avatar: email is blank");
            return null;
        }
        final String normalized = email.trim().toLowerCase(Locale.ROOT);
        return GRAVATAR_BASE_URL + DigestUtils.md5DigestAsHex(normalized.getBytes(StandardCharsets.UTF_8));
    }
}
