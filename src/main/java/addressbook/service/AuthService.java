package addressbook.service;

import addressbook.api.dto.RegisterRequest;
import addressbook.api.exception.DuplicateResourceException;
import addressbook.api.exception.VerificationException;
import addressbook.persistence.IntegrityViolationTranslator;
import addressbook.security.JwtService;
import addressbook.security.PasswordHasher;
import addressbook.security.TokenPurpose;
import addressbook.security.UnauthorizedException;
import addressbook.security.User;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registration, login and email-confirmation protocol.
 *
 * <p>Confirmation mail is handed to {@link EmailService}, which runs asynchronously; a mail
 * failure never fails the request that triggered it.
 */
@Service
public class AuthService {

    public static final String BAD_CREDENTIALS_MESSAGE = "The username or password is incorrect";
    public static final String EMAIL_NOT_CONFIRMED_MESSAGE = "Email is not confirmed";
    public static final String VERIFICATION_ERROR_MESSAGE = "Verification error";
    public static final String ALREADY_CONFIRMED_MESSAGE = "Your email has been already confirmed";
    public static final String CONFIRMED_MESSAGE = "Email confirmed successfully";
    public static final String CHECK_EMAIL_MESSAGE = "Check your email for confirmation link";

    private static final Logger LOG = LoggerFactory.getLogger(AuthService.class);

    private final UserService userService;
    private final PasswordHasher passwordHasher;
    private final JwtService jwtService;
    private final EmailService emailService;

    public AuthService(
            final UserService userService,
            final PasswordHasher passwordHasher,
            final JwtService jwtService,
            final EmailService emailService) {
        this.userService = userService;
        this.passwordHasher = passwordHasher;
        this.jwtService = jwtService;
        this.emailService = emailService;
    }

    /**
     * Creates an unconfirmed account and mails a confirmation link.
     *
     * @param request registration data
     * @param baseUrl public base URL used to build the link
     * @return the new user
     * @throws DuplicateResourceException if the email (checked first) or username is taken
     */
    public User register(final RegisterRequest request, final String baseUrl) {
        if (userService.findByEmail(request.email()).isPresent()) {
            throw new DuplicateResourceException(IntegrityViolationTranslator.USER_EMAIL_MESSAGE);
        }
        if (userService.findByUsername(request.username()).isPresent()) {
            throw new DuplicateResourceException(IntegrityViolationTranslator.USER_USERNAME_MESSAGE);
        }
        final String hash = passwordHasher.hash(request.password());
        final User user = userService.create(request.username(), request.email(), hash, null);
        emailService.sendConfirmationEmail(user.getEmail(), user.getUsername(), baseUrl);
        return user;
    }

    /**
     * @return a session token for the user
     * @throws UnauthorizedException for unknown users, wrong passwords and unconfirmed emails
     */
    public String login(final String username, final String password) {
        final Optional<User> found = userService.findByUsername(username);
        if (found.isEmpty() || !passwordHasher.verify(password, found.get().getPassword())) {
            LOG.debug("Login rejected: bad credentials");
            throw new UnauthorizedException(BAD_CREDENTIALS_MESSAGE);
        }
        final User user = found.get();
        if (!user.isConfirmed()) {
            LOG.debug("Login rejected: email not confirmed for user id={}", user.getId());
            throw new UnauthorizedException(EMAIL_NOT_CONFIRMED_MESSAGE);
        }
        return jwtService.issueSessionToken(user.getUsername());
    }

    /**
     * Applies an email-confirmation token. Applying the same token twice is harmless.
     *
     * @return outcome message
     * @throws addressbook.security.InvalidTokenException if the token is invalid or expired
     * @throws VerificationException                      if no account has the token's email
     */
    public String confirmEmail(final String token) {
        final String email = jwtService.verify(token, TokenPurpose.EMAIL_CONFIRMATION);
        final User user = userService.findByEmail(email)
                .orElseThrow(() -> new VerificationException(VERIFICATION_ERROR_MESSAGE));
        if (user.isConfirmed()) {
            return ALREADY_CONFIRMED_MESSAGE;
        }
        userService.confirmEmail(email);
        return CONFIRMED_MESSAGE;
    }

    /**
     * Resends the confirmation link if the account exists and is still unconfirmed. Unknown
     * emails get the same answer as known ones.
     *
     * @return outcome message
     */
    public String requestEmail(final String email, final String baseUrl) {
        final Optional<User> found = userService.findByEmail(email);
        if (found.isEmpty()) {
            return CHECK_EMAIL_MESSAGE;
        }
        final User user = found.get();
        if (user.isConfirmed()) {
            return ALREADY_CONFIRMED_MESSAGE;
        }
        emailService.sendConfirmationEmail(user.getEmail(), user.getUsername(), baseUrl);
        return CHECK_EMAIL_MESSAGE;
    }
}
