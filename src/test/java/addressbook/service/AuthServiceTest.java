package addressbook.service;

import addressbook.api.dto.RegisterRequest;
import addressbook.api.exception.DuplicateResourceException;
import addressbook.api.exception.VerificationException;
import addressbook.security.InvalidTokenException;
import addressbook.security.JwtService;
import addressbook.security.PasswordHasher;
import addressbook.security.TokenPurpose;
import addressbook.security.UnauthorizedException;
import addressbook.security.User;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AuthService}; collaborators are mocked.
 */
@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final String HASH = "$2a$10$N9qo8uLOickgx2ZMRZoMye3.Jv8Q5J5YJO1gqRbC1I/pL.sZ5g5jC";
    private static final String BASE_URL = "http://localhost:8080/";

    @Mock
    private UserService userService;
    @Mock
    private PasswordHasher passwordHasher;
    @Mock
    private JwtService jwtService;
    @Mock
    private EmailService emailService;
    @InjectMocks
    private AuthService authService;

    @Test
    void registerCreatesUnconfirmedUserAndSendsConfirmation() {
        final RegisterRequest request = new RegisterRequest("alice", "alice@example.com", "secret");
        final User created = new User("alice", "alice@example.com", HASH, null);
        when(userService.findByEmail("alice@example.com")).thenReturn(Optional.empty());
        when(userService.findByUsername("alice")).thenReturn(Optional.empty());
        when(passwordHasher.hash("secret")).thenReturn(HASH);
        when(userService.create("alice", "alice@example.com", HASH, null)).thenReturn(created);

        final User result = authService.register(request, BASE_URL);

        assertThat(result).isSameAs(created);
        assertThat(result.isConfirmed()).isFalse();
        verify(emailService).sendConfirmationEmail("alice@example.com", "alice", BASE_URL);
    }

    @Test
    void registerRejectsTakenEmailBeforeCheckingUsername() {
        final User existing = new User("someone", "alice@example.com", HASH, null);
        when(userService.findByEmail("alice@example.com")).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> authService.register(
                new RegisterRequest("alice", "alice@example.com", "secret"), BASE_URL))
                .isInstanceOf(DuplicateResourceException.class)
                .hasMessage("User with this email already exists");
        verify(userService, never()).findByUsername(anyString());
        verifyNoInteractions(emailService, passwordHasher);
    }

    @Test
    void registerRejectsTakenUsername() {
        final User existing = new User("alice", "other@example.com", HASH, null);
        when(userService.findByEmail("alice@example.com")).thenReturn(Optional.empty());
        when(userService.findByUsername("alice")).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> authService.register(
                new RegisterRequest("alice", "alice@example.com", "secret"), BASE_URL))
                .isInstanceOf(DuplicateResourceException.class)
                .hasMessage("User with this username already exists");
        verifyNoInteractions(emailService);
    }

    @Test
    void loginIssuesTokenForConfirmedUser() {
        final User alice = new User("alice", "alice@example.com", HASH, null);
        alice.confirm();
        when(userService.findByUsername("alice")).thenReturn(Optional.of(alice));
        when(passwordHasher.verify("secret", HASH)).thenReturn(true);
        when(jwtService.issueSessionToken("alice")).thenReturn("jwt");

        assertThat(authService.login("alice", "secret")).isEqualTo("jwt");
    }

    @Test
    void loginFailsWithSameMessageForUnknownUserAndWrongPassword() {
        final User alice = new User("alice", "alice@example.com", HASH, null);
        alice.confirm();
        when(userService.findByUsername("ghost")).thenReturn(Optional.empty());
        when(userService.findByUsername("alice")).thenReturn(Optional.of(alice));
        when(passwordHasher.verify("wrong", HASH)).thenReturn(false);

        assertThatThrownBy(() -> authService.login("ghost", "secret"))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage(AuthService.BAD_CREDENTIALS_MESSAGE);
        assertThatThrownBy(() -> authService.login("alice", "wrong"))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage(AuthService.BAD_CREDENTIALS_MESSAGE);
        verifyNoInteractions(jwtService);
    }

    @Test
    void loginFailsForUnconfirmedEmailWithDistinctMessage() {
        final User alice = new User("alice", "alice@example.com", HASH, null);
        when(userService.findByUsername("alice")).thenReturn(Optional.of(alice));
        when(passwordHasher.verify("secret", HASH)).thenReturn(true);

        assertThatThrownBy(() -> authService.login("alice", "secret"))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage(AuthService.EMAIL_NOT_CONFIRMED_MESSAGE);
        verifyNoInteractions(jwtService);
    }

    @Test
    void confirmEmailConfirmsOnceThenReportsAlreadyConfirmed() {
        final User alice = new User("alice", "alice@example.com", HASH, null);
        when(jwtService.verify("token", TokenPurpose.EMAIL_CONFIRMATION)).thenReturn("alice@example.com");
        when(userService.findByEmail("alice@example.com")).thenReturn(Optional.of(alice));

        assertThat(authService.confirmEmail("token")).isEqualTo(AuthService.CONFIRMED_MESSAGE);
        verify(userService).confirmEmail("alice@example.com");

        alice.confirm();
        assertThat(authService.confirmEmail("token")).isEqualTo(AuthService.ALREADY_CONFIRMED_MESSAGE);
        verify(userService).confirmEmail(anyString());
    }

    @Test
    void confirmEmailFailsWhenNoUserHasTheEmail() {
        when(jwtService.verify("token", TokenPurpose.EMAIL_CONFIRMATION)).thenReturn("ghost@example.com");
        when(userService.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.confirmEmail("token"))
                .isInstanceOf(VerificationException.class)
                .hasMessage(AuthService.VERIFICATION_ERROR_MESSAGE);
    }

    @Test
    void confirmEmailPropagatesInvalidToken() {
        when(jwtService.verify("bad", TokenPurpose.EMAIL_CONFIRMATION)).thenThrow(new InvalidTokenException());

        assertThatThrownBy(() -> authService.confirmEmail("bad"))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessage("The token is invalid or expired");
        verifyNoInteractions(userService);
    }

    @Test
    void requestEmailForUnknownAddressReturnsGenericMessageWithoutSending() {
        when(userService.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        assertThat(authService.requestEmail("ghost@example.com", BASE_URL))
                .isEqualTo(AuthService.CHECK_EMAIL_MESSAGE);
        verifyNoInteractions(emailService);
    }

    @Test
    void requestEmailForConfirmedUserDoesNotSend() {
        final User alice = new User("alice", "alice@example.com", HASH, null);
        alice.confirm();
        when(userService.findByEmail("alice@example.com")).thenReturn(Optional.of(alice));

        assertThat(authService.requestEmail("alice@example.com", BASE_URL))
                .isEqualTo(AuthService.ALREADY_CONFIRMED_MESSAGE);
        verify(emailService, never()).sendConfirmationEmail(any(), any(), any());
    }

    @Test
    void requestEmailForUnconfirmedUserResends() {
        final User alice = new User("alice", "alice@example.com", HASH, null);
        when(userService.findByEmail("alice@example.com")).thenReturn(Optional.of(alice));

        assertThat(authService.requestEmail("alice@example.com", BASE_URL))
                .isEqualTo(AuthService.CHECK_EMAIL_MESSAGE);
        verify(emailService).sendConfirmationEmail("alice@example.com", "alice", BASE_URL);
    }
}
