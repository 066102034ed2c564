package addressbook.api;

import addressbook.api.dto.ErrorResponse;
import addressbook.api.dto.LoginRequest;
import addressbook.api.dto.MessageResponse;
import addressbook.api.dto.RegisterRequest;
import addressbook.api.dto.RequestEmailRequest;
import addressbook.api.dto.TokenResponse;
import addressbook.api.dto.UserResponse;
import addressbook.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * REST controller for registration, login and email confirmation.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>POST /api/auth/register - create an unconfirmed account and mail a confirmation link (201)</li>
 *   <li>POST /api/auth/login - exchange credentials for a bearer token, JSON or form body (200)</li>
 *   <li>GET /api/auth/confirmed_email/{token} - apply a confirmation link (200)</li>
 *   <li>POST /api/auth/request_email - resend the confirmation link (200)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/auth")
@Tag(name = "Authentication", description = "User registration, login and email confirmation")
public class AuthController {

    private final AuthService authService;

    public AuthController(final AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Register a new user")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "User created",
                    content = @Content(schema = @Schema(implementation = UserResponse.class))),
            @ApiResponse(responseCode = "409", description = "Username or email already exists",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "422", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(value = "/register", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public UserResponse register(@Valid @RequestBody final RegisterRequest request) {
        return UserResponse.from(authService.register(request, baseUrl()));
    }

    @Operation(summary = "Log in with a JSON body")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Token issued",
                    content = @Content(schema = @Schema(implementation = TokenResponse.class))),
            @ApiResponse(responseCode = "401", description = "Bad credentials or email not confirmed",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_JSON_VALUE)
    public TokenResponse login(@Valid @RequestBody final LoginRequest request) {
        return TokenResponse.bearer(authService.login(request.username(), request.password()));
    }

    /**
     * Form variant of {@link #login(LoginRequest)} for OAuth2 password-flow clients such as
     * the Swagger UI.
     */
    @Operation(summary = "Log in with a form body")
    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public TokenResponse loginForm(@Valid @ModelAttribute final LoginRequest request) {
        return TokenResponse.bearer(authService.login(request.username(), request.password()));
    }

    @Operation(summary = "Confirm an email address")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Confirmed or already confirmed"),
            @ApiResponse(responseCode = "400", description = "Token invalid or expired, or unknown email",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/confirmed_email/{token}")
    public MessageResponse confirmedEmail(@PathVariable final String token) {
        return new MessageResponse(authService.confirmEmail(token));
    }

    @Operation(summary = "Resend the confirmation email")
    @PostMapping(value = "/request_email", consumes = MediaType.APPLICATION_JSON_VALUE)
    public MessageResponse requestEmail(@Valid @RequestBody final RequestEmailRequest request) {
        return new MessageResponse(authService.requestEmail(request.email(), baseUrl()));
    }

    // Resolved on the request thread; the mail is sent from another one.
    private static String baseUrl() {
        return ServletUriComponentsBuilder.fromCurrentContextPath().path("/").build().toUriString();
    }
}
