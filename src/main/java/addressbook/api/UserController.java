package addressbook.api;

import addressbook.api.dto.ErrorResponse;
import addressbook.api.dto.UserResponse;
import addressbook.api.exception.InvalidRequestException;
import addressbook.security.User;
import addressbook.service.AvatarStorage;
import addressbook.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.io.InputStream;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST controller for the authenticated user's own account.
 *
 * <ul>
 *   <li>GET /api/users/me - current user, limited per client IP by
 *       {@link addressbook.config.RateLimitingFilter}</li>
 *   <li>PATCH /api/users/avatar - upload a new avatar image (multipart field {@code file})</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/users")
@Tag(name = "Users", description = "Current user account")
@SecurityRequirement(name = "bearerAuth")
public class UserController {

    static final String EMPTY_AVATAR_MESSAGE = "Avatar file must not be empty";

    private final UserService userService;
    private final AvatarStorage avatarStorage;

    public UserController(final UserService userService, final AvatarStorage avatarStorage) {
        this.userService = userService;
        this.avatarStorage = avatarStorage;
    }

    @Operation(summary = "Get the current user", description = "No more than 10 requests per minute")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Current user"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid token",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "429", description = "Rate limit exceeded",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/me")
    public UserResponse me(@AuthenticationPrincipal final User user) {
        return UserResponse.from(user);
    }

    @Operation(summary = "Upload a new avatar")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Avatar updated"),
            @ApiResponse(responseCode = "400", description = "File is not an image",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PatchMapping(value = "/avatar", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public UserResponse updateAvatar(
            @AuthenticationPrincipal final User user,
            @RequestParam("file") final MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            throw new InvalidRequestException(EMPTY_AVATAR_MESSAGE);
        }
        final String url;
        try (InputStream content = file.getInputStream()) {
            url = avatarStorage.store(user.getUsername(), file.getContentType(), content);
        }
        return UserResponse.from(userService.updateAvatar(user.getEmail(), url));
    }
}
