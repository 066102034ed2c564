package addressbook.api;

import addressbook.api.dto.ContactRequest;
import addressbook.api.dto.ContactResponse;
import addressbook.api.dto.ContactUpdateRequest;
import addressbook.api.dto.ErrorResponse;
import addressbook.api.exception.ResourceNotFoundException;
import addressbook.persistence.store.ContactFilter;
import addressbook.security.User;
import addressbook.service.ContactService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the authenticated user's address book.
 *
 * <p>Every request works on the caller's own contacts. A contact id that belongs to another
 * user answers 404 exactly like an unknown id.
 */
@RestController
@RequestMapping("/api/contacts")
@Tag(name = "Contacts", description = "Address book of the current user")
@SecurityRequirement(name = "bearerAuth")
public class ContactController {

    static final String NOT_FOUND_MESSAGE = "Contact is not found";

    private final ContactService contactService;

    public ContactController(final ContactService contactService) {
        this.contactService = contactService;
    }

    @Operation(summary = "List contacts, optionally filtered by name or email substring")
    @GetMapping
    public List<ContactResponse> list(
            @AuthenticationPrincipal final User user,
            @RequestParam(defaultValue = "0") @Min(0) final int skip,
            @RequestParam(defaultValue = "100") @Min(0) @Max(ContactService.MAX_LIMIT) final int limit,
            @RequestParam(name = "first_name", required = false) final String firstName,
            @RequestParam(name = "last_name", required = false) final String lastName,
            @RequestParam(required = false) final String email) {
        return contactService.list(user, skip, limit, new ContactFilter(firstName, lastName, email)).stream()
                .map(ContactResponse::from)
                .toList();
    }

    @Operation(summary = "List contacts with a birthday in the next seven days")
    @GetMapping("/upcoming-birthdays")
    public List<ContactResponse> upcomingBirthdays(
            @AuthenticationPrincipal final User user,
            @RequestParam(defaultValue = "0") @Min(0) final int skip,
            @RequestParam(defaultValue = "10") @Min(0) @Max(ContactService.MAX_LIMIT) final int limit) {
        return contactService.upcomingBirthdays(user, skip, limit).stream()
                .map(ContactResponse::from)
                .toList();
    }

    @Operation(summary = "Get a contact by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Contact found"),
            @ApiResponse(responseCode = "404", description = "Contact not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{id}")
    public ContactResponse get(@AuthenticationPrincipal final User user, @PathVariable final Long id) {
        return contactService.get(user, id)
                .map(ContactResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND_MESSAGE));
    }

    @Operation(summary = "Create a contact")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Contact created"),
            @ApiResponse(responseCode = "409", description = "A contact with this email already exists",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "422", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public ContactResponse create(
            @AuthenticationPrincipal final User user,
            @Valid @RequestBody final ContactRequest request) {
        return ContactResponse.from(contactService.create(user, request));
    }

    @Operation(summary = "Update the given fields of a contact")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Contact updated"),
            @ApiResponse(responseCode = "404", description = "Contact not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "409", description = "A contact with this email already exists",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PutMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ContactResponse update(
            @AuthenticationPrincipal final User user,
            @PathVariable final Long id,
            @Valid @RequestBody final ContactUpdateRequest request) {
        return contactService.update(user, id, request)
                .map(ContactResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND_MESSAGE));
    }

    @Operation(summary = "Delete a contact and return it")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Contact deleted"),
            @ApiResponse(responseCode = "404", description = "Contact not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @DeleteMapping("/{id}")
    public ContactResponse delete(@AuthenticationPrincipal final User user, @PathVariable final Long id) {
        return contactService.remove(user, id)
                .map(ContactResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND_MESSAGE));
    }
}
