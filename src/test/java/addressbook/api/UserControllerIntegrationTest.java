package addressbook.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import addressbook.security.TestUserSetup;
import addressbook.security.User;
import addressbook.service.LocalAvatarStorage;
import addressbook.support.PostgresContainerSupport;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class UserControllerIntegrationTest extends PostgresContainerSupport {

    private static final byte[] PNG_BYTES = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n'};

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private TestUserSetup testUserSetup;

    private String username;
    private String bearer;

    @BeforeEach
    void setUp() {
        username = "carol" + UUID.randomUUID().toString().substring(0, 8);
        final User user = testUserSetup.confirmedUser(username);
        bearer = testUserSetup.bearer(user);
    }

    @Test
    void me_returnsCurrentUserWithoutPassword() throws Exception {
        mockMvc.perform(get("/api/users/me").header(HttpHeaders.AUTHORIZATION, bearer).with(clientAddress()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value(username))
                .andExpect(jsonPath("$.email").value(username + "@example.com"))
                .andExpect(jsonPath("$.confirmed").value(true))
                .andExpect(jsonPath("$.password").doesNotExist());
    }

    @Test
    void me_withoutToken_returns401() throws Exception {
        mockMvc.perform(get("/api/users/me").with(clientAddress()))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    void uploadAvatar_storesFileAndUpdatesUser() throws Exception {
        final MockMultipartFile file = new MockMultipartFile("file", "me.png", MediaType.IMAGE_PNG_VALUE, PNG_BYTES);

        mockMvc.perform(multipart(HttpMethod.PATCH, "/api/users/avatar")
                        .file(file)
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.avatar").value("/avatars/" + username + ".png"));

        mockMvc.perform(get("/api/users/me").header(HttpHeaders.AUTHORIZATION, bearer).with(clientAddress()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.avatar").value("/avatars/" + username + ".png"));

        mockMvc.perform(get("/avatars/{name}", username + ".png"))
                .andExpect(status().isOk())
                .andExpect(content().bytes(PNG_BYTES));
    }

    @Test
    void uploadAvatar_rejectsNonImage() throws Exception {
        final MockMultipartFile file = new MockMultipartFile(
                "file", "notes.txt", MediaType.TEXT_PLAIN_VALUE, "hello".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart(HttpMethod.PATCH, "/api/users/avatar")
                        .file(file)
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.message").value(LocalAvatarStorage.AVATAR_NOT_IMAGE_MESSAGE));
    }

    @Test
    void uploadAvatar_rejectsEmptyFile() throws Exception {
        final MockMultipartFile file = new MockMultipartFile("file", "me.png", MediaType.IMAGE_PNG_VALUE, new byte[0]);

        mockMvc.perform(multipart(HttpMethod.PATCH, "/api/users/avatar")
                        .file(file)
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(UserController.EMPTY_AVATAR_MESSAGE));
    }

    @Test
    void uploadAvatar_withoutFilePart_returns422() throws Exception {
        mockMvc.perform(multipart(HttpMethod.PATCH, "/api/users/avatar")
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isUnprocessableEntity());
    }

    // Separate client address so these calls never share a rate-limit window with other suites.
    private static RequestPostProcessor clientAddress() {
        return request -> {
            request.setRemoteAddr("198.51.100.20");
            return request;
        };
    }
}
