package addressbook.service;

import addressbook.api.exception.InvalidRequestException;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalAvatarStorageTest {

    @TempDir
    Path dir;

    @Test
    void storesImageUnderUsernameAndReturnsPublicUrl() throws Exception {
        final LocalAvatarStorage storage = new LocalAvatarStorage(dir.toString(), "/avatars/");

        final String url = storage.store("alice", "image/png", new ByteArrayInputStream(new byte[]{1, 2, 3}));

        assertThat(url).isEqualTo("/avatars/alice.png");
        assertThat(Files.readAllBytes(dir.resolve("alice.png"))).containsExactly(1, 2, 3);
    }

    @Test
    void newUploadReplacesPreviousOne() throws Exception {
        final LocalAvatarStorage storage = new LocalAvatarStorage(dir.toString(), "/avatars");

        storage.store("alice", "image/jpeg", new ByteArrayInputStream("old".getBytes(StandardCharsets.UTF_8)));
        storage.store("alice", "image/jpeg", new ByteArrayInputStream("new".getBytes(StandardCharsets.UTF_8)));

        assertThat(Files.readString(dir.resolve("alice.jpg"))).isEqualTo("new");
    }

    @Test
    void rejectsNonImageContent() {
        final LocalAvatarStorage storage = new LocalAvatarStorage(dir.toString(), "/avatars");

        assertThatThrownBy(() -> storage.store("alice", "text/plain", new ByteArrayInputStream(new byte[0])))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage(LocalAvatarStorage.AVATAR_NOT_IMAGE_MESSAGE);
        assertThatThrownBy(() -> storage.store("alice", null, new ByteArrayInputStream(new byte[0])))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void usernameCannotEscapeStorageDirectory() throws Exception {
        final LocalAvatarStorage storage = new LocalAvatarStorage(dir.toString(), "/avatars");

        final String url = storage.store("../../etc/passwd", "image/png", new ByteArrayInputStream(new byte[]{1}));

        assertThat(url).doesNotContain("/../");
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).hasSize(1);
        }
    }
}
