package addressbook.service;

import addressbook.api.exception.InvalidRequestException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * {@link AvatarStorage} on the local file system.
 *
 * <p>Files land in {@code app.avatar.storage-dir} as {@code <username>.<ext>}, so a new
 * upload overwrites the previous one. They are served under {@code app.avatar.public-base-url}
 * by the static resource handler in {@link addressbook.config.WebConfig}.
 */
@Component
public class LocalAvatarStorage implements AvatarStorage {

    /** Client message for an upload whose content type is not {@code image/*}. */
    public static final String AVATAR_NOT_IMAGE_MESSAGE = "Avatar must be an image";

    private static final Logger LOG = LoggerFactory.getLogger(LocalAvatarStorage.class);

    private static final Map<String, String> EXTENSIONS = Map.of(
            MediaType.IMAGE_PNG_VALUE, "png",
            MediaType.IMAGE_JPEG_VALUE, "jpg",
            MediaType.IMAGE_GIF_VALUE, "gif",
            "image/webp", "webp");

    private final Path storageDir;
    private final String publicBaseUrl;

    public LocalAvatarStorage(
            @Value("${app.avatar.storage-dir:./avatars}") final String storageDir,
            @Value("${app.avatar.public-base-url:/avatars}") final String publicBaseUrl) {
        this.storageDir = Paths.get(storageDir).toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl.endsWith("/")
                ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
                : publicBaseUrl;
    }

    @Override
    public String store(final String username, final String contentType, final InputStream content)
            throws IOException {
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
            throw new InvalidRequestException(AVATAR_NOT_IMAGE_MESSAGE);
        }
        if (content == null) {
            throw new IllegalArgumentException("Avatar content must not be null");
        }
        final String fileName = safeName(username) + "." + extensionFor(contentType);
        final Path target = storageDir.resolve(fileName).normalize();
        if (!target.startsWith(storageDir)) {
            throw new IllegalArgumentException("Invalid avatar name");
        }
        Files.createDirectories(storageDir);
        Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        LOG.info("Stored avatar for user '{}' at {}", username, target);
        return publicBaseUrl + "/" + fileName;
    }

    Path storageDir() {
        return storageDir;
    }

    private static String extensionFor(final String contentType) {
        final String base = contentType.toLowerCase(Locale.ROOT).split(";", 2)[0].trim();
        return EXTENSIONS.getOrDefault(base, "img");
    }

    private static String safeName(final String username) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username must not be blank");
        }
        return username.trim().replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
