package addressbook.service;

import java.io.IOException;
import java.io.InputStream;

/**
 * Stores a user's uploaded avatar image and tells where it can be fetched.
 */
public interface AvatarStorage {

    /**
     * Stores the image, replacing any earlier avatar for the same user.
     *
     * @param username    owner of the avatar; determines the stored name
     * @param contentType declared MIME type, must be {@code image/*}
     * @param content     image bytes
     * @return public URL of the stored image
     * @throws addressbook.api.exception.InvalidRequestException if the content type is not an image type
     * @throws IOException              if the image cannot be written
     */
    String store(String username, String contentType, InputStream content) throws IOException;
}
