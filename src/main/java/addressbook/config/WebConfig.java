package addressbook.config;

import java.nio.file.Paths;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves uploaded avatars from {@code app.avatar.storage-dir} under {@code /avatars/**}.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    static final String AVATAR_PATH_PATTERN = "/avatars/**";

    private final String storageDir;

    public WebConfig(@Value("${app.avatar.storage-dir:./avatars}") final String storageDir) {
        this.storageDir = storageDir;
    }

    @Override
    public void addResourceHandlers(final ResourceHandlerRegistry registry) {
        final String location = Paths.get(storageDir).toAbsolutePath().normalize().toUri().toString();
        registry.addResourceHandler(AVATAR_PATH_PATTERN)
                .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
