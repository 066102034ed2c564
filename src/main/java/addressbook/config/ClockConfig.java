package addressbook.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides an application-wide {@link Clock} bean for time-sensitive operations.
 *
 * <p>Token issuance, token expiry checks and the upcoming-birthday window all read
 * time from this clock, so tests can pin "today" with {@link Clock#fixed}.
 *
 * <h2>Configuration</h2>
 * <pre>
 * app:
 *   timezone: Europe/Kyiv
 * </pre>
 *
 * <p>If not specified, defaults to the JVM's system default zone. The zone matters for
 * birthdays: "today" is the calendar date in this zone.
 */
@Configuration
public class ClockConfig {

    /**
     * Creates a Clock bean configured for the application's business timezone.
     *
     * @param timezone the IANA timezone ID (e.g., "Europe/Kyiv", "UTC")
     * @return a Clock in the configured timezone
     */
    @Bean
    public Clock clock(@Value("${app.timezone:}") final String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(timezone));
    }
}
