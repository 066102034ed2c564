package addressbook.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson configuration to enforce strict type checking.
 *
 * <p>By default, Jackson coerces scalars to strings (e.g., {@code 5551234567} becomes
 * {@code "5551234567"}). Contact and registration payloads declare their fields as strings,
 * so a number or boolean where a name, email or phone number is expected is rejected with a
 * validation error instead of being silently converted.
 */
@Configuration
public class JacksonConfig {

    /**
     * Customizes the Spring-managed ObjectMapper to reject type coercion for string fields.
     *
     * @return customizer for the ObjectMapper builder
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer strictCoercionCustomizer() {
        return builder -> builder.postConfigurer(JacksonConfig::configureStrictCoercion);
    }

    static void configureStrictCoercion(final ObjectMapper mapper) {
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail);
    }
}
