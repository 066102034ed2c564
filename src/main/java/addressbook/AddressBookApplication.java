package addressbook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the address book REST API.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AddressBookApplication {

    public static void main(final String[] args) {
        SpringApplication.run(AddressBookApplication.class, args);
    }
}
