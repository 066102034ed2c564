package addressbook.persistence;

import addressbook.api.exception.DuplicateResourceException;
import java.sql.SQLException;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.dao.DataIntegrityViolationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntegrityViolationTranslatorTest {

    private final IntegrityViolationTranslator translator = new IntegrityViolationTranslator();

    @Test
    void successfulWriteReturnsItsResult() {
        assertThat(translator.execute(() -> "saved")).isEqualTo("saved");
    }

    @ParameterizedTest
    @CsvSource({
            "uq_contacts_user_email, The contact with this email already exists.",
            "UQ_USERS_EMAIL, User with this email already exists",
            "uq_users_username, User with this username already exists",
            "fk_contacts_user, The integrity error occurred."
    })
    void constraintNameSelectsMessage(final String constraint, final String expected) {
        final DataIntegrityViolationException ex = new DataIntegrityViolationException(
                "could not execute statement",
                new ConstraintViolationException("violation", new SQLException("violation", "23505"), constraint));

        assertThatThrownBy(() -> translator.execute(() -> {
            throw ex;
        }))
                .isInstanceOf(DuplicateResourceException.class)
                .hasMessage(expected)
                .hasCause(ex);
    }

    @Test
    void driverMessageIsUsedWhenConstraintNameIsMissing() {
        final DataIntegrityViolationException ex = new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException("ERROR: duplicate key value violates unique constraint \"uq_users_email\""));

        assertThatThrownBy(() -> translator.run(() -> {
            throw ex;
        }))
                .isInstanceOf(DuplicateResourceException.class)
                .hasMessage("User with this email already exists");
    }

    @Test
    void unknownViolationFallsBackToGenericMessageWithoutDatabaseText() {
        final DataIntegrityViolationException ex = new DataIntegrityViolationException(
                "null value in column \"email\" violates not-null constraint");

        assertThatThrownBy(() -> translator.execute(() -> {
            throw ex;
        }))
                .isInstanceOf(DuplicateResourceException.class)
                .hasMessage(IntegrityViolationTranslator.GENERIC_MESSAGE);
    }

    @Test
    void otherExceptionsPassThrough() {
        assertThatThrownBy(() -> translator.execute(() -> {
            throw new IllegalStateException("boom");
        }))
                .isInstanceOf(IllegalStateException.class);
    }
}
