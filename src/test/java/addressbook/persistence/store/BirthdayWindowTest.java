package addressbook.persistence.store;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BirthdayWindowTest {

    @Test
    void windowInsideOneYearHasSingleRange() {
        final BirthdayWindow window = BirthdayWindow.startingOn(LocalDate.of(2024, 6, 10), 7);

        assertThat(window.wrapsYearEnd()).isFalse();
        assertThat(window.firstFrom()).isEqualTo(610);
        assertThat(window.firstTo()).isEqualTo(617);
        assertThat(window.secondFrom()).isGreaterThan(window.secondTo());
    }

    @Test
    void windowCrossingYearEndIsSplit() {
        final BirthdayWindow window = BirthdayWindow.startingOn(LocalDate.of(2024, 12, 28), 7);

        assertThat(window.wrapsYearEnd()).isTrue();
        assertThat(window.firstFrom()).isEqualTo(1228);
        assertThat(window.firstTo()).isEqualTo(1231);
        assertThat(window.secondFrom()).isEqualTo(101);
        assertThat(window.secondTo()).isEqualTo(104);
    }

    @ParameterizedTest
    @CsvSource({
            "1979-12-28, true",
            "2001-12-31, true",
            "1990-01-02, true",
            "1990-01-04, true",
            "1990-01-05, false",
            "1985-06-15, false",
            "1970-12-27, false"
    })
    void dec28IncludesEarlyJanuaryAndExcludesMidYear(final LocalDate birthday, final boolean expected) {
        final BirthdayWindow window = BirthdayWindow.startingOn(LocalDate.of(2024, 12, 28), 7);

        assertThat(window.contains(birthday)).isEqualTo(expected);
    }

    @Test
    void leapDayIsMatchedOnlyWhenWindowReachesIt() {
        final BirthdayWindow leapYear = BirthdayWindow.startingOn(LocalDate.of(2024, 2, 25), 7);
        final BirthdayWindow march = BirthdayWindow.startingOn(LocalDate.of(2023, 3, 1), 7);

        assertThat(leapYear.contains(LocalDate.of(2000, 2, 29))).isTrue();
        assertThat(march.contains(LocalDate.of(2000, 2, 29))).isFalse();
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> BirthdayWindow.startingOn(null, 7)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BirthdayWindow.startingOn(LocalDate.of(2024, 1, 1), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
