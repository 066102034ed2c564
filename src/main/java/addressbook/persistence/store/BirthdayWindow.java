package addressbook.persistence.store;

import java.time.LocalDate;
import java.time.MonthDay;

/**
 * An inclusive range of calendar days, ignoring the year, starting today.
 *
 * <p>Days are encoded as {@code month * 100 + day} (so 28 December is {@code 1228}). When the
 * range crosses the end of the year it is split in two: {@code [start, 1231]} and
 * {@code [101, end]}. A window that does not wrap has an empty second range.
 */
public final class BirthdayWindow {

    /** Number of days after today that still count as upcoming. */
    public static final int DEFAULT_DAYS_AHEAD = 7;

    private static final int YEAR_END_KEY = 1231;
    private static final int YEAR_START_KEY = 101;

    private final int firstFrom;
    private final int firstTo;
    private final int secondFrom;
    private final int secondTo;

    private BirthdayWindow(final int firstFrom, final int firstTo, final int secondFrom, final int secondTo) {
        this.firstFrom = firstFrom;
        this.firstTo = firstTo;
        this.secondFrom = secondFrom;
        this.secondTo = secondTo;
    }

    /**
     * Builds the window {@code [today, today + daysAhead]}.
     *
     * @param today     current date in the application's time zone
     * @param daysAhead non-negative length of the window beyond today
     * @return the window
     */
    public static BirthdayWindow startingOn(final LocalDate today, final int daysAhead) {
        if (today == null) {
            throw new IllegalArgumentException("today must not be null");
        }
        if (daysAhead < 0 || daysAhead > 365) {
            throw new IllegalArgumentException("daysAhead must be between 0 and 365");
        }
        final int start = key(MonthDay.from(today));
        final int end = key(MonthDay.from(today.plusDays(daysAhead)));
        if (start <= end) {
            return new BirthdayWindow(start, end, 1, 0);
        }
        return new BirthdayWindow(start, YEAR_END_KEY, YEAR_START_KEY, end);
    }

    /**
     * @param date any date
     * @return true if the date's month and day fall inside this window
     */
    public boolean contains(final LocalDate date) {
        final int k = key(MonthDay.from(date));
        return (k >= firstFrom && k <= firstTo) || (k >= secondFrom && k <= secondTo);
    }

    public boolean wrapsYearEnd() {
        return secondFrom <= secondTo;
    }

    public int firstFrom() {
        return firstFrom;
    }

    public int firstTo() {
        return firstTo;
    }

    public int secondFrom() {
        return secondFrom;
    }

    public int secondTo() {
        return secondTo;
    }

    static int key(final MonthDay monthDay) {
        return monthDay.getMonthValue() * 100 + monthDay.getDayOfMonth();
    }

    @Override
    public String toString() {
        return wrapsYearEnd()
                ? "BirthdayWindow[" + firstFrom + ".." + firstTo + ", " + secondFrom + ".." + secondTo + "]"
                : "BirthdayWindow[" + firstFrom + ".." + firstTo + "]";
    }
}
