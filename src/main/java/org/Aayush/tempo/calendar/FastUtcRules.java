package org.Aayush.tempo.calendar;

/**
 * Simplified rules backing {@link CalendarKind#FAST_UTC}.
 * <p>
 * Every year has 365 days and every month 30, except December which takes the five
 * days left over so that a year still closes at 365. Nothing is ever a leap day or a
 * leap second.
 * </p>
 */
final class FastUtcRules {

    static final int DAYS_PER_YEAR = 365;
    static final int DAYS_PER_MONTH = 30;
    static final int DAYS_IN_LAST_MONTH = DAYS_PER_YEAR - 11 * DAYS_PER_MONTH;

    private FastUtcRules() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    static int daysInMonth(int month) {
        return month == 12 ? DAYS_IN_LAST_MONTH : DAYS_PER_MONTH;
    }

    static int dayOfYear(int month, int day) {
        return (month - 1) * DAYS_PER_MONTH + day;
    }
}
