package org.Aayush.tempo.calendar;

import java.util.Arrays;

/**
 * Proleptic Gregorian rules backing {@link CalendarKind#GREGORIAN}.
 */
final class GregorianRules {

    static final int DAYS_PER_400_YEARS = 146_097;
    static final int LEAP_SECOND_START_YEAR = 1972;
    static final int LEAP_SECONDS_SINCE_1972 = 27;

    private static final int[] DAYS_IN_MONTH = {31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};
    private static final int[] DAYS_BEFORE_MONTH = {0, 31, 59, 90, 120, 151, 181, 212, 243, 273, 304, 334};

    // Days that ended with an inserted 23:59:60, encoded as yyyymmdd and kept sorted.
    private static final int[] LEAP_SECOND_DAYS = {
            19720630, 19721231, 19731231, 19741231, 19751231, 19761231, 19771231,
            19781231, 19791231, 19810630, 19820630, 19830630, 19850630, 19871231,
            19891231, 19901231, 19920630, 19930630, 19940630, 19951231, 19970630,
            19981231, 20051231, 20081231, 20120630, 20150630, 20161231
    };

    private GregorianRules() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    static boolean isLeapYear(long year) {
        return year % 4 == 0 && (year % 100 != 0 || year % 400 == 0);
    }

    static int daysInMonth(int year, int month) {
        if (month == 2 && isLeapYear(year)) {
            return 29;
        }
        return DAYS_IN_MONTH[month - 1];
    }

    static int daysInYear(int year) {
        return isLeapYear(year) ? 366 : 365;
    }

    static int dayOfYear(int year, int month, int day) {
        int leapDay = month > 2 && isLeapYear(year) ? 1 : 0;
        return DAYS_BEFORE_MONTH[month - 1] + leapDay + day;
    }

    /**
     * Days from 0001-01-01 to January 1st of {@code year}.
     */
    static long daysBeforeYear(long year) {
        long y = year - 1;
        return y * 365 + Math.floorDiv(y, 4) - Math.floorDiv(y, 100) + Math.floorDiv(y, 400);
    }

    /**
     * Leap years strictly before {@code year}, counted from year 1.
     */
    static long leapYearsBefore(long year) {
        long y = year - 1;
        return Math.floorDiv(y, 4) - Math.floorDiv(y, 100) + Math.floorDiv(y, 400);
    }

    static int dayOfWeek(int year, int month, int day) {
        long days = daysBeforeYear(year) + dayOfYear(year, month, day);
        return (int) Math.floorMod(days + 6, 7L);
    }

    static boolean isLeapSecond(int year, int month, int day, int hour, int minute, int second) {
        if (second != 60 || minute != 59 || hour != 23) {
            return false;
        }
        return Arrays.binarySearch(LEAP_SECOND_DAYS, year * 10_000 + month * 100 + day) >= 0;
    }

    /**
     * Cumulative leap seconds in effect on a date. Uses the single post-1972 total
     * instead of walking {@link #LEAP_SECOND_DAYS}.
     */
    static int leapSecondsInEffect(int year) {
        return year >= LEAP_SECOND_START_YEAR ? LEAP_SECONDS_SINCE_1972 : 0;
    }
}
