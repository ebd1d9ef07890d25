package org.Aayush.tempo.date;

import org.Aayush.tempo.calendar.Calendar;
import org.Aayush.tempo.core.hash.HashFields;
import org.Aayush.tempo.core.time.TimeUtils;

/**
 * Reduce-and-carry normalization shared by {@link CalendarDate} and {@link CalendarDateTime}.
 * <p>
 * Inputs are raw (possibly out-of-range, possibly negative) sums. Each unit is reduced into
 * its calendar bound and the excess carried into the next larger unit, in the order
 * nanosecond, microsecond, millisecond, second, minute, hour, day; months then carry into
 * years, years wrap into {@code [minYear, maxYear]}, and days are finally settled against the
 * month lengths of the resulting year and month.
 * </p>
 */
final class FieldNormalizer {
    private static final int MONTHS_PER_YEAR = 12;

    private FieldNormalizer() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * In-range date fields.
     */
    record DateParts(int year, int month, int day) {
    }

    /**
     * In-range date-time fields.
     */
    record DateTimeParts(
            DateParts date,
            int hour,
            int minute,
            int second,
            int millisecond,
            int microsecond,
            int nanosecond
    ) {
    }

    static DateParts normalizeDate(Calendar calendar, long year, long month, long day) {
        long monthIndex = month - calendar.minMonth();
        long carriedYear = Math.addExact(year, Math.floorDiv(monthIndex, MONTHS_PER_YEAR));
        int normalizedMonth = (int) Math.floorMod(monthIndex, MONTHS_PER_YEAR) + calendar.minMonth();
        int normalizedYear = wrapYear(calendar, carriedYear);

        if (day >= calendar.minDay() && day <= calendar.maxDaysInMonth(normalizedYear, normalizedMonth)) {
            return new DateParts(normalizedYear, normalizedMonth, (int) day);
        }
        long firstOfMonth = calendar.daysSinceEpoch(normalizedYear, normalizedMonth, calendar.minDay());
        long ordinal = Math.addExact(firstOfMonth, day - calendar.minDay());
        HashFields fields = calendar.dateFromDays(Math.floorMod(ordinal, calendar.daysInYearRange()));
        return new DateParts(fields.year(), fields.month(), fields.day());
    }

    static DateTimeParts normalizeDateTime(
            Calendar calendar,
            long year,
            long month,
            long day,
            long hour,
            long minute,
            long second,
            long millisecond,
            long microsecond,
            long nanosecond
    ) {
        long carry = Math.floorDiv(nanosecond, TimeUtils.NANOS_PER_MICRO);
        int ns = (int) Math.floorMod(nanosecond, TimeUtils.NANOS_PER_MICRO);

        long totalMicros = Math.addExact(microsecond, carry);
        carry = Math.floorDiv(totalMicros, TimeUtils.MICROS_PER_MILLI);
        int us = (int) Math.floorMod(totalMicros, TimeUtils.MICROS_PER_MILLI);

        long totalMillis = Math.addExact(millisecond, carry);
        carry = Math.floorDiv(totalMillis, TimeUtils.MILLIS_PER_SECOND);
        int ms = (int) Math.floorMod(totalMillis, TimeUtils.MILLIS_PER_SECOND);

        long totalSeconds = Math.addExact(second, carry);
        carry = Math.floorDiv(totalSeconds, TimeUtils.SECONDS_PER_MINUTE);
        int s = (int) Math.floorMod(totalSeconds, TimeUtils.SECONDS_PER_MINUTE);

        long totalMinutes = Math.addExact(minute, carry);
        carry = Math.floorDiv(totalMinutes, TimeUtils.MINUTES_PER_HOUR);
        int mi = (int) Math.floorMod(totalMinutes, TimeUtils.MINUTES_PER_HOUR);

        long totalHours = Math.addExact(hour, carry);
        carry = Math.floorDiv(totalHours, TimeUtils.HOURS_PER_DAY);
        int h = (int) Math.floorMod(totalHours, TimeUtils.HOURS_PER_DAY);

        DateParts date = normalizeDate(calendar, year, month, Math.addExact(day, carry));
        return new DateTimeParts(date, h, mi, s, ms, us, ns);
    }

    private static int wrapYear(Calendar calendar, long year) {
        long span = (long) calendar.maxYear() - calendar.minYear() + 1;
        return (int) (calendar.minYear() + Math.floorMod(year - calendar.minYear(), span));
    }
}
