package org.Aayush.tempo.fixed;

import org.Aayush.tempo.calendar.Calendar;
import org.Aayush.tempo.core.hash.HashFields;
import org.Aayush.tempo.core.time.TimeUtils;
import org.Aayush.tempo.date.DateTimeAmount;
import org.Aayush.tempo.zone.TimeZone;

import java.util.Objects;

/**
 * Counter and field conversions shared by the fixed-width family.
 */
final class FixedConversions {
    static final Calendar CALENDAR = Calendar.UTC_FAST;
    static final int EPOCH_YEAR = CALENDAR.minYear();

    private static final long FAST_DAYS_PER_YEAR = CALENDAR.maxTypicalDaysInYear();
    private static final long FAST_DAYS_PER_MONTH = 30L;

    private FixedConversions() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Fields of an unsigned millisecond count since the epoch.
     */
    static HashFields fieldsFromMillis(long unsignedMillis) {
        return CALENDAR.fieldsFromMillis(unsignedMillis);
    }

    /**
     * Fields of an unsigned tick count since the epoch.
     */
    static HashFields fieldsFromTicks(long unsignedTicks, TimeUtils.TickUnit unit) {
        return fieldsFromMillis(unsignedTicks * unit.millisPerTick());
    }

    /**
     * Milliseconds since the epoch of a fast-calendar civil time.
     */
    static long millisOf(int year, int month, int day, int hour, int minute, int second, int millisecond) {
        return CALENDAR.millisSinceEpoch(year, month, day, hour, minute, second, millisecond);
    }

    /**
     * Length of an amount on the fast calendar: a year is 365 days and a month 30 days.
     * Sub-millisecond units are floored.
     */
    static long amountMillis(DateTimeAmount amount) {
        Objects.requireNonNull(amount, "amount");
        long days = Math.addExact(
                Math.addExact(Math.multiplyExact(amount.years(), FAST_DAYS_PER_YEAR),
                        Math.multiplyExact(amount.months(), FAST_DAYS_PER_MONTH)),
                amount.days());
        long seconds = Math.addExact(
                Math.addExact(Math.multiplyExact(days, TimeUtils.SECONDS_PER_DAY),
                        Math.multiplyExact(amount.hours(), TimeUtils.SECONDS_PER_HOUR)),
                Math.addExact(Math.multiplyExact(amount.minutes(), TimeUtils.SECONDS_PER_MINUTE), amount.seconds()));
        long subSecondMillis = Math.addExact(
                amount.milliseconds(),
                Math.addExact(
                        Math.floorDiv(amount.microseconds(), TimeUtils.MICROS_PER_MILLI),
                        Math.floorDiv(amount.nanoseconds(), TimeUtils.NANOS_PER_MICRO * TimeUtils.MICROS_PER_MILLI)));
        return Math.addExact(Math.multiplyExact(seconds, TimeUtils.MILLIS_PER_SECOND), subSecondMillis);
    }

    /**
     * Whole ticks of an amount, floored.
     */
    static long amountTicks(DateTimeAmount amount, TimeUtils.TickUnit unit) {
        return TimeUtils.toTicks(amountMillis(amount), unit);
    }

    /**
     * Offset of {@code zone} at a local fast-calendar time, in milliseconds.
     */
    static long offsetMillis(TimeZone zone, HashFields local) {
        Objects.requireNonNull(zone, "zone");
        int minutes = zone.offsetAt(
                local.year(), local.month(), local.day(), local.hour(), local.minute(), local.second(), CALENDAR
        ).totalMinutes();
        return minutes * TimeUtils.SECONDS_PER_MINUTE * TimeUtils.MILLIS_PER_SECOND;
    }

    /**
     * Shifts a local tick counter to UTC.
     */
    static long toUtcTicks(long unsignedTicks, TimeUtils.TickUnit unit, TimeZone zone) {
        HashFields local = fieldsFromTicks(unsignedTicks, unit);
        long millis = unsignedTicks * unit.millisPerTick() - offsetMillis(zone, local);
        return TimeUtils.toTicks(millis, unit);
    }

    /**
     * Shifts a UTC tick counter to local time in {@code zone}.
     */
    static long fromUtcTicks(long unsignedTicks, TimeUtils.TickUnit unit, TimeZone zone) {
        long utcMillis = unsignedTicks * unit.millisPerTick();
        long guess = offsetMillis(zone, fieldsFromMillis(utcMillis));
        long actual = offsetMillis(zone, fieldsFromMillis(utcMillis + guess));
        return TimeUtils.toTicks(utcMillis + actual, unit);
    }

    /**
     * Rejects fields outside the fast calendar or beyond the year a layout can hold.
     */
    static void requireValid(
            int year,
            int month,
            int day,
            int hour,
            int minute,
            int second,
            int millisecond,
            int maxYear
    ) {
        if (year > maxYear || !CALENDAR.isValid(year, month, day, hour, minute, second, millisecond, 0, 0)) {
            throw new IllegalArgumentException(String.format(
                    "invalid fixed date-time %04d-%02d-%02dT%02d:%02d:%02d.%03d (max year %d)",
                    year, month, day, hour, minute, second, millisecond, maxYear));
        }
    }
}
