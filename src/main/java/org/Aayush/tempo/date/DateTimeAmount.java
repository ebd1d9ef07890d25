package org.Aayush.tempo.date;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Signed amount of calendar units to add to a {@link CalendarDateTime}. Units are applied as
 * raw sums and normalized together, so no unit is converted to another before adding.
 */
@Value
@Builder(toBuilder = true)
@Accessors(fluent = true)
public class DateTimeAmount {
    public static final DateTimeAmount ZERO = DateTimeAmount.builder().build();

    long years;
    long months;
    long days;
    long hours;
    long minutes;
    long seconds;
    long milliseconds;
    long microseconds;
    long nanoseconds;

    public static DateTimeAmount ofYears(long years) {
        return DateTimeAmount.builder().years(years).build();
    }

    public static DateTimeAmount ofMonths(long months) {
        return DateTimeAmount.builder().months(months).build();
    }

    public static DateTimeAmount ofDays(long days) {
        return DateTimeAmount.builder().days(days).build();
    }

    public static DateTimeAmount ofHours(long hours) {
        return DateTimeAmount.builder().hours(hours).build();
    }

    public static DateTimeAmount ofMinutes(long minutes) {
        return DateTimeAmount.builder().minutes(minutes).build();
    }

    public static DateTimeAmount ofSeconds(long seconds) {
        return DateTimeAmount.builder().seconds(seconds).build();
    }

    public static DateTimeAmount ofNanoseconds(long nanoseconds) {
        return DateTimeAmount.builder().nanoseconds(nanoseconds).build();
    }

    /**
     * Returns whether every unit is zero.
     */
    public boolean isZero() {
        return years == 0 && months == 0 && days == 0 && hours == 0 && minutes == 0
                && seconds == 0 && milliseconds == 0 && microseconds == 0 && nanoseconds == 0;
    }

    /**
     * Returns the amount with every unit negated.
     *
     * @throws ArithmeticException when a unit is {@link Long#MIN_VALUE}.
     */
    public DateTimeAmount negated() {
        return new DateTimeAmount(
                Math.negateExact(years),
                Math.negateExact(months),
                Math.negateExact(days),
                Math.negateExact(hours),
                Math.negateExact(minutes),
                Math.negateExact(seconds),
                Math.negateExact(milliseconds),
                Math.negateExact(microseconds),
                Math.negateExact(nanoseconds)
        );
    }
}
