package org.Aayush.tempo.core.time;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Clock;
import java.util.Objects;

/**
 * Shared unit constants and floor-safe conversions used by calendar and fixed-width values.
 *
 * <p>All methods are safe for negative inputs.</p>
 */
public final class TimeUtils {

    /**
     * Counter resolutions used by fixed-width date-time values.
     */
    @Getter
    @Accessors(fluent = true)
    @RequiredArgsConstructor
    public enum TickUnit {
        MILLISECONDS(1L),
        MINUTES(60_000L),
        HOURS(3_600_000L);

        /** Number of milliseconds represented by one tick. */
        private final long millisPerTick;
    }

    public static final long NANOS_PER_MICRO = 1_000L;
    public static final long MICROS_PER_MILLI = 1_000L;
    public static final long MILLIS_PER_SECOND = 1_000L;
    public static final long NANOS_PER_SECOND = 1_000_000_000L;
    public static final long SECONDS_PER_MINUTE = 60L;
    public static final long MINUTES_PER_HOUR = 60L;
    public static final long HOURS_PER_DAY = 24L;
    public static final long SECONDS_PER_HOUR = 3_600L;
    public static final long SECONDS_PER_DAY = 86_400L;
    public static final long MILLIS_PER_DAY = 86_400_000L;
    public static final int DAYS_PER_WEEK = 7;

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Converts milliseconds into whole ticks of {@code unit}, flooring toward negative infinity.
     *
     * @param millis millisecond count (may be negative).
     * @param unit target tick unit.
     * @return floor of {@code millis / unit.millisPerTick()}.
     */
    public static long toTicks(long millis, TickUnit unit) {
        if (unit == null) {
            throw new IllegalArgumentException("Tick unit cannot be null");
        }
        return Math.floorDiv(millis, unit.millisPerTick());
    }

    /**
     * Converts ticks of {@code unit} back to milliseconds.
     *
     * @throws ArithmeticException on overflow.
     */
    public static long toMillis(long ticks, TickUnit unit) {
        if (unit == null) {
            throw new IllegalArgumentException("Tick unit cannot be null");
        }
        return Math.multiplyExact(ticks, unit.millisPerTick());
    }

    /**
     * Returns day-of-week for a day count relative to an epoch whose weekday is known.
     *
     * @param daysSinceEpoch days since the epoch (may be negative).
     * @param epochDayOfWeek weekday of the epoch day, Monday = 0.
     * @return day-of-week where Monday = 0 and Sunday = 6.
     */
    public static int dayOfWeek(long daysSinceEpoch, int epochDayOfWeek) {
        return (int) Math.floorMod(daysSinceEpoch + epochDayOfWeek, (long) DAYS_PER_WEEK);
    }

    /**
     * Reads Unix epoch milliseconds from a clock.
     */
    public static long currentUnixMillis(Clock clock) {
        return Objects.requireNonNull(clock, "clock").millis();
    }

    /**
     * Formats a signed offset in minutes as {@code +HH:mm} / {@code -HH:mm}.
     *
     * @param totalMinutes signed offset in minutes.
     * @return formatted offset such as {@code +05:30}.
     */
    public static String formatOffset(int totalMinutes) {
        char sign = totalMinutes < 0 ? '-' : '+';
        int magnitude = Math.abs(totalMinutes);
        return String.format("%c%02d:%02d", sign, magnitude / 60, magnitude % 60);
    }
}
