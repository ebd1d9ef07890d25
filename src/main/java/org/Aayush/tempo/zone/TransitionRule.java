package org.Aayush.tempo.zone;

import lombok.EqualsAndHashCode;
import org.Aayush.tempo.calendar.Calendar;

import java.util.Objects;

/**
 * Daylight-saving start or end rule packed into twelve bits.
 * <pre>
 * bits 11-8 : month, 1..12
 * bits 7-5  : target day of week, Monday = 0
 * bit 4     : count from the end of the month
 * bit 3     : week ordinal (0 = first matching weekday, 1 = second)
 * bits 2-0  : hour code, mapping 0..7 to 20, 21, 22, 23, 0, 1, 2, 3
 * </pre>
 * <p>
 * "Last Sunday of March at 01:00" is {@code (3, 6, true, 0, 1)}; "second Sunday of March
 * at 02:00" is {@code (3, 6, false, 1, 2)}.
 * </p>
 */
@EqualsAndHashCode
public final class TransitionRule {
    public static final int BIT_WIDTH = 12;

    private static final int[] HOURS_BY_CODE = {20, 21, 22, 23, 0, 1, 2, 3};
    private static final int MONTH_SHIFT = 8;
    private static final int DOW_SHIFT = 5;
    private static final int END_OF_MONTH_SHIFT = 4;
    private static final int WEEK_SHIFT = 3;
    private static final int MASK = (1 << BIT_WIDTH) - 1;

    private final int bits;

    /**
     * Creates a rule.
     *
     * @param month transition month, 1..12.
     * @param dayOfWeek target weekday, Monday = 0.
     * @param endOfMonth {@code true} to count weekdays backward from the last day.
     * @param week {@code 0} for the first matching weekday, {@code 1} for the second.
     * @param hour transition hour, one of 20, 21, 22, 23, 0, 1, 2, 3.
     */
    public TransitionRule(int month, int dayOfWeek, boolean endOfMonth, int week, int hour) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("transition month must be in [1, 12]: " + month);
        }
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new IllegalArgumentException("transition day of week must be in [0, 6]: " + dayOfWeek);
        }
        if (week != 0 && week != 1) {
            throw new IllegalArgumentException("transition week must be 0 or 1: " + week);
        }
        this.bits = month << MONTH_SHIFT
                | dayOfWeek << DOW_SHIFT
                | (endOfMonth ? 1 : 0) << END_OF_MONTH_SHIFT
                | week << WEEK_SHIFT
                | hourCode(hour);
    }

    /**
     * Decodes the low twelve bits of {@code packed}.
     */
    public static TransitionRule fromBits(int packed) {
        int value = packed & MASK;
        return new TransitionRule(
                value >>> MONTH_SHIFT,
                (value >>> DOW_SHIFT) & 0x07,
                ((value >>> END_OF_MONTH_SHIFT) & 1) == 1,
                (value >>> WEEK_SHIFT) & 1,
                HOURS_BY_CODE[value & 0x07]
        );
    }

    /**
     * Returns whether {@code hour} can be encoded.
     */
    public static boolean isEncodableHour(int hour) {
        for (int candidate : HOURS_BY_CODE) {
            if (candidate == hour) {
                return true;
            }
        }
        return false;
    }

    public int month() {
        return bits >>> MONTH_SHIFT;
    }

    public int dayOfWeek() {
        return (bits >>> DOW_SHIFT) & 0x07;
    }

    public boolean endOfMonth() {
        return ((bits >>> END_OF_MONTH_SHIFT) & 1) == 1;
    }

    public int week() {
        return (bits >>> WEEK_SHIFT) & 1;
    }

    public int hour() {
        return HOURS_BY_CODE[bits & 0x07];
    }

    /**
     * Returns the packed twelve bits.
     */
    public int bits() {
        return bits;
    }

    /**
     * Finds the day of {@link #month()} in {@code year} on which this rule fires by scanning
     * the month forward (or backward when {@link #endOfMonth()} is set) for the target weekday.
     *
     * @return day of month, or {@code -1} when the month has too few matching weekdays.
     */
    public int transitionDay(int year, Calendar calendar) {
        Objects.requireNonNull(calendar, "calendar");
        int month = month();
        int lastDay = calendar.maxDaysInMonth(year, month);
        int wanted = week() + 1;
        int seen = 0;
        if (endOfMonth()) {
            for (int day = lastDay; day >= calendar.minDay(); day--) {
                if (calendar.dayOfWeek(year, month, day) == dayOfWeek() && ++seen == wanted) {
                    return day;
                }
            }
        } else {
            for (int day = calendar.minDay(); day <= lastDay; day++) {
                if (calendar.dayOfWeek(year, month, day) == dayOfWeek() && ++seen == wanted) {
                    return day;
                }
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "TransitionRule(month=" + month()
                + ", dayOfWeek=" + dayOfWeek()
                + ", endOfMonth=" + endOfMonth()
                + ", week=" + week()
                + ", hour=" + hour() + ")";
    }

    private static int hourCode(int hour) {
        for (int code = 0; code < HOURS_BY_CODE.length; code++) {
            if (HOURS_BY_CODE[code] == hour) {
                return code;
            }
        }
        throw new IllegalArgumentException("transition hour must be one of 20-23 or 0-3: " + hour);
    }
}
