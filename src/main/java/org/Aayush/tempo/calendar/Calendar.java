package org.Aayush.tempo.calendar;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.Aayush.tempo.core.hash.CalendarHash;
import org.Aayush.tempo.core.hash.HashFields;
import org.Aayush.tempo.core.time.TimeUtils;

import java.util.Objects;

/**
 * Immutable calendar value: field bounds plus the rule variant that interprets them.
 * <p>
 * Contract summary:
 * </p>
 * <ul>
 * <li>The variant is a closed {@link CalendarKind} tag; every operation dispatches on it with an
 * exhaustive {@code switch}.</li>
 * <li>The epoch is January 1st of {@link #minYear()}; all "since epoch" counters are measured
 * from there.</li>
 * <li>Instances are value objects: equal bounds and kind mean equal calendars.</li>
 * </ul>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class Calendar {
    public static final int MAX_YEAR = 9999;

    /** Gregorian calendar starting at year 1, matching Python's {@code datetime} range. */
    public static final Calendar PYTHON = gregorian(1);
    /** Gregorian calendar with the Unix epoch. */
    public static final Calendar UTC = gregorian(1970);
    /** Fast calendar with the Unix epoch; backs the fixed-width date-time family. */
    public static final Calendar UTC_FAST = fastUtc(1970);

    private final CalendarKind kind;
    private final int minYear;
    private final int maxYear;
    private final int minMonth;
    private final int maxMonth;
    private final int minDay;
    private final int maxDay;
    private final int minHour;
    private final int maxHour;
    private final int minMinute;
    private final int maxMinute;
    private final int minSecond;
    private final int maxTypicalSecond;
    private final int maxPossibleSecond;
    private final int maxMillisecond;
    private final int maxMicrosecond;
    private final int maxNanosecond;
    private final int maxTypicalDaysInYear;
    private final int maxPossibleDaysInYear;
    @ToString.Exclude
    private final int epochDayOfWeek;

    private Calendar(CalendarKind kind, int minYear) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (minYear < 1 || minYear > MAX_YEAR) {
            throw new IllegalArgumentException("minYear must be in [1, " + MAX_YEAR + "]: " + minYear);
        }
        this.minYear = minYear;
        this.maxYear = MAX_YEAR;
        this.minMonth = 1;
        this.maxMonth = 12;
        this.minDay = 1;
        this.minHour = 0;
        this.maxHour = 23;
        this.minMinute = 0;
        this.maxMinute = 59;
        this.minSecond = 0;
        this.maxTypicalSecond = 59;
        this.maxMillisecond = 999;
        this.maxMicrosecond = 999;
        this.maxNanosecond = 999;
        this.maxTypicalDaysInYear = 365;
        switch (kind) {
            case GREGORIAN -> {
                this.maxDay = 31;
                this.maxPossibleSecond = 60;
                this.maxPossibleDaysInYear = 366;
            }
            case FAST_UTC -> {
                this.maxDay = FastUtcRules.DAYS_IN_LAST_MONTH;
                this.maxPossibleSecond = 59;
                this.maxPossibleDaysInYear = 365;
            }
            default -> throw new IllegalStateException("unhandled calendar kind " + kind);
        }
        this.epochDayOfWeek = GregorianRules.dayOfWeek(minYear, 1, 1);
    }

    /**
     * Creates a proleptic Gregorian calendar whose epoch is January 1st of {@code minYear}.
     */
    public static Calendar gregorian(int minYear) {
        return new Calendar(CalendarKind.GREGORIAN, minYear);
    }

    /**
     * Creates a fast calendar whose epoch is January 1st of {@code minYear}.
     */
    public static Calendar fastUtc(int minYear) {
        return new Calendar(CalendarKind.FAST_UTC, minYear);
    }

    /**
     * Returns a calendar of the same kind whose epoch is January 1st of {@code year}.
     */
    public Calendar anchoredAt(int year) {
        if (year == minYear) {
            return this;
        }
        return new Calendar(kind, year);
    }

    /**
     * Returns whether {@code year} has a leap day.
     */
    public boolean isLeapYear(int year) {
        return switch (kind) {
            case GREGORIAN -> GregorianRules.isLeapYear(year);
            case FAST_UTC -> false;
        };
    }

    /**
     * Returns whether the instant is an inserted leap second ({@code 23:59:60} on a
     * leap-second day).
     */
    public boolean isLeapSecond(int year, int month, int day, int hour, int minute, int second) {
        return switch (kind) {
            case GREGORIAN -> GregorianRules.isLeapSecond(year, month, day, hour, minute, second);
            case FAST_UTC -> false;
        };
    }

    /**
     * Returns day-of-week where Monday = 0 and Sunday = 6.
     */
    public int dayOfWeek(int year, int month, int day) {
        return switch (kind) {
            case GREGORIAN -> GregorianRules.dayOfWeek(year, month, day);
            case FAST_UTC -> TimeUtils.dayOfWeek(daysSinceEpoch(year, month, day), epochDayOfWeek);
        };
    }

    /**
     * Returns the 1-based day of the year.
     */
    public int dayOfYear(int year, int month, int day) {
        return switch (kind) {
            case GREGORIAN -> GregorianRules.dayOfYear(year, month, day);
            case FAST_UTC -> FastUtcRules.dayOfYear(month, day);
        };
    }

    /**
     * Returns the length of a month.
     */
    public int maxDaysInMonth(int year, int month) {
        return switch (kind) {
            case GREGORIAN -> GregorianRules.daysInMonth(year, month);
            case FAST_UTC -> FastUtcRules.daysInMonth(month);
        };
    }

    /**
     * Returns the length of a year.
     */
    public int daysInYear(int year) {
        return switch (kind) {
            case GREGORIAN -> GregorianRules.daysInYear(year);
            case FAST_UTC -> FastUtcRules.DAYS_PER_YEAR;
        };
    }

    /**
     * Returns the number of days in the whole supported year range, i.e. the period after
     * which year wrapping returns to the same date.
     */
    public long daysInYearRange() {
        return switch (kind) {
            case GREGORIAN -> GregorianRules.daysBeforeYear(maxYear + 1L) - GregorianRules.daysBeforeYear(minYear);
            case FAST_UTC -> (long) (maxYear - minYear + 1) * FastUtcRules.DAYS_PER_YEAR;
        };
    }

    /**
     * Returns weekday of the first day and the length of a month.
     */
    public MonthRange monthRange(int year, int month) {
        return new MonthRange(dayOfWeek(year, month, 1), maxDaysInMonth(year, month));
    }

    /**
     * Leap seconds inserted between the epoch and the given date.
     */
    public int leapSecondsSinceEpoch(int year, int month, int day) {
        return switch (kind) {
            case GREGORIAN -> GregorianRules.leapSecondsInEffect(year) - GregorianRules.leapSecondsInEffect(minYear);
            case FAST_UTC -> 0;
        };
    }

    /**
     * Leap days between the epoch and the given date, including the date's own year when
     * the date is past February.
     */
    public int leapDaysSinceEpoch(int year, int month, int day) {
        return switch (kind) {
            case GREGORIAN -> {
                long before = GregorianRules.leapYearsBefore(year) - GregorianRules.leapYearsBefore(minYear);
                int current = month > 2 && GregorianRules.isLeapYear(year) ? 1 : 0;
                yield (int) before + current;
            }
            case FAST_UTC -> 0;
        };
    }

    /**
     * Whole days between the epoch and the given date.
     */
    public long daysSinceEpoch(int year, int month, int day) {
        long yearDays = (long) (year - minYear) * maxTypicalDaysInYear;
        long leapDays = switch (kind) {
            case GREGORIAN -> GregorianRules.leapYearsBefore(year) - GregorianRules.leapYearsBefore(minYear);
            case FAST_UTC -> 0L;
        };
        return yearDays + leapDays + dayOfYear(year, month, day) - 1;
    }

    /**
     * Seconds between the epoch and the given instant, leap seconds included once.
     */
    public long secondsSinceEpoch(int year, int month, int day, int hour, int minute, int second) {
        long seconds = daysSinceEpoch(year, month, day) * TimeUtils.SECONDS_PER_DAY
                + hour * TimeUtils.SECONDS_PER_HOUR
                + minute * TimeUtils.SECONDS_PER_MINUTE
                + second;
        return seconds + leapSecondsSinceEpoch(year, month, day);
    }

    /**
     * Milliseconds between the epoch and the given instant.
     */
    public long millisSinceEpoch(
            int year,
            int month,
            int day,
            int hour,
            int minute,
            int second,
            int millisecond
    ) {
        return secondsSinceEpoch(year, month, day, hour, minute, second) * TimeUtils.MILLIS_PER_SECOND + millisecond;
    }

    /**
     * Nanoseconds between the epoch and the given instant as an unsigned 64-bit count.
     * <p>
     * The count is exact for instants less than about 584 years after the epoch; beyond
     * that it wraps. Read it with {@link Long#toUnsignedString(long)} or
     * {@link Long#compareUnsigned(long, long)}.
     * </p>
     */
    public long nanosSinceEpoch(
            int year,
            int month,
            int day,
            int hour,
            int minute,
            int second,
            int millisecond,
            int microsecond,
            int nanosecond
    ) {
        long seconds = secondsSinceEpoch(year, month, day, hour, minute, second);
        return seconds * TimeUtils.NANOS_PER_SECOND
                + millisecond * 1_000_000L
                + microsecond * TimeUtils.NANOS_PER_MICRO
                + nanosecond;
    }

    /**
     * Converts a non-negative day count since the epoch back to a date.
     *
     * @return tuple with year, month and day set; time fields are zero.
     */
    public HashFields dateFromDays(long daysSinceEpoch) {
        if (daysSinceEpoch < 0) {
            throw new IllegalArgumentException("daysSinceEpoch must be non-negative: " + daysSinceEpoch);
        }
        long remaining = daysSinceEpoch;
        long year = minYear;
        switch (kind) {
            case GREGORIAN -> {
                year += 400L * (remaining / GregorianRules.DAYS_PER_400_YEARS);
                remaining %= GregorianRules.DAYS_PER_400_YEARS;
                while (remaining >= GregorianRules.daysInYear((int) year)) {
                    remaining -= GregorianRules.daysInYear((int) year);
                    year++;
                }
            }
            case FAST_UTC -> {
                year += remaining / FastUtcRules.DAYS_PER_YEAR;
                remaining %= FastUtcRules.DAYS_PER_YEAR;
            }
            default -> throw new IllegalStateException("unhandled calendar kind " + kind);
        }
        int y = (int) year;
        int month = minMonth;
        while (remaining >= maxDaysInMonth(y, month)) {
            remaining -= maxDaysInMonth(y, month);
            month++;
        }
        return HashFields.of(y, month, (int) remaining + minDay, 0, 0, 0);
    }

    /**
     * Decomposes an unsigned millisecond count since the epoch into civil fields. Leap
     * seconds are not subtracted.
     */
    public HashFields fieldsFromMillis(long unsignedMillis) {
        long days = Long.divideUnsigned(unsignedMillis, TimeUtils.MILLIS_PER_DAY);
        long millisOfDay = Long.remainderUnsigned(unsignedMillis, TimeUtils.MILLIS_PER_DAY);
        HashFields date = dateFromDays(days);
        int secondsOfDay = (int) (millisOfDay / TimeUtils.MILLIS_PER_SECOND);
        return date.toBuilder()
                .hour(secondsOfDay / 3_600)
                .minute(secondsOfDay / 60 % 60)
                .second(secondsOfDay % 60)
                .millisecond((int) (millisOfDay % TimeUtils.MILLIS_PER_SECOND))
                .build();
    }

    /**
     * Returns whether a date lies inside this calendar's bounds.
     */
    public boolean isValid(int year, int month, int day) {
        if (year < minYear || year > maxYear || month < minMonth || month > maxMonth) {
            return false;
        }
        return day >= minDay && day <= maxDaysInMonth(year, month);
    }

    /**
     * Returns whether a date-time lies inside this calendar's bounds. Second
     * {@link #maxPossibleSecond()} is accepted only on a leap second.
     */
    public boolean isValid(
            int year,
            int month,
            int day,
            int hour,
            int minute,
            int second,
            int millisecond,
            int microsecond,
            int nanosecond
    ) {
        if (!isValid(year, month, day)) {
            return false;
        }
        if (hour < minHour || hour > maxHour || minute < minMinute || minute > maxMinute) {
            return false;
        }
        if (second < minSecond || second > maxPossibleSecond) {
            return false;
        }
        if (second > maxTypicalSecond && !isLeapSecond(year, month, day, hour, minute, second)) {
            return false;
        }
        return millisecond >= 0 && millisecond <= maxMillisecond
                && microsecond >= 0 && microsecond <= maxMicrosecond
                && nanosecond >= 0 && nanosecond <= maxNanosecond;
    }

    /**
     * Packs a tuple with the given layout.
     */
    public long hash(CalendarHash layout, HashFields fields) {
        return Objects.requireNonNull(layout, "layout").pack(fields);
    }

    /**
     * Packs a date-time with the given layout.
     */
    public long hash(
            CalendarHash layout,
            int year,
            int month,
            int day,
            int hour,
            int minute,
            int second,
            int millisecond,
            int microsecond
    ) {
        return hash(layout, HashFields.of(year, month, day, hour, minute, second, millisecond, microsecond));
    }

    /**
     * Unpacks a value produced by {@link #hash(CalendarHash, HashFields)}.
     */
    public HashFields fromHash(CalendarHash layout, long value) {
        return Objects.requireNonNull(layout, "layout").unpack(value);
    }
}
