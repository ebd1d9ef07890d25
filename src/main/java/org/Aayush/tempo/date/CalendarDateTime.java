package org.Aayush.tempo.date;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.tempo.calendar.Calendar;
import org.Aayush.tempo.core.hash.CalendarHash;
import org.Aayush.tempo.core.hash.HashField;
import org.Aayush.tempo.core.hash.HashFields;
import org.Aayush.tempo.core.time.TimeUtils;
import org.Aayush.tempo.format.IsoCodec;
import org.Aayush.tempo.format.IsoFields;
import org.Aayush.tempo.format.IsoFormat;
import org.Aayush.tempo.zone.Offset;
import org.Aayush.tempo.zone.TimeZone;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable date-time with nanosecond resolution bound to a time zone and a calendar.
 * <p>
 * Contract summary:
 * </p>
 * <ul>
 * <li>Construction rejects values outside the calendar's bounds; second 60 is accepted only
 * on a leap second.</li>
 * <li>{@link #add(DateTimeAmount)} sums every unit raw and normalizes once, carrying from
 * nanoseconds up to years, so one call may roll over every field.</li>
 * <li>{@link #toUtc()} and {@link #fromUtc(TimeZone)} shift by the zone offset and then
 * correct by the change in cumulative leap seconds, so {@link #secondsSinceEpoch()} minus the
 * offset is preserved.</li>
 * <li>{@link #deltaNanos(CalendarDateTime)} and {@link #compareTo(CalendarDateTime)} measure
 * on the signed UTC second count, {@link #secondsSinceEpoch()} minus the offset, so they hold
 * for instants that fall before the calendar's first year in UTC.</li>
 * <li>{@link #deltaNanos(CalendarDateTime)} stays exact for operands any distance apart.</li>
 * </ul>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class CalendarDateTime implements Comparable<CalendarDateTime> {
    /**
     * Largest year distance whose nanosecond count still fits an unsigned 64-bit counter.
     */
    static final int MAX_NANOS_SPAN_YEARS = 580;
    /**
     * Gregorian leap-year cycle; shifting by a multiple keeps month lengths unchanged.
     */
    static final int ANCHOR_CYCLE_YEARS = 400;
    /**
     * Headroom added to anchored counts so an instant up to a day before the anchor year
     * still counts as non-negative.
     */
    private static final long ANCHOR_BIAS_NANOS = TimeUtils.SECONDS_PER_DAY * TimeUtils.NANOS_PER_SECOND;

    private static final Comparator<CalendarDateTime> FIELD_ORDER = Comparator
            .comparingInt(CalendarDateTime::year)
            .thenComparingInt(CalendarDateTime::month)
            .thenComparingInt(CalendarDateTime::day)
            .thenComparingInt(CalendarDateTime::hour)
            .thenComparingInt(CalendarDateTime::minute)
            .thenComparingInt(CalendarDateTime::second)
            .thenComparingInt(CalendarDateTime::millisecond)
            .thenComparingInt(CalendarDateTime::microsecond)
            .thenComparingInt(CalendarDateTime::nanosecond);

    private static final Comparator<CalendarDateTime> BINDING_ORDER = Comparator
            .<CalendarDateTime, String>comparing(dateTime -> dateTime.timeZone().name())
            .thenComparingInt(dateTime -> dateTime.timeZone().offset().totalMinutes())
            .thenComparing(dateTime -> dateTime.timeZone().hasDst())
            .thenComparing(dateTime -> dateTime.calendar().kind())
            .thenComparingInt(dateTime -> dateTime.calendar().minYear());

    private final int year;
    private final int month;
    private final int day;
    private final int hour;
    private final int minute;
    private final int second;
    private final int millisecond;
    private final int microsecond;
    private final int nanosecond;
    private final TimeZone timeZone;
    private final Calendar calendar;

    private CalendarDateTime(
            int year,
            int month,
            int day,
            int hour,
            int minute,
            int second,
            int millisecond,
            int microsecond,
            int nanosecond,
            TimeZone timeZone,
            Calendar calendar
    ) {
        this.year = year;
        this.month = month;
        this.day = day;
        this.hour = hour;
        this.minute = minute;
        this.second = second;
        this.millisecond = millisecond;
        this.microsecond = microsecond;
        this.nanosecond = nanosecond;
        this.timeZone = timeZone;
        this.calendar = calendar;
    }

    private CalendarDateTime(FieldNormalizer.DateTimeParts parts, TimeZone timeZone, Calendar calendar) {
        this(
                parts.date().year(),
                parts.date().month(),
                parts.date().day(),
                parts.hour(),
                parts.minute(),
                parts.second(),
                parts.millisecond(),
                parts.microsecond(),
                parts.nanosecond(),
                timeZone,
                calendar
        );
    }

    /**
     * Creates a UTC date-time on {@link Calendar#PYTHON} with zero sub-second fields.
     */
    public static CalendarDateTime of(int year, int month, int day, int hour, int minute, int second) {
        return of(year, month, day, hour, minute, second, 0, 0, 0, TimeZone.utc(), Calendar.PYTHON);
    }

    /**
     * Creates a date-time with zero sub-second fields.
     */
    public static CalendarDateTime of(
            int year,
            int month,
            int day,
            int hour,
            int minute,
            int second,
            TimeZone timeZone,
            Calendar calendar
    ) {
        return of(year, month, day, hour, minute, second, 0, 0, 0, timeZone, calendar);
    }

    /**
     * Creates a date-time.
     *
     * @throws IllegalArgumentException when a field is outside the calendar's bounds.
     */
    public static CalendarDateTime of(
            int year,
            int month,
            int day,
            int hour,
            int minute,
            int second,
            int millisecond,
            int microsecond,
            int nanosecond,
            TimeZone timeZone,
            Calendar calendar
    ) {
        Objects.requireNonNull(timeZone, "timeZone");
        Objects.requireNonNull(calendar, "calendar");
        if (!calendar.isValid(year, month, day, hour, minute, second, millisecond, microsecond, nanosecond)) {
            throw new IllegalArgumentException(String.format(
                    "invalid date-time %04d-%02d-%02dT%02d:%02d:%02d.%03d%03d%03d for %s calendar",
                    year, month, day, hour, minute, second, millisecond, microsecond, nanosecond, calendar.kind()));
        }
        return new CalendarDateTime(
                year, month, day, hour, minute, second, millisecond, microsecond, nanosecond, timeZone, calendar);
    }

    /**
     * Returns midnight of the calendar's epoch day in UTC.
     */
    public static CalendarDateTime epoch(Calendar calendar) {
        Objects.requireNonNull(calendar, "calendar");
        return new CalendarDateTime(
                calendar.minYear(), calendar.minMonth(), calendar.minDay(), 0, 0, 0, 0, 0, 0, TimeZone.utc(), calendar);
    }

    /**
     * Returns the local date-time of a Unix timestamp in {@code timeZone}. Unix time has no
     * leap seconds, so none are inserted.
     */
    public static CalendarDateTime fromUnixEpoch(long unixSeconds, TimeZone timeZone, Calendar calendar) {
        return fromUnixMillis(Math.multiplyExact(unixSeconds, TimeUtils.MILLIS_PER_SECOND), timeZone, calendar);
    }

    /**
     * Returns the local date-time of a Unix millisecond timestamp in {@code timeZone}.
     */
    public static CalendarDateTime fromUnixMillis(long unixMillis, TimeZone timeZone, Calendar calendar) {
        Objects.requireNonNull(timeZone, "timeZone");
        Objects.requireNonNull(calendar, "calendar");
        FieldNormalizer.DateTimeParts parts = FieldNormalizer.normalizeDateTime(
                calendar, 1970, 1, 1, 0, 0, 0, unixMillis, 0, 0);
        CalendarDateTime utc = new CalendarDateTime(parts, TimeZone.utc(), calendar);
        return timeZone.equals(TimeZone.utc()) ? utc : utc.fromUtc(timeZone);
    }

    /**
     * Returns the current local date-time according to {@code clock}, at millisecond resolution.
     */
    public static CalendarDateTime now(Clock clock, TimeZone timeZone, Calendar calendar) {
        return fromUnixMillis(TimeUtils.currentUnixMillis(clock), timeZone, calendar);
    }

    /**
     * Returns the current local date-time according to the system clock.
     */
    public static CalendarDateTime now(TimeZone timeZone, Calendar calendar) {
        return now(Clock.systemUTC(), timeZone, calendar);
    }

    /**
     * Decodes a packed hash. Fields the layout does not carry are zero.
     *
     * @throws IllegalArgumentException when the layout carries no year or the decoded value is invalid.
     */
    public static CalendarDateTime fromHash(CalendarHash layout, long hash, TimeZone timeZone, Calendar calendar) {
        Objects.requireNonNull(layout, "layout");
        if (!layout.supports(HashField.YEAR)) {
            throw new IllegalArgumentException(layout + " does not carry a year");
        }
        HashFields fields = Objects.requireNonNull(calendar, "calendar").fromHash(layout, hash);
        return of(
                fields.year(),
                fields.month(),
                fields.day(),
                fields.hour(),
                fields.minute(),
                fields.second(),
                fields.millisecond(),
                fields.microsecond(),
                0,
                timeZone,
                calendar
        );
    }

    /**
     * Parses ISO-8601 text. Layouts without a date use the epoch day, layouts without a time
     * use midnight, and a parsed UTC offset replaces {@code timeZone} with a fixed zone.
     *
     * @return parsed value, or empty when the text does not match or names an invalid value.
     */
    public static Optional<CalendarDateTime> fromIso(
            String text,
            IsoFormat format,
            TimeZone timeZone,
            Calendar calendar
    ) {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(timeZone, "timeZone");
        Objects.requireNonNull(calendar, "calendar");
        Optional<IsoFields> parsed = IsoCodec.parse(text, format);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        IsoFields fields = parsed.get();
        int y = format.hasDate() ? fields.year() : calendar.minYear();
        int mo = format.hasDate() ? fields.month() : calendar.minMonth();
        int d = format.hasDate() ? fields.day() : calendar.minDay();
        if (!calendar.isValid(y, mo, d, fields.hour(), fields.minute(), fields.second(), 0, 0, 0)) {
            return Optional.empty();
        }
        TimeZone zone = timeZone;
        if (fields.hasOffset()) {
            Optional<TimeZone> offsetZone = offsetZone(fields.offsetMinutes());
            if (offsetZone.isEmpty()) {
                return Optional.empty();
            }
            zone = offsetZone.get();
        }
        return Optional.of(new CalendarDateTime(
                y, mo, d, fields.hour(), fields.minute(), fields.second(), 0, 0, 0, zone, calendar));
    }

    /**
     * Parses text with a {@link DateTimeFormatter}; empty on any parse failure.
     */
    public static Optional<CalendarDateTime> parse(
            String text,
            DateTimeFormatter formatter,
            TimeZone timeZone,
            Calendar calendar
    ) {
        Objects.requireNonNull(formatter, "formatter");
        Objects.requireNonNull(timeZone, "timeZone");
        Objects.requireNonNull(calendar, "calendar");
        if (text == null) {
            return Optional.empty();
        }
        LocalDateTime parsed;
        try {
            parsed = LocalDateTime.parse(text, formatter);
        } catch (DateTimeException e) {
            return Optional.empty();
        }
        int nano = parsed.getNano();
        int ms = nano / 1_000_000;
        int us = nano / 1_000 % 1_000;
        int ns = nano % 1_000;
        if (!calendar.isValid(parsed.getYear(), parsed.getMonthValue(), parsed.getDayOfMonth(),
                parsed.getHour(), parsed.getMinute(), parsed.getSecond(), ms, us, ns)) {
            return Optional.empty();
        }
        return Optional.of(new CalendarDateTime(
                parsed.getYear(), parsed.getMonthValue(), parsed.getDayOfMonth(),
                parsed.getHour(), parsed.getMinute(), parsed.getSecond(), ms, us, ns, timeZone, calendar));
    }

    /**
     * Adds every unit of {@code amount} and normalizes the sum. A zero amount returns this
     * value unchanged, preserving a leap second.
     */
    public CalendarDateTime add(DateTimeAmount amount) {
        Objects.requireNonNull(amount, "amount");
        if (amount.isZero()) {
            return this;
        }
        FieldNormalizer.DateTimeParts parts = FieldNormalizer.normalizeDateTime(
                calendar,
                Math.addExact(year, amount.years()),
                Math.addExact(month, amount.months()),
                Math.addExact(day, amount.days()),
                Math.addExact(hour, amount.hours()),
                Math.addExact(minute, amount.minutes()),
                Math.addExact(second, amount.seconds()),
                Math.addExact(millisecond, amount.milliseconds()),
                Math.addExact(microsecond, amount.microseconds()),
                Math.addExact(nanosecond, amount.nanoseconds())
        );
        return new CalendarDateTime(parts, timeZone, calendar);
    }

    public CalendarDateTime subtract(DateTimeAmount amount) {
        return add(Objects.requireNonNull(amount, "amount").negated());
    }

    public CalendarDateTime addYears(long years) {
        return add(DateTimeAmount.ofYears(years));
    }

    public CalendarDateTime addMonths(long months) {
        return add(DateTimeAmount.ofMonths(months));
    }

    public CalendarDateTime addDays(long days) {
        return add(DateTimeAmount.ofDays(days));
    }

    public CalendarDateTime addHours(long hours) {
        return add(DateTimeAmount.ofHours(hours));
    }

    public CalendarDateTime addMinutes(long minutes) {
        return add(DateTimeAmount.ofMinutes(minutes));
    }

    public CalendarDateTime addSeconds(long seconds) {
        return add(DateTimeAmount.ofSeconds(seconds));
    }

    public CalendarDateTime addNanos(long nanos) {
        return add(DateTimeAmount.ofNanoseconds(nanos));
    }

    public CalendarDateTime withYear(int newYear) {
        return with(newYear, month, day, hour, minute, second, millisecond, microsecond, nanosecond);
    }

    public CalendarDateTime withMonth(int newMonth) {
        return with(year, newMonth, day, hour, minute, second, millisecond, microsecond, nanosecond);
    }

    public CalendarDateTime withDay(int newDay) {
        return with(year, month, newDay, hour, minute, second, millisecond, microsecond, nanosecond);
    }

    public CalendarDateTime withHour(int newHour) {
        return with(year, month, day, newHour, minute, second, millisecond, microsecond, nanosecond);
    }

    public CalendarDateTime withMinute(int newMinute) {
        return with(year, month, day, hour, newMinute, second, millisecond, microsecond, nanosecond);
    }

    public CalendarDateTime withSecond(int newSecond) {
        return with(year, month, day, hour, minute, newSecond, millisecond, microsecond, nanosecond);
    }

    public CalendarDateTime withMillisecond(int newMillisecond) {
        return with(year, month, day, hour, minute, second, newMillisecond, microsecond, nanosecond);
    }

    public CalendarDateTime withMicrosecond(int newMicrosecond) {
        return with(year, month, day, hour, minute, second, millisecond, newMicrosecond, nanosecond);
    }

    public CalendarDateTime withNanosecond(int newNanosecond) {
        return with(year, month, day, hour, minute, second, millisecond, microsecond, newNanosecond);
    }

    /**
     * Rebinds to another zone without shifting any field.
     */
    public CalendarDateTime withTimeZone(TimeZone newTimeZone) {
        return new CalendarDateTime(year, month, day, hour, minute, second, millisecond, microsecond, nanosecond,
                Objects.requireNonNull(newTimeZone, "timeZone"), calendar);
    }

    /**
     * Moves to another calendar, keeping the distance in days from the epoch and the time of day.
     */
    public CalendarDateTime withCalendar(Calendar newCalendar) {
        Objects.requireNonNull(newCalendar, "calendar");
        if (newCalendar.equals(calendar)) {
            return this;
        }
        FieldNormalizer.DateTimeParts parts = FieldNormalizer.normalizeDateTime(
                newCalendar,
                newCalendar.minYear(),
                newCalendar.minMonth(),
                newCalendar.minDay() + daysSinceEpoch(),
                hour,
                minute,
                second,
                millisecond,
                microsecond,
                nanosecond
        );
        return new CalendarDateTime(parts, timeZone, newCalendar);
    }

    /**
     * Converts to UTC: shifts by the offset in effect here, then corrects by the change in
     * cumulative leap seconds between the two dates. An instant before the calendar's first
     * year wraps to its last year, like any other carry.
     */
    public CalendarDateTime toUtc() {
        Offset offset = timeZone.offsetAt(year, month, day, hour, minute, second, calendar);
        CalendarDateTime shifted = shiftMinutes(-offset.totalMinutes(), TimeZone.utc());
        return shifted.correctLeapSeconds(leapSecondsSinceEpoch());
    }

    /**
     * Converts this instant to local time in {@code target}.
     */
    public CalendarDateTime fromUtc(TimeZone target) {
        Objects.requireNonNull(target, "target");
        CalendarDateTime utc = toUtc();
        Offset guess = target.offsetAt(utc.year, utc.month, utc.day, utc.hour, utc.minute, utc.second, calendar);
        CalendarDateTime local = utc.shiftMinutes(guess.totalMinutes(), target);
        Offset actual = target.offsetAt(local.year, local.month, local.day, local.hour, local.minute, local.second,
                calendar);
        if (!actual.equals(guess)) {
            local = utc.shiftMinutes(actual.totalMinutes(), target);
        }
        return local.correctLeapSeconds(utc.leapSecondsSinceEpoch());
    }

    /**
     * Difference {@code this - other} in nanoseconds, exact for any distance.
     * <p>
     * {@code other} is first moved onto this calendar. Both operands are counted in UTC
     * nanoseconds from a synthetic epoch at the smaller of their local years, plus one day of
     * headroom. When they are at least {@value #MAX_NANOS_SPAN_YEARS} years apart, the later one
     * is moved back by the smallest multiple of {@value #ANCHOR_CYCLE_YEARS} years that brings
     * the span below that limit; the seconds removed are reported separately.
     * </p>
     */
    public NanosDelta deltaNanos(CalendarDateTime other) {
        Objects.requireNonNull(other, "other");
        CalendarDateTime that = other.withCalendar(calendar);
        boolean selfIsLater = compareInstants(this, that) >= 0;
        CalendarDateTime earlier = selfIsLater ? that : this;
        CalendarDateTime later = selfIsLater ? this : that;

        int anchorYear = Math.min(earlier.year, later.year);
        Calendar anchored = calendar.anchoredAt(anchorYear);
        long span = (long) Math.max(earlier.year, later.year) - anchorYear;
        long overflowYears = 0;
        if (span >= MAX_NANOS_SPAN_YEARS) {
            long excess = span - MAX_NANOS_SPAN_YEARS + 1;
            overflowYears = ANCHOR_CYCLE_YEARS * ((excess + ANCHOR_CYCLE_YEARS - 1) / ANCHOR_CYCLE_YEARS);
        }
        CalendarDateTime shiftedLater = later.shiftYears(overflowYears);
        long overflowSeconds = anchoredSeconds(anchored, later) - anchoredSeconds(anchored, shiftedLater);

        long laterNanos = anchoredUtcNanos(anchored, shiftedLater, later.offsetSeconds());
        long earlierNanos = anchoredUtcNanos(anchored, earlier, earlier.offsetSeconds());
        return selfIsLater
                ? new NanosDelta(laterNanos, earlierNanos, overflowYears, overflowSeconds, 1)
                : new NanosDelta(earlierNanos, laterNanos, overflowYears, overflowSeconds, -1);
    }

    public int dayOfWeek() {
        return calendar.dayOfWeek(year, month, day);
    }

    public int dayOfYear() {
        return calendar.dayOfYear(year, month, day);
    }

    public boolean isLeapYear() {
        return calendar.isLeapYear(year);
    }

    public boolean isLeapSecond() {
        return calendar.isLeapSecond(year, month, day, hour, minute, second);
    }

    public int leapSecondsSinceEpoch() {
        return calendar.leapSecondsSinceEpoch(year, month, day);
    }

    public long daysSinceEpoch() {
        return calendar.daysSinceEpoch(year, month, day);
    }

    /**
     * Seconds from the calendar epoch, leap seconds included; the zone is not applied.
     */
    public long secondsSinceEpoch() {
        return calendar.secondsSinceEpoch(year, month, day, hour, minute, second);
    }

    public long millisSinceEpoch() {
        return calendar.millisSinceEpoch(year, month, day, hour, minute, second, millisecond);
    }

    /**
     * Unsigned nanoseconds from the calendar epoch; wraps for values about 584 years past it.
     */
    public long nanosSinceEpoch() {
        return calendar.nanosSinceEpoch(year, month, day, hour, minute, second, millisecond, microsecond, nanosecond);
    }

    /**
     * Packs with {@code layout}; the 8-bit layout receives the day of week.
     */
    public long hash(CalendarHash layout) {
        Objects.requireNonNull(layout, "layout");
        int dayField = layout == CalendarHash.UINT8 ? dayOfWeek() : day;
        return calendar.hash(layout, year, month, dayField, hour, minute, second, millisecond, microsecond);
    }

    /**
     * Formats with {@code format}; offset layouts print the offset in effect here.
     */
    public Optional<String> toIso(IsoFormat format) {
        Objects.requireNonNull(format, "format");
        IsoFields.IsoFieldsBuilder fields = IsoFields.builder()
                .year(year)
                .month(month)
                .day(day)
                .hour(hour)
                .minute(minute)
                .second(second);
        if (format.hasOffset()) {
            fields.offsetMinutes(timeZone.offsetAt(year, month, day, hour, minute, second, calendar).totalMinutes())
                    .hasOffset(true);
        }
        return IsoCodec.format(fields.build(), format);
    }

    /**
     * Formats as {@code yyyy-MM-ddTHH:mm:ss}.
     */
    public String toIso() {
        return toIso(IsoFormat.DEFAULT).orElseThrow();
    }

    /**
     * Formats with a {@link DateTimeFormatter}; empty when the value does not exist in the ISO
     * calendar (leap second, fast-calendar December 31-35).
     */
    public Optional<String> format(DateTimeFormatter formatter) {
        Objects.requireNonNull(formatter, "formatter");
        try {
            LocalDateTime local = LocalDateTime.of(year, month, day, hour, minute, second,
                    millisecond * 1_000_000 + microsecond * 1_000 + nanosecond);
            return Optional.of(local.format(formatter));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * Returns the date part.
     */
    public CalendarDate toDate() {
        return CalendarDate.of(year, month, day, timeZone, calendar);
    }

    @Override
    public int compareTo(CalendarDateTime other) {
        int byInstant = compareInstants(this, other.withCalendar(calendar));
        if (byInstant != 0) {
            return byInstant;
        }
        int byFields = FIELD_ORDER.compare(this, other);
        return byFields != 0 ? byFields : BINDING_ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        String fraction = String.format(".%03d%03d%03d", millisecond, microsecond, nanosecond);
        return toIso() + fraction + "[" + timeZone.name() + "]";
    }

    private CalendarDateTime with(
            int newYear,
            int newMonth,
            int newDay,
            int newHour,
            int newMinute,
            int newSecond,
            int newMillisecond,
            int newMicrosecond,
            int newNanosecond
    ) {
        return of(newYear, newMonth, newDay, newHour, newMinute, newSecond, newMillisecond, newMicrosecond,
                newNanosecond, timeZone, calendar);
    }

    private CalendarDateTime shiftMinutes(int minutes, TimeZone target) {
        if (minutes == 0) {
            return target.equals(timeZone) ? this : withTimeZone(target);
        }
        FieldNormalizer.DateTimeParts parts = FieldNormalizer.normalizeDateTime(
                calendar, year, month, day, hour, (long) minute + minutes, second, millisecond, microsecond, nanosecond);
        return new CalendarDateTime(parts, target, calendar);
    }

    private CalendarDateTime correctLeapSeconds(int sourceLeapSeconds) {
        int correction = sourceLeapSeconds - leapSecondsSinceEpoch();
        return correction == 0 ? this : addSeconds(correction);
    }

    /**
     * Moves back by whole years without touching other fields. Only used with multiples of
     * {@value #ANCHOR_CYCLE_YEARS}, which keep February 29th valid.
     */
    private CalendarDateTime shiftYears(long years) {
        if (years == 0) {
            return this;
        }
        return new CalendarDateTime(Math.toIntExact(year - years), month, day, hour, minute, second, millisecond,
                microsecond, nanosecond, timeZone, calendar);
    }

    private long offsetSeconds() {
        return timeZone.offsetAt(year, month, day, hour, minute, second, calendar).totalSeconds();
    }

    private long utcSeconds() {
        return secondsSinceEpoch() - offsetSeconds();
    }

    private long subSecondNanos() {
        return millisecond * 1_000_000L + microsecond * TimeUtils.NANOS_PER_MICRO + nanosecond;
    }

    /**
     * Orders two values on the same calendar by UTC instant.
     */
    private static int compareInstants(CalendarDateTime a, CalendarDateTime b) {
        int bySeconds = Long.compare(a.utcSeconds(), b.utcSeconds());
        return bySeconds != 0 ? bySeconds : Long.compare(a.subSecondNanos(), b.subSecondNanos());
    }

    /**
     * Unsigned UTC nanoseconds of {@code value} from {@code anchored}'s epoch, plus the anchor bias.
     * The local count and the offset may each wrap; their difference does not.
     */
    private static long anchoredUtcNanos(Calendar anchored, CalendarDateTime value, long offsetSeconds) {
        return anchoredNanos(anchored, value) - offsetSeconds * TimeUtils.NANOS_PER_SECOND + ANCHOR_BIAS_NANOS;
    }

    private static long anchoredSeconds(Calendar anchored, CalendarDateTime value) {
        return anchored.secondsSinceEpoch(value.year, value.month, value.day, value.hour, value.minute, value.second);
    }

    private static long anchoredNanos(Calendar anchored, CalendarDateTime value) {
        return anchored.nanosSinceEpoch(value.year, value.month, value.day, value.hour, value.minute, value.second,
                value.millisecond, value.microsecond, value.nanosecond);
    }

    private static Optional<TimeZone> offsetZone(int offsetMinutes) {
        if (offsetMinutes == 0) {
            return Optional.of(TimeZone.utc());
        }
        int magnitude = Math.abs(offsetMinutes) % 60;
        if (magnitude != 0 && magnitude != 30 && magnitude != 45) {
            return Optional.empty();
        }
        Offset offset = Offset.ofTotalMinutes(offsetMinutes);
        return Optional.of(TimeZone.fixed(offset.toString(), offset));
    }
}
