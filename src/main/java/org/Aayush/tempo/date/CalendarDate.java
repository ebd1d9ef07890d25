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
import org.Aayush.tempo.zone.TimeZone;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable calendar date bound to a time zone and a calendar.
 * <p>
 * Contract summary:
 * </p>
 * <ul>
 * <li>Construction rejects dates outside the calendar's bounds.</li>
 * <li>Arithmetic never fails on range: sums are normalized by carrying, and years wrap into
 * the calendar's year range.</li>
 * <li>{@code withX} replaces one field without normalizing and rejects invalid results.</li>
 * <li>{@link #withCalendar(Calendar)} keeps the distance from the epoch, so the same
 * {@code (y, m, d)} may denote a different day afterwards.</li>
 * <li>Equality is field equality (date, zone, calendar); ordering compares the UTC instant of
 * local midnight first.</li>
 * </ul>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class CalendarDate implements Comparable<CalendarDate> {
    private static final Comparator<CalendarDate> FIELD_ORDER = Comparator
            .comparingInt(CalendarDate::year)
            .thenComparingInt(CalendarDate::month)
            .thenComparingInt(CalendarDate::day)
            .thenComparing(date -> date.timeZone().name())
            .thenComparingInt(date -> date.timeZone().offset().totalMinutes())
            .thenComparing(date -> date.timeZone().hasDst())
            .thenComparing(date -> date.calendar().kind())
            .thenComparingInt(date -> date.calendar().minYear());

    private final int year;
    private final int month;
    private final int day;
    private final TimeZone timeZone;
    private final Calendar calendar;

    private CalendarDate(int year, int month, int day, TimeZone timeZone, Calendar calendar) {
        this.year = year;
        this.month = month;
        this.day = day;
        this.timeZone = timeZone;
        this.calendar = calendar;
    }

    /**
     * Creates a UTC date on {@link Calendar#PYTHON}.
     */
    public static CalendarDate of(int year, int month, int day) {
        return of(year, month, day, TimeZone.utc(), Calendar.PYTHON);
    }

    /**
     * Creates a date.
     *
     * @throws IllegalArgumentException when the date is outside the calendar's bounds.
     */
    public static CalendarDate of(int year, int month, int day, TimeZone timeZone, Calendar calendar) {
        Objects.requireNonNull(timeZone, "timeZone");
        Objects.requireNonNull(calendar, "calendar");
        if (!calendar.isValid(year, month, day)) {
            throw new IllegalArgumentException(
                    "invalid date " + year + "-" + month + "-" + day + " for " + calendar.kind() + " calendar");
        }
        return new CalendarDate(year, month, day, timeZone, calendar);
    }

    /**
     * Returns the first day of the calendar's epoch year in UTC.
     */
    public static CalendarDate epoch(Calendar calendar) {
        Objects.requireNonNull(calendar, "calendar");
        return new CalendarDate(calendar.minYear(), calendar.minMonth(), calendar.minDay(), TimeZone.utc(), calendar);
    }

    /**
     * Returns the local date of a Unix timestamp in {@code timeZone}.
     */
    public static CalendarDate fromUnixEpoch(long unixSeconds, TimeZone timeZone, Calendar calendar) {
        return CalendarDateTime.fromUnixEpoch(unixSeconds, timeZone, calendar).toDate();
    }

    /**
     * Returns the current local date according to {@code clock}.
     */
    public static CalendarDate now(Clock clock, TimeZone timeZone, Calendar calendar) {
        long unixSeconds = Math.floorDiv(TimeUtils.currentUnixMillis(clock), TimeUtils.MILLIS_PER_SECOND);
        return fromUnixEpoch(unixSeconds, timeZone, calendar);
    }

    /**
     * Returns the current local date according to the system clock.
     */
    public static CalendarDate now(TimeZone timeZone, Calendar calendar) {
        return now(Clock.systemUTC(), timeZone, calendar);
    }

    /**
     * Decodes the date part of a packed hash.
     *
     * @throws IllegalArgumentException when the layout carries no year or the decoded date is invalid.
     */
    public static CalendarDate fromHash(CalendarHash layout, long hash, TimeZone timeZone, Calendar calendar) {
        Objects.requireNonNull(layout, "layout");
        if (!layout.supports(HashField.YEAR)) {
            throw new IllegalArgumentException(layout + " does not carry a year");
        }
        HashFields fields = Objects.requireNonNull(calendar, "calendar").fromHash(layout, hash);
        return of(fields.year(), fields.month(), fields.day(), timeZone, calendar);
    }

    /**
     * Parses ISO-8601 text; empty when the text does not match or names an invalid date.
     */
    public static Optional<CalendarDate> fromIso(String text, IsoFormat format, TimeZone timeZone, Calendar calendar) {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(timeZone, "timeZone");
        Objects.requireNonNull(calendar, "calendar");
        if (!format.hasDate()) {
            return Optional.empty();
        }
        return IsoCodec.parse(text, format)
                .filter(fields -> calendar.isValid(fields.year(), fields.month(), fields.day()))
                .map(fields -> new CalendarDate(fields.year(), fields.month(), fields.day(), timeZone, calendar));
    }

    /**
     * Parses text with a {@link DateTimeFormatter}; empty on any parse failure.
     */
    public static Optional<CalendarDate> parse(
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
        LocalDate parsed;
        try {
            parsed = LocalDate.parse(text, formatter);
        } catch (DateTimeException e) {
            return Optional.empty();
        }
        if (!calendar.isValid(parsed.getYear(), parsed.getMonthValue(), parsed.getDayOfMonth())) {
            return Optional.empty();
        }
        return Optional.of(of(parsed.getYear(), parsed.getMonthValue(), parsed.getDayOfMonth(), timeZone, calendar));
    }

    /**
     * Adds raw amounts and normalizes the sum. Seconds contribute their whole days only.
     */
    public CalendarDate add(long years, long months, long days, long seconds) {
        long totalDays = Math.addExact(days, Math.floorDiv(seconds, TimeUtils.SECONDS_PER_DAY));
        if (years == 0 && months == 0 && totalDays == 0) {
            return this;
        }
        FieldNormalizer.DateParts parts = FieldNormalizer.normalizeDate(
                calendar,
                Math.addExact(year, years),
                Math.addExact(month, months),
                Math.addExact(day, totalDays)
        );
        return new CalendarDate(parts.year(), parts.month(), parts.day(), timeZone, calendar);
    }

    /**
     * Subtracts raw amounts and normalizes the difference.
     */
    public CalendarDate subtract(long years, long months, long days, long seconds) {
        return add(Math.negateExact(years), Math.negateExact(months), Math.negateExact(days), Math.negateExact(seconds));
    }

    public CalendarDate addYears(long years) {
        return add(years, 0, 0, 0);
    }

    public CalendarDate addMonths(long months) {
        return add(0, months, 0, 0);
    }

    public CalendarDate addDays(long days) {
        return add(0, 0, days, 0);
    }

    public CalendarDate withYear(int newYear) {
        return of(newYear, month, day, timeZone, calendar);
    }

    public CalendarDate withMonth(int newMonth) {
        return of(year, newMonth, day, timeZone, calendar);
    }

    public CalendarDate withDay(int newDay) {
        return of(year, month, newDay, timeZone, calendar);
    }

    /**
     * Rebinds the date to another zone without shifting it.
     */
    public CalendarDate withTimeZone(TimeZone newTimeZone) {
        return new CalendarDate(year, month, day, Objects.requireNonNull(newTimeZone, "timeZone"), calendar);
    }

    /**
     * Moves the date to another calendar, keeping its distance in days from the epoch.
     */
    public CalendarDate withCalendar(Calendar newCalendar) {
        Objects.requireNonNull(newCalendar, "calendar");
        if (newCalendar.equals(calendar)) {
            return this;
        }
        return epoch(newCalendar).withTimeZone(timeZone).addDays(daysSinceEpoch());
    }

    /**
     * Returns the UTC date of this date's local midnight.
     */
    public CalendarDate toUtc() {
        long days = Math.floorDiv(-offsetSeconds(), TimeUtils.SECONDS_PER_DAY);
        return withTimeZone(TimeZone.utc()).addDays(days);
    }

    /**
     * Returns the date in {@code target} at this date's UTC midnight.
     */
    public CalendarDate fromUtc(TimeZone target) {
        Objects.requireNonNull(target, "target");
        CalendarDate utc = toUtc();
        int offset = target.offsetAt(utc.year, utc.month, utc.day, 0, 0, 0, calendar).totalSeconds();
        return utc.withTimeZone(target).addDays(Math.floorDiv(offset, TimeUtils.SECONDS_PER_DAY));
    }

    /**
     * Seconds from {@code other}'s local midnight to this date's local midnight, measured in
     * this date's calendar.
     */
    public long deltaSeconds(CalendarDate other) {
        Objects.requireNonNull(other, "other");
        CalendarDate aligned = other.withCalendar(calendar);
        return utcSeconds() - aligned.utcSeconds();
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

    public int leapSecondsSinceEpoch() {
        return calendar.leapSecondsSinceEpoch(year, month, day);
    }

    public int leapDaysSinceEpoch() {
        return calendar.leapDaysSinceEpoch(year, month, day);
    }

    public long daysSinceEpoch() {
        return calendar.daysSinceEpoch(year, month, day);
    }

    /**
     * Seconds from the epoch to local midnight of this date, leap seconds included.
     */
    public long secondsSinceEpoch() {
        return calendar.secondsSinceEpoch(year, month, day, 0, 0, 0);
    }

    /**
     * Packs the date with {@code layout}; the 8-bit layout receives the day of week.
     */
    public long hash(CalendarHash layout) {
        Objects.requireNonNull(layout, "layout");
        int dayField = layout == CalendarHash.UINT8 ? dayOfWeek() : day;
        return calendar.hash(layout, HashFields.of(year, month, dayField, 0, 0, 0));
    }

    /**
     * Formats the date; layouts with a time part show midnight.
     */
    public Optional<String> toIso(IsoFormat format) {
        return IsoCodec.format(IsoFields.of(year, month, day, 0, 0, 0), format);
    }

    /**
     * Formats the date as {@code yyyy-MM-dd}.
     */
    public String toIso() {
        return toIso(IsoFormat.DATE).orElseThrow();
    }

    /**
     * Formats with a {@link DateTimeFormatter}; empty when the date does not exist in the ISO
     * calendar (fast-calendar December 31-35) or the pattern needs fields a date lacks.
     */
    public Optional<String> format(DateTimeFormatter formatter) {
        Objects.requireNonNull(formatter, "formatter");
        try {
            return Optional.of(LocalDate.of(year, month, day).format(formatter));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * Converts to a {@link CalendarDateTime} at local midnight.
     */
    public CalendarDateTime atStartOfDay() {
        return CalendarDateTime.of(year, month, day, 0, 0, 0, 0, 0, 0, timeZone, calendar);
    }

    @Override
    public int compareTo(CalendarDate other) {
        CalendarDate aligned = other.withCalendar(calendar);
        int byInstant = Long.compare(utcSeconds(), aligned.utcSeconds());
        if (byInstant != 0) {
            return byInstant;
        }
        return FIELD_ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return toIso() + "[" + timeZone.name() + "]";
    }

    private long utcSeconds() {
        return secondsSinceEpoch() - offsetSeconds();
    }

    private int offsetSeconds() {
        return timeZone.offsetAt(year, month, day, 0, 0, 0, calendar).totalSeconds();
    }
}
