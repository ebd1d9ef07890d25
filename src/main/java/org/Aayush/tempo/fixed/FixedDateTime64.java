package org.Aayush.tempo.fixed;

import lombok.EqualsAndHashCode;
import org.Aayush.tempo.core.hash.CalendarHash;
import org.Aayush.tempo.core.hash.HashField;
import org.Aayush.tempo.core.hash.HashFields;
import org.Aayush.tempo.core.time.TimeUtils;
import org.Aayush.tempo.date.DateTimeAmount;
import org.Aayush.tempo.zone.TimeZone;

import java.time.Clock;
import java.util.Objects;

/**
 * Millisecond-resolution fixed date-time: unsigned 64-bit milliseconds since 1970 on the fast
 * calendar, hashed with {@link CalendarHash#UINT64}.
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class FixedDateTime64 implements FixedDateTime, Comparable<FixedDateTime64> {
    private static final CalendarHash LAYOUT = CalendarHash.UINT64;
    private static final TimeUtils.TickUnit UNIT = TimeUtils.TickUnit.MILLISECONDS;
    private static final int MAX_YEAR = (int) LAYOUT.mask(HashField.YEAR);

    @EqualsAndHashCode.Include
    private long counter;
    private long hash;
    private boolean hashStale;

    private FixedDateTime64(long counter, long hash) {
        this.counter = counter;
        this.hash = hash;
    }

    /**
     * Creates a value from fast-calendar fields.
     *
     * @throws IllegalArgumentException when the fields are outside the fast calendar.
     */
    public static FixedDateTime64 of(
            int year,
            int month,
            int day,
            int hour,
            int minute,
            int second,
            int millisecond
    ) {
        FixedConversions.requireValid(year, month, day, hour, minute, second, millisecond, MAX_YEAR);
        long counter = FixedConversions.millisOf(year, month, day, hour, minute, second, millisecond);
        return new FixedDateTime64(counter, LAYOUT.pack(HashFields.of(
                year, month, day, hour, minute, second, millisecond, 0)));
    }

    /**
     * Creates a value whose counter is {@code unixMillis}. The day count since 1970 is kept; the
     * civil fields follow the fast calendar.
     */
    public static FixedDateTime64 fromUnixEpoch(long unixMillis) {
        return new FixedDateTime64(unixMillis, hashOf(unixMillis));
    }

    /**
     * Creates a value from the current time of {@code clock}.
     */
    public static FixedDateTime64 now(Clock clock) {
        return fromUnixEpoch(TimeUtils.currentUnixMillis(clock));
    }

    /**
     * Creates a value from a packed hash, deriving the counter from it.
     */
    public static FixedDateTime64 fromHash(long hash) {
        return new FixedDateTime64(counterOf(hash), hash);
    }

    public long counter() {
        return counter;
    }

    @Override
    public CalendarHash layout() {
        return LAYOUT;
    }

    @Override
    public TimeUtils.TickUnit unit() {
        return UNIT;
    }

    @Override
    public long unsignedCounter() {
        return counter;
    }

    @Override
    public long hash() {
        return hash;
    }

    @Override
    public boolean isHashStale() {
        return hashStale;
    }

    @Override
    public void refreshHash() {
        hash = hashOf(counter);
        hashStale = false;
    }

    @Override
    public void refreshCounter() {
        counter = counterOf(hash);
        hashStale = false;
    }

    /**
     * Adds to the counter only; wraps at 64 bits.
     */
    public FixedDateTime64 add(DateTimeAmount amount) {
        counter += FixedConversions.amountTicks(amount, UNIT);
        hashStale = true;
        return this;
    }

    /**
     * Subtracts from the counter only; wraps at 64 bits.
     */
    public FixedDateTime64 subtract(DateTimeAmount amount) {
        counter -= FixedConversions.amountTicks(amount, UNIT);
        hashStale = true;
        return this;
    }

    /**
     * Adds another value's counter to this one; wraps at 64 bits.
     */
    public FixedDateTime64 plus(FixedDateTime64 other) {
        counter += Objects.requireNonNull(other, "other").counter;
        hashStale = true;
        return this;
    }

    public FixedDateTime64 withYear(int year) {
        return withField(HashField.YEAR, year);
    }

    public FixedDateTime64 withMonth(int month) {
        return withField(HashField.MONTH, month);
    }

    public FixedDateTime64 withDay(int day) {
        return withField(HashField.DAY, day);
    }

    public FixedDateTime64 withHour(int hour) {
        return withField(HashField.HOUR, hour);
    }

    public FixedDateTime64 withMinute(int minute) {
        return withField(HashField.MINUTE, minute);
    }

    public FixedDateTime64 withSecond(int second) {
        return withField(HashField.SECOND, second);
    }

    public FixedDateTime64 withMillisecond(int millisecond) {
        return withField(HashField.MILLISECOND, millisecond);
    }

    /**
     * Treats the counter as local time in {@code zone} and returns the UTC value.
     */
    public FixedDateTime64 toUtc(TimeZone zone) {
        return fromUnixEpoch(FixedConversions.toUtcTicks(counter, UNIT, zone));
    }

    /**
     * Treats the counter as UTC and returns the local value in {@code zone}.
     */
    public FixedDateTime64 fromUtc(TimeZone zone) {
        return fromUnixEpoch(FixedConversions.fromUtcTicks(counter, UNIT, zone));
    }

    /**
     * Orders by unsigned counter.
     */
    @Override
    public int compareTo(FixedDateTime64 other) {
        return Long.compareUnsigned(counter, other.counter);
    }

    @Override
    public String toString() {
        return "FixedDateTime64(counter=" + Long.toUnsignedString(counter)
                + ", hash=0x" + Long.toHexString(hash)
                + (hashStale ? ", stale" : "") + ")";
    }

    private FixedDateTime64 withField(HashField field, int value) {
        hash = LAYOUT.withField(hash, field, value);
        hashStale = true;
        return this;
    }

    private static long hashOf(long counter) {
        return LAYOUT.pack(FixedConversions.fieldsFromMillis(counter));
    }

    private static long counterOf(long hash) {
        HashFields fields = LAYOUT.unpack(hash);
        return FixedConversions.millisOf(fields.year(), fields.month(), fields.day(), fields.hour(), fields.minute(),
                fields.second(), fields.millisecond());
    }
}
