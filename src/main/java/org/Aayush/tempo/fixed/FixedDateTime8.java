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
 * Hour-resolution fixed date-time in one byte: unsigned hours since the 1970 epoch, covering
 * a little over ten days, hashed with {@link CalendarHash#UINT8} as day of week and hour.
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class FixedDateTime8 implements FixedDateTime, Comparable<FixedDateTime8> {
    private static final CalendarHash LAYOUT = CalendarHash.UINT8;
    private static final TimeUtils.TickUnit UNIT = TimeUtils.TickUnit.HOURS;
    private static final int HOURS_PER_DAY = (int) TimeUtils.HOURS_PER_DAY;

    @EqualsAndHashCode.Include
    private byte counter;
    private byte hash;
    private boolean hashStale;

    private FixedDateTime8(byte counter, byte hash) {
        this.counter = counter;
        this.hash = hash;
    }

    /**
     * Creates the first value in the epoch's week range with the given weekday and hour.
     *
     * @param dayOfWeek Monday = 0.
     * @throws IllegalArgumentException when a field is out of range.
     */
    public static FixedDateTime8 of(int dayOfWeek, int hour) {
        if (dayOfWeek < 0 || dayOfWeek >= TimeUtils.DAYS_PER_WEEK) {
            throw new IllegalArgumentException("dayOfWeek must be in [0, 6]: " + dayOfWeek);
        }
        if (hour < 0 || hour >= HOURS_PER_DAY) {
            throw new IllegalArgumentException("hour must be in [0, 23]: " + hour);
        }
        byte hash = (byte) LAYOUT.pack(HashFields.of(0, 0, dayOfWeek, hour, 0, 0));
        return new FixedDateTime8(counterOf(hash), hash);
    }

    /**
     * Creates a value from Unix milliseconds, floored to the hour and wrapped to 8 bits.
     */
    public static FixedDateTime8 fromUnixEpoch(long unixMillis) {
        byte counter = (byte) TimeUtils.toTicks(unixMillis, UNIT);
        return new FixedDateTime8(counter, hashOf(counter));
    }

    public static FixedDateTime8 now(Clock clock) {
        return fromUnixEpoch(TimeUtils.currentUnixMillis(clock));
    }

    /**
     * Creates a value from a packed hash; the counter is the first matching hour after the epoch.
     */
    public static FixedDateTime8 fromHash(byte hash) {
        return new FixedDateTime8(counterOf(hash), hash);
    }

    public byte counter() {
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
        return Byte.toUnsignedLong(counter);
    }

    @Override
    public long hash() {
        return Byte.toUnsignedLong(hash);
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
     * Adds whole hours of {@code amount} to the counter only; wraps at 8 bits.
     */
    public FixedDateTime8 add(DateTimeAmount amount) {
        counter += (byte) FixedConversions.amountTicks(amount, UNIT);
        hashStale = true;
        return this;
    }

    /**
     * Subtracts whole hours of {@code amount} from the counter only; wraps at 8 bits.
     */
    public FixedDateTime8 subtract(DateTimeAmount amount) {
        counter -= (byte) FixedConversions.amountTicks(amount, UNIT);
        hashStale = true;
        return this;
    }

    public FixedDateTime8 plus(FixedDateTime8 other) {
        counter += Objects.requireNonNull(other, "other").counter;
        hashStale = true;
        return this;
    }

    /**
     * Replaces the hashed weekday, Monday = 0.
     */
    public FixedDateTime8 withDayOfWeek(int dayOfWeek) {
        return withField(HashField.DAY, dayOfWeek);
    }

    public FixedDateTime8 withHour(int hour) {
        return withField(HashField.HOUR, hour);
    }

    public FixedDateTime8 toUtc(TimeZone zone) {
        byte utc = (byte) FixedConversions.toUtcTicks(unsignedCounter(), UNIT, zone);
        return new FixedDateTime8(utc, hashOf(utc));
    }

    public FixedDateTime8 fromUtc(TimeZone zone) {
        byte local = (byte) FixedConversions.fromUtcTicks(unsignedCounter(), UNIT, zone);
        return new FixedDateTime8(local, hashOf(local));
    }

    @Override
    public int compareTo(FixedDateTime8 other) {
        return Integer.compare(Byte.toUnsignedInt(counter), Byte.toUnsignedInt(other.counter));
    }

    @Override
    public String toString() {
        return "FixedDateTime8(counter=" + Byte.toUnsignedInt(counter)
                + ", hash=0x" + Integer.toHexString(Byte.toUnsignedInt(hash))
                + (hashStale ? ", stale" : "") + ")";
    }

    private FixedDateTime8 withField(HashField field, int value) {
        hash = (byte) LAYOUT.withField(hash(), field, value);
        hashStale = true;
        return this;
    }

    private static byte hashOf(byte counter) {
        long hours = Byte.toUnsignedLong(counter);
        int dayOfWeek = TimeUtils.dayOfWeek(hours / HOURS_PER_DAY, FixedConversions.CALENDAR.epochDayOfWeek());
        int hour = (int) (hours % HOURS_PER_DAY);
        return (byte) LAYOUT.pack(HashFields.of(0, 0, dayOfWeek, hour, 0, 0));
    }

    private static byte counterOf(byte hash) {
        long packed = Byte.toUnsignedLong(hash);
        int dayOfWeek = LAYOUT.field(packed, HashField.DAY);
        int hour = LAYOUT.field(packed, HashField.HOUR);
        int days = Math.floorMod(dayOfWeek - FixedConversions.CALENDAR.epochDayOfWeek(), TimeUtils.DAYS_PER_WEEK);
        return (byte) (days * HOURS_PER_DAY + hour);
    }
}
