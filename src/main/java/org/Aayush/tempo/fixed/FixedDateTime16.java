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
 * Hour-resolution fixed date-time: unsigned 16-bit hours since 1970 on the fast calendar,
 * hashed with {@link CalendarHash#UINT16}. The hash has no year; it reads as the epoch year.
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class FixedDateTime16 implements FixedDateTime, Comparable<FixedDateTime16> {
    private static final CalendarHash LAYOUT = CalendarHash.UINT16;
    private static final TimeUtils.TickUnit UNIT = TimeUtils.TickUnit.HOURS;

    @EqualsAndHashCode.Include
    private short counter;
    private short hash;
    private boolean hashStale;

    private FixedDateTime16(short counter, short hash) {
        this.counter = counter;
        this.hash = hash;
    }

    /**
     * Creates a value in the epoch year.
     *
     * @throws IllegalArgumentException when the fields are outside the fast calendar.
     */
    public static FixedDateTime16 of(int month, int day, int hour) {
        int year = FixedConversions.EPOCH_YEAR;
        FixedConversions.requireValid(year, month, day, hour, 0, 0, 0, year);
        long millis = FixedConversions.millisOf(year, month, day, hour, 0, 0, 0);
        return new FixedDateTime16(
                (short) TimeUtils.toTicks(millis, UNIT),
                (short) LAYOUT.pack(HashFields.of(0, month, day, hour, 0, 0)));
    }

    /**
     * Creates a value from Unix milliseconds, floored to the hour and wrapped to 16 bits.
     */
    public static FixedDateTime16 fromUnixEpoch(long unixMillis) {
        short counter = (short) TimeUtils.toTicks(unixMillis, UNIT);
        return new FixedDateTime16(counter, hashOf(counter));
    }

    public static FixedDateTime16 now(Clock clock) {
        return fromUnixEpoch(TimeUtils.currentUnixMillis(clock));
    }

    /**
     * Creates a value from a packed hash; the counter is placed in the epoch year.
     */
    public static FixedDateTime16 fromHash(short hash) {
        return new FixedDateTime16(counterOf(hash), hash);
    }

    public short counter() {
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
        return Short.toUnsignedLong(counter);
    }

    @Override
    public long hash() {
        return Short.toUnsignedLong(hash);
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
     * Adds whole hours of {@code amount} to the counter only; wraps at 16 bits.
     */
    public FixedDateTime16 add(DateTimeAmount amount) {
        counter += (short) FixedConversions.amountTicks(amount, UNIT);
        hashStale = true;
        return this;
    }

    /**
     * Subtracts whole hours of {@code amount} from the counter only; wraps at 16 bits.
     */
    public FixedDateTime16 subtract(DateTimeAmount amount) {
        counter -= (short) FixedConversions.amountTicks(amount, UNIT);
        hashStale = true;
        return this;
    }

    public FixedDateTime16 plus(FixedDateTime16 other) {
        counter += Objects.requireNonNull(other, "other").counter;
        hashStale = true;
        return this;
    }

    public FixedDateTime16 withMonth(int month) {
        return withField(HashField.MONTH, month);
    }

    public FixedDateTime16 withDay(int day) {
        return withField(HashField.DAY, day);
    }

    public FixedDateTime16 withHour(int hour) {
        return withField(HashField.HOUR, hour);
    }

    public FixedDateTime16 toUtc(TimeZone zone) {
        short utc = (short) FixedConversions.toUtcTicks(unsignedCounter(), UNIT, zone);
        return new FixedDateTime16(utc, hashOf(utc));
    }

    public FixedDateTime16 fromUtc(TimeZone zone) {
        short local = (short) FixedConversions.fromUtcTicks(unsignedCounter(), UNIT, zone);
        return new FixedDateTime16(local, hashOf(local));
    }

    @Override
    public int compareTo(FixedDateTime16 other) {
        return Integer.compare(Short.toUnsignedInt(counter), Short.toUnsignedInt(other.counter));
    }

    @Override
    public String toString() {
        return "FixedDateTime16(counter=" + Short.toUnsignedInt(counter)
                + ", hash=0x" + Integer.toHexString(Short.toUnsignedInt(hash))
                + (hashStale ? ", stale" : "") + ")";
    }

    private FixedDateTime16 withField(HashField field, int value) {
        hash = (short) LAYOUT.withField(hash(), field, value);
        hashStale = true;
        return this;
    }

    private static short hashOf(short counter) {
        return (short) LAYOUT.pack(FixedConversions.fieldsFromTicks(Short.toUnsignedLong(counter), UNIT));
    }

    private static short counterOf(short hash) {
        HashFields fields = LAYOUT.unpack(Short.toUnsignedLong(hash));
        long millis = FixedConversions.millisOf(
                FixedConversions.EPOCH_YEAR, fields.month(), fields.day(), fields.hour(), 0, 0, 0);
        return (short) TimeUtils.toTicks(millis, UNIT);
    }
}
