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
 * Minute-resolution fixed date-time: unsigned 32-bit minutes since 1970 on the fast calendar,
 * hashed with {@link CalendarHash#UINT32}. The hash holds years up to 2047 and no seconds.
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class FixedDateTime32 implements FixedDateTime, Comparable<FixedDateTime32> {
    private static final CalendarHash LAYOUT = CalendarHash.UINT32;
    private static final TimeUtils.TickUnit UNIT = TimeUtils.TickUnit.MINUTES;
    private static final int MAX_YEAR = (int) LAYOUT.mask(HashField.YEAR);

    @EqualsAndHashCode.Include
    private int counter;
    private int hash;
    private boolean hashStale;

    private FixedDateTime32(int counter, int hash) {
        this.counter = counter;
        this.hash = hash;
    }

    /**
     * Creates a value from fast-calendar fields.
     *
     * @throws IllegalArgumentException when the fields are outside the fast calendar or past 2047.
     */
    public static FixedDateTime32 of(int year, int month, int day, int hour, int minute) {
        FixedConversions.requireValid(year, month, day, hour, minute, 0, 0, MAX_YEAR);
        long millis = FixedConversions.millisOf(year, month, day, hour, minute, 0, 0);
        return new FixedDateTime32(
                (int) TimeUtils.toTicks(millis, UNIT),
                (int) LAYOUT.pack(HashFields.of(year, month, day, hour, minute, 0)));
    }

    /**
     * Creates a value from Unix milliseconds, floored to the minute and wrapped to 32 bits.
     */
    public static FixedDateTime32 fromUnixEpoch(long unixMillis) {
        int counter = (int) TimeUtils.toTicks(unixMillis, UNIT);
        return new FixedDateTime32(counter, hashOf(counter));
    }

    public static FixedDateTime32 now(Clock clock) {
        return fromUnixEpoch(TimeUtils.currentUnixMillis(clock));
    }

    /**
     * Creates a value from a packed hash, deriving the counter from it.
     */
    public static FixedDateTime32 fromHash(int hash) {
        return new FixedDateTime32(counterOf(hash), hash);
    }

    public int counter() {
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
        return Integer.toUnsignedLong(counter);
    }

    @Override
    public long hash() {
        return Integer.toUnsignedLong(hash);
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
     * Adds whole minutes of {@code amount} to the counter only; wraps at 32 bits.
     */
    public FixedDateTime32 add(DateTimeAmount amount) {
        counter += (int) FixedConversions.amountTicks(amount, UNIT);
        hashStale = true;
        return this;
    }

    /**
     * Subtracts whole minutes of {@code amount} from the counter only; wraps at 32 bits.
     */
    public FixedDateTime32 subtract(DateTimeAmount amount) {
        counter -= (int) FixedConversions.amountTicks(amount, UNIT);
        hashStale = true;
        return this;
    }

    public FixedDateTime32 plus(FixedDateTime32 other) {
        counter += Objects.requireNonNull(other, "other").counter;
        hashStale = true;
        return this;
    }

    public FixedDateTime32 withYear(int year) {
        return withField(HashField.YEAR, year);
    }

    public FixedDateTime32 withMonth(int month) {
        return withField(HashField.MONTH, month);
    }

    public FixedDateTime32 withDay(int day) {
        return withField(HashField.DAY, day);
    }

    public FixedDateTime32 withHour(int hour) {
        return withField(HashField.HOUR, hour);
    }

    public FixedDateTime32 withMinute(int minute) {
        return withField(HashField.MINUTE, minute);
    }

    public FixedDateTime32 toUtc(TimeZone zone) {
        int utc = (int) FixedConversions.toUtcTicks(unsignedCounter(), UNIT, zone);
        return new FixedDateTime32(utc, hashOf(utc));
    }

    public FixedDateTime32 fromUtc(TimeZone zone) {
        int local = (int) FixedConversions.fromUtcTicks(unsignedCounter(), UNIT, zone);
        return new FixedDateTime32(local, hashOf(local));
    }

    @Override
    public int compareTo(FixedDateTime32 other) {
        return Integer.compareUnsigned(counter, other.counter);
    }

    @Override
    public String toString() {
        return "FixedDateTime32(counter=" + Integer.toUnsignedString(counter)
                + ", hash=0x" + Integer.toHexString(hash)
                + (hashStale ? ", stale" : "") + ")";
    }

    private FixedDateTime32 withField(HashField field, int value) {
        hash = (int) LAYOUT.withField(hash(), field, value);
        hashStale = true;
        return this;
    }

    private static int hashOf(int counter) {
        return (int) LAYOUT.pack(FixedConversions.fieldsFromTicks(Integer.toUnsignedLong(counter), UNIT));
    }

    private static int counterOf(int hash) {
        HashFields fields = LAYOUT.unpack(Integer.toUnsignedLong(hash));
        long millis = FixedConversions.millisOf(
                fields.year(), fields.month(), fields.day(), fields.hour(), fields.minute(), 0, 0);
        return (int) TimeUtils.toTicks(millis, UNIT);
    }
}
