package org.Aayush.tempo.date;

import lombok.Value;
import lombok.experimental.Accessors;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Result of {@link CalendarDateTime#deltaNanos(CalendarDateTime)}.
 * <p>
 * Both operands are counted in nanoseconds from a synthetic epoch at the earlier operand's
 * year. When the operands are too far apart for an unsigned 64-bit nanosecond counter, the
 * later operand is first moved back by {@link #overflowYears()} (a multiple of 400, so the
 * leap-year pattern is unchanged) and the seconds removed that way are reported in
 * {@link #overflowSeconds()}.
 * </p>
 * <p>
 * {@code selfNanos} and {@code otherNanos} are unsigned; read them with
 * {@link Long#toUnsignedString(long)}.
 * </p>
 */
@Value
@Accessors(fluent = true)
public class NanosDelta {
    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    long selfNanos;
    long otherNanos;
    long overflowYears;
    long overflowSeconds;
    /** {@code 1} when self is at or after other, {@code -1} otherwise. */
    int sign;

    /**
     * Returns {@code self - other} in nanoseconds.
     */
    public BigInteger totalNanos() {
        BigInteger counted = unsigned(selfNanos).subtract(unsigned(otherNanos));
        BigInteger overflow = BigInteger.valueOf(overflowSeconds).multiply(NANOS_PER_SECOND);
        return sign >= 0 ? counted.add(overflow) : counted.subtract(overflow);
    }

    /**
     * Returns {@code self - other} as a duration.
     */
    public Duration toDuration() {
        BigInteger[] secondsAndNanos = totalNanos().divideAndRemainder(NANOS_PER_SECOND);
        return Duration.ofSeconds(secondsAndNanos[0].longValueExact(), secondsAndNanos[1].longValue());
    }

    /**
     * Returns whether the operands needed overflow anchoring.
     */
    public boolean isAnchored() {
        return overflowYears != 0;
    }

    private static BigInteger unsigned(long value) {
        return new BigInteger(Long.toUnsignedString(value));
    }
}
