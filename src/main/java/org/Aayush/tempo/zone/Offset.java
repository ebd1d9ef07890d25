package org.Aayush.tempo.zone;

import lombok.EqualsAndHashCode;
import org.Aayush.tempo.core.time.TimeUtils;

/**
 * UTC offset packed into one byte.
 * <pre>
 * bit 7    : sign (0 = east of UTC, 1 = west)
 * bits 6-3 : hours, 0..15
 * bits 2-1 : minute code (0 = :00, 1 = :30, 2 = :45, 3 = reserved)
 * bit 0    : irregular-DST flag
 * </pre>
 * <p>
 * The irregular flag marks the two zones whose daylight saving shift is not one hour:
 * a zone with a non-zero standard minute (Lord Howe Island) shifts by 30 minutes, a zone
 * with a zero standard minute (Troll station) shifts by two hours.
 * </p>
 */
@EqualsAndHashCode
public final class Offset {
    public static final Offset UTC = new Offset(0, 0, 1);

    private static final int SIGN_SHIFT = 7;
    private static final int HOUR_SHIFT = 3;
    private static final int MINUTE_SHIFT = 1;
    private static final int HOUR_MASK = 0x0F;
    private static final int MINUTE_CODE_MASK = 0x03;
    private static final int RESERVED_MINUTE_CODE = 3;
    private static final int[] MINUTES_BY_CODE = {0, 30, 45};

    private final byte bits;

    /**
     * Creates a regular offset.
     *
     * @param hour hours in {@code [0, 15]}.
     * @param minute minutes, one of {@code 0, 30, 45}.
     * @param sign {@code 1} east of UTC, {@code -1} west of UTC.
     */
    public Offset(int hour, int minute, int sign) {
        this(hour, minute, sign, false);
    }

    private Offset(int hour, int minute, int sign, boolean irregular) {
        if (hour < 0 || hour > HOUR_MASK) {
            throw new IllegalArgumentException("offset hour must be in [0, 15]: " + hour);
        }
        if (sign != 1 && sign != -1) {
            throw new IllegalArgumentException("offset sign must be 1 or -1: " + sign);
        }
        int minuteCode = minuteCode(minute);
        int packed = (sign == -1 ? 1 : 0) << SIGN_SHIFT
                | hour << HOUR_SHIFT
                | minuteCode << MINUTE_SHIFT
                | (irregular ? 1 : 0);
        this.bits = (byte) packed;
    }

    /**
     * Creates an offset for a zone whose daylight saving shift is irregular.
     */
    public static Offset irregular(int hour, int minute, int sign) {
        return new Offset(hour, minute, sign, true);
    }

    /**
     * Decodes a packed byte.
     *
     * @throws IllegalArgumentException when the reserved minute code is set.
     */
    public static Offset fromByte(byte packed) {
        int value = packed & 0xFF;
        int minuteCode = (value >>> MINUTE_SHIFT) & MINUTE_CODE_MASK;
        if (minuteCode == RESERVED_MINUTE_CODE) {
            throw new IllegalArgumentException("reserved minute code in offset byte 0x" + Integer.toHexString(value));
        }
        int sign = (value >>> SIGN_SHIFT) == 1 ? -1 : 1;
        int hour = (value >>> HOUR_SHIFT) & HOUR_MASK;
        return new Offset(hour, MINUTES_BY_CODE[minuteCode], sign, (value & 1) == 1);
    }

    /**
     * Creates a regular offset from a signed minute count.
     */
    public static Offset ofTotalMinutes(int totalMinutes) {
        int magnitude = Math.abs(totalMinutes);
        return new Offset(magnitude / 60, magnitude % 60, totalMinutes < 0 ? -1 : 1);
    }

    public int hour() {
        return (bits >>> HOUR_SHIFT) & HOUR_MASK;
    }

    public int minute() {
        return MINUTES_BY_CODE[(bits >>> MINUTE_SHIFT) & MINUTE_CODE_MASK];
    }

    /**
     * Returns {@code 1} east of UTC and {@code -1} west of UTC.
     */
    public int sign() {
        return ((bits & 0xFF) >>> SIGN_SHIFT) == 1 ? -1 : 1;
    }

    public boolean isIrregular() {
        return (bits & 1) == 1;
    }

    /**
     * Returns the packed byte.
     */
    public byte toByte() {
        return bits;
    }

    /**
     * Returns the signed offset in minutes.
     */
    public int totalMinutes() {
        return sign() * (hour() * 60 + minute());
    }

    /**
     * Returns the signed offset in seconds.
     */
    public int totalSeconds() {
        return totalMinutes() * 60;
    }

    @Override
    public String toString() {
        return TimeUtils.formatOffset(totalMinutes());
    }

    private static int minuteCode(int minute) {
        return switch (minute) {
            case 0 -> 0;
            case 30 -> 1;
            case 45 -> 2;
            default -> throw new IllegalArgumentException("offset minute must be 0, 30 or 45: " + minute);
        };
    }
}
