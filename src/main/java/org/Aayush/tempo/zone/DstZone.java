package org.Aayush.tempo.zone;

import lombok.EqualsAndHashCode;

import java.util.Objects;

/**
 * Daylight-saving zone packed into 32 bits: start rule (bits 31-20), end rule (bits 19-8)
 * and standard offset (bits 7-0).
 */
@EqualsAndHashCode
public final class DstZone {
    private static final int START_SHIFT = 20;
    private static final int END_SHIFT = 8;
    private static final int RULE_MASK = (1 << TransitionRule.BIT_WIDTH) - 1;
    private static final int REGULAR_SHIFT_MINUTES = 60;
    private static final int HALF_HOUR_SHIFT_MINUTES = 30;
    private static final int TWO_HOUR_SHIFT_MINUTES = 120;
    private static final int MAX_OFFSET_HOURS = 15;

    private final int bits;

    /**
     * Creates a zone from its rules and standard offset.
     *
     * @throws IllegalArgumentException when the daylight-saving offset derived from
     *                                  {@code offset} cannot be expressed as an {@link Offset}.
     */
    public DstZone(TransitionRule start, TransitionRule end, Offset offset) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(offset, "offset");
        if (!supportsStandardOffset(offset)) {
            throw new IllegalArgumentException("daylight saving offset of " + offset + " is not encodable: "
                    + (offset.totalMinutes() + shiftMinutes(offset)) + " minutes");
        }
        this.bits = start.bits() << START_SHIFT
                | end.bits() << END_SHIFT
                | (offset.toByte() & 0xFF);
    }

    /**
     * Decodes a packed value.
     */
    public static DstZone fromBits(int packed) {
        return new DstZone(
                TransitionRule.fromBits(packed >>> START_SHIFT),
                TransitionRule.fromBits((packed >>> END_SHIFT) & RULE_MASK),
                Offset.fromByte((byte) packed)
        );
    }

    public TransitionRule start() {
        return TransitionRule.fromBits(bits >>> START_SHIFT);
    }

    public TransitionRule end() {
        return TransitionRule.fromBits((bits >>> END_SHIFT) & RULE_MASK);
    }

    /**
     * Returns the standard (non-DST) offset.
     */
    public Offset offset() {
        return Offset.fromByte((byte) bits);
    }

    /**
     * Returns the offset in effect while daylight saving is active.
     */
    public Offset dstOffset() {
        Offset standard = offset();
        return Offset.ofTotalMinutes(standard.totalMinutes() + shiftMinutes(standard));
    }

    /**
     * Returns whether a zone with standard offset {@code standard} has an encodable
     * daylight-saving offset: at most fifteen hours from UTC, on a minute of 0, 30 or 45.
     */
    public static boolean supportsStandardOffset(Offset standard) {
        int dstMinutes = Objects.requireNonNull(standard, "standard").totalMinutes() + shiftMinutes(standard);
        int magnitude = Math.abs(dstMinutes);
        int minute = magnitude % 60;
        return magnitude / 60 <= MAX_OFFSET_HOURS && (minute == 0 || minute == 30 || minute == 45);
    }

    /**
     * Returns the packed 32 bits.
     */
    public int bits() {
        return bits;
    }

    @Override
    public String toString() {
        return "DstZone(start=" + start() + ", end=" + end() + ", offset=" + offset() + ")";
    }

    private static int shiftMinutes(Offset standard) {
        if (!standard.isIrregular()) {
            return REGULAR_SHIFT_MINUTES;
        }
        return standard.minute() == 0 ? TWO_HOUR_SHIFT_MINUTES : HALF_HOUR_SHIFT_MINUTES;
    }
}
