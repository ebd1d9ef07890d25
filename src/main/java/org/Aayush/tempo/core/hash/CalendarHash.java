package org.Aayush.tempo.core.hash;

import java.util.Objects;

/**
 * Catalog of fixed-width bit layouts for a civil-time tuple.
 * <p>
 * Every layout assigns a bit budget to a subset of {@link HashField}s and packs them
 * most-significant-first (year highest), so packed values of one layout sort in
 * chronological order. Packed values are a persisted wire format: layouts must not
 * change within a release line.
 * </p>
 * <pre>
 * width | year   | month | day   | hour  | minute | second | ms     | us
 * 64    | 16 @47 | 4 @43 | 6 @37 | 5 @32 | 6 @26  | 6 @20  | 10 @10 | 10 @0
 * 32    | 11 @21 | 4 @17 | 6 @11 | 5 @6  | 6 @0   |        |        |
 * 16    |        | 4 @11 | 6 @5  | 5 @0  |        |        |        |
 * 8     |        |       | 3 @5  | 5 @0  |        |        |        |
 * </pre>
 * <p>
 * The 8-bit layout has room for a day of week only (Monday = 0); its {@code day} field
 * carries that value.
 * </p>
 */
public enum CalendarHash {
    UINT8(8, new int[]{0, 0, 3, 5, 0, 0, 0, 0}),
    UINT16(16, new int[]{0, 4, 6, 5, 0, 0, 0, 0}),
    UINT32(32, new int[]{11, 4, 6, 5, 6, 0, 0, 0}),
    UINT64(64, new int[]{16, 4, 6, 5, 6, 6, 10, 10});

    private static final HashField[] FIELDS = HashField.values();

    private final int width;
    private final int[] bits;
    private final int[] shifts;
    private final long[] masks;

    CalendarHash(int width, int[] bits) {
        this.width = width;
        this.bits = bits;
        this.shifts = new int[bits.length];
        this.masks = new long[bits.length];
        int shift = 0;
        for (int i = bits.length - 1; i >= 0; i--) {
            shifts[i] = shift;
            masks[i] = (1L << bits[i]) - 1L;
            shift += bits[i];
        }
        if (shift > width) {
            throw new IllegalStateException("layout exceeds " + width + " bits");
        }
    }

    /**
     * Returns layout width in bits.
     */
    public int width() {
        return width;
    }

    /**
     * Returns bit budget for one field; {@code 0} when the layout does not carry it.
     */
    public int bits(HashField field) {
        return bits[Objects.requireNonNull(field, "field").ordinal()];
    }

    /**
     * Returns the shift of one field's least significant bit.
     */
    public int shift(HashField field) {
        return shifts[Objects.requireNonNull(field, "field").ordinal()];
    }

    /**
     * Returns the unshifted mask of one field.
     */
    public long mask(HashField field) {
        return masks[Objects.requireNonNull(field, "field").ordinal()];
    }

    /**
     * Returns whether this layout carries the field at all.
     */
    public boolean supports(HashField field) {
        return bits(field) > 0;
    }

    /**
     * Packs a tuple. Values wider than their budget are truncated by masking.
     *
     * @param fields tuple to pack.
     * @return packed value in the low {@link #width()} bits.
     */
    public long pack(HashFields fields) {
        Objects.requireNonNull(fields, "fields");
        long packed = 0L;
        for (int i = 0; i < FIELDS.length; i++) {
            if (bits[i] == 0) {
                continue;
            }
            packed |= (fields.get(FIELDS[i]) & masks[i]) << shifts[i];
        }
        return packed;
    }

    /**
     * Unpacks a value. Fields the layout does not carry come back as {@code 0}.
     */
    public HashFields unpack(long packed) {
        return HashFields.of(
                field(packed, HashField.YEAR),
                field(packed, HashField.MONTH),
                field(packed, HashField.DAY),
                field(packed, HashField.HOUR),
                field(packed, HashField.MINUTE),
                field(packed, HashField.SECOND),
                field(packed, HashField.MILLISECOND),
                field(packed, HashField.MICROSECOND)
        );
    }

    /**
     * Reads one field from a packed value.
     */
    public int field(long packed, HashField field) {
        int i = Objects.requireNonNull(field, "field").ordinal();
        if (bits[i] == 0) {
            return 0;
        }
        return (int) ((packed >>> shifts[i]) & masks[i]);
    }

    /**
     * Replaces one field inside a packed value, leaving all other bits intact.
     *
     * @throws IllegalArgumentException when the layout does not carry {@code field}.
     */
    public long withField(long packed, HashField field, int value) {
        int i = Objects.requireNonNull(field, "field").ordinal();
        if (bits[i] == 0) {
            throw new IllegalArgumentException(name() + " does not carry " + field);
        }
        long cleared = packed & ~(masks[i] << shifts[i]);
        return cleared | ((value & masks[i]) << shifts[i]);
    }

    /**
     * Returns whether every carried field of the tuple fits its budget, i.e. whether
     * {@code unpack(pack(fields))} reproduces those fields.
     */
    public boolean fits(HashFields fields) {
        Objects.requireNonNull(fields, "fields");
        for (int i = 0; i < FIELDS.length; i++) {
            if (bits[i] == 0) {
                continue;
            }
            int value = fields.get(FIELDS[i]);
            if (value < 0 || value > masks[i]) {
                return false;
            }
        }
        return true;
    }
}
