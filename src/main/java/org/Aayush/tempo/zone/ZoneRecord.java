package org.Aayush.tempo.zone;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Objects;
import java.util.Optional;

/**
 * One zone-database entry: either a fixed offset or a daylight-saving zone.
 */
@Getter
@ToString
@EqualsAndHashCode
@Accessors(fluent = true)
public final class ZoneRecord {

    /** Zone name such as {@code America/New_York}. */
    private final String name;
    /** Standard offset; for DST zones this is the offset outside daylight saving. */
    private final Offset offset;
    @Getter(AccessLevel.NONE)
    private final DstZone dstZone;

    private ZoneRecord(String name, Offset offset, DstZone dstZone) {
        String normalized = Objects.requireNonNull(name, "name").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("zone name must be non-blank");
        }
        this.name = normalized;
        this.offset = Objects.requireNonNull(offset, "offset");
        this.dstZone = dstZone;
    }

    /**
     * Creates a record for a zone without daylight saving.
     */
    public static ZoneRecord fixed(String name, Offset offset) {
        return new ZoneRecord(name, offset, null);
    }

    /**
     * Creates a record for a daylight-saving zone.
     */
    public static ZoneRecord daylightSaving(String name, DstZone dstZone) {
        Objects.requireNonNull(dstZone, "dstZone");
        return new ZoneRecord(name, dstZone.offset(), dstZone);
    }

    public boolean hasDst() {
        return dstZone != null;
    }

    /**
     * Returns the daylight-saving rules, empty for fixed zones.
     */
    public Optional<DstZone> dstZone() {
        return Optional.ofNullable(dstZone);
    }
}
