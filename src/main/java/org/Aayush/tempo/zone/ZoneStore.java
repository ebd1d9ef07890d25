package org.Aayush.tempo.zone;

import java.util.Optional;
import java.util.Set;

/**
 * Read-only zone database keyed by zone name.
 *
 * <p>Implementations are immutable once built and safe for concurrent readers.</p>
 */
public interface ZoneStore {

    /**
     * Returns daylight-saving rules for a zone, or empty when the zone is unknown or has
     * no daylight saving.
     */
    Optional<DstZone> dstZone(String zoneName);

    /**
     * Returns the fixed offset of a zone without daylight saving, or empty when the zone
     * is unknown or observes daylight saving.
     */
    Optional<Offset> fixedOffset(String zoneName);

    /**
     * Returns immutable set of known zone names.
     */
    Set<String> zoneNames();

    /**
     * Returns number of known zones.
     */
    default int size() {
        return zoneNames().size();
    }

    /**
     * Returns the full record of a zone, preferring daylight-saving data.
     */
    default Optional<ZoneRecord> record(String zoneName) {
        if (zoneName == null) {
            return Optional.empty();
        }
        Optional<DstZone> dst = dstZone(zoneName);
        if (dst.isPresent()) {
            return Optional.of(ZoneRecord.daylightSaving(zoneName, dst.get()));
        }
        return fixedOffset(zoneName).map(offset -> ZoneRecord.fixed(zoneName, offset));
    }
}
