package org.Aayush.tempo.zone;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Source of zone records used to populate a {@link ZoneStore}.
 *
 * <p>Providers are consulted once while a store is built; lookups afterwards go to the store.</p>
 */
public interface ZoneRecordProvider {

    /**
     * Returns every zone name this provider may know about.
     */
    Set<String> zoneNames();

    /**
     * Returns the record of one zone, or empty when the zone is unknown or cannot be expressed.
     */
    Optional<ZoneRecord> lookup(String zoneName);

    /**
     * Returns every record this provider can express, in zone-name order.
     */
    default List<ZoneRecord> records() {
        List<ZoneRecord> records = new ArrayList<>();
        for (String name : zoneNames().stream().sorted().toList()) {
            lookup(name).ifPresent(records::add);
        }
        return records;
    }
}
