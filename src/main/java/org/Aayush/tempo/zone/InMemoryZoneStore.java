package org.Aayush.tempo.zone;

import it.unimi.dsi.fastutil.objects.Object2ByteOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Heap zone store keeping each record in its packed form.
 * <p>
 * DST zones live in a name to 32-bit map and fixed zones in a name to 8-bit map, so
 * lookups never box and each entry costs one primitive slot. Immutable after
 * {@link Builder#build()}; safe for concurrent reads.
 * </p>
 */
public final class InMemoryZoneStore implements ZoneStore {

    private final Object2IntOpenHashMap<String> dstBitsByName;
    private final Object2ByteOpenHashMap<String> offsetBitsByName;
    private final Set<String> zoneNames;

    private InMemoryZoneStore(
            Object2IntOpenHashMap<String> dstBitsByName,
            Object2ByteOpenHashMap<String> offsetBitsByName,
            Set<String> zoneNames
    ) {
        this.dstBitsByName = dstBitsByName;
        this.offsetBitsByName = offsetBitsByName;
        this.zoneNames = zoneNames;
    }

    /**
     * Returns a new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a store with no zones.
     */
    public static InMemoryZoneStore empty() {
        return builder().build();
    }

    @Override
    public Optional<DstZone> dstZone(String zoneName) {
        if (zoneName == null || !dstBitsByName.containsKey(zoneName)) {
            return Optional.empty();
        }
        return Optional.of(DstZone.fromBits(dstBitsByName.getInt(zoneName)));
    }

    @Override
    public Optional<Offset> fixedOffset(String zoneName) {
        if (zoneName == null || !offsetBitsByName.containsKey(zoneName)) {
            return Optional.empty();
        }
        return Optional.of(Offset.fromByte(offsetBitsByName.getByte(zoneName)));
    }

    @Override
    public Set<String> zoneNames() {
        return zoneNames;
    }

    /**
     * Mutable single-use builder. A later record for the same name replaces the earlier one.
     */
    public static final class Builder {
        private final Object2IntOpenHashMap<String> dstBitsByName = new Object2IntOpenHashMap<>();
        private final Object2ByteOpenHashMap<String> offsetBitsByName = new Object2ByteOpenHashMap<>();
        private final LinkedHashSet<String> names = new LinkedHashSet<>();

        private Builder() {
        }

        /**
         * Adds or replaces one record.
         */
        public Builder add(ZoneRecord record) {
            Objects.requireNonNull(record, "record");
            String name = record.name();
            if (record.hasDst()) {
                offsetBitsByName.removeByte(name);
                dstBitsByName.put(name, record.dstZone().orElseThrow().bits());
            } else {
                dstBitsByName.removeInt(name);
                offsetBitsByName.put(name, record.offset().toByte());
            }
            names.add(name);
            return this;
        }

        /**
         * Adds or replaces every record.
         */
        public Builder addAll(Collection<ZoneRecord> records) {
            Objects.requireNonNull(records, "records");
            for (ZoneRecord record : records) {
                add(record);
            }
            return this;
        }

        /**
         * Adds or replaces a daylight-saving zone.
         */
        public Builder addDst(String name, DstZone dstZone) {
            return add(ZoneRecord.daylightSaving(name, dstZone));
        }

        /**
         * Adds or replaces a fixed zone.
         */
        public Builder addFixed(String name, Offset offset) {
            return add(ZoneRecord.fixed(name, offset));
        }

        /**
         * Copies every record visible in another store.
         */
        public Builder addAll(ZoneStore store) {
            Objects.requireNonNull(store, "store");
            for (String name : store.zoneNames()) {
                store.record(name).ifPresent(this::add);
            }
            return this;
        }

        /**
         * Freezes the collected records.
         */
        public InMemoryZoneStore build() {
            Object2IntOpenHashMap<String> dst = new Object2IntOpenHashMap<>(dstBitsByName);
            Object2ByteOpenHashMap<String> fixed = new Object2ByteOpenHashMap<>(offsetBitsByName);
            dst.trim();
            fixed.trim();
            return new InMemoryZoneStore(dst, fixed, Set.copyOf(names));
        }
    }
}
