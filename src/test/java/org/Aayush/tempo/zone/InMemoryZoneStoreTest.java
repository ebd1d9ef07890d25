package org.Aayush.tempo.zone;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("In-Memory Zone Store Tests")
class InMemoryZoneStoreTest {

    private static final DstZone NEW_YORK = new DstZone(
            new TransitionRule(3, 6, false, 1, 2),
            new TransitionRule(11, 6, false, 0, 2),
            new Offset(5, 0, -1));

    @Test
    @DisplayName("Baseline: fixed and daylight-saving lookups")
    void testLookups() {
        InMemoryZoneStore store = InMemoryZoneStore.builder()
                .addDst("America/New_York", NEW_YORK)
                .addFixed("Asia/Tokyo", new Offset(9, 0, 1))
                .build();

        assertEquals(NEW_YORK, store.dstZone("America/New_York").orElseThrow());
        assertTrue(store.fixedOffset("America/New_York").isEmpty());
        assertEquals(new Offset(9, 0, 1), store.fixedOffset("Asia/Tokyo").orElseThrow());
        assertTrue(store.dstZone("Asia/Tokyo").isEmpty());
        assertEquals(Set.of("America/New_York", "Asia/Tokyo"), store.zoneNames());
        assertEquals(2, store.size());
    }

    @Test
    @DisplayName("record() prefers daylight-saving data and handles misses")
    void testRecord() {
        InMemoryZoneStore store = InMemoryZoneStore.builder()
                .addDst("America/New_York", NEW_YORK)
                .build();

        ZoneRecord record = store.record("America/New_York").orElseThrow();
        assertTrue(record.hasDst());
        assertEquals(new Offset(5, 0, -1), record.offset());
        assertTrue(store.record("Asia/Tokyo").isEmpty());
        assertTrue(store.record(null).isEmpty());
        assertTrue(store.dstZone(null).isEmpty());
    }

    @Test
    @DisplayName("A later record replaces an earlier one across kinds")
    void testReplacement() {
        InMemoryZoneStore store = InMemoryZoneStore.builder()
                .addDst("Asia/Tokyo", NEW_YORK)
                .addFixed("Asia/Tokyo", new Offset(9, 0, 1))
                .build();

        assertTrue(store.dstZone("Asia/Tokyo").isEmpty());
        assertEquals(new Offset(9, 0, 1), store.fixedOffset("Asia/Tokyo").orElseThrow());
        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("addAll copies records from collections and other stores")
    void testAddAll() {
        InMemoryZoneStore first = InMemoryZoneStore.builder()
                .addAll(List.of(
                        ZoneRecord.daylightSaving("America/New_York", NEW_YORK),
                        ZoneRecord.fixed("UTC", Offset.UTC)))
                .build();
        InMemoryZoneStore copy = InMemoryZoneStore.builder().addAll(first).build();

        assertEquals(first.zoneNames(), copy.zoneNames());
        assertEquals(first.record("America/New_York"), copy.record("America/New_York"));
        assertEquals(first.record("UTC"), copy.record("UTC"));
    }

    @Test
    @DisplayName("Empty store and immutable names")
    void testEmptyStore() {
        InMemoryZoneStore empty = InMemoryZoneStore.empty();
        assertEquals(0, empty.size());
        assertThrows(UnsupportedOperationException.class, () -> empty.zoneNames().add("UTC"));
    }
}
