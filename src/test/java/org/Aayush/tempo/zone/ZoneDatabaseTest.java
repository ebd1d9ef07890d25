package org.Aayush.tempo.zone;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Zone Database Tests")
class ZoneDatabaseTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearProperties() {
        System.clearProperty(ZoneDatabaseConfig.ZONE_FILE_PROPERTY);
        System.clearProperty(ZoneDatabaseConfig.JAVA_RULES_PROPERTY);
    }

    @Test
    @DisplayName("Built-in only configuration")
    void testBuiltInOnly() {
        ZoneStore store = ZoneDatabase.load(ZoneDatabaseConfig.builtInOnly());
        assertEquals(new BuiltInZoneRecordProvider().zoneNames(), store.zoneNames());
        assertTrue(store.dstZone("America/New_York").isPresent());
    }

    @Test
    @DisplayName("JDK rules are overlaid by the built-in table")
    void testJavaRulesOverlay() {
        ZoneStore store = ZoneDatabase.load(ZoneDatabaseConfig.withJavaZoneRules());
        assertTrue(store.size() > new BuiltInZoneRecordProvider().zoneNames().size());
        assertTrue(store.fixedOffset("Asia/Kathmandu").isPresent());
        assertTrue(store.dstZone("Pacific/Chatham").isPresent(), "built-in entry fills the skipped JDK zone");
    }

    @Test
    @DisplayName("Zone file records replace earlier sources")
    void testZoneFileOverrides() {
        Path file = tempDir.resolve("override.tzdb");
        FileZoneStore.write(file, InMemoryZoneStore.builder()
                .addFixed("America/New_York", new Offset(5, 0, -1))
                .addFixed("Custom/Zone", new Offset(2, 30, 1))
                .build());

        ZoneStore store = ZoneDatabase.load(ZoneDatabaseConfig.builder().zoneFile(file).build());

        assertTrue(store.dstZone("America/New_York").isEmpty());
        assertEquals(-300, store.fixedOffset("America/New_York").orElseThrow().totalMinutes());
        assertEquals(150, store.fixedOffset("Custom/Zone").orElseThrow().totalMinutes());
    }

    @Test
    @DisplayName("No sources yields an empty store")
    void testNoSources() {
        ZoneStore store = ZoneDatabase.load(ZoneDatabaseConfig.builder().includeBuiltIn(false).build());
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("System properties select sources")
    void testFromSystemProperties() {
        Path file = tempDir.resolve("zones.tzdb");
        System.setProperty(ZoneDatabaseConfig.ZONE_FILE_PROPERTY, " " + file + " ");
        System.setProperty(ZoneDatabaseConfig.JAVA_RULES_PROPERTY, "true");

        ZoneDatabaseConfig config = ZoneDatabaseConfig.fromSystemProperties();

        assertEquals(file, config.getZoneFile());
        assertTrue(config.isIncludeJavaZoneRules());
        assertTrue(config.isIncludeBuiltIn());
        assertEquals(JavaZoneRulesProvider.DEFAULT_REFERENCE_INSTANT, config.getReferenceInstant());
    }

    @Test
    @DisplayName("Exception Path: unreadable zone file")
    void testMissingZoneFile() {
        ZoneDatabaseConfig config = ZoneDatabaseConfig.builder().zoneFile(tempDir.resolve("missing.tzdb")).build();
        ZoneRecordException ex = assertThrows(ZoneRecordException.class, () -> ZoneDatabase.load(config));
        assertEquals(ZoneRecordException.REASON_FILE_IO, ex.reasonCode());
    }

    @Test
    @DisplayName("A failed default load reaches the caller and the next call retries")
    void testDefaultStoreRetriesAfterFailure() {
        AtomicInteger attempts = new AtomicInteger();
        ZoneStore loaded = ZoneDatabase.load(ZoneDatabaseConfig.builtInOnly());
        ZoneDatabase.DefaultStore defaultStore = new ZoneDatabase.DefaultStore(() -> {
            if (attempts.incrementAndGet() == 1) {
                return ZoneDatabase.load(ZoneDatabaseConfig.builder()
                        .zoneFile(tempDir.resolve("missing.tzdb"))
                        .build());
            }
            return loaded;
        });

        ZoneRecordException ex = assertThrows(ZoneRecordException.class, defaultStore::get);
        assertEquals(ZoneRecordException.REASON_FILE_IO, ex.reasonCode());
        assertSame(loaded, defaultStore.get());
        assertSame(loaded, defaultStore.get());
        assertEquals(2, attempts.get());
    }
}
