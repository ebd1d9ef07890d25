package org.Aayush.tempo.zone;

import org.Aayush.tempo.calendar.Calendar;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Time Zone Tests")
class TimeZoneTest {

    private static ZoneStore store;

    @BeforeAll
    static void loadStore() {
        store = ZoneDatabase.load(ZoneDatabaseConfig.builtInOnly());
    }

    private static TimeZone zone(String name) {
        return TimeZone.of(name, store).orElseThrow();
    }

    // ========== Northern Hemisphere ==========

    @ParameterizedTest
    @CsvSource({
            "2024, 1, 15, 12, -300",
            "2024, 7, 4, 12, -240",
            "2024, 3, 10, 1, -300",
            "2024, 3, 10, 2, -240",
            "2024, 3, 9, 23, -300",
            "2024, 11, 3, 1, -240",
            "2024, 11, 3, 2, -300",
            "2024, 12, 25, 0, -300"
    })
    @DisplayName("New York switches on the second Sunday of March and first Sunday of November")
    void testNewYork(int year, int month, int day, int hour, int expectedMinutes) {
        assertEquals(expectedMinutes, zone("America/New_York").offsetAt(year, month, day, hour, 30, 0).totalMinutes());
    }

    @ParameterizedTest
    @CsvSource({
            "2024, 3, 31, 0, 0",
            "2024, 3, 31, 1, 60",
            "2024, 10, 27, 1, 60",
            "2024, 10, 27, 2, 0",
            "2024, 6, 1, 12, 60"
    })
    @DisplayName("London switches on the last Sundays of March and October")
    void testLondon(int year, int month, int day, int hour, int expectedMinutes) {
        assertEquals(expectedMinutes, zone("Europe/London").offsetAt(year, month, day, hour, 0, 0).totalMinutes());
    }

    // ========== Southern Hemisphere ==========

    @ParameterizedTest
    @CsvSource({
            "2024, 1, 15, 12, 660",
            "2024, 7, 15, 12, 600",
            "2024, 4, 7, 2, 660",
            "2024, 4, 7, 3, 600",
            "2024, 10, 6, 1, 600",
            "2024, 10, 6, 2, 660",
            "2024, 12, 31, 23, 660"
    })
    @DisplayName("Sydney daylight saving wraps around the year boundary")
    void testSydney(int year, int month, int day, int hour, int expectedMinutes) {
        assertEquals(expectedMinutes, zone("Australia/Sydney").offsetAt(year, month, day, hour, 0, 0).totalMinutes());
    }

    @Test
    @DisplayName("Lord Howe Island shifts by 30 minutes")
    void testLordHowe() {
        TimeZone lordHowe = zone("Australia/Lord_Howe");
        assertEquals(660, lordHowe.offsetAt(2024, 1, 15, 12, 0, 0).totalMinutes());
        assertEquals(630, lordHowe.offsetAt(2024, 7, 15, 12, 0, 0).totalMinutes());
    }

    @Test
    @DisplayName("Troll station shifts by two hours")
    void testTroll() {
        TimeZone troll = zone("Antarctica/Troll");
        assertEquals(120, troll.offsetAt(2024, 7, 15, 12, 0, 0).totalMinutes());
        assertEquals(0, troll.offsetAt(2024, 1, 15, 12, 0, 0).totalMinutes());
        assertEquals("+02:00", troll.offsetAt(2024, 7, 15, 12, 0, 0).toString());
    }

    // ========== Fixed Zones and Fallbacks ==========

    @Test
    @DisplayName("Fixed zones always report their static offset")
    void testFixedZones() {
        TimeZone kolkata = zone("Asia/Kolkata");
        assertFalse(kolkata.hasDst());
        assertEquals(330, kolkata.offsetAt(2024, 7, 1, 0, 0, 0).totalMinutes());
        assertTrue(kolkata.dstZone().isEmpty());
        assertFalse(kolkata.isDaylightSaving(2024, 7, 1, 0));

        TimeZone fixed = TimeZone.fixed("+05:45", new Offset(5, 45, 1));
        assertEquals(345, fixed.offsetAt(2024, 1, 1, 0, 0, 0).totalMinutes());
        assertEquals(TimeZone.utc().offset(), TimeZone.utc().offsetAt(2024, 7, 1, 0, 0, 0));
    }

    @Test
    @DisplayName("Daylight-saving zone without rules in its store falls back to the static offset")
    void testMissingRulesFallback() {
        TimeZone orphan = TimeZone.of("Nowhere/Orphan", new Offset(3, 0, 1), true, InMemoryZoneStore.empty());
        assertEquals(180, orphan.offsetAt(2024, 7, 1, 12, 0, 0).totalMinutes());
        assertTrue(orphan.dstZone().isEmpty());
    }

    @Test
    @DisplayName("Unknown names resolve to empty")
    void testUnknownZone() {
        assertTrue(TimeZone.of("Atlantis/Capital", store).isEmpty());
        assertTrue(TimeZone.of(null, store).isEmpty());
        assertTrue(TimeZone.of("America/New_York").isPresent(), "process-wide database carries built-ins");
    }

    @Test
    @DisplayName("Equality covers name, offset and daylight-saving flag")
    void testEquality() {
        TimeZone fromStore = zone("America/New_York");
        TimeZone manual = TimeZone.of("America/New_York", new Offset(5, 0, -1), true, InMemoryZoneStore.empty());
        assertEquals(fromStore, manual);
        assertEquals(fromStore.hashCode(), manual.hashCode());
        assertNotEquals(fromStore, TimeZone.fixed("America/New_York", new Offset(5, 0, -1)));
        assertThrows(IllegalArgumentException.class, () -> TimeZone.fixed("  ", Offset.UTC));
    }

    @Test
    @DisplayName("isDaylightSaving and calendar-specific evaluation")
    void testIsDaylightSaving() {
        TimeZone newYork = zone("America/New_York");
        assertTrue(newYork.isDaylightSaving(2024, 7, 4, 12));
        assertFalse(newYork.isDaylightSaving(2024, 1, 4, 12));
        assertEquals(-240, newYork.offsetAt(2024, 7, 4, 12, 0, 0, Calendar.UTC).totalMinutes());
    }

    @ParameterizedTest
    @CsvSource({
            "3, 31, 1, -300",
            "3, 31, 2, -240",
            "11, 3, 1, -240",
            "11, 3, 2, -300"
    })
    @DisplayName("Rules from a custom store: last Sunday of March to first Sunday of November")
    void testCustomStoreRules(int month, int day, int hour, int expectedMinutes) {
        DstZone rules = new DstZone(
                new TransitionRule(3, 6, true, 0, 2),
                new TransitionRule(11, 6, false, 0, 2),
                new Offset(5, 0, -1));
        ZoneStore custom = InMemoryZoneStore.builder().addDst("Test/Custom", rules).build();
        TimeZone zone = TimeZone.of("Test/Custom", custom).orElseThrow();
        assertEquals(expectedMinutes, zone.offsetAt(2024, month, day, hour, 0, 0).totalMinutes());
    }
}
