package org.Aayush.tempo.date;

import org.Aayush.tempo.calendar.Calendar;
import org.Aayush.tempo.core.hash.CalendarHash;
import org.Aayush.tempo.format.IsoFormat;
import org.Aayush.tempo.zone.DstZone;
import org.Aayush.tempo.zone.InMemoryZoneStore;
import org.Aayush.tempo.zone.Offset;
import org.Aayush.tempo.zone.TimeZone;
import org.Aayush.tempo.zone.TransitionRule;
import org.Aayush.tempo.zone.ZoneStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Calendar Date-Time Tests")
class CalendarDateTimeTest {

    private static final TimeZone PLUS_ONE = TimeZone.fixed("Test/Plus1", new Offset(1, 0, 1));

    private static CalendarDateTime utc(int y, int mo, int d, int h, int mi, int s, int ms, int us, int ns) {
        return CalendarDateTime.of(y, mo, d, h, mi, s, ms, us, ns, TimeZone.utc(), Calendar.PYTHON);
    }

    private static TimeZone newYork() {
        return TimeZone.of("America/New_York").orElseThrow();
    }

    // ========== Normalizing Arithmetic ==========

    @Test
    @DisplayName("A nanosecond overflow cascades into a year rollover")
    void testNanosecondCascade() {
        CalendarDateTime last = utc(2024, 12, 31, 23, 59, 59, 999, 999, 999);
        assertEquals(utc(2025, 1, 1, 0, 0, 0, 0, 0, 0), last.addNanos(1));
        assertEquals(last, utc(2025, 1, 1, 0, 0, 0, 0, 0, 0).addNanos(-1));
    }

    @Test
    @DisplayName("Mixed amounts normalize in one call")
    void testMixedAmount() {
        DateTimeAmount amount = DateTimeAmount.builder()
                .months(1)
                .hours(25)
                .minutes(61)
                .milliseconds(1_500)
                .build();
        CalendarDateTime start = CalendarDateTime.of(2024, 1, 31, 12, 0, 0);
        assertEquals(utc(2024, 3, 3, 14, 1, 1, 500, 0, 0), start.add(amount));
        assertEquals(utc(2024, 3, 2, 12, 0, 0, 0, 0, 0), start.add(amount).subtract(amount.toBuilder().months(0).build()));
    }

    @Test
    @DisplayName("Unit helpers and zero amounts")
    void testUnitHelpers() {
        CalendarDateTime start = CalendarDateTime.of(2024, 2, 28, 23, 0, 0);
        assertEquals(CalendarDateTime.of(2024, 2, 29, 0, 0, 0), start.addHours(1));
        assertEquals(CalendarDateTime.of(2024, 3, 1, 0, 0, 0), start.addMinutes(25 * 60));
        assertEquals(CalendarDateTime.of(2024, 2, 28, 22, 59, 59), start.addSeconds(-1));
        assertEquals(CalendarDateTime.of(2025, 2, 28, 23, 0, 0), start.addYears(1));
        assertSame(start, start.add(DateTimeAmount.ZERO));
    }

    @Test
    @DisplayName("Years wrap into the calendar's range")
    void testYearWrap() {
        assertEquals(CalendarDateTime.of(1, 1, 1, 0, 0, 0), CalendarDateTime.of(9999, 12, 31, 23, 59, 59).addSeconds(1));
    }

    // ========== Construction and Replacement ==========

    @Test
    @DisplayName("Construction validates every field and accepts real leap seconds")
    void testConstruction() {
        assertThrows(IllegalArgumentException.class, () -> CalendarDateTime.of(2024, 1, 1, 24, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> CalendarDateTime.of(2024, 1, 1, 23, 59, 60));
        assertThrows(IllegalArgumentException.class, () -> utc(2024, 1, 1, 0, 0, 0, 0, 0, 1_000));
        CalendarDateTime leap = CalendarDateTime.of(2016, 12, 31, 23, 59, 60);
        assertTrue(leap.isLeapSecond());
        assertEquals(60, leap.second());
    }

    @Test
    @DisplayName("withX replaces one field and validates")
    void testWithFields() {
        CalendarDateTime value = utc(2024, 2, 29, 12, 30, 15, 1, 2, 3);
        assertEquals(utc(2024, 2, 29, 12, 30, 15, 1, 2, 9), value.withNanosecond(9));
        assertEquals(utc(2024, 2, 29, 7, 30, 15, 1, 2, 3), value.withHour(7));
        assertEquals(value, value.withYear(2000).withYear(2024));
        assertThrows(IllegalArgumentException.class, () -> value.withYear(2023));
        assertThrows(IllegalArgumentException.class, () -> value.withSecond(60));
    }

    @Test
    @DisplayName("withCalendar keeps days from the epoch and time of day")
    void testWithCalendar() {
        CalendarDateTime value = CalendarDateTime.of(2024, 1, 25, 12, 30, 0, TimeZone.utc(), Calendar.UTC);
        CalendarDateTime fast = value.withCalendar(Calendar.UTC_FAST);
        assertEquals(CalendarDateTime.of(2024, 2, 8, 12, 30, 0, TimeZone.utc(), Calendar.UTC_FAST), fast);
        assertSame(value, value.withCalendar(Calendar.UTC));
    }

    // ========== UTC Conversion ==========

    @Test
    @DisplayName("toUtc and fromUtc across daylight saving")
    void testUtcRoundTrip() {
        CalendarDateTime summer = CalendarDateTime.of(2024, 7, 4, 12, 0, 0, newYork(), Calendar.PYTHON);
        CalendarDateTime summerUtc = summer.toUtc();
        assertEquals(CalendarDateTime.of(2024, 7, 4, 16, 0, 0), summerUtc);
        assertEquals(summer, summerUtc.fromUtc(newYork()));

        CalendarDateTime winter = CalendarDateTime.of(2024, 1, 4, 22, 0, 0, newYork(), Calendar.PYTHON);
        assertEquals(CalendarDateTime.of(2024, 1, 5, 3, 0, 0), winter.toUtc());
        assertEquals(winter, winter.toUtc().fromUtc(newYork()));
    }

    @Test
    @DisplayName("Conversions agree with java.time away from the leap-second boundary")
    void testAgreesWithJavaTime() {
        LocalDateTime local = LocalDateTime.of(2024, 11, 10, 8, 45);
        LocalDateTime expected = local.atZone(java.time.ZoneId.of("America/New_York"))
                .withZoneSameInstant(ZoneOffset.UTC)
                .toLocalDateTime();
        CalendarDateTime converted = CalendarDateTime.of(2024, 11, 10, 8, 45, 0, newYork(), Calendar.PYTHON).toUtc();
        assertEquals(expected.getHour(), converted.hour());
        assertEquals(expected.getDayOfMonth(), converted.day());
    }

    @Test
    @DisplayName("Crossing the leap-second era boundary applies the correction")
    void testLeapSecondCorrection() {
        CalendarDateTime local = CalendarDateTime.of(1972, 1, 1, 0, 30, 0, PLUS_ONE, Calendar.UTC);
        assertEquals(CalendarDateTime.of(1971, 12, 31, 23, 30, 27, TimeZone.utc(), Calendar.UTC), local.toUtc());
    }

    @Test
    @DisplayName("A leap second survives conversion in UTC")
    void testLeapSecondPreserved() {
        CalendarDateTime leap = CalendarDateTime.of(2016, 12, 31, 23, 59, 60);
        assertSame(leap, leap.toUtc());
        assertTrue(leap.fromUtc(TimeZone.utc()).isLeapSecond());
    }

    // ========== Deltas ==========

    @Test
    @DisplayName("Short deltas need no anchoring")
    void testShortDelta() {
        CalendarDateTime later = utc(2024, 1, 25, 0, 0, 1, 0, 0, 5);
        CalendarDateTime earlier = utc(2024, 1, 25, 0, 0, 0, 0, 0, 0);
        NanosDelta delta = later.deltaNanos(earlier);
        assertFalse(delta.isAnchored());
        assertEquals(1, delta.sign());
        assertEquals(BigInteger.valueOf(1_000_000_005L), delta.totalNanos());
        assertEquals(Duration.ofSeconds(1, 5), delta.toDuration());
        assertEquals(BigInteger.valueOf(-1_000_000_005L), earlier.deltaNanos(later).totalNanos());
    }

    @Test
    @DisplayName("Zones are applied before measuring")
    void testDeltaAcrossZones() {
        CalendarDateTime newYorkNoon = CalendarDateTime.of(2024, 7, 4, 12, 0, 0, newYork(), Calendar.PYTHON);
        CalendarDateTime utcNoon = CalendarDateTime.of(2024, 7, 4, 12, 0, 0);
        assertEquals(Duration.ofHours(4), newYorkNoon.deltaNanos(utcNoon).toDuration());
    }

    @Test
    @DisplayName("600 years apart: anchored, finite and sign-correct")
    void testSixHundredYearDelta() {
        CalendarDateTime early = CalendarDateTime.of(1900, 1, 1, 0, 0, 0);
        CalendarDateTime late = CalendarDateTime.of(2500, 6, 15, 12, 0, 0);
        long civilSeconds = ChronoUnit.SECONDS.between(
                LocalDateTime.of(1900, 1, 1, 0, 0), LocalDateTime.of(2500, 6, 15, 12, 0));
        BigInteger expected = BigInteger.valueOf(civilSeconds + 27).multiply(BigInteger.valueOf(1_000_000_000L));

        NanosDelta forward = late.deltaNanos(early);
        assertTrue(forward.isAnchored());
        assertEquals(400, forward.overflowYears());
        assertEquals(1, forward.sign());
        assertEquals(expected, forward.totalNanos());

        NanosDelta backward = early.deltaNanos(late);
        assertEquals(-1, backward.sign());
        assertEquals(expected.negate(), backward.totalNanos());
    }

    @Test
    @DisplayName("Deltas beyond two anchor cycles stay exact")
    void testLongestDelta() {
        CalendarDateTime first = CalendarDateTime.of(1, 1, 1, 0, 0, 0);
        CalendarDateTime last = CalendarDateTime.of(9999, 12, 31, 23, 59, 59);
        NanosDelta delta = last.deltaNanos(first);
        long civilSeconds = ChronoUnit.SECONDS.between(
                LocalDateTime.of(1, 1, 1, 0, 0), LocalDateTime.of(9999, 12, 31, 23, 59, 59));
        assertEquals(0, delta.overflowYears() % 400);
        assertEquals(BigInteger.valueOf(civilSeconds + 27).multiply(BigInteger.valueOf(1_000_000_000L)),
                delta.totalNanos());
    }

    @Test
    @DisplayName("An eastern zone on the Unix epoch day measures before the epoch")
    void testDeltaBeforeCalendarEpoch() {
        TimeZone plusFive = TimeZone.fixed("Test/Plus5", new Offset(5, 0, 1));
        CalendarDateTime east = CalendarDateTime.of(1970, 1, 1, 2, 0, 0, plusFive, Calendar.UTC);
        CalendarDateTime epoch = CalendarDateTime.of(1970, 1, 1, 0, 0, 0, TimeZone.utc(), Calendar.UTC);

        NanosDelta backward = east.deltaNanos(epoch);
        assertEquals(-1, backward.sign());
        assertFalse(backward.isAnchored());
        assertEquals(Duration.ofHours(-3), backward.toDuration());
        assertEquals(Duration.ofHours(3), epoch.deltaNanos(east).toDuration());
        assertTrue(east.compareTo(epoch) < 0);
        assertTrue(epoch.compareTo(east) > 0);
    }

    @Test
    @DisplayName("An eastern zone on the first day of year 1 stays exact")
    void testDeltaBeforeYearOne() {
        TimeZone plusFive = TimeZone.fixed("Test/Plus5", new Offset(5, 0, 1));
        CalendarDateTime east = CalendarDateTime.of(1, 1, 1, 2, 0, 0, plusFive, Calendar.PYTHON);
        CalendarDateTime midnight = CalendarDateTime.of(1, 1, 1, 0, 0, 0);
        assertEquals(Duration.ofHours(-3), east.deltaNanos(midnight).toDuration());
        assertTrue(east.compareTo(midnight) < 0);
    }

    // ========== Factories, Queries and Text ==========

    @Test
    @DisplayName("Unix factories apply the target zone")
    void testUnixFactories() {
        assertEquals(CalendarDateTime.of(2024, 1, 25, 0, 0, 0),
                CalendarDateTime.fromUnixEpoch(1_706_140_800L, TimeZone.utc(), Calendar.PYTHON));
        assertEquals(CalendarDateTime.of(2024, 1, 24, 19, 0, 0, newYork(), Calendar.PYTHON),
                CalendarDateTime.fromUnixEpoch(1_706_140_800L, newYork(), Calendar.PYTHON));
        assertEquals(utc(1969, 12, 31, 23, 59, 59, 999, 0, 0),
                CalendarDateTime.fromUnixMillis(-1L, TimeZone.utc(), Calendar.PYTHON));
        Clock clock = Clock.fixed(Instant.parse("2024-01-25T10:15:30.250Z"), ZoneOffset.UTC);
        assertEquals(utc(2024, 1, 25, 10, 15, 30, 250, 0, 0), CalendarDateTime.now(clock, TimeZone.utc(), Calendar.PYTHON));
    }

    @Test
    @DisplayName("Epoch counters")
    void testEpochCounters() {
        CalendarDateTime value = CalendarDateTime.of(2024, 1, 25, 0, 0, 1, 2, 0, 0, TimeZone.utc(), Calendar.UTC);
        assertEquals(19_747L, value.daysSinceEpoch());
        assertEquals(19_747L * 86_400L + 27L + 1L, value.secondsSinceEpoch());
        assertEquals((19_747L * 86_400L + 28L) * 1_000L + 2L, value.millisSinceEpoch());
        assertEquals(((19_747L * 86_400L + 28L) * 1_000L + 2L) * 1_000_000L, value.nanosSinceEpoch());
        assertEquals(3, value.dayOfWeek());
        assertEquals(25, value.dayOfYear());
    }

    @Test
    @DisplayName("Hash round trip keeps fields down to microseconds")
    void testHash() {
        CalendarDateTime value = utc(2024, 7, 4, 13, 45, 30, 123, 456, 0);
        assertEquals(value, CalendarDateTime.fromHash(CalendarHash.UINT64, value.hash(CalendarHash.UINT64),
                TimeZone.utc(), Calendar.PYTHON));
        assertThrows(IllegalArgumentException.class,
                () -> CalendarDateTime.fromHash(CalendarHash.UINT8, 0L, TimeZone.utc(), Calendar.PYTHON));
    }

    @Test
    @DisplayName("ISO text with offsets")
    void testIso() {
        CalendarDateTime summer = CalendarDateTime.of(2024, 7, 4, 12, 0, 0, newYork(), Calendar.PYTHON);
        assertEquals("2024-07-04T12:00:00", summer.toIso());
        assertEquals("2024-07-04T12:00:00-04:00", summer.toIso(IsoFormat.EXTENDED_OFFSET).orElseThrow());
        assertEquals("2024-07-04T12:00:00Z",
                CalendarDateTime.of(2024, 7, 4, 12, 0, 0).toIso(IsoFormat.EXTENDED_OFFSET).orElseThrow());

        CalendarDateTime parsed = CalendarDateTime.fromIso(
                "2024-01-31T23:59:58+05:30", IsoFormat.EXTENDED_OFFSET, TimeZone.utc(), Calendar.PYTHON).orElseThrow();
        assertEquals("+05:30", parsed.timeZone().name());
        assertEquals(CalendarDateTime.of(2024, 1, 31, 18, 29, 58), parsed.toUtc());
        assertTrue(CalendarDateTime.fromIso(
                "2024-01-31T23:59:58+05:20", IsoFormat.EXTENDED_OFFSET, TimeZone.utc(), Calendar.PYTHON).isEmpty());
        assertTrue(CalendarDateTime.fromIso(
                "2024-01-31T23:59:60", IsoFormat.EXTENDED, TimeZone.utc(), Calendar.PYTHON).isEmpty());

        CalendarDateTime timeOnly = CalendarDateTime.fromIso(
                "12:34:56", IsoFormat.TIME, TimeZone.utc(), Calendar.UTC).orElseThrow();
        assertEquals(CalendarDateTime.of(1970, 1, 1, 12, 34, 56, TimeZone.utc(), Calendar.UTC), timeOnly);
    }

    @Test
    @DisplayName("DateTimeFormatter bridge")
    void testFormatter() {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss.SSSSSSSSS");
        CalendarDateTime value = utc(2024, 1, 25, 8, 5, 3, 1, 2, 3);
        assertEquals("2024/01/25 08:05:03.001002003", value.format(formatter).orElseThrow());
        assertEquals(value, CalendarDateTime.parse("2024/01/25 08:05:03.001002003", formatter,
                TimeZone.utc(), Calendar.PYTHON).orElseThrow());
        assertTrue(CalendarDateTime.of(2016, 12, 31, 23, 59, 60).format(formatter).isEmpty());
        assertTrue(CalendarDateTime.parse("nope", formatter, TimeZone.utc(), Calendar.PYTHON).isEmpty());
    }

    @Test
    @DisplayName("Ordering by instant, then fields, then binding")
    void testCompareTo() {
        CalendarDateTime newYorkNoon = CalendarDateTime.of(2024, 7, 4, 12, 0, 0, newYork(), Calendar.PYTHON);
        CalendarDateTime utcThreePm = CalendarDateTime.of(2024, 7, 4, 15, 0, 0);
        assertTrue(newYorkNoon.compareTo(utcThreePm) > 0);
        CalendarDateTime sameInstant = CalendarDateTime.of(2024, 7, 4, 16, 0, 0);
        assertNotEquals(0, newYorkNoon.compareTo(sameInstant));
        assertNotEquals(newYorkNoon, sameInstant);
        assertEquals(0, utcThreePm.compareTo(CalendarDateTime.of(2024, 7, 4, 15, 0, 0)));
    }

    @Test
    @DisplayName("Zones sharing a name break ties on offset and daylight-saving flag")
    void testCompareToSameZoneName() {
        CalendarDateTime fixed = CalendarDateTime.of(2024, 7, 4, 12, 0, 0,
                TimeZone.fixed("Test/Shared", new Offset(1, 0, 1)), Calendar.PYTHON);
        CalendarDateTime flagged = CalendarDateTime.of(2024, 7, 4, 12, 0, 0,
                TimeZone.of("Test/Shared", new Offset(1, 0, 1), true, InMemoryZoneStore.empty()), Calendar.PYTHON);
        assertNotEquals(fixed, flagged);
        assertNotEquals(0, fixed.compareTo(flagged));
        assertEquals(-Integer.signum(fixed.compareTo(flagged)), Integer.signum(flagged.compareTo(fixed)));

        DstZone summerPlusOne = new DstZone(
                new TransitionRule(3, 6, true, 0, 2), new TransitionRule(10, 6, true, 0, 3), new Offset(1, 0, 1));
        ZoneStore store = InMemoryZoneStore.builder().addDst("Test/Shared", summerPlusOne).build();
        CalendarDateTime summer = CalendarDateTime.of(2024, 7, 4, 12, 0, 0,
                TimeZone.of("Test/Shared", store).orElseThrow(), Calendar.PYTHON);
        CalendarDateTime fixedPlusTwo = CalendarDateTime.of(2024, 7, 4, 12, 0, 0,
                TimeZone.fixed("Test/Shared", new Offset(2, 0, 1)), Calendar.PYTHON);
        assertEquals(Duration.ZERO, summer.deltaNanos(fixedPlusTwo).toDuration());
        assertNotEquals(summer, fixedPlusTwo);
        assertNotEquals(0, summer.compareTo(fixedPlusTwo));
    }
}
