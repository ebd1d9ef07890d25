package org.Aayush.tempo.zone;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.Aayush.tempo.calendar.Calendar;

import java.util.Objects;
import java.util.Optional;

/**
 * Named zone resolving civil timestamps to UTC offsets.
 * <p>
 * Contract summary:
 * </p>
 * <ul>
 * <li>Zones without daylight saving always report their static {@link #offset()}.</li>
 * <li>Daylight-saving zones read their {@link DstZone} from the bound {@link ZoneStore}; when
 * the store has no rules for the name the static offset is reported.</li>
 * <li>Transitions are evaluated in local wall time: an instant at or after the start
 * transition is in daylight saving, an instant at or after the end transition is not.</li>
 * <li>Equality covers name, static offset and the daylight-saving flag, not the store.</li>
 * </ul>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(onlyExplicitlyIncluded = true)
public final class TimeZone {
    private static final TimeZone UTC = new TimeZone("UTC", Offset.UTC, false, InMemoryZoneStore.empty());

    @EqualsAndHashCode.Include
    @ToString.Include
    private final String name;
    @EqualsAndHashCode.Include
    @ToString.Include
    private final Offset offset;
    @EqualsAndHashCode.Include
    @ToString.Include
    private final boolean hasDst;
    private final ZoneStore store;

    private TimeZone(String name, Offset offset, boolean hasDst, ZoneStore store) {
        String normalized = Objects.requireNonNull(name, "name").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("zone name must be non-blank");
        }
        this.name = normalized.intern();
        this.offset = Objects.requireNonNull(offset, "offset");
        this.hasDst = hasDst;
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Returns the UTC zone.
     */
    public static TimeZone utc() {
        return UTC;
    }

    /**
     * Creates a zone with a constant offset.
     */
    public static TimeZone fixed(String name, Offset offset) {
        return new TimeZone(name, offset, false, InMemoryZoneStore.empty());
    }

    /**
     * Creates a zone from explicit parts.
     *
     * @param hasDst whether to consult {@code store} for daylight-saving rules.
     */
    public static TimeZone of(String name, Offset offset, boolean hasDst, ZoneStore store) {
        return new TimeZone(name, offset, hasDst, store);
    }

    /**
     * Looks a zone up in the process-wide {@link ZoneDatabase}.
     */
    public static Optional<TimeZone> of(String name) {
        return of(name, ZoneDatabase.get());
    }

    /**
     * Looks a zone up in {@code store}.
     *
     * @return zone, or empty when the store does not know the name.
     */
    public static Optional<TimeZone> of(String name, ZoneStore store) {
        Objects.requireNonNull(store, "store");
        return store.record(name)
                .map(record -> new TimeZone(record.name(), record.offset(), record.hasDst(), store));
    }

    /**
     * Returns daylight-saving rules, empty for fixed zones and store misses.
     */
    public Optional<DstZone> dstZone() {
        return hasDst ? store.dstZone(name) : Optional.empty();
    }

    /**
     * Resolves the offset in effect at a local civil time on the Gregorian calendar.
     */
    public Offset offsetAt(int year, int month, int day, int hour, int minute, int second) {
        return offsetAt(year, month, day, hour, minute, second, Calendar.PYTHON);
    }

    /**
     * Resolves the offset in effect at a local civil time; {@code calendar} supplies the
     * weekdays and month lengths used to locate transition days.
     */
    public Offset offsetAt(int year, int month, int day, int hour, int minute, int second, Calendar calendar) {
        Objects.requireNonNull(calendar, "calendar");
        if (!hasDst) {
            return offset;
        }
        Optional<DstZone> dst = store.dstZone(name);
        if (dst.isEmpty()) {
            return offset;
        }
        DstZone zone = dst.get();
        return isDaylightSaving(zone, year, month, day, hour, calendar)
                ? zone.dstOffset()
                : zone.offset();
    }

    /**
     * Returns whether daylight saving is in effect at a local hour on the Gregorian calendar.
     */
    public boolean isDaylightSaving(int year, int month, int day, int hour) {
        return dstZone()
                .map(zone -> isDaylightSaving(zone, year, month, day, hour, Calendar.PYTHON))
                .orElse(false);
    }

    private static boolean isDaylightSaving(DstZone zone, int year, int month, int day, int hour, Calendar calendar) {
        TransitionRule start = zone.start();
        TransitionRule end = zone.end();
        if (month == start.month()) {
            return !isBefore(start, year, day, hour, calendar);
        }
        if (month == end.month()) {
            return isBefore(end, year, day, hour, calendar);
        }
        if (start.month() < end.month()) {
            return month > start.month() && month < end.month();
        }
        // Southern hemisphere: daylight saving spans the year boundary.
        return month > start.month() || month < end.month();
    }

    /**
     * Transitions fire on the hour, so minutes and seconds never decide the comparison.
     */
    private static boolean isBefore(TransitionRule rule, int year, int day, int hour, Calendar calendar) {
        int transitionDay = rule.transitionDay(year, calendar);
        if (transitionDay < 0) {
            return true;
        }
        if (day != transitionDay) {
            return day < transitionDay;
        }
        return hour < rule.hour();
    }
}
