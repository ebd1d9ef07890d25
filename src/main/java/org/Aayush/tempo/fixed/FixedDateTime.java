package org.Aayush.tempo.fixed;

import org.Aayush.tempo.core.hash.CalendarHash;
import org.Aayush.tempo.core.hash.HashField;
import org.Aayush.tempo.core.time.TimeUtils;
import org.Aayush.tempo.format.IsoCodec;
import org.Aayush.tempo.format.IsoFields;
import org.Aayush.tempo.format.IsoFormat;

import java.util.Optional;

/**
 * Fixed-resolution date-time on {@link org.Aayush.tempo.calendar.Calendar#UTC_FAST}: one
 * unsigned tick counter from the 1970 epoch plus a cached packed hash of its fields.
 * <p>
 * Contract summary:
 * </p>
 * <ul>
 * <li>Field accessors read the cached hash only, never the counter.</li>
 * <li>Arithmetic changes the counter only, wraps silently at the counter width and leaves the
 * hash as it was.</li>
 * <li>{@code withX} changes hash bits only and leaves the counter as it was.</li>
 * <li>Either kind of change sets {@link #isHashStale()}; {@link #refreshHash()} rebuilds the
 * hash from the counter and {@link #refreshCounter()} rebuilds the counter from the hash.</li>
 * <li>Instances are mutable and must not be shared between threads without external
 * synchronization.</li>
 * </ul>
 */
public interface FixedDateTime {

    /**
     * Returns the hash layout of this width.
     */
    CalendarHash layout();

    /**
     * Returns the resolution of one counter tick.
     */
    TimeUtils.TickUnit unit();

    /**
     * Returns the counter widened without sign extension.
     */
    long unsignedCounter();

    /**
     * Returns the cached hash in the low {@link CalendarHash#width()} bits.
     */
    long hash();

    /**
     * Returns whether the counter or the hash changed since they last agreed.
     */
    boolean isHashStale();

    /**
     * Rebuilds the hash from the counter.
     */
    void refreshHash();

    /**
     * Rebuilds the counter from the hash.
     */
    void refreshCounter();

    /**
     * Returns the hashed year; widths without a year report the epoch year.
     */
    default int year() {
        return layout().supports(HashField.YEAR) ? layout().field(hash(), HashField.YEAR) : FixedConversions.EPOCH_YEAR;
    }

    default int month() {
        return layout().field(hash(), HashField.MONTH);
    }

    /**
     * Returns the hashed day of month; {@code 0} for the 8-bit width, whose day field holds a weekday.
     */
    default int day() {
        return layout() == CalendarHash.UINT8 ? 0 : layout().field(hash(), HashField.DAY);
    }

    default int hour() {
        return layout().field(hash(), HashField.HOUR);
    }

    default int minute() {
        return layout().field(hash(), HashField.MINUTE);
    }

    default int second() {
        return layout().field(hash(), HashField.SECOND);
    }

    default int millisecond() {
        return layout().field(hash(), HashField.MILLISECOND);
    }

    /**
     * Returns the hashed day of week, Monday = 0.
     */
    default int dayOfWeek() {
        if (layout() == CalendarHash.UINT8) {
            return layout().field(hash(), HashField.DAY);
        }
        return FixedConversions.CALENDAR.dayOfWeek(year(), month(), day());
    }

    /**
     * Formats the hashed fields; empty when the layout lacks the date the format needs.
     */
    default Optional<String> toIso(IsoFormat format) {
        if (format.hasDate() && !layout().supports(HashField.MONTH)) {
            return Optional.empty();
        }
        return IsoCodec.format(IsoFields.of(year(), month(), day(), hour(), minute(), second()), format);
    }
}
