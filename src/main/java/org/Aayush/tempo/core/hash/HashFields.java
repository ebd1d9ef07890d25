package org.Aayush.tempo.core.hash;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Immutable civil-time tuple consumed and produced by {@link CalendarHash} layouts.
 *
 * <p>Fields are plain integers; range checks are the caller's concern because packing
 * truncates silently.</p>
 */
@Value
@Builder(toBuilder = true)
@Accessors(fluent = true)
public class HashFields {
    int year;
    int month;
    int day;
    int hour;
    int minute;
    int second;
    int millisecond;
    int microsecond;

    /**
     * Creates a full tuple.
     */
    public static HashFields of(
            int year,
            int month,
            int day,
            int hour,
            int minute,
            int second,
            int millisecond,
            int microsecond
    ) {
        return new HashFields(year, month, day, hour, minute, second, millisecond, microsecond);
    }

    /**
     * Creates a tuple with zero sub-second fields.
     */
    public static HashFields of(int year, int month, int day, int hour, int minute, int second) {
        return new HashFields(year, month, day, hour, minute, second, 0, 0);
    }

    /**
     * Returns the value of one field.
     */
    public int get(HashField field) {
        return switch (field) {
            case YEAR -> year;
            case MONTH -> month;
            case DAY -> day;
            case HOUR -> hour;
            case MINUTE -> minute;
            case SECOND -> second;
            case MILLISECOND -> millisecond;
            case MICROSECOND -> microsecond;
        };
    }
}
