package org.Aayush.tempo.format;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Fields read from or written to ISO-8601 text. Fields absent from a layout are zero.
 */
@Value
@Builder(toBuilder = true)
@Accessors(fluent = true)
public class IsoFields {
    int year;
    int month;
    int day;
    int hour;
    int minute;
    int second;
    /** Signed UTC offset in minutes; meaningful only when {@link #hasOffset()} is set. */
    int offsetMinutes;
    boolean hasOffset;

    /**
     * Returns date-time fields without an offset.
     */
    public static IsoFields of(int year, int month, int day, int hour, int minute, int second) {
        return IsoFields.builder()
                .year(year)
                .month(month)
                .day(day)
                .hour(hour)
                .minute(minute)
                .second(second)
                .build();
    }
}
