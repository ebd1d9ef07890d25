package org.Aayush.tempo.calendar;

/**
 * Closed set of calendar rule variants understood by {@link Calendar}.
 *
 * <p>Adding a variant means adding a constant here; every {@code switch} in
 * {@link Calendar} then fails to compile until the variant is handled.</p>
 */
public enum CalendarKind {
    /** Proleptic Gregorian calendar with leap days and a leap-second table. */
    GREGORIAN,
    /** 365-day years, 30-day months, no leap handling. */
    FAST_UTC
}
