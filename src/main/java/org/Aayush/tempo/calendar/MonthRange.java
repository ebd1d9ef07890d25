package org.Aayush.tempo.calendar;

/**
 * Weekday of the first day of a month and the number of days in it.
 *
 * @param firstDayOfWeek weekday of day 1, Monday = 0.
 * @param daysInMonth month length.
 */
public record MonthRange(int firstDayOfWeek, int daysInMonth) {
}
