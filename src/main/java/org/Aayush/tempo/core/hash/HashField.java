package org.Aayush.tempo.core.hash;

/**
 * Civil-time fields addressable inside a packed calendar hash, most significant first.
 */
public enum HashField {
    YEAR,
    MONTH,
    DAY,
    HOUR,
    MINUTE,
    SECOND,
    MILLISECOND,
    MICROSECOND
}
