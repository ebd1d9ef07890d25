package org.Aayush.tempo.format;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.regex.Pattern;

/**
 * Supported ISO-8601 text layouts.
 */
@Getter
@Accessors(fluent = true)
public enum IsoFormat {
    /** {@code 20240131235959}. */
    BASIC("%04d%02d%02d%02d%02d%02d", "(\\d{4})(\\d{2})(\\d{2})(\\d{2})(\\d{2})(\\d{2})", true, true, false),
    /** {@code 2024-01-31T23:59:59}. */
    EXTENDED("%04d-%02d-%02dT%02d:%02d:%02d",
            "(\\d{4})-(\\d{2})-(\\d{2})T(\\d{2}):(\\d{2}):(\\d{2})", true, true, false),
    /** {@code 2024-01-31 23:59:59}. */
    EXTENDED_SPACED("%04d-%02d-%02d %02d:%02d:%02d",
            "(\\d{4})-(\\d{2})-(\\d{2}) (\\d{2}):(\\d{2}):(\\d{2})", true, true, false),
    /** {@code 2024-01-31T23:59:59+05:30}, or {@code Z} for UTC. */
    EXTENDED_OFFSET("%04d-%02d-%02dT%02d:%02d:%02d",
            "(\\d{4})-(\\d{2})-(\\d{2})T(\\d{2}):(\\d{2}):(\\d{2})(Z|[+-]\\d{2}:\\d{2})", true, true, true),
    /** {@code 2024-01-31}. */
    DATE("%04d-%02d-%02d", "(\\d{4})-(\\d{2})-(\\d{2})", true, false, false),
    /** {@code 23:59:59}. */
    TIME("%02d:%02d:%02d", "(\\d{2}):(\\d{2}):(\\d{2})", false, true, false),
    /** {@code 235959}. */
    BASIC_TIME("%02d%02d%02d", "(\\d{2})(\\d{2})(\\d{2})", false, true, false);

    /** Layout used when callers do not pick one. */
    public static final IsoFormat DEFAULT = EXTENDED;

    private final String template;
    private final Pattern pattern;
    private final boolean hasDate;
    private final boolean hasTime;
    private final boolean hasOffset;

    IsoFormat(String template, String regex, boolean hasDate, boolean hasTime, boolean hasOffset) {
        this.template = template;
        this.pattern = Pattern.compile(regex);
        this.hasDate = hasDate;
        this.hasTime = hasTime;
        this.hasOffset = hasOffset;
    }
}
