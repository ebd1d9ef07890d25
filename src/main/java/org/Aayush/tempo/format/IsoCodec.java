package org.Aayush.tempo.format;

import lombok.experimental.UtilityClass;
import org.Aayush.tempo.core.time.TimeUtils;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Formats and parses {@link IsoFields} as ISO-8601 text.
 * <p>
 * Parsing checks syntax and per-field ranges only (month 1-12, day 1-35, hour 0-23,
 * minute 0-59, second 0-60, offset up to 15:45). Calendar-specific validity is the caller's
 * concern. Every failure is reported as an empty result.
 * </p>
 */
@UtilityClass
public class IsoCodec {
    private static final int MAX_DAY = 35;
    private static final int MAX_SECOND = 60;
    private static final int MAX_OFFSET_MINUTES = 15 * 60 + 45;

    /**
     * Formats fields; empty when a field does not fit the layout (year outside 0..9999 or a
     * negative field).
     */
    public Optional<String> format(IsoFields fields, IsoFormat format) {
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(format, "format");
        if (fields.year() < 0 || fields.year() > 9999 || fields.month() < 0 || fields.day() < 0
                || fields.hour() < 0 || fields.minute() < 0 || fields.second() < 0) {
            return Optional.empty();
        }
        String text;
        if (format.hasDate() && format.hasTime()) {
            text = String.format(Locale.ROOT, format.template(), fields.year(), fields.month(), fields.day(),
                    fields.hour(), fields.minute(), fields.second());
        } else if (format.hasDate()) {
            text = String.format(Locale.ROOT, format.template(), fields.year(), fields.month(), fields.day());
        } else {
            text = String.format(Locale.ROOT, format.template(), fields.hour(), fields.minute(), fields.second());
        }
        if (format.hasOffset()) {
            int offset = fields.hasOffset() ? fields.offsetMinutes() : 0;
            text += offset == 0 ? "Z" : TimeUtils.formatOffset(offset);
        }
        return Optional.of(text);
    }

    /**
     * Parses text in the given layout.
     */
    public Optional<IsoFields> parse(String text, IsoFormat format) {
        Objects.requireNonNull(format, "format");
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = format.pattern().matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        IsoFields.IsoFieldsBuilder builder = IsoFields.builder();
        int group = 1;
        if (format.hasDate()) {
            int month = Integer.parseInt(matcher.group(group + 1));
            int day = Integer.parseInt(matcher.group(group + 2));
            if (month < 1 || month > 12 || day < 1 || day > MAX_DAY) {
                return Optional.empty();
            }
            builder.year(Integer.parseInt(matcher.group(group))).month(month).day(day);
            group += 3;
        }
        if (format.hasTime()) {
            int hour = Integer.parseInt(matcher.group(group));
            int minute = Integer.parseInt(matcher.group(group + 1));
            int second = Integer.parseInt(matcher.group(group + 2));
            if (hour > 23 || minute > 59 || second > MAX_SECOND) {
                return Optional.empty();
            }
            builder.hour(hour).minute(minute).second(second);
            group += 3;
        }
        if (format.hasOffset()) {
            Optional<Integer> offset = parseOffset(matcher.group(group));
            if (offset.isEmpty()) {
                return Optional.empty();
            }
            builder.offsetMinutes(offset.get()).hasOffset(true);
        }
        return Optional.of(builder.build());
    }

    /**
     * Tries every layout in declaration order.
     */
    public Optional<IsoFields> parseAny(String text) {
        for (IsoFormat format : IsoFormat.values()) {
            Optional<IsoFields> parsed = parse(text, format);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private Optional<Integer> parseOffset(String designator) {
        if ("Z".equals(designator)) {
            return Optional.of(0);
        }
        int sign = designator.charAt(0) == '-' ? -1 : 1;
        int hours = Integer.parseInt(designator.substring(1, 3));
        int minutes = Integer.parseInt(designator.substring(4, 6));
        if (minutes > 59) {
            return Optional.empty();
        }
        int total = hours * 60 + minutes;
        if (total > MAX_OFFSET_MINUTES) {
            return Optional.empty();
        }
        return Optional.of(sign * total);
    }
}
