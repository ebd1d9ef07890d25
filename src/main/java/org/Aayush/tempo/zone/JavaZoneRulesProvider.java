package org.Aayush.tempo.zone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.zone.ZoneOffsetTransitionRule;
import java.time.zone.ZoneRules;
import java.time.zone.ZoneRulesException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Derives zone records from the JDK's bundled tz database.
 * <p>
 * Only the current recurring rules are read. A zone is skipped when those rules do not fit
 * the packed format:
 * </p>
 * <ul>
 * <li>more or fewer than two recurring transitions,</li>
 * <li>a daylight-saving shift other than one hour, or 30 minutes / two hours for irregular zones,</li>
 * <li>a transition that is not the first or second (or last or second-to-last) weekday of a month;
 * an on-or-after day six days before the month's end counts as the last weekday,</li>
 * <li>a wall-clock transition hour outside 20:00-03:00 or not on the hour.</li>
 * </ul>
 * Zones without recurring rules become fixed zones at their standard offset at the
 * reference instant.
 */
public final class JavaZoneRulesProvider implements ZoneRecordProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(JavaZoneRulesProvider.class);

    /** Reference instant used when the caller does not pick one. */
    public static final Instant DEFAULT_REFERENCE_INSTANT = Instant.parse("2024-01-01T00:00:00Z");

    private static final int ONE_HOUR_SECONDS = 3_600;
    private static final int HALF_HOUR_SECONDS = 1_800;
    private static final int TWO_HOURS_SECONDS = 7_200;
    private static final int MAX_OFFSET_HOURS = 15;
    private static final LocalDate REFERENCE_DATE = LocalDate.of(2001, 6, 15);

    private final Instant referenceInstant;

    /**
     * Creates a provider reading standard offsets at {@link #DEFAULT_REFERENCE_INSTANT}.
     */
    public JavaZoneRulesProvider() {
        this(DEFAULT_REFERENCE_INSTANT);
    }

    /**
     * Creates a provider reading standard offsets at {@code referenceInstant}.
     */
    public JavaZoneRulesProvider(Instant referenceInstant) {
        this.referenceInstant = Objects.requireNonNull(referenceInstant, "referenceInstant");
    }

    @Override
    public Set<String> zoneNames() {
        return ZoneId.getAvailableZoneIds();
    }

    @Override
    public Optional<ZoneRecord> lookup(String zoneName) {
        if (zoneName == null || zoneName.isBlank()) {
            return Optional.empty();
        }
        ZoneRules rules;
        try {
            rules = ZoneId.of(zoneName).getRules();
        } catch (ZoneRulesException e) {
            LOGGER.debug("Unknown zone {}: {}", zoneName, e.getMessage());
            return Optional.empty();
        } catch (DateTimeException e) {
            LOGGER.debug("Invalid zone id {}: {}", zoneName, e.getMessage());
            return Optional.empty();
        }

        List<ZoneOffsetTransitionRule> transitionRules = rules.getTransitionRules();
        if (transitionRules.isEmpty()) {
            ZoneOffset standard = rules.getStandardOffset(referenceInstant);
            return toOffset(standard, false)
                    .map(offset -> ZoneRecord.fixed(zoneName, offset))
                    .or(() -> skip(zoneName, "standard offset " + standard + " is not encodable"));
        }
        if (transitionRules.size() != 2) {
            return skip(zoneName, transitionRules.size() + " recurring transitions");
        }
        return toDstRecord(zoneName, transitionRules.get(0), transitionRules.get(1));
    }

    private Optional<ZoneRecord> toDstRecord(
            String zoneName,
            ZoneOffsetTransitionRule first,
            ZoneOffsetTransitionRule second
    ) {
        boolean firstIsStart = first.getOffsetAfter().getTotalSeconds() > first.getOffsetBefore().getTotalSeconds();
        ZoneOffsetTransitionRule start = firstIsStart ? first : second;
        ZoneOffsetTransitionRule end = firstIsStart ? second : first;

        ZoneOffset standard = start.getStandardOffset();
        if (!standard.equals(start.getOffsetBefore()) || !standard.equals(end.getOffsetAfter())) {
            return skip(zoneName, "daylight saving is not expressed against the standard offset");
        }
        int shiftSeconds = start.getOffsetAfter().getTotalSeconds() - standard.getTotalSeconds();
        boolean irregular;
        if (shiftSeconds == ONE_HOUR_SECONDS) {
            irregular = false;
        } else if (shiftSeconds == HALF_HOUR_SECONDS && standard.getTotalSeconds() % ONE_HOUR_SECONDS != 0) {
            irregular = true;
        } else if (shiftSeconds == TWO_HOURS_SECONDS && standard.getTotalSeconds() % ONE_HOUR_SECONDS == 0) {
            irregular = true;
        } else {
            return skip(zoneName, "daylight saving shift of " + shiftSeconds + "s");
        }

        Optional<Offset> offset = toOffset(standard, irregular);
        Optional<TransitionRule> startRule = toTransitionRule(start);
        Optional<TransitionRule> endRule = toTransitionRule(end);
        if (offset.isEmpty() || startRule.isEmpty() || endRule.isEmpty()) {
            return skip(zoneName, "transition rules are not encodable");
        }
        if (!DstZone.supportsStandardOffset(offset.get())) {
            return skip(zoneName, "daylight saving offset is not encodable");
        }
        DstZone dstZone = new DstZone(startRule.get(), endRule.get(), offset.get());
        return Optional.of(ZoneRecord.daylightSaving(zoneName, dstZone));
    }

    /**
     * Converts a JDK offset, rejecting seconds, minutes other than 0/30/45 and magnitudes
     * above fifteen hours.
     */
    static Optional<Offset> toOffset(ZoneOffset zoneOffset, boolean irregular) {
        int totalSeconds = zoneOffset.getTotalSeconds();
        if (totalSeconds % 60 != 0) {
            return Optional.empty();
        }
        int magnitudeMinutes = Math.abs(totalSeconds / 60);
        int hour = magnitudeMinutes / 60;
        int minute = magnitudeMinutes % 60;
        if (hour > MAX_OFFSET_HOURS || (minute != 0 && minute != 30 && minute != 45)) {
            return Optional.empty();
        }
        int sign = totalSeconds < 0 ? -1 : 1;
        return Optional.of(irregular ? Offset.irregular(hour, minute, sign) : new Offset(hour, minute, sign));
    }

    /**
     * Converts a recurring JDK rule to the packed form, expressing its time as wall-clock
     * time before the transition.
     */
    static Optional<TransitionRule> toTransitionRule(ZoneOffsetTransitionRule rule) {
        if (rule.getDayOfWeek() == null || rule.isMidnightEndOfDay()) {
            return Optional.empty();
        }
        int indicator = rule.getDayOfMonthIndicator();
        boolean endOfMonth = indicator < 0;
        int daysFromEdge = endOfMonth ? -indicator - 1 : indicator - 1;
        if (!endOfMonth && daysFromEdge % 7 != 0 && rule.getMonth() != Month.FEBRUARY) {
            // "Sunday on or after the 25th" of a 31-day month is its last Sunday.
            endOfMonth = true;
            daysFromEdge = rule.getMonth().maxLength() - indicator - 6;
        }
        if (daysFromEdge < 0 || daysFromEdge % 7 != 0) {
            return Optional.empty();
        }
        int week = daysFromEdge / 7;
        if (week > 1) {
            return Optional.empty();
        }

        LocalDateTime reference = LocalDateTime.of(REFERENCE_DATE, rule.getLocalTime());
        LocalDateTime wall = rule.getTimeDefinition()
                .createDateTime(reference, rule.getStandardOffset(), rule.getOffsetBefore());
        if (!wall.toLocalDate().equals(REFERENCE_DATE) || wall.getMinute() != 0 || wall.getSecond() != 0) {
            return Optional.empty();
        }
        int hour = wall.getHour();
        if (!TransitionRule.isEncodableHour(hour)) {
            return Optional.empty();
        }
        int dayOfWeek = rule.getDayOfWeek().getValue() - 1;
        return Optional.of(new TransitionRule(rule.getMonth().getValue(), dayOfWeek, endOfMonth, week, hour));
    }

    private static <T> Optional<T> skip(String zoneName, String reason) {
        LOGGER.debug("Skipping zone {}: {}", zoneName, reason);
        return Optional.empty();
    }
}
