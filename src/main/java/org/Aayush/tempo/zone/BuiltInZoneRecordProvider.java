package org.Aayush.tempo.zone;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Curated table of common zones, available without any zone file or JDK zone data.
 * <p>
 * Rules are the current ones only. Zones whose real rules the packed format cannot express
 * exactly (Chatham switches at 02:45) carry the closest encodable rule.
 * </p>
 */
public final class BuiltInZoneRecordProvider implements ZoneRecordProvider {
    private static final int SUNDAY = 6;

    private static final TransitionRule US_START = new TransitionRule(3, SUNDAY, false, 1, 2);
    private static final TransitionRule US_END = new TransitionRule(11, SUNDAY, false, 0, 2);
    private static final TransitionRule EU_START = new TransitionRule(3, SUNDAY, true, 0, 2);
    private static final TransitionRule EU_END = new TransitionRule(10, SUNDAY, true, 0, 3);
    private static final TransitionRule UK_START = new TransitionRule(3, SUNDAY, true, 0, 1);
    private static final TransitionRule UK_END = new TransitionRule(10, SUNDAY, true, 0, 2);
    private static final TransitionRule AU_START = new TransitionRule(10, SUNDAY, false, 0, 2);
    private static final TransitionRule AU_END = new TransitionRule(4, SUNDAY, false, 0, 3);
    private static final TransitionRule NZ_START = new TransitionRule(9, SUNDAY, true, 0, 2);
    private static final TransitionRule NZ_END = new TransitionRule(4, SUNDAY, false, 0, 3);

    private static final Map<String, ZoneRecord> RECORDS = buildRecords();

    @Override
    public Set<String> zoneNames() {
        return RECORDS.keySet();
    }

    @Override
    public Optional<ZoneRecord> lookup(String zoneName) {
        if (zoneName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(RECORDS.get(zoneName));
    }

    private static Map<String, ZoneRecord> buildRecords() {
        Map<String, ZoneRecord> records = new LinkedHashMap<>();
        fixed(records, "UTC", Offset.UTC);
        fixed(records, "Etc/UTC", Offset.UTC);

        dst(records, "America/New_York", US_START, US_END, west(5, 0));
        dst(records, "America/Chicago", US_START, US_END, west(6, 0));
        dst(records, "America/Denver", US_START, US_END, west(7, 0));
        dst(records, "America/Los_Angeles", US_START, US_END, west(8, 0));
        dst(records, "America/Anchorage", US_START, US_END, west(9, 0));
        dst(records, "America/St_Johns", US_START, US_END, west(3, 30));
        fixed(records, "America/Phoenix", west(7, 0));
        fixed(records, "America/Sao_Paulo", west(3, 0));
        fixed(records, "Pacific/Honolulu", west(10, 0));

        dst(records, "Europe/London", UK_START, UK_END, Offset.UTC);
        dst(records, "Europe/Lisbon", UK_START, UK_END, Offset.UTC);
        dst(records, "Europe/Paris", EU_START, EU_END, east(1, 0));
        dst(records, "Europe/Berlin", EU_START, EU_END, east(1, 0));
        dst(records, "Europe/Madrid", EU_START, EU_END, east(1, 0));
        fixed(records, "Europe/Moscow", east(3, 0));

        fixed(records, "Asia/Dubai", east(4, 0));
        fixed(records, "Asia/Kolkata", east(5, 30));
        fixed(records, "Asia/Kathmandu", east(5, 45));
        fixed(records, "Asia/Shanghai", east(8, 0));
        fixed(records, "Asia/Tokyo", east(9, 0));

        dst(records, "Australia/Sydney", AU_START, AU_END, east(10, 0));
        dst(records, "Australia/Melbourne", AU_START, AU_END, east(10, 0));
        dst(records, "Australia/Lord_Howe", AU_START, new TransitionRule(4, SUNDAY, false, 0, 2),
                Offset.irregular(10, 30, 1));
        fixed(records, "Australia/Brisbane", east(10, 0));
        dst(records, "Antarctica/Troll", UK_START, new TransitionRule(10, SUNDAY, true, 0, 3),
                Offset.irregular(0, 0, 1));
        dst(records, "Pacific/Auckland", NZ_START, NZ_END, east(12, 0));
        dst(records, "Pacific/Chatham", NZ_START, NZ_END, east(12, 45));
        fixed(records, "Pacific/Kiritimati", east(14, 0));
        return Map.copyOf(records);
    }

    private static void fixed(Map<String, ZoneRecord> records, String name, Offset offset) {
        records.put(name, ZoneRecord.fixed(name, offset));
    }

    private static void dst(
            Map<String, ZoneRecord> records,
            String name,
            TransitionRule start,
            TransitionRule end,
            Offset standard
    ) {
        records.put(name, ZoneRecord.daylightSaving(name, new DstZone(start, end, standard)));
    }

    private static Offset east(int hour, int minute) {
        return new Offset(hour, minute, 1);
    }

    private static Offset west(int hour, int minute) {
        return new Offset(hour, minute, -1);
    }
}
