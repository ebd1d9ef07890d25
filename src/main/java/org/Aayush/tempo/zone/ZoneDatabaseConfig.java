package org.Aayush.tempo.zone;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Sources used to populate a zone database, applied in order: JDK zone rules, built-in
 * table, zone file. A later source replaces records of the same name.
 */
@Value
@Builder
public class ZoneDatabaseConfig {
    /** System property naming a zone file for the process-wide database. */
    public static final String ZONE_FILE_PROPERTY = "tempo.zone.file";
    /** System property enabling JDK zone rules for the process-wide database. */
    public static final String JAVA_RULES_PROPERTY = "tempo.zone.java-rules";

    /**
     * Whether to derive records from the JDK's zone rules.
     */
    @Builder.Default
    boolean includeJavaZoneRules = false;

    /**
     * Whether to include {@link BuiltInZoneRecordProvider}.
     */
    @Builder.Default
    boolean includeBuiltIn = true;

    /**
     * Optional zone file read by {@link FileZoneStore}; {@code null} for none.
     */
    Path zoneFile;

    /**
     * Instant at which JDK standard offsets of zones without recurring rules are read.
     */
    @Builder.Default
    Instant referenceInstant = JavaZoneRulesProvider.DEFAULT_REFERENCE_INSTANT;

    /**
     * Returns config with the built-in table only.
     */
    public static ZoneDatabaseConfig builtInOnly() {
        return ZoneDatabaseConfig.builder().build();
    }

    /**
     * Returns config with JDK zone rules overlaid by the built-in table.
     */
    public static ZoneDatabaseConfig withJavaZoneRules() {
        return ZoneDatabaseConfig.builder()
                .includeJavaZoneRules(true)
                .build();
    }

    /**
     * Returns config read from {@value #ZONE_FILE_PROPERTY} and {@value #JAVA_RULES_PROPERTY}.
     */
    public static ZoneDatabaseConfig fromSystemProperties() {
        String zoneFile = System.getProperty(ZONE_FILE_PROPERTY);
        return ZoneDatabaseConfig.builder()
                .includeJavaZoneRules(Boolean.getBoolean(JAVA_RULES_PROPERTY))
                .zoneFile(zoneFile == null || zoneFile.isBlank() ? null : Path.of(zoneFile.trim()))
                .build();
    }
}
