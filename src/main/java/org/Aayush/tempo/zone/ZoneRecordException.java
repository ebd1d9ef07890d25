package org.Aayush.tempo.zone;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Zone-database failure with a deterministic reason code.
 */
@Getter
@Accessors(fluent = true)
public final class ZoneRecordException extends RuntimeException {
    public static final String REASON_FILE_IO = "ZONE_FILE_IO";
    public static final String REASON_BAD_MAGIC = "ZONE_FILE_BAD_MAGIC";
    public static final String REASON_UNSUPPORTED_VERSION = "ZONE_FILE_UNSUPPORTED_VERSION";
    public static final String REASON_TRUNCATED = "ZONE_FILE_TRUNCATED";
    public static final String REASON_INVALID_RECORD = "ZONE_RECORD_INVALID";
    public static final String REASON_DUPLICATE_ZONE = "ZONE_RECORD_DUPLICATE";

    private final String reasonCode;

    /**
     * Creates a reason-coded zone failure.
     */
    public ZoneRecordException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = reasonCode;
    }

    /**
     * Creates a reason-coded zone failure with cause.
     */
    public ZoneRecordException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = reasonCode;
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + Objects.requireNonNull(reasonCode, "reasonCode") + "] " + Objects.requireNonNull(message, "message");
    }
}
