package io.riskwatch.ingestion.api.model;

import java.util.Locale;

/**
 * Landing-zone lifecycle. {@code PARSED} and {@code DLQ} are terminal.
 */
public enum DocumentStatus {
    PENDING,
    PARSED,
    ERROR,
    DLQ;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DocumentStatus fromDb(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
