package io.riskwatch.ingestion.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of D&amp;O risk labels. The wire value is what gets persisted and what the LLM must answer with.
 */
public enum RiskLabel {
    HIGH_LEGAL("High-Legal"),
    HIGH_FINANCIAL("High-Financial"),
    HIGH_REGULATORY("High-Regulatory"),
    MEDIUM_OPERATIONAL("Medium-Operational"),
    LOW_OPERATIONAL("Low-Operational"),
    LOW_OTHER("Low-Other");

    private final String wireValue;

    RiskLabel(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isHighRisk() {
        return wireValue.startsWith("High-");
    }

    public static Optional<RiskLabel> fromWire(String value) {
        if (value == null) return Optional.empty();

        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(label -> label.wireValue.equals(trimmed))
                .findFirst();
    }
}
