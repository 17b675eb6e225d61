package io.riskwatch.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SearchSummary(
        @JsonProperty("query") String query,
        @JsonProperty("dateRange") String dateRange,
        @JsonProperty("totalResults") int totalResults,
        @JsonProperty("errors") List<String> errors
) {
    public SearchSummary {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
