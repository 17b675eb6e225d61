package io.riskwatch.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SourceReport(
        @JsonProperty("source") String source,
        @JsonProperty("fetched") int fetched,
        @JsonProperty("newDocuments") int newDocuments,
        @JsonProperty("duplicates") int duplicates,
        @JsonProperty("classified") int classified,
        @JsonProperty("highRisk") int highRisk,
        @JsonProperty("failed") int failed,
        @JsonProperty("errors") List<String> errors
) {
    public SourceReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
