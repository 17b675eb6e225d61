package io.riskwatch.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record IngestionSummary(
        @JsonProperty("runId") String runId,
        @JsonProperty("query") String query,
        @JsonProperty("dateRange") String dateRange,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("durationMs") long durationMs,
        @JsonProperty("sources") Map<String, SourceReport> sources
) {

    public int totalFetched() {
        return sources.values().stream().mapToInt(SourceReport::fetched).sum();
    }

    public int totalNew() {
        return sources.values().stream().mapToInt(SourceReport::newDocuments).sum();
    }

    public int totalDuplicates() {
        return sources.values().stream().mapToInt(SourceReport::duplicates).sum();
    }

    public int totalHighRisk() {
        return sources.values().stream().mapToInt(SourceReport::highRisk).sum();
    }

    public int totalErrors() {
        return sources.values().stream().mapToInt(report -> report.errors().size()).sum();
    }
}
