package io.riskwatch.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.riskwatch.ingestion.api.dto.IngestionSummary;

import java.time.LocalDateTime;
import java.util.List;

public record BatchProcessedEvent(
        @JsonProperty("batchId") String batchId,
        @JsonProperty("query") String query,
        @JsonProperty("sources") List<String> sources,
        @JsonProperty("totalDocuments") int totalDocuments,
        @JsonProperty("newDocuments") int newDocuments,
        @JsonProperty("duplicates") int duplicates,
        @JsonProperty("highRiskDocuments") int highRiskDocuments,
        @JsonProperty("errors") int errors,
        @JsonProperty("processingDurationMs") long processingDurationMs,
        @JsonProperty("processedAt")
        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime processedAt
) {
    public static BatchProcessedEvent create(IngestionSummary summary) {
        return new BatchProcessedEvent(
                "BATCH-" + summary.runId(),
                summary.query(),
                List.copyOf(summary.sources().keySet()),
                summary.totalFetched(),
                summary.totalNew(),
                summary.totalDuplicates(),
                summary.totalHighRisk(),
                summary.totalErrors(),
                summary.durationMs(),
                LocalDateTime.now()
        );
    }
}
