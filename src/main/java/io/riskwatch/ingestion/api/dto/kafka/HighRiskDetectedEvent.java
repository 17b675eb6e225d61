package io.riskwatch.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.riskwatch.ingestion.api.model.Event;

import java.time.LocalDateTime;
import java.util.UUID;

public record HighRiskDetectedEvent(
        @JsonProperty("alertId") String alertId,
        @JsonProperty("eventId") String eventId,
        @JsonProperty("title") String title,
        @JsonProperty("riskLabel") String riskLabel,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("rationale") String rationale,
        @JsonProperty("source") String source,
        @JsonProperty("url") String url,
        @JsonProperty("detectedAt") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime detectedAt
) {
    public static HighRiskDetectedEvent create(Event event) {
        return new HighRiskDetectedEvent(
                "ALERT-" + UUID.randomUUID().toString().substring(0, 8),
                event.eventId(), event.title(), event.riskLabel().wireValue(),
                event.confidence() != null ? event.confidence() : 0.0,
                event.rationale(), event.source(), event.url(), LocalDateTime.now()
        );
    }
}
