package io.riskwatch.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.riskwatch.ingestion.api.model.Event;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record EventIngestedEvent(
        @JsonProperty("eventId") String eventId,
        @JsonProperty("title") String title,
        @JsonProperty("url") String url,
        @JsonProperty("source") String source,
        @JsonProperty("section") String section,
        @JsonProperty("pubDate") @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate pubDate,
        @JsonProperty("riskLabel") String riskLabel,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("processedAt") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime processedAt
) {
    public static EventIngestedEvent create(Event event) {
        return new EventIngestedEvent(
                event.eventId(), event.title(), event.url(), event.source(), event.section(), event.pubDate(),
                event.riskLabel() != null ? event.riskLabel().wireValue() : null,
                event.confidence(), LocalDateTime.now()
        );
    }
}
