package io.riskwatch.ingestion.api.model;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical classifiable unit derived from a landing-zone document.
 * Only the classification, embedding and alert fields change after creation.
 */
public record Event(
        String eventId,
        String rawId,
        String title,
        String text,
        String source,
        String section,
        LocalDate pubDate,
        String url,
        RiskLabel riskLabel,
        String rationale,
        Double confidence,
        Instant classifierTs,
        boolean alerted
) {

    public static String eventIdFor(String source, String rawId) {
        return source + ":" + rawId;
    }

    public boolean isClassified() {
        return riskLabel != null;
    }

    public Event withClassification(ClassificationResult result, Instant classifiedAt) {
        return new Event(eventId, rawId, title, text, source, section, pubDate, url,
                result.label(), result.reason(), result.confidence(), classifiedAt, alerted);
    }

    public Event withAlerted(boolean value) {
        return new Event(eventId, rawId, title, text, source, section, pubDate, url,
                riskLabel, rationale, confidence, classifierTs, value);
    }

    /**
     * Column map for the analytical events table. Embedding columns stay null.
     */
    public Map<String, Object> toRow(Instant createdAt) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("event_id", eventId);
        row.put("raw_id", rawId);
        row.put("title", title);
        row.put("text", text);
        row.put("source", source);
        row.put("section", section);
        row.put("pub_date", pubDate);
        row.put("url", url);
        row.put("embedding", null);
        row.put("embedding_model", null);
        row.put("risk_label", riskLabel != null ? riskLabel.wireValue() : null);
        row.put("rationale", rationale);
        row.put("confidence", confidence);
        row.put("classifier_ts", classifierTs != null ? Timestamp.from(classifierTs) : null);
        row.put("alerted", alerted);
        row.put("created_at", Timestamp.from(createdAt));
        return row;
    }
}
