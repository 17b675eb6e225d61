package io.riskwatch.ingestion.api.model;

import java.time.Instant;
import java.util.Map;

public record RawDocument(
        String rawId,
        String source,
        byte[] payload,
        Map<String, Object> meta,
        int retries,
        DocumentStatus status,
        Instant fetchedAt,
        Instant createdAt,
        Instant updatedAt
) {
    public RawDocument {
        meta = meta == null ? Map.of() : meta;
    }

    public Object metaValue(String key) {
        return meta.get(key);
    }
}
