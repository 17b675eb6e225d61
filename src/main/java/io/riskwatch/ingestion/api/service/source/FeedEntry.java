package io.riskwatch.ingestion.api.service.source;

import java.time.Instant;

public record FeedEntry(
        String title,
        String link,
        String description,
        String author,
        Instant publishedAt,
        String category
) {}
