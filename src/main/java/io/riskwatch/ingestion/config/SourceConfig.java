package io.riskwatch.ingestion.config;

import java.util.List;

public record SourceConfig(
        String name,
        String type,
        boolean enabled,
        List<FeedConfig> feeds
) {
    public SourceConfig {
        feeds = feeds == null ? List.of() : List.copyOf(feeds);
    }

    public boolean isRss() {
        return type == null || "rss".equalsIgnoreCase(type);
    }

    public record FeedConfig(String url, String category) {}
}
