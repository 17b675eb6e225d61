package io.riskwatch.ingestion.api.service.source;

import io.riskwatch.ingestion.api.dto.RawItem;
import io.riskwatch.ingestion.api.dto.SearchQuery;
import io.riskwatch.ingestion.api.dto.SourceSearchResult;
import io.riskwatch.ingestion.api.exception.SourceFetchException;
import io.riskwatch.ingestion.config.SourceConfig;
import io.riskwatch.ingestion.config.SourceConfig.FeedConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Generic news adapter: one instance per configured outlet, parameterized by its feeds.
 * Entries are kept when they mention the query and fall inside the date range.
 */
public class RssSourceAdapter implements SourceAdapter {

    private static final Logger logger = LoggerFactory.getLogger(RssSourceAdapter.class);

    private final SourceConfig source;
    private final RssFeedReader feedReader;

    public RssSourceAdapter(SourceConfig source, RssFeedReader feedReader) {
        this.source = source;
        this.feedReader = feedReader;
    }

    @Override
    public String name() {
        return source.name();
    }

    @Override
    public String description() {
        return "rss, " + source.feeds().size() + " feeds";
    }

    @Override
    public SourceSearchResult search(SearchQuery query) {
        List<RawItem> items = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (FeedConfig feed : source.feeds()) {
            try {
                List<FeedEntry> entries = feedReader.read(feed.url(), feed.category());
                int before = items.size();
                entries.stream()
                        .filter(entry -> mentions(entry, query.query()))
                        .filter(entry -> withinRange(entry, query))
                        .map(this::toItem)
                        .forEach(items::add);
                logger.debug("{} feed {}: {} entries, {} matching '{}'",
                        source.name(), feed.category(), entries.size(), items.size() - before, query.query());

            } catch (SourceFetchException e) {
                logger.warn("{} feed {} failed: {} (category: {})", source.name(), feed.url(), e.getMessage(), e.getCategory());
                errors.add(feed.category() + ": " + e.getCategory() + " - " + e.getMessage());
            }
        }

        return SourceSearchResult.of(query, items, errors);
    }

    private boolean mentions(FeedEntry entry, String query) {
        if (query == null || query.isBlank()) return true;

        String needle = query.toLowerCase(Locale.ROOT);
        return entry.title().toLowerCase(Locale.ROOT).contains(needle)
                || (entry.description() != null && entry.description().toLowerCase(Locale.ROOT).contains(needle));
    }

    private boolean withinRange(FeedEntry entry, SearchQuery query) {
        // undated entries are kept; the feed is assumed to be recent
        if (entry.publishedAt() == null) return true;
        return query.covers(LocalDate.ofInstant(entry.publishedAt(), ZoneOffset.UTC));
    }

    private RawItem toItem(FeedEntry entry) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("outlet", source.name());
        if (entry.author() != null) {
            attributes.put("author", entry.author());
        }
        return new RawItem(
                entry.title(),
                entry.link(),
                entry.publishedAt() != null ? entry.publishedAt().toString() : null,
                entry.description(),
                entry.category(),
                attributes
        );
    }
}
