package io.riskwatch.ingestion.api.dto;

import java.util.List;

public record SourceSearchResult(
        SearchSummary summary,
        List<RawItem> items,
        String error
) {
    public SourceSearchResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static SourceSearchResult of(SearchQuery query, List<RawItem> items, List<String> errors) {
        return new SourceSearchResult(
                new SearchSummary(query.query(), query.dateRange(), items.size(), errors),
                items,
                null
        );
    }

    public static SourceSearchResult failed(SearchQuery query, String error) {
        return new SourceSearchResult(
                new SearchSummary(query.query(), query.dateRange(), 0, List.of(error)),
                List.of(),
                error
        );
    }

    public boolean isFailed() {
        return error != null;
    }
}
