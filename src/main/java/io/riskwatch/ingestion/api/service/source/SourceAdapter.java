package io.riskwatch.ingestion.api.service.source;

import io.riskwatch.ingestion.api.dto.SearchQuery;
import io.riskwatch.ingestion.api.dto.SourceSearchResult;

/**
 * One external source. Implementations report per-feed problems in the result summary and
 * throw only when the whole source is unusable.
 */
public interface SourceAdapter {

    String name();

    SourceSearchResult search(SearchQuery query);

    default String description() {
        return name();
    }
}
