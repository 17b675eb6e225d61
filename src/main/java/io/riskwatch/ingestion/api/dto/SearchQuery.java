package io.riskwatch.ingestion.api.dto;

import java.time.Clock;
import java.time.LocalDate;

/**
 * A search with a fully resolved date range.
 */
public record SearchQuery(
        String query,
        LocalDate startDate,
        LocalDate endDate
) {
    public static final int DEFAULT_DAYS_BACK = 7;

    /**
     * Explicit dates win; a missing end defaults to today, a missing start to {@code end - daysBack}.
     */
    public static SearchQuery resolve(String query, LocalDate startDate, LocalDate endDate,
                                      Integer daysBack, Clock clock) {
        int days = daysBack != null && daysBack > 0 ? daysBack : DEFAULT_DAYS_BACK;
        LocalDate end = endDate != null ? endDate : LocalDate.now(clock);
        LocalDate start = startDate != null ? startDate : end.minusDays(days);
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start date " + start + " is after end date " + end);
        }
        return new SearchQuery(query == null ? "" : query.trim(), start, end);
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public String dateRange() {
        return startDate + ".." + endDate;
    }
}
