package io.riskwatch.ingestion.api.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * @param sources adapter names to query; null or empty means every enabled source
 */
public record IngestionRequest(
        String query,
        LocalDate startDate,
        LocalDate endDate,
        Integer daysBack,
        List<String> sources
) {}
