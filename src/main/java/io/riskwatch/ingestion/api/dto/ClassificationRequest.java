package io.riskwatch.ingestion.api.dto;

public record ClassificationRequest(
        String text,
        String title,
        String source,
        String section
) {}
