package io.riskwatch.ingestion.api.model;

public record DedupResult(RawDocument document, boolean isNew) {}
