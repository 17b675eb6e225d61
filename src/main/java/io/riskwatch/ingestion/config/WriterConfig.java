package io.riskwatch.ingestion.config;

import java.time.Duration;

public record WriterConfig(
        int batchSize,
        int maxRetries,
        Duration backoffBase,
        String eventsTable,
        String runsTable
) {}
