package io.riskwatch.ingestion.config;

import java.time.Duration;

public record MonitoringConfig(
        int alertThreshold,
        Duration window,
        int recentCapacity
) {}
