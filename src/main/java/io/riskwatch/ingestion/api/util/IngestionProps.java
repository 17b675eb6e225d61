package io.riskwatch.ingestion.api.util;

import io.riskwatch.ingestion.config.IngestionConfig;
import org.springframework.stereotype.Component;

/**
 * Scalar views of the configuration for SpEL in {@code @Retryable} and {@code @Scheduled}.
 */
@Component
public class IngestionProps {
    private final int maxAttempts;
    private final long retryDelay;
    private final long scheduleIntervalMs;
    private final long initialDelayMs;
    private final long sweepIntervalMs;

    public IngestionProps(IngestionConfig config) {
        this.maxAttempts = config.http().maxRetries();
        this.retryDelay = config.http().retryDelay();
        this.scheduleIntervalMs = config.processing().getScheduleIntervalMs();
        this.initialDelayMs = config.processing().getInitialDelayMs();
        this.sweepIntervalMs = config.processing().getSweepIntervalMs();
    }

    // retry
    public int getMaxAttempts() { return maxAttempts; }
    public long getRetryDelay() { return retryDelay; }

    // schedule
    public long getScheduleIntervalMs() { return scheduleIntervalMs; }
    public long getInitialDelayMs() { return initialDelayMs; }
    public long getSweepIntervalMs() { return sweepIntervalMs; }
}
