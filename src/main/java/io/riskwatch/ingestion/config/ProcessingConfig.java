package io.riskwatch.ingestion.config;

import java.time.Duration;
import java.util.List;

public record ProcessingConfig(
        Duration scheduleInterval,
        Duration initialDelay,
        Duration sweepInterval,
        boolean enableScheduling,
        List<String> watchlist,
        int daysBack,
        Duration adapterTimeout,
        int drainBatchSize,
        int vacuumDays,
        int executorPoolSize,
        int executorQueueCapacity
) {
    public ProcessingConfig {
        watchlist = watchlist == null ? List.of() : List.copyOf(watchlist);
    }

    public long getScheduleIntervalMs() {
        return scheduleInterval.toMillis();
    }

    public long getInitialDelayMs() {
        return initialDelay.toMillis();
    }

    public long getSweepIntervalMs() {
        return sweepInterval.toMillis();
    }
}
