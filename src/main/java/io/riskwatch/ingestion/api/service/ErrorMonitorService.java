package io.riskwatch.ingestion.api.service;

import io.riskwatch.ingestion.config.IngestionConfig;
import io.riskwatch.ingestion.config.MonitoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Sink for failures that would otherwise lose data: dropped write batches, dead-lettered documents.
 * Counts per operation live in Redis so that every instance sees the same window.
 */
@Service
public class ErrorMonitorService {

    private static final Logger logger = LoggerFactory.getLogger(ErrorMonitorService.class);

    static final String KEY_PREFIX = "monitor:failures:";

    private final RedisTemplate<String, String> redisTemplate;
    private final Clock clock;
    private final int alertThreshold;
    private final Duration window;
    private final int recentCapacity;
    private final Deque<FailureRecord> recent = new ConcurrentLinkedDeque<>();

    @Autowired
    public ErrorMonitorService(RedisTemplate<String, String> redisTemplate, Clock clock, IngestionConfig config) {
        this(redisTemplate, clock, config.monitoring());
    }

    public ErrorMonitorService(RedisTemplate<String, String> redisTemplate, Clock clock, MonitoringConfig config) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.alertThreshold = config.alertThreshold();
        this.window = config.window();
        this.recentCapacity = config.recentCapacity();
    }

    /**
     * Records one failure and checks the alert threshold. Never throws.
     *
     * @return true when the operation exceeded the threshold within the window
     */
    public boolean recordFailure(String operation, String subject, Throwable error, Map<String, Object> context) {
        String message = error != null ? error.getClass().getSimpleName() + ": " + error.getMessage() : "unknown error";
        FailureRecord failure = new FailureRecord(operation, subject, message, context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context)), clock.instant());

        recent.addLast(failure);
        while (recent.size() > recentCapacity) {
            recent.pollFirst();
        }

        logger.error("Failure in {} for {}: {} {}", operation, subject, message, failure.context());

        long count = increment(operation);
        if (count > alertThreshold) {
            logger.error("ALERT: {} failed {} times within {}", operation, count, window);
            return true;
        }
        return false;
    }

    public MonitorSummary summary() {
        Instant since = clock.instant().minus(window);
        Map<String, Long> byOperation = new TreeMap<>();
        List<FailureRecord> latest = new ArrayList<>();
        for (FailureRecord failure : recent) {
            if (failure.occurredAt().isAfter(since)) {
                byOperation.merge(failure.operation(), 1L, Long::sum);
            }
            latest.add(failure);
        }
        return new MonitorSummary(recent.size(), byOperation, latest);
    }

    private long increment(String operation) {
        String key = KEY_PREFIX + operation;
        try {
            Long count = redisTemplate.opsForValue().increment(key);
            // a counter left without a TTL (failed expire after INCR) would never reset
            if (count != null && (count == 1L || Long.valueOf(-1L).equals(redisTemplate.getExpire(key)))) {
                redisTemplate.expire(key, window);
            }
            if (count != null) {
                return count;
            }
        } catch (RuntimeException e) {
            logger.warn("Redis counter unavailable for {}, counting locally: {}", operation, e.getMessage());
        }
        return localCount(operation);
    }

    private long localCount(String operation) {
        Instant since = clock.instant().minus(window);
        return recent.stream()
                .filter(failure -> failure.operation().equals(operation))
                .filter(failure -> failure.occurredAt().isAfter(since))
                .count();
    }

    public record FailureRecord(
            String operation,
            String subject,
            String message,
            Map<String, Object> context,
            Instant occurredAt
    ) {}

    public record MonitorSummary(
            int recentFailures,
            Map<String, Long> failuresInWindow,
            List<FailureRecord> latest
    ) {}
}
