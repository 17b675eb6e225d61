package io.riskwatch.ingestion.api.service;

import io.riskwatch.ingestion.api.dto.IngestionSummary;
import io.riskwatch.ingestion.api.dto.kafka.BatchProcessedEvent;
import io.riskwatch.ingestion.api.dto.kafka.EventIngestedEvent;
import io.riskwatch.ingestion.api.dto.kafka.HighRiskDetectedEvent;
import io.riskwatch.ingestion.api.model.Event;
import io.riskwatch.ingestion.config.IngestionConfig;
import io.riskwatch.ingestion.config.KafkaProperties;
import io.riskwatch.ingestion.config.RiskAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private static final double HEALTHY_SUCCESS_RATE = 0.5;

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties topics;
    private final RiskAnalysis riskAnalysis;

    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong alerts = new AtomicLong();

    @Autowired
    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties topics, IngestionConfig config) {
        this(kafkaTemplate, topics, config.riskAnalysis());
    }

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties topics, RiskAnalysis riskAnalysis) {
        this.kafkaTemplate = kafkaTemplate;
        this.topics = topics;
        this.riskAnalysis = riskAnalysis;
    }

    public void publishEventIngested(Event event) {
        try {
            send(topics.eventIngested(), event.eventId(), EventIngestedEvent.create(event))
                    .whenComplete((result, ex) -> {
                        if (ex == null) {
                            logger.debug("Sent event ingested: {} to partition: {}",
                                    event.eventId(), result.getRecordMetadata().partition());
                        } else {
                            logger.error("Failed to send event ingested: {}", event.eventId(), ex);
                        }
                    });

        } catch (Exception e) {
            failed.incrementAndGet();
            logger.error("Error publishing event ingested for: {}", event.eventId(), e);
        }
    }

    /**
     * Publishes an alert when the event's classification is one the risk policy alerts on.
     *
     * @return true when an alert was handed to the producer
     */
    public boolean publishHighRiskDetected(Event event) {
        if (!event.isClassified() || !riskAnalysis.requiresAlert(event.riskLabel(), event.confidence())) {
            return false;
        }

        try {
            HighRiskDetectedEvent alert = HighRiskDetectedEvent.create(event);

            send(topics.highRiskDetected(), event.eventId(), alert)
                    .whenComplete((result, ex) -> {
                        if (ex == null) {
                            logger.warn("ALERT SENT: {} for event: {} ({}, confidence {})",
                                    alert.alertId(), event.eventId(), alert.riskLabel(), alert.confidence());
                        } else {
                            logger.error("CRITICAL: Failed to send high risk alert: {}", alert.alertId(), ex);
                        }
                    });
            alerts.incrementAndGet();
            return true;

        } catch (Exception e) {
            failed.incrementAndGet();
            logger.error("Error publishing high risk alert for: {}", event.eventId(), e);
            return false;
        }
    }

    public void publishBatchProcessed(IngestionSummary summary) {
        try {
            BatchProcessedEvent event = BatchProcessedEvent.create(summary);

            send(topics.batchProcessed(), event.batchId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex == null) {
                            logger.info("Sent batch processed event: {} ({} documents, {} new)",
                                    event.batchId(), event.totalDocuments(), event.newDocuments());
                        } else {
                            logger.error("Failed to send batch processed event: {}", event.batchId(), ex);
                        }
                    });

        } catch (Exception e) {
            failed.incrementAndGet();
            logger.error("Error publishing batch processed event for run: {}", summary.runId(), e);
        }
    }

    private CompletableFuture<SendResult<String, Object>> send(String topic, String key, Object payload) {
        attempts.incrementAndGet();
        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, payload);
        if (future == null) {
            throw new IllegalStateException("Producer returned no send future for " + topic);
        }
        return future.whenComplete((result, ex) -> {
            if (ex == null) {
                published.incrementAndGet();
            } else {
                failed.incrementAndGet();
            }
        });
    }

    public boolean isHealthy() {
        PublishingStats stats = getStats();
        return stats.totalAttempts() == 0 || stats.getSuccessRate() >= HEALTHY_SUCCESS_RATE;
    }

    public PublishingStats getStats() {
        return new PublishingStats(published.get(), failed.get(), attempts.get(), alerts.get());
    }

    public record PublishingStats(
            long totalPublished,
            long totalFailed,
            long totalAttempts,
            long totalAlerts
    ) {
        public double getSuccessRate() {
            return totalAttempts > 0 ? (double) totalPublished / totalAttempts : 0.0;
        }
    }
}
