package io.riskwatch.ingestion.api.service;

import io.riskwatch.ingestion.api.model.ClassificationResult;
import io.riskwatch.ingestion.api.model.DocumentStatus;
import io.riskwatch.ingestion.api.model.Event;
import io.riskwatch.ingestion.api.model.RawDocument;
import io.riskwatch.ingestion.config.IngestionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one landing-zone document through normalization, classification, publishing and the
 * write-behind buffer, and records the outcome on the document's status.
 */
@Service
public class DocumentProcessor {

    private static final Logger logger = LoggerFactory.getLogger(DocumentProcessor.class);

    private final RawDocumentStore store;
    private final EventNormalizer normalizer;
    private final ClassificationEngine classificationEngine;
    private final EventPublisherService eventPublisher;
    private final BatchedWriter writer;
    private final ErrorMonitorService errorMonitor;
    private final Clock clock;
    private final String eventsTable;

    @Autowired
    public DocumentProcessor(RawDocumentStore store,
                             EventNormalizer normalizer,
                             ClassificationEngine classificationEngine,
                             EventPublisherService eventPublisher,
                             BatchedWriter writer,
                             ErrorMonitorService errorMonitor,
                             Clock clock,
                             IngestionConfig config) {
        this(store, normalizer, classificationEngine, eventPublisher, writer, errorMonitor, clock,
                config.writer().eventsTable());
    }

    public DocumentProcessor(RawDocumentStore store,
                             EventNormalizer normalizer,
                             ClassificationEngine classificationEngine,
                             EventPublisherService eventPublisher,
                             BatchedWriter writer,
                             ErrorMonitorService errorMonitor,
                             Clock clock,
                             String eventsTable) {
        this.store = store;
        this.normalizer = normalizer;
        this.classificationEngine = classificationEngine;
        this.eventPublisher = eventPublisher;
        this.writer = writer;
        this.errorMonitor = errorMonitor;
        this.clock = clock;
        this.eventsTable = eventsTable;
    }

    /**
     * Never throws. Failures are counted on the document and dead-lettered ones reported to the monitor.
     */
    public ProcessingOutcome process(RawDocument document) {
        try {
            Optional<Event> normalized = normalizer.normalize(document);
            if (normalized.isEmpty()) {
                store.markParsed(document.rawId());
                return ProcessingOutcome.skipped(document.rawId());
            }

            Event event = normalized.get();
            ClassificationResult result = classificationEngine.classify(
                    event.text(), event.title(), event.source(), event.section());

            Instant now = clock.instant();
            Event classified = event.withClassification(result, now);

            eventPublisher.publishEventIngested(classified);
            boolean alerted = eventPublisher.publishHighRiskDetected(classified);
            Event stored = classified.withAlerted(alerted);

            writer.queue(eventsTable, stored.toRow(now));
            store.markParsed(document.rawId());

            logger.debug("Classified {} as {} ({}, {})", stored.eventId(), result.label().wireValue(),
                    result.method().wireValue(), result.confidence());
            return ProcessingOutcome.classified(document.rawId(), result, alerted);

        } catch (RuntimeException e) {
            logger.warn("Processing of document {} from {} failed: {}", document.rawId(), document.source(), e.getMessage());
            return fail(document, e);
        }
    }

    public SweepStats drainPending(int limit) {
        return sweep("pending", store.getUnparsed(limit));
    }

    public SweepStats retryFailed(int limit) {
        return sweep("error", store.getRetryable(limit));
    }

    private SweepStats sweep(String kind, List<RawDocument> documents) {
        int classified = 0;
        int skipped = 0;
        int failed = 0;
        for (RawDocument document : documents) {
            ProcessingOutcome outcome = process(document);
            switch (outcome.status()) {
                case CLASSIFIED -> classified++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }
        if (!documents.isEmpty()) {
            logger.info("Swept {} {} documents: {} classified, {} skipped, {} failed",
                    documents.size(), kind, classified, skipped, failed);
        }
        return new SweepStats(documents.size(), classified, skipped, failed);
    }

    private ProcessingOutcome fail(RawDocument document, RuntimeException error) {
        try {
            Optional<RawDocument> after = store.markError(document.rawId());
            if (after.isPresent() && after.get().status() == DocumentStatus.DLQ) {
                errorMonitor.recordFailure("document_processing", document.rawId(), error,
                        Map.of("source", document.source(), "retries", after.get().retries()));
            }
        } catch (RuntimeException e) {
            logger.error("Could not record failure of document {}: {}", document.rawId(), e.getMessage(), e);
            errorMonitor.recordFailure("document_status", document.rawId(), e, Map.of("source", document.source()));
        }
        return ProcessingOutcome.failed(document.rawId(), error.getMessage());
    }

    public enum Status { CLASSIFIED, SKIPPED, FAILED }

    public record ProcessingOutcome(
            String rawId,
            Status status,
            ClassificationResult classification,
            boolean alerted,
            String error
    ) {
        public static ProcessingOutcome classified(String rawId, ClassificationResult result, boolean alerted) {
            return new ProcessingOutcome(rawId, Status.CLASSIFIED, result, alerted, null);
        }

        public static ProcessingOutcome skipped(String rawId) {
            return new ProcessingOutcome(rawId, Status.SKIPPED, null, false, null);
        }

        public static ProcessingOutcome failed(String rawId, String error) {
            return new ProcessingOutcome(rawId, Status.FAILED, null, false, error);
        }

        public boolean isHighRisk() {
            return classification != null && classification.label().isHighRisk();
        }
    }

    public record SweepStats(int examined, int classified, int skipped, int failed) {}
}
