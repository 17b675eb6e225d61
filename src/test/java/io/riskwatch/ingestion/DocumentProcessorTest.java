package io.riskwatch.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.riskwatch.ingestion.api.model.ClassificationMethod;
import io.riskwatch.ingestion.api.model.ClassificationResult;
import io.riskwatch.ingestion.api.model.DocumentStatus;
import io.riskwatch.ingestion.api.model.Event;
import io.riskwatch.ingestion.api.model.RawDocument;
import io.riskwatch.ingestion.api.model.RiskLabel;
import io.riskwatch.ingestion.api.service.BatchedWriter;
import io.riskwatch.ingestion.api.service.ClassificationEngine;
import io.riskwatch.ingestion.api.service.DocumentProcessor;
import io.riskwatch.ingestion.api.service.DocumentProcessor.ProcessingOutcome;
import io.riskwatch.ingestion.api.service.ErrorMonitorService;
import io.riskwatch.ingestion.api.service.EventNormalizer;
import io.riskwatch.ingestion.api.service.EventPublisherService;
import io.riskwatch.ingestion.api.service.RawDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DocumentProcessorTest {

    private static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

    @Mock
    private RawDocumentStore store;

    @Mock
    private ClassificationEngine classificationEngine;

    @Mock
    private EventPublisherService eventPublisher;

    @Mock
    private BatchedWriter writer;

    @Mock
    private ErrorMonitorService errorMonitor;

    private DocumentProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new DocumentProcessor(store, new EventNormalizer(new ObjectMapper()), classificationEngine,
                eventPublisher, writer, errorMonitor, Clock.fixed(NOW, ZoneOffset.UTC), "analytics_events");
    }

    @Test
    @DisplayName("Classified events are published, buffered and the document marked parsed last")
    @SuppressWarnings("unchecked")
    void shouldClassifyPublishAndQueue() {
        ClassificationResult result = new ClassificationResult(RiskLabel.HIGH_LEGAL, 0.9, "court", ClassificationMethod.KEYWORD_SECTION);
        when(classificationEngine.classify("Cuerpo", "Sentencia", "boe", "JUS")).thenReturn(result);
        when(eventPublisher.publishHighRiskDetected(any(Event.class))).thenReturn(true);

        ProcessingOutcome outcome = processor.process(document("r1", "boe",
                "{\"title\":\"Sentencia\",\"text\":\"Cuerpo\",\"section\":\"JUS\"}"));

        assertThat(outcome.status()).isEqualTo(DocumentProcessor.Status.CLASSIFIED);
        assertThat(outcome.alerted()).isTrue();
        assertThat(outcome.isHighRisk()).isTrue();

        ArgumentCaptor<Map<String, Object>> row = ArgumentCaptor.forClass(Map.class);
        InOrder inOrder = inOrder(eventPublisher, writer, store);
        inOrder.verify(eventPublisher).publishEventIngested(any(Event.class));
        inOrder.verify(eventPublisher).publishHighRiskDetected(any(Event.class));
        inOrder.verify(writer).queue(eq("analytics_events"), row.capture());
        inOrder.verify(store).markParsed("r1");

        assertThat(row.getValue())
                .containsEntry("event_id", "boe:r1")
                .containsEntry("risk_label", "High-Legal")
                .containsEntry("confidence", 0.9)
                .containsEntry("rationale", "court")
                .containsEntry("alerted", true)
                .containsEntry("embedding", null);
    }

    @Test
    void shouldSkipUntitledDocument() {
        ProcessingOutcome outcome = processor.process(document("r2", "elpais", "{\"text\":\"sin título\"}"));

        assertThat(outcome.status()).isEqualTo(DocumentProcessor.Status.SKIPPED);
        verify(store).markParsed("r2");
        verifyNoInteractions(classificationEngine, eventPublisher, writer);
    }

    @Test
    @DisplayName("A failure counts a retry and leaves the document unparsed")
    void shouldMarkErrorOnFailure() {
        when(classificationEngine.classify(any(), any(), any(), any())).thenReturn(ClassificationResult.defaultResult());
        doThrow(new IllegalStateException("buffer unavailable")).when(writer).queue(anyString(), anyMap());
        when(store.markError("r3")).thenReturn(Optional.of(stored("r3", 1, DocumentStatus.ERROR)));

        ProcessingOutcome outcome = processor.process(document("r3", "elpais", "{\"title\":\"t\"}"));

        assertThat(outcome.status()).isEqualTo(DocumentProcessor.Status.FAILED);
        assertThat(outcome.error()).isEqualTo("buffer unavailable");
        verify(store, never()).markParsed(anyString());
        verifyNoInteractions(errorMonitor);
    }

    @Test
    void shouldReportDeadLetteredDocument() {
        when(store.markError("r4")).thenReturn(Optional.of(stored("r4", 5, DocumentStatus.DLQ)));

        ProcessingOutcome outcome = processor.process(document("r4", "elpais", "not json"));

        assertThat(outcome.status()).isEqualTo(DocumentProcessor.Status.FAILED);
        verify(errorMonitor).recordFailure(eq("document_processing"), eq("r4"), any(RuntimeException.class), anyMap());
    }

    @Test
    void shouldDrainPendingDocuments() {
        when(store.getUnparsed(10)).thenReturn(List.of(
                document("a", "elpais", "{\"title\":\"uno\"}"),
                document("b", "elpais", "{\"text\":\"sin título\"}"),
                document("c", "elpais", "broken")));
        when(classificationEngine.classify(any(), any(), any(), any())).thenReturn(ClassificationResult.defaultResult());
        when(store.markError("c")).thenReturn(Optional.of(stored("c", 1, DocumentStatus.ERROR)));

        DocumentProcessor.SweepStats stats = processor.drainPending(10);

        assertThat(stats).isEqualTo(new DocumentProcessor.SweepStats(3, 1, 1, 1));
    }

    @Test
    void shouldRetryFailedDocuments() {
        when(store.getRetryable(5)).thenReturn(List.of(document("a", "elpais", "{\"title\":\"uno\"}")));
        when(classificationEngine.classify(any(), any(), any(), any())).thenReturn(ClassificationResult.defaultResult());

        DocumentProcessor.SweepStats stats = processor.retryFailed(5);

        assertThat(stats.classified()).isEqualTo(1);
        verify(store).markParsed("a");
    }

    private static RawDocument document(String rawId, String source, String payload) {
        return new RawDocument(rawId, source, payload.getBytes(StandardCharsets.UTF_8), Map.of(),
                0, DocumentStatus.PENDING, NOW, NOW, NOW);
    }

    private static RawDocument stored(String rawId, int retries, DocumentStatus status) {
        return new RawDocument(rawId, "elpais", new byte[0], Map.of(), retries, status, NOW, NOW, NOW);
    }
}
