package io.riskwatch.ingestion.api;

import io.riskwatch.ingestion.api.dto.ClassificationRequest;
import io.riskwatch.ingestion.api.dto.IngestionRequest;
import io.riskwatch.ingestion.api.dto.IngestionSummary;
import io.riskwatch.ingestion.api.dto.SourcesInfo;
import io.riskwatch.ingestion.api.model.ClassificationResult;
import io.riskwatch.ingestion.api.service.BatchedWriter;
import io.riskwatch.ingestion.api.service.ClassificationEngine;
import io.riskwatch.ingestion.api.service.ErrorMonitorService;
import io.riskwatch.ingestion.api.service.EventPublisherService;
import io.riskwatch.ingestion.api.service.IngestionCoordinator;
import io.riskwatch.ingestion.api.service.RawDocumentStore;
import io.riskwatch.ingestion.api.service.source.SourceAdapterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/ingestion")
public class IngestionController {

    private static final Logger logger = LoggerFactory.getLogger(IngestionController.class);

    private final IngestionCoordinator coordinator;
    private final ClassificationEngine classificationEngine;
    private final RawDocumentStore store;
    private final BatchedWriter writer;
    private final EventPublisherService eventPublisher;
    private final ErrorMonitorService errorMonitor;
    private final SourceAdapterRegistry registry;

    public IngestionController(IngestionCoordinator coordinator,
                               ClassificationEngine classificationEngine,
                               RawDocumentStore store,
                               BatchedWriter writer,
                               EventPublisherService eventPublisher,
                               ErrorMonitorService errorMonitor,
                               SourceAdapterRegistry registry) {
        this.coordinator = coordinator;
        this.classificationEngine = classificationEngine;
        this.store = store;
        this.writer = writer;
        this.eventPublisher = eventPublisher;
        this.errorMonitor = errorMonitor;
        this.registry = registry;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean eventPublisherHealthy = eventPublisher.isHealthy();
        var stats = eventPublisher.getStats();

        var healthInfo = Map.of(
                "status", eventPublisherHealthy ? "UP" : "DOWN",
                "service", "RiskWatch Ingestion Service",
                "timestamp", LocalDateTime.now(),
                "messaging", Map.of(
                        "healthy", eventPublisherHealthy,
                        "totalPublished", stats.totalPublished(),
                        "successRate", String.format("%.2f%%", stats.getSuccessRate() * 100)
                )
        );

        return eventPublisherHealthy ?
                ResponseEntity.ok(healthInfo) :
                ResponseEntity.status(503).body(healthInfo);
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("documents", store.getStats());
        status.put("classification", classificationEngine.getStats());
        status.put("writer", writer.getStats());
        status.put("publishing", eventPublisher.getStats());
        status.put("failures", errorMonitor.summary().failuresInWindow());
        return ResponseEntity.ok(status);
    }

    @GetMapping("/sources")
    public SourcesInfo getSources() {
        var sources = registry.describe();
        return new SourcesInfo(sources, sources.size(), LocalDateTime.now());
    }

    @PostMapping("/runs")
    public ResponseEntity<IngestionSummary> run(@RequestBody IngestionRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(coordinator.run(request));
    }

    @PostMapping("/classify")
    public ClassificationResult classify(@RequestBody ClassificationRequest request) {
        return classificationEngine.classify(request.text(), request.title(), request.source(), request.section());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
