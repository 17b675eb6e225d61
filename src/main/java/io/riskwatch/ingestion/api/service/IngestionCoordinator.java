package io.riskwatch.ingestion.api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.riskwatch.ingestion.api.dto.IngestionRequest;
import io.riskwatch.ingestion.api.dto.IngestionSummary;
import io.riskwatch.ingestion.api.dto.RawItem;
import io.riskwatch.ingestion.api.dto.SearchQuery;
import io.riskwatch.ingestion.api.dto.SourceReport;
import io.riskwatch.ingestion.api.dto.SourceSearchResult;
import io.riskwatch.ingestion.api.model.DedupResult;
import io.riskwatch.ingestion.api.service.DocumentProcessor.ProcessingOutcome;
import io.riskwatch.ingestion.api.service.source.SourceAdapter;
import io.riskwatch.ingestion.api.service.source.SourceAdapterRegistry;
import io.riskwatch.ingestion.config.IngestionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a search out to the selected sources, lands every hit in the content-addressed store and
 * sends new documents through processing. A failing or slow source only affects its own report.
 */
@Service
public class IngestionCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(IngestionCoordinator.class);

    private final SourceAdapterRegistry registry;
    private final RawDocumentStore store;
    private final DocumentProcessor processor;
    private final BatchedWriter writer;
    private final EventPublisherService eventPublisher;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final Clock clock;
    private final Duration adapterTimeout;
    private final int defaultDaysBack;
    private final String runsTable;

    @Autowired
    public IngestionCoordinator(SourceAdapterRegistry registry,
                                RawDocumentStore store,
                                DocumentProcessor processor,
                                BatchedWriter writer,
                                EventPublisherService eventPublisher,
                                ObjectMapper objectMapper,
                                @Qualifier("ingestionTaskExecutor") Executor executor,
                                Clock clock,
                                IngestionConfig config) {
        this(registry, store, processor, writer, eventPublisher, objectMapper, executor, clock,
                config.processing().adapterTimeout(), config.processing().daysBack(), config.writer().runsTable());
    }

    public IngestionCoordinator(SourceAdapterRegistry registry,
                                RawDocumentStore store,
                                DocumentProcessor processor,
                                BatchedWriter writer,
                                EventPublisherService eventPublisher,
                                ObjectMapper objectMapper,
                                Executor executor,
                                Clock clock,
                                Duration adapterTimeout,
                                int defaultDaysBack,
                                String runsTable) {
        this.registry = registry;
        this.store = store;
        this.processor = processor;
        this.writer = writer;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.clock = clock;
        this.adapterTimeout = adapterTimeout;
        this.defaultDaysBack = defaultDaysBack;
        this.runsTable = runsTable;
    }

    public IngestionSummary run(IngestionRequest request) {
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        String runId = UUID.randomUUID().toString();

        SearchQuery query = SearchQuery.resolve(request.query(), request.startDate(), request.endDate(),
                request.daysBack() != null ? request.daysBack() : defaultDaysBack, clock);
        List<SourceAdapter> adapters = registry.select(request.sources());

        logger.info("Ingestion run {} for '{}' ({}) across {} sources", runId, query.query(), query.dateRange(), adapters.size());

        Map<String, CompletableFuture<SourceSearchResult>> searches = new LinkedHashMap<>();
        for (SourceAdapter adapter : adapters) {
            searches.put(adapter.name(), CompletableFuture
                    .supplyAsync(() -> adapter.search(query), executor)
                    .orTimeout(adapterTimeout.toMillis(), TimeUnit.MILLISECONDS));
        }

        Map<String, SourceSearchResult> results = new LinkedHashMap<>();
        searches.forEach((source, future) -> results.put(source, await(source, future, query)));

        Map<String, List<CompletableFuture<ItemOutcome>>> ingestions = new LinkedHashMap<>();
        results.forEach((source, result) -> {
            List<CompletableFuture<ItemOutcome>> futures = new ArrayList<>();
            for (RawItem item : result.items()) {
                futures.add(CompletableFuture.supplyAsync(() -> ingest(source, query, item), executor));
            }
            ingestions.put(source, futures);
        });

        Map<String, SourceReport> reports = new LinkedHashMap<>();
        results.forEach((source, result) -> reports.put(source, report(source, result, ingestions.get(source))));

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        IngestionSummary summary = new IngestionSummary(runId, query.query(), query.dateRange(), startedAt, durationMs, reports);

        writer.queue(runsTable, runRow(summary));
        eventPublisher.publishBatchProcessed(summary);

        logger.info("Ingestion run {} completed: {} fetched, {} new, {} duplicates, {} high risk, {} errors in {}ms",
                runId, summary.totalFetched(), summary.totalNew(), summary.totalDuplicates(),
                summary.totalHighRisk(), summary.totalErrors(), durationMs);
        return summary;
    }

    private SourceSearchResult await(String source, CompletableFuture<SourceSearchResult> future, SearchQuery query) {
        try {
            SourceSearchResult result = future.join();
            if (result == null) {
                return SourceSearchResult.failed(query, "source returned no result");
            }
            return result;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String message = cause instanceof TimeoutException
                    ? "timed out after " + adapterTimeout
                    : cause.getClass().getSimpleName() + ": " + cause.getMessage();
            logger.error("Source {} failed: {}", source, message);
            return SourceSearchResult.failed(query, message);
        }
    }

    ItemOutcome ingest(String source, SearchQuery query, RawItem item) {
        try {
            byte[] payload = objectMapper.writeValueAsBytes(item);
            DedupResult dedup = store.createWithDedup(source, payload, meta(source, query, item));
            if (!dedup.isNew()) {
                return ItemOutcome.ofDuplicate();
            }
            return ItemOutcome.ofProcessed(processor.process(dedup.document()));

        } catch (JsonProcessingException e) {
            logger.warn("Item '{}' from {} could not be serialized: {}", item.title(), source, e.getMessage());
            return ItemOutcome.ofError("serialization: " + e.getOriginalMessage());
        } catch (RuntimeException e) {
            logger.error("Landing item '{}' from {} failed: {}", item.title(), source, e.getMessage(), e);
            return ItemOutcome.ofError(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private SourceReport report(String source, SourceSearchResult result, List<CompletableFuture<ItemOutcome>> futures) {
        List<String> errors = new ArrayList<>(result.summary().errors());
        int newDocuments = 0;
        int duplicates = 0;
        int classified = 0;
        int highRisk = 0;
        int failed = 0;

        for (CompletableFuture<ItemOutcome> future : futures) {
            ItemOutcome outcome = future.join();
            if (outcome.error() != null) {
                failed++;
                errors.add(outcome.error());
            } else if (outcome.duplicate()) {
                duplicates++;
            } else {
                newDocuments++;
                ProcessingOutcome processing = outcome.processing();
                switch (processing.status()) {
                    case CLASSIFIED -> {
                        classified++;
                        if (processing.isHighRisk()) highRisk++;
                    }
                    case FAILED -> {
                        failed++;
                        errors.add("processing " + processing.rawId() + ": " + processing.error());
                    }
                    case SKIPPED -> { }
                }
            }
        }

        logger.info("Processed {}: {} fetched, {} new, {} duplicates, {} errors",
                source, result.items().size(), newDocuments, duplicates, errors.size());
        return new SourceReport(source, result.items().size(), newDocuments, duplicates, classified, highRisk, failed, errors);
    }

    private Map<String, Object> meta(String source, SearchQuery query, RawItem item) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("source", source);
        meta.put("query", query.query());
        meta.put("title", item.title());
        meta.put("url", item.url());
        meta.put("published_at", item.publishedAt());
        meta.put("section", item.section());
        return meta;
    }

    private Map<String, Object> runRow(IngestionSummary summary) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("run_id", summary.runId());
        row.put("query", summary.query());
        row.put("date_range", summary.dateRange());
        row.put("sources", String.join(",", summary.sources().keySet()));
        row.put("total_fetched", summary.totalFetched());
        row.put("total_new", summary.totalNew());
        row.put("total_duplicates", summary.totalDuplicates());
        row.put("total_high_risk", summary.totalHighRisk());
        row.put("total_errors", summary.totalErrors());
        row.put("started_at", Timestamp.from(summary.startedAt()));
        row.put("duration_ms", summary.durationMs());
        return row;
    }

    record ItemOutcome(boolean duplicate, ProcessingOutcome processing, String error) {
        static ItemOutcome ofDuplicate() {
            return new ItemOutcome(true, null, null);
        }

        static ItemOutcome ofProcessed(ProcessingOutcome processing) {
            return new ItemOutcome(false, processing, null);
        }

        static ItemOutcome ofError(String message) {
            return new ItemOutcome(false, null, message);
        }
    }
}
