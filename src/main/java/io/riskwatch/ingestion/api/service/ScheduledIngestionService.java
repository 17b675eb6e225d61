package io.riskwatch.ingestion.api.service;

import io.riskwatch.ingestion.api.dto.IngestionRequest;
import io.riskwatch.ingestion.api.dto.IngestionSummary;
import io.riskwatch.ingestion.config.IngestionConfig;
import io.riskwatch.ingestion.config.ProcessingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class ScheduledIngestionService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledIngestionService.class);

    private final IngestionCoordinator coordinator;
    private final DocumentProcessor processor;
    private final RawDocumentStore store;
    private final BatchedWriter writer;
    private final IngestionConfig config;

    public ScheduledIngestionService(IngestionCoordinator coordinator,
                                     DocumentProcessor processor,
                                     RawDocumentStore store,
                                     BatchedWriter writer,
                                     IngestionConfig config) {
        this.coordinator = coordinator;
        this.processor = processor;
        this.store = store;
        this.writer = writer;
        this.config = config;
    }

    @Scheduled(
            fixedRateString = "#{@ingestionProps.scheduleIntervalMs}",
            initialDelayString = "#{@ingestionProps.initialDelayMs}"
    )
    public void ingestWatchlist() {
        ProcessingConfig processing = config.processing();
        if (!processing.enableScheduling()) {
            return;
        }

        List<String> watchlist = processing.watchlist();
        logger.info("Starting scheduled ingestion for {} watchlist entries", watchlist.size());
        long startTime = System.currentTimeMillis();

        List<IngestionSummary> summaries = new ArrayList<>();
        int totalNew = 0;
        for (String company : watchlist) {
            try {
                IngestionSummary summary = coordinator.run(
                        new IngestionRequest(company, null, null, processing.daysBack(), null));
                summaries.add(summary);
                totalNew += summary.totalNew();

            } catch (Exception e) {
                logger.error("Scheduled ingestion for '{}' failed: {}", company, e.getMessage(), e);
            }
        }

        writer.flush();
        logger.info("Scheduled ingestion completed: {} runs, {} new documents in {}ms",
                summaries.size(), totalNew, System.currentTimeMillis() - startTime);
    }

    @Scheduled(
            fixedDelayString = "#{@ingestionProps.sweepIntervalMs}",
            initialDelayString = "#{@ingestionProps.initialDelayMs}"
    )
    public void sweepUnparsed() {
        ProcessingConfig processing = config.processing();
        if (!processing.enableScheduling()) {
            return;
        }

        try {
            processor.drainPending(processing.drainBatchSize());
            processor.retryFailed(processing.drainBatchSize());
        } catch (Exception e) {
            logger.error("Sweep of unparsed documents failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${ingestion.processing.vacuum-cron:0 30 3 * * *}")
    public void vacuum() {
        if (!config.processing().enableScheduling()) {
            return;
        }

        try {
            store.vacuumOld(config.processing().vacuumDays());
        } catch (Exception e) {
            logger.error("Vacuum of parsed documents failed: {}", e.getMessage(), e);
        }
    }
}
