package io.riskwatch.ingestion.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "ingestion")
public record IngestionConfig(
        List<SourceConfig> sources,
        ProcessingConfig processing,
        HttpConfig http,
        ClassificationConfig classification,
        WriterConfig writer,
        MonitoringConfig monitoring,
        RiskAnalysis riskAnalysis
) {

    private static final Logger logger = LoggerFactory.getLogger(IngestionConfig.class);

    public IngestionConfig {
        sources = sources == null ? List.of() : List.copyOf(sources);
        logger.debug("Ingestion configured with {} sources", sources.size());
    }

    public List<SourceConfig> getEnabledSources() {
        return sources.stream()
                .filter(SourceConfig::enabled)
                .toList();
    }
}
