package io.riskwatch.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "kafka.topics")
public record KafkaProperties(
        String eventIngested,
        String highRiskDetected,
        String batchProcessed
) {}
