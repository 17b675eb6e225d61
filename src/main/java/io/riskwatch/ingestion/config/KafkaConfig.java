package io.riskwatch.ingestion.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    private static final int PARTITIONS = 3;

    private final KafkaProperties topics;

    public KafkaConfig(KafkaProperties topics) {
        this.topics = topics;
    }

    @Bean
    public NewTopic eventIngestedTopic() {
        return TopicBuilder.name(topics.eventIngested()).partitions(PARTITIONS).replicas(1).build();
    }

    @Bean
    public NewTopic highRiskDetectedTopic() {
        return TopicBuilder.name(topics.highRiskDetected()).partitions(PARTITIONS).replicas(1).build();
    }

    @Bean
    public NewTopic batchProcessedTopic() {
        return TopicBuilder.name(topics.batchProcessed()).partitions(1).replicas(1).build();
    }
}
