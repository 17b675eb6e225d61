package io.riskwatch.ingestion.config;

import io.riskwatch.ingestion.api.service.BatchedWriter;
import io.riskwatch.ingestion.api.service.ErrorMonitorService;
import io.riskwatch.ingestion.api.service.sink.AnalyticalSink;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class PersistenceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * One writer per process. The container calls {@link BatchedWriter#close()} on shutdown,
     * which performs the terminal flush.
     */
    @Bean(destroyMethod = "close")
    public BatchedWriter batchedWriter(AnalyticalSink sink, ErrorMonitorService errorMonitor, IngestionConfig config) {
        WriterConfig writer = config.writer();
        return new BatchedWriter(sink, errorMonitor, writer.batchSize(),
                writerRetryTemplate(writer.maxRetries(), writer.backoffBase(), new ThreadWaitSleeper()));
    }

    /**
     * Up to {@code maxRetries} attempts per batch, waiting {@code base * 2^n} between them.
     */
    public static RetryTemplate writerRetryTemplate(int maxRetries, Duration backoffBase, Sleeper sleeper) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be positive");
        }
        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(backoffBase.toMillis());
        backOff.setMultiplier(2.0);
        backOff.setMaxInterval(Math.max(1L, backoffBase.toMillis()) << Math.min(maxRetries, 20));
        backOff.setSleeper(sleeper);

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new SimpleRetryPolicy(maxRetries));
        retryTemplate.setBackOffPolicy(backOff);
        return retryTemplate;
    }
}
