package io.riskwatch.ingestion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    @Bean("ingestionTaskExecutor")
    public ThreadPoolTaskExecutor ingestionTaskExecutor(IngestionConfig config) {
        ProcessingConfig processing = config.processing();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(processing.executorPoolSize());
        executor.setMaxPoolSize(processing.executorPoolSize());
        executor.setQueueCapacity(processing.executorQueueCapacity());
        executor.setThreadNamePrefix("Ingestion-");
        // saturation pushes work back onto the coordinating thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
