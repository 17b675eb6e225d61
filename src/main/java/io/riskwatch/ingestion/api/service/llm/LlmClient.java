package io.riskwatch.ingestion.api.service.llm;

import io.riskwatch.ingestion.api.exception.LlmException;

import java.time.Duration;

/**
 * Text-generation capability used as the second classification layer.
 */
public interface LlmClient {

    String generate(String prompt, Duration timeout, double temperature) throws LlmException;

    /**
     * @return true when the backing service is configured and answered its last health probe
     */
    boolean isAvailable();
}
