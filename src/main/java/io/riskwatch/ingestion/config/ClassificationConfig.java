package io.riskwatch.ingestion.config;

import java.time.Duration;
import java.util.List;

public record ClassificationConfig(
        List<String> languages,
        LlmConfig llm
) {
    public ClassificationConfig {
        languages = languages == null || languages.isEmpty() ? List.of("es", "en") : List.copyOf(languages);
    }

    /**
     * External text-generation service used when keyword rules have no opinion.
     */
    public record LlmConfig(
            boolean enabled,
            String baseUrl,
            Duration timeout,
            int maxPromptChars,
            int maxTokens,
            Duration healthCheckInterval
    ) {}
}
