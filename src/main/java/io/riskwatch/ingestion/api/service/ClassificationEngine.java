package io.riskwatch.ingestion.api.service;

import io.riskwatch.ingestion.api.exception.LlmException;
import io.riskwatch.ingestion.api.model.ClassificationResult;
import io.riskwatch.ingestion.api.model.KeywordVerdict;
import io.riskwatch.ingestion.api.model.RiskLabel;
import io.riskwatch.ingestion.api.service.llm.LlmClient;
import io.riskwatch.ingestion.config.ClassificationConfig.LlmConfig;
import io.riskwatch.ingestion.config.IngestionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Layered classification: keyword rules, then the LLM when one is available, then a fixed default.
 * {@link #classify} never throws.
 */
@Service
public class ClassificationEngine {

    private static final Logger logger = LoggerFactory.getLogger(ClassificationEngine.class);

    private static final double TEMPERATURE = 0.0;
    private static final int DEFAULT_MAX_PROMPT_CHARS = 1500;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(90);

    private final KeywordRuleEngine keywordRuleEngine;
    private final LlmResponseParser responseParser;
    private final Optional<LlmClient> llmClient;
    private final int maxPromptChars;
    private final Duration llmTimeout;

    private final AtomicLong total = new AtomicLong();
    private final AtomicLong keywordHits = new AtomicLong();
    private final AtomicLong llmCalls = new AtomicLong();
    private final AtomicLong llmAccepted = new AtomicLong();
    private final AtomicLong llmRejected = new AtomicLong();
    private final AtomicLong defaults = new AtomicLong();

    @Autowired
    public ClassificationEngine(KeywordRuleEngine keywordRuleEngine,
                                LlmResponseParser responseParser,
                                Optional<LlmClient> llmClient,
                                IngestionConfig config) {
        this(keywordRuleEngine, responseParser, llmClient, config.classification().llm());
    }

    public ClassificationEngine(KeywordRuleEngine keywordRuleEngine,
                                LlmResponseParser responseParser,
                                Optional<LlmClient> llmClient,
                                LlmConfig llmConfig) {
        this.keywordRuleEngine = keywordRuleEngine;
        this.responseParser = responseParser;
        this.llmClient = llmClient;
        this.maxPromptChars = llmConfig != null && llmConfig.maxPromptChars() > 0
                ? llmConfig.maxPromptChars() : DEFAULT_MAX_PROMPT_CHARS;
        this.llmTimeout = llmConfig != null && llmConfig.timeout() != null
                ? llmConfig.timeout() : DEFAULT_TIMEOUT;
    }

    public ClassificationResult classify(String text, String title, String source, String section) {
        total.incrementAndGet();
        try {
            String combined = ((title == null ? "" : title) + " " + (text == null ? "" : text)).trim();

            KeywordVerdict verdict = keywordRuleEngine.evaluate(combined, section);
            if (!verdict.isNoOpinion()) {
                keywordHits.incrementAndGet();
                logger.debug("Keyword rules classified '{}' as {} ({})", abbreviate(title), verdict.label().wireValue(), verdict.method().wireValue());
                return verdict.toResult();
            }

            Optional<ClassificationResult> llmResult = classifyWithLlm(text, title, source, section);
            if (llmResult.isPresent()) {
                llmAccepted.incrementAndGet();
                return llmResult.get();
            }

        } catch (RuntimeException e) {
            logger.error("Classification failed for '{}' from {}, using default: {}", abbreviate(title), source, e.getMessage(), e);
        }

        defaults.incrementAndGet();
        return ClassificationResult.defaultResult();
    }

    private Optional<ClassificationResult> classifyWithLlm(String text, String title, String source, String section) {
        if (llmClient.isEmpty() || !llmClient.get().isAvailable()) {
            return Optional.empty();
        }

        llmCalls.incrementAndGet();
        try {
            String response = llmClient.get().generate(buildPrompt(text, title, source, section), llmTimeout, TEMPERATURE);
            Optional<ClassificationResult> parsed = responseParser.parse(response);
            if (parsed.isEmpty()) {
                llmRejected.incrementAndGet();
            }
            return parsed;

        } catch (LlmException e) {
            llmRejected.incrementAndGet();
            logger.warn("LLM classification unavailable for '{}': {}", abbreviate(title), e.getMessage());
            return Optional.empty();
        }
    }

    String buildPrompt(String text, String title, String source, String section) {
        String body = text == null ? "" : text;
        if (body.length() > maxPromptChars) {
            body = body.substring(0, maxPromptChars);
        }
        String labels = Arrays.stream(RiskLabel.values())
                .map(RiskLabel::wireValue)
                .collect(Collectors.joining(", "));

        return """
                Analyze this document for Directors & Officers (D&O) liability risk.

                SOURCE: %s
                SECTION: %s
                TITLE: %s
                TEXT: %s

                Labels:
                - High-Legal: criminal or civil proceedings, corruption, fraud, court sanctions
                - High-Financial: insolvency, bankruptcy, creditor proceedings, severe financial distress
                - High-Regulatory: sanctions or enforcement by a regulator or supervisor
                - Medium-Operational: workforce reductions, environmental incidents, material operational damage
                - Low-Operational: routine corporate acts such as appointments, mergers, capital changes
                - Low-Other: anything else

                Respond ONLY with one JSON object, no other text:
                {"label": "<one of: %s>", "reason": "<short explanation>", "confidence": <number between 0 and 1>}
                """.formatted(nullToDash(source), nullToDash(section), nullToDash(title), body, labels);
    }

    public ClassificationStats getStats() {
        return new ClassificationStats(total.get(), keywordHits.get(), llmCalls.get(),
                llmAccepted.get(), llmRejected.get(), defaults.get());
    }

    private static String nullToDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }

    private static String abbreviate(String title) {
        if (title == null) return "";
        return title.length() > 60 ? title.substring(0, 60) + "..." : title;
    }

    public record ClassificationStats(
            long total,
            long keywordHits,
            long llmCalls,
            long llmAccepted,
            long llmRejected,
            long defaults
    ) {}
}
