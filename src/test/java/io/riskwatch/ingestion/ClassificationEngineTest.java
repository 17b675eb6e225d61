package io.riskwatch.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.riskwatch.ingestion.api.exception.LlmException;
import io.riskwatch.ingestion.api.model.ClassificationMethod;
import io.riskwatch.ingestion.api.model.ClassificationResult;
import io.riskwatch.ingestion.api.model.RiskLabel;
import io.riskwatch.ingestion.api.service.ClassificationEngine;
import io.riskwatch.ingestion.api.service.KeywordRuleEngine;
import io.riskwatch.ingestion.api.service.LlmResponseParser;
import io.riskwatch.ingestion.api.service.llm.LlmClient;
import io.riskwatch.ingestion.config.ClassificationConfig.LlmConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClassificationEngineTest {

    private static final String NEUTRAL_TEXT = "La compañía presenta su nuevo catálogo de productos";

    @Mock
    private LlmClient llmClient;

    private KeywordRuleEngine keywordRuleEngine;
    private LlmResponseParser responseParser;
    private LlmConfig llmConfig;
    private ClassificationEngine engine;

    @BeforeEach
    void setUp() {
        keywordRuleEngine = new KeywordRuleEngine(List.of("es", "en"));
        responseParser = new LlmResponseParser(new ObjectMapper());
        llmConfig = new LlmConfig(true, "http://localhost:8000", Duration.ofSeconds(90), 1500, 256, Duration.ofMinutes(5));
        engine = new ClassificationEngine(keywordRuleEngine, responseParser, Optional.of(llmClient), llmConfig);
    }

    @Test
    @DisplayName("Keyword hits are final and the LLM is never consulted")
    void keywordHitSkipsLlm() throws Exception {
        ClassificationResult result = engine.classify("Sentencia del tribunal", "Resolución", "BOE", "JUS");

        assertThat(result.label()).isEqualTo(RiskLabel.HIGH_LEGAL);
        assertThat(result.confidence()).isEqualTo(0.9);
        assertThat(result.method()).isEqualTo(ClassificationMethod.KEYWORD_SECTION);
        verify(llmClient, never()).generate(anyString(), any(), anyDouble());
        assertThat(engine.getStats().keywordHits()).isEqualTo(1);
    }

    @Test
    void titleContributesToKeywordMatching() {
        ClassificationResult result = engine.classify("Detalles del caso", "Investigación por soborno y fraude", "elpais", null);

        assertThat(result.label()).isEqualTo(RiskLabel.HIGH_LEGAL);
        assertThat(result.method()).isEqualTo(ClassificationMethod.KEYWORD_MATCH);
    }

    @Test
    @DisplayName("Valid LLM answers are used when keyword rules have no opinion")
    void usesLlmWhenKeywordsHaveNoOpinion() throws Exception {
        when(llmClient.isAvailable()).thenReturn(true);
        when(llmClient.generate(anyString(), eq(Duration.ofSeconds(90)), eq(0.0)))
                .thenReturn("{\"label\": \"Medium-Operational\", \"reason\": \"plant closure\", \"confidence\": 0.72}");

        ClassificationResult result = engine.classify(NEUTRAL_TEXT, "Catálogo", "expansion", null);

        assertThat(result.label()).isEqualTo(RiskLabel.MEDIUM_OPERATIONAL);
        assertThat(result.confidence()).isEqualTo(0.72);
        assertThat(result.method()).isEqualTo(ClassificationMethod.LLM_ANALYSIS);
        assertThat(engine.getStats().llmAccepted()).isEqualTo(1);
    }

    @Test
    void fallsBackToDefaultWithoutLlm() {
        ClassificationEngine withoutLlm = new ClassificationEngine(keywordRuleEngine, responseParser, Optional.empty(), llmConfig);

        ClassificationResult result = withoutLlm.classify(NEUTRAL_TEXT, "Catálogo", "expansion", null);

        assertThat(result).isEqualTo(ClassificationResult.defaultResult());
        assertThat(result.method()).isEqualTo(ClassificationMethod.DEFAULT);
        assertThat(result.confidence()).isEqualTo(0.6);
    }

    @Test
    void skipsUnavailableLlm() throws Exception {
        when(llmClient.isAvailable()).thenReturn(false);

        ClassificationResult result = engine.classify(NEUTRAL_TEXT, "Catálogo", "expansion", null);

        assertThat(result.method()).isEqualTo(ClassificationMethod.DEFAULT);
        verify(llmClient, never()).generate(anyString(), any(), anyDouble());
    }

    @Test
    @DisplayName("Invalid LLM output falls through to the default result")
    void rejectsInvalidLlmOutput() throws Exception {
        when(llmClient.isAvailable()).thenReturn(true);
        when(llmClient.generate(anyString(), any(), anyDouble()))
                .thenReturn("{\"label\": \"Critical\", \"reason\": \"?\", \"confidence\": 0.99}");

        ClassificationResult result = engine.classify(NEUTRAL_TEXT, "Catálogo", "expansion", null);

        assertThat(result).isEqualTo(ClassificationResult.defaultResult());
        assertThat(engine.getStats().llmRejected()).isEqualTo(1);
    }

    @Test
    void llmFailureFallsBackToDefault() throws Exception {
        when(llmClient.isAvailable()).thenReturn(true);
        when(llmClient.generate(anyString(), any(), anyDouble())).thenThrow(new LlmException("read timed out"));

        ClassificationResult result = engine.classify(NEUTRAL_TEXT, "Catálogo", "expansion", null);

        assertThat(result.method()).isEqualTo(ClassificationMethod.DEFAULT);
    }

    @Test
    @DisplayName("Never throws, even when a layer fails unexpectedly")
    void neverThrows() {
        KeywordRuleEngine broken = mock(KeywordRuleEngine.class);
        when(broken.evaluate(any(), any())).thenThrow(new IllegalStateException("boom"));
        ClassificationEngine fragile = new ClassificationEngine(broken, responseParser, Optional.of(llmClient), llmConfig);

        ClassificationResult result = fragile.classify(NEUTRAL_TEXT, "Catálogo", "expansion", null);

        assertThat(result).isEqualTo(ClassificationResult.defaultResult());
        assertThat(fragile.getStats().defaults()).isEqualTo(1);
    }

    @Test
    void handlesMissingTextAndTitle() {
        ClassificationEngine withoutLlm = new ClassificationEngine(keywordRuleEngine, responseParser, Optional.empty(), llmConfig);

        assertThat(withoutLlm.classify(null, null, null, null)).isEqualTo(ClassificationResult.defaultResult());
    }

    @Test
    @DisplayName("Document text sent to the LLM is truncated")
    void truncatesPromptText() throws Exception {
        when(llmClient.isAvailable()).thenReturn(true);
        when(llmClient.generate(anyString(), any(), anyDouble())).thenReturn("no idea");

        engine.classify("x".repeat(5000), "Largo", "expansion", null);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmClient).generate(prompt.capture(), eq(Duration.ofSeconds(90)), eq(0.0));
        assertThat(prompt.getValue())
                .contains("x".repeat(1500))
                .doesNotContain("x".repeat(1501))
                .contains("TITLE: Largo")
                .contains("High-Legal, High-Financial, High-Regulatory, Medium-Operational, Low-Operational, Low-Other");
    }
}
