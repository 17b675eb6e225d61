package io.riskwatch.ingestion.api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.riskwatch.ingestion.api.model.ClassificationMethod;
import io.riskwatch.ingestion.api.model.ClassificationResult;
import io.riskwatch.ingestion.api.model.RiskLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts and validates the classification object from free-form model output.
 */
@Component
public class LlmResponseParser {

    private static final Logger logger = LoggerFactory.getLogger(LlmResponseParser.class);

    private static final Pattern LABELLED_OBJECT = Pattern.compile("\\{[^{}]*\"label\"[^{}]*\\}");
    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*(\\{.*?\\})\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;
    private final List<Function<String, Optional<String>>> strategies;

    public LlmResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strategies = List.of(
                Optional::of,
                response -> firstMatch(LABELLED_OBJECT, response, 0),
                response -> firstMatch(FENCED_BLOCK, response, 1)
        );
    }

    public Optional<ClassificationResult> parse(String response) {
        if (response == null || response.isBlank()) {
            logger.warn("Validation failed: model response is empty");
            return Optional.empty();
        }

        String trimmed = response.trim();
        for (Function<String, Optional<String>> strategy : strategies) {
            Optional<JsonNode> node = strategy.apply(trimmed).flatMap(this::readObject);
            if (node.isPresent()) {
                return validate(node.get());
            }
        }

        logger.warn("Validation failed: no JSON object found in model response");
        return Optional.empty();
    }

    Optional<ClassificationResult> validate(JsonNode node) {
        JsonNode label = node.get("label");
        JsonNode reason = node.get("reason");
        JsonNode confidence = node.get("confidence");

        if (label == null || label.isNull() || reason == null || reason.isNull()
                || confidence == null || confidence.isNull()) {
            logger.warn("Validation failed: 'label', 'reason' and 'confidence' are required, got {}", node);
            return Optional.empty();
        }

        Optional<RiskLabel> riskLabel = RiskLabel.fromWire(label.asText());
        if (riskLabel.isEmpty()) {
            logger.warn("Validation failed: label '{}' is outside the closed label set", label.asText());
            return Optional.empty();
        }

        Optional<Double> score = parseConfidence(confidence);
        if (score.isEmpty()) {
            logger.warn("Validation failed: confidence '{}' is not a number in [0,1]", confidence.asText());
            return Optional.empty();
        }

        return Optional.of(new ClassificationResult(riskLabel.get(), score.get(), reason.asText(),
                ClassificationMethod.LLM_ANALYSIS));
    }

    private Optional<Double> parseConfidence(JsonNode confidence) {
        double value;
        if (confidence.isNumber()) {
            value = confidence.asDouble();
        } else if (confidence.isTextual()) {
            try {
                value = Double.parseDouble(confidence.asText().trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }

        if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    private Optional<JsonNode> readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            logger.debug("Candidate is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static Optional<String> firstMatch(Pattern pattern, String text, int group) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(group)) : Optional.empty();
    }
}
