package io.riskwatch.ingestion.api.model;

import java.util.Map;
import java.util.Set;

/**
 * Outcome of the keyword rules. {@link #NO_OPINION} is distinct from a weak match:
 * it carries the 0.5 sentinel and no method, and must never be surfaced as a classification.
 */
public record KeywordVerdict(
        RiskLabel label,
        double confidence,
        ClassificationMethod method,
        String reason,
        Map<KeywordCategory, Set<String>> matches
) {
    public static final KeywordVerdict NO_OPINION =
            new KeywordVerdict(RiskLabel.LOW_OTHER, 0.5, null, "no keyword matched", Map.of());

    public boolean isNoOpinion() {
        return method == null;
    }

    public ClassificationResult toResult() {
        if (isNoOpinion()) {
            throw new IllegalStateException("keyword rules have no opinion");
        }
        return new ClassificationResult(label, confidence, reason, method);
    }
}
