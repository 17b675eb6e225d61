package io.riskwatch.ingestion.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ClassificationResult(
        @JsonProperty("label") RiskLabel label,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("reason") String reason,
        @JsonProperty("method") ClassificationMethod method
) {
    public ClassificationResult {
        if (label == null || method == null) {
            throw new IllegalArgumentException("label and method are required");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
    }

    public static ClassificationResult defaultResult() {
        return new ClassificationResult(RiskLabel.LOW_OTHER, 0.6, "no high-risk pattern detected",
                ClassificationMethod.DEFAULT);
    }
}
