package io.riskwatch.ingestion.config;

import io.riskwatch.ingestion.api.model.RiskLabel;

import java.util.Set;

public record RiskAnalysis(
        Set<String> alertLabels,
        double minAlertConfidence
) {
    public RiskAnalysis {
        alertLabels = alertLabels == null ? Set.of() : Set.copyOf(alertLabels);
    }

    public boolean requiresAlert(RiskLabel label, Double confidence) {
        if (label == null || confidence == null) return false;

        return alertLabels.contains(label.wireValue()) && confidence >= minAlertConfidence;
    }
}
