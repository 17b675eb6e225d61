package io.riskwatch.ingestion.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ClassificationMethod {
    KEYWORD_SECTION("keyword_section"),
    KEYWORD_MATCH("keyword_match"),
    LLM_ANALYSIS("llm_analysis"),
    DEFAULT("default");

    private final String wireValue;

    ClassificationMethod(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
