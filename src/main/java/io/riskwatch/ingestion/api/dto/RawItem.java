package io.riskwatch.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One hit returned by a source adapter. Serialized as the landing-zone payload, so field order is stable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawItem(
        @JsonProperty("title") String title,
        @JsonProperty("url") String url,
        @JsonProperty("published_at") String publishedAt,
        @JsonProperty("text") String text,
        @JsonProperty("section") String section,
        @JsonProperty("attributes") Map<String, Object> attributes
) {}
