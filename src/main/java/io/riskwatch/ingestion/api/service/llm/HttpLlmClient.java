package io.riskwatch.ingestion.api.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.riskwatch.ingestion.api.exception.LlmException;
import io.riskwatch.ingestion.config.ClassificationConfig.LlmConfig;
import io.riskwatch.ingestion.config.IngestionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Talks to a generation service exposing {@code POST /generate} and {@code GET /health}.
 */
@Service
@ConditionalOnProperty(prefix = "ingestion.classification.llm", name = "enabled", havingValue = "true")
public class HttpLlmClient implements LlmClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpLlmClient.class);

    private final LlmConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private volatile Instant lastProbe = Instant.EPOCH;
    private volatile boolean lastProbeHealthy;

    @Autowired
    public HttpLlmClient(IngestionConfig config, ObjectMapper objectMapper, Clock clock) {
        this(config.classification().llm(), objectMapper, clock);
    }

    public HttpLlmClient(LlmConfig config, ObjectMapper objectMapper, Clock clock) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String generate(String prompt, Duration timeout, double temperature) throws LlmException {
        HttpURLConnection connection = null;
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("prompt", prompt);
            body.put("max_tokens", config.maxTokens());
            body.put("temperature", temperature);

            connection = open("/generate", timeout);
            connection.setRequestMethod("POST");
            connection.setDoOutput(true);
            connection.setRequestProperty("Content-Type", "application/json");
            try (OutputStream out = connection.getOutputStream()) {
                objectMapper.writeValue(out, body);
            }

            int status = connection.getResponseCode();
            if (status != HttpURLConnection.HTTP_OK) {
                throw new LlmException("Generation service answered HTTP " + status);
            }

            JsonNode response;
            try (InputStream in = connection.getInputStream()) {
                response = objectMapper.readTree(in);
            }
            JsonNode text = response.get("text");
            if (text == null || !text.isTextual()) {
                throw new LlmException("Generation response has no text field");
            }
            logger.debug("Generated {} chars with model {}", text.asText().length(), response.path("model").asText("unknown"));
            return text.asText();

        } catch (SocketTimeoutException e) {
            throw new LlmException("Generation timed out after " + timeout, e);
        } catch (IOException e) {
            throw new LlmException("Generation request failed: " + e.getMessage(), e);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    @Override
    public boolean isAvailable() {
        if (!config.enabled() || config.baseUrl() == null || config.baseUrl().isBlank()) {
            return false;
        }

        Instant now = clock.instant();
        if (now.isBefore(lastProbe.plus(config.healthCheckInterval()))) {
            return lastProbeHealthy;
        }

        boolean healthy = probe();
        lastProbeHealthy = healthy;
        lastProbe = now;
        return healthy;
    }

    private boolean probe() {
        HttpURLConnection connection = null;
        try {
            connection = open("/health", Duration.ofSeconds(5));
            connection.setRequestMethod("GET");
            boolean healthy = connection.getResponseCode() == HttpURLConnection.HTTP_OK;
            if (!healthy) {
                logger.warn("Generation service health check returned {}", connection.getResponseCode());
            }
            return healthy;
        } catch (IOException e) {
            logger.warn("Generation service unreachable at {}: {}", config.baseUrl(), e.getMessage());
            return false;
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private HttpURLConnection open(String path, Duration timeout) throws IOException {
        String base = config.baseUrl().endsWith("/")
                ? config.baseUrl().substring(0, config.baseUrl().length() - 1)
                : config.baseUrl();
        HttpURLConnection connection = (HttpURLConnection) new URL(base + path).openConnection();
        int millis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        connection.setConnectTimeout(Math.min(millis, 10_000));
        connection.setReadTimeout(millis);
        connection.setRequestProperty("Accept", "application/json");
        connection.setUseCaches(false);
        return connection;
    }
}
