package io.riskwatch.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.riskwatch.ingestion.api.model.DocumentStatus;
import io.riskwatch.ingestion.api.model.Event;
import io.riskwatch.ingestion.api.model.RawDocument;
import io.riskwatch.ingestion.api.service.EventNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventNormalizerTest {

    private EventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new EventNormalizer(new ObjectMapper());
    }

    @Test
    void shouldBuildEventFromPayload() {
        RawDocument document = document("""
                {"title":"Multa a la eléctrica","url":"https://elpais.com/a","published_at":"2024-03-15T08:30:00Z",
                 "text":"La CNMC sanciona...","section":"economia"}
                """, Map.of());

        Optional<Event> event = normalizer.normalize(document);

        assertThat(event).isPresent();
        assertThat(event.get().eventId()).isEqualTo("elpais:abc123");
        assertThat(event.get().rawId()).isEqualTo("abc123");
        assertThat(event.get().title()).isEqualTo("Multa a la eléctrica");
        assertThat(event.get().text()).isEqualTo("La CNMC sanciona...");
        assertThat(event.get().section()).isEqualTo("economia");
        assertThat(event.get().url()).isEqualTo("https://elpais.com/a");
        assertThat(event.get().pubDate()).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(event.get().isClassified()).isFalse();
        assertThat(event.get().alerted()).isFalse();
    }

    @Test
    @DisplayName("Meta fills fields the payload lacks")
    void shouldFallBackToMeta() {
        RawDocument document = document("{\"text\":\"cuerpo\"}",
                Map.of("title", "Título en meta", "url", "https://example.com/m", "published_at", "2024-03-01"));

        Event event = normalizer.normalize(document).orElseThrow();

        assertThat(event.title()).isEqualTo("Título en meta");
        assertThat(event.url()).isEqualTo("https://example.com/m");
        assertThat(event.pubDate()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(event.text()).isEqualTo("cuerpo");
    }

    @Test
    void textDefaultsToTitle() {
        Event event = normalizer.normalize(document("{\"title\":\"Solo título\"}", Map.of())).orElseThrow();

        assertThat(event.text()).isEqualTo("Solo título");
        assertThat(event.pubDate()).isNull();
    }

    @Test
    void shouldSkipDocumentWithoutTitle() {
        assertThat(normalizer.normalize(document("{\"text\":\"sin título\",\"title\":\"  \"}", Map.of()))).isEmpty();
    }

    @Test
    void shouldRejectUnreadablePayload() {
        assertThatThrownBy(() -> normalizer.normalize(document("<html>not json</html>", Map.of())))
                .isInstanceOf(UncheckedIOException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "2024-03-15",
            "2024-03-15T10:00:00Z",
            "2024-03-15T10:00:00",
            "2024-03-15T10:00:00+01:00",
            "Fri, 15 Mar 2024 10:00:00 GMT",
            "20240315",
            "15/03/2024"
    })
    void shouldParseSupportedDateFormats(String value) {
        assertThat(EventNormalizer.parseDate(value)).contains(LocalDate.of(2024, 3, 15));
    }

    @Test
    void shouldIgnoreUnrecognizedDates() {
        assertThat(EventNormalizer.parseDate("mid March")).isEmpty();
        assertThat(EventNormalizer.parseDate("")).isEmpty();
        assertThat(EventNormalizer.parseDate(null)).isEmpty();
    }

    private static RawDocument document(String payload, Map<String, Object> meta) {
        Instant now = Instant.parse("2024-03-15T10:00:00Z");
        return new RawDocument("abc123", "elpais", payload.getBytes(StandardCharsets.UTF_8), meta,
                0, DocumentStatus.PENDING, now, now, now);
    }
}
