package io.riskwatch.ingestion.api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.riskwatch.ingestion.api.dto.RawItem;
import io.riskwatch.ingestion.api.model.Event;
import io.riskwatch.ingestion.api.model.RawDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns a landing-zone document back into a canonical {@link Event}. The payload is authoritative;
 * {@code meta} only fills gaps.
 */
@Component
public class EventNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(EventNormalizer.class);

    private static final List<Function<String, LocalDate>> DATE_PARSERS = List.of(
            value -> OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDate(),
            value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toLocalDate(),
            value -> LocalDate.parse(value.length() > 10 && value.charAt(10) == 'T' ? value.substring(0, 10) : value),
            value -> LocalDate.parse(value, DateTimeFormatter.BASIC_ISO_DATE),
            value -> LocalDate.parse(value, DateTimeFormatter.ofPattern("dd/MM/yyyy"))
    );

    private final ObjectMapper objectMapper;

    public EventNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return empty when the document carries no usable title
     */
    public Optional<Event> normalize(RawDocument document) {
        RawItem item = readPayload(document);

        String title = firstNonBlank(item.title(), metaString(document, "title"));
        if (title == null) {
            logger.debug("Document {} has no title, skipping", document.rawId());
            return Optional.empty();
        }

        String text = firstNonBlank(item.text(), metaString(document, "text"), title);
        String section = firstNonBlank(item.section(), metaString(document, "section"));
        String url = firstNonBlank(item.url(), metaString(document, "url"));
        LocalDate pubDate = parseDate(firstNonBlank(item.publishedAt(), metaString(document, "published_at")))
                .orElse(null);

        return Optional.of(new Event(
                Event.eventIdFor(document.source(), document.rawId()),
                document.rawId(),
                title,
                text,
                document.source(),
                section,
                pubDate,
                url,
                null, null, null, null,
                false
        ));
    }

    public static Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) return Optional.empty();

        String trimmed = value.trim();
        for (Function<String, LocalDate> parser : DATE_PARSERS) {
            try {
                return Optional.of(parser.apply(trimmed));
            } catch (DateTimeParseException e) {
                logger.trace("'{}' does not match: {}", trimmed, e.getMessage());
            }
        }
        logger.debug("Unrecognized publication date '{}'", value);
        return Optional.empty();
    }

    private RawItem readPayload(RawDocument document) {
        try {
            return objectMapper.readValue(document.payload(), RawItem.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Payload of " + document.rawId() + " is not a readable item", e);
        }
    }

    private static String metaString(RawDocument document, String key) {
        Object value = document.metaValue(key);
        return value != null ? value.toString() : null;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
